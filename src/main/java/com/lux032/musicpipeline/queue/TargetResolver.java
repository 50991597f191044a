package com.lux032.musicpipeline.queue;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 将文件系统通知映射为规范化的任务目标
 */
@FunctionalInterface
public interface TargetResolver {

    /**
     * @param root 监控根目录
     * @param path 发生变化的路径(已规范化，位于 root 之下)
     * @param directory 该路径是否为目录
     * @return 任务目标，不关心此通知时返回空
     */
    Optional<String> resolve(Path root, Path path, boolean directory);
}
