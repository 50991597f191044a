package com.lux032.musicpipeline.queue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 各个领域的目标解析规则
 */
public final class TargetResolvers {

    /**
     * 曲库重建任务使用的固定目标
     */
    public static final String LIBRARY_TARGET = "library";

    private TargetResolvers() {
    }

    /**
     * 收件箱: 以根目录下第一级条目(通常是艺术家目录)作为目标，根目录下的散落文件归到根目录
     */
    public static TargetResolver inboxTopLevel() {
        return (root, path, directory) -> {
            Path relative = root.relativize(path);
            if (relative.getNameCount() == 1 && !directory) {
                return Optional.of(root.toString());
            }
            return Optional.of(root.resolve(relative.getName(0)).toString());
        };
    }

    /**
     * 曲库: 任意新文件都折叠为同一个固定目标
     */
    public static TargetResolver libraryKey() {
        return (root, path, directory) -> directory ? Optional.empty() : Optional.of(LIBRARY_TARGET);
    }

    /**
     * 封面: 新建的专辑目录，已有封面文件时忽略
     */
    public static TargetResolver albumDirectory(String coverFileName) {
        return (root, path, directory) -> {
            if (!directory || Files.exists(path.resolve(coverFileName))) {
                return Optional.empty();
            }
            return Optional.of(path.toString());
        };
    }

    /**
     * 歌词: 支持格式的音频文件
     */
    public static TargetResolver audioFiles(String[] supportedFormats) {
        Set<String> extensions = Arrays.stream(supportedFormats)
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        return (root, path, directory) -> {
            if (directory) {
                return Optional.empty();
            }
            String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
            int dot = name.lastIndexOf('.');
            if (dot < 0 || !extensions.contains(name.substring(dot + 1))) {
                return Optional.empty();
            }
            return Optional.of(path.toString());
        };
    }
}
