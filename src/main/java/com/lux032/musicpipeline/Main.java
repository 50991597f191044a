package com.lux032.musicpipeline;

import com.lux032.musicpipeline.config.PipelineConfig;
import com.lux032.musicpipeline.core.ApplicationLifecycleManager;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 音乐库流水线主程序
 * 功能：
 * 1. 监控收件箱目录，文件稳定后调用 beets 导入
 * 2. 导入或封面更新后重建音乐库目录
 * 3. 为新专辑获取封面，为音轨获取歌词(限流)
 * 4. 提供状态、统计和手动触发的 HTTP 接口
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        System.out.println("========================================");
        System.out.println("  Music Pipeline");
        System.out.println("========================================");

        try {
            // 1. 加载配置
            Path configPath = Paths.get(args.length > 0 ? args[0] : PipelineConfig.DEFAULT_FILE_NAME);
            PipelineConfig config = PipelineConfig.load(configPath);
            if (!config.isValid()) {
                log.error("Invalid configuration, exiting");
                return;
            }

            log.info("Configuration loaded");
            log.info("Inbox directory: {}", config.getInboxDirectory());
            log.info("Library directory: {}", config.getLibraryDirectory());

            // 2. 创建并初始化生命周期管理器
            ApplicationLifecycleManager lifecycleManager = new ApplicationLifecycleManager(config);
            lifecycleManager.initializeServices();

            // 3. 进程退出时优雅关闭
            Runtime.getRuntime().addShutdownHook(new Thread(lifecycleManager::shutdown, "shutdown"));

            // 4. 启动 Web 接口
            lifecycleManager.startWebServer();

            // 5. 启动目录监控和 worker(非守护线程，维持进程运行)
            lifecycleManager.startMonitoring();

            log.info("System running, send SIGTERM to stop");

        } catch (Exception e) {
            log.error("Fatal error during startup", e);
        }
    }
}
