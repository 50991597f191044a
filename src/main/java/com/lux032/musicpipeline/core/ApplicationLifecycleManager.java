package com.lux032.musicpipeline.core;

import com.lux032.musicpipeline.config.PipelineConfig;
import com.lux032.musicpipeline.model.QueueName;
import com.lux032.musicpipeline.service.DirectoryWatcher;
import com.lux032.musicpipeline.web.WebServer;
import com.lux032.musicpipeline.worker.WorkerPool;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 应用程序生命周期管理器
 * 负责初始化、启动和关闭所有服务
 */
@Slf4j
@Getter
public class ApplicationLifecycleManager {

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final PipelineConfig config;

    private OrchestratorContext context;
    private WorkerPool workerPool;
    private WebServer webServer;
    private final List<DirectoryWatcher> watchers = new ArrayList<>();
    private ScheduledExecutorService cleanupScheduler;

    public ApplicationLifecycleManager(PipelineConfig config) {
        this.config = config;
    }

    /**
     * 初始化所有服务
     */
    public void initializeServices() {
        log.info("Initializing services...");
        context = OrchestratorContext.create(config);

        workerPool = new WorkerPool();
        for (QueueName name : QueueName.values()) {
            if (context.isEnabled(name)) {
                workerPool.register(name, context.createWorker(name));
            } else {
                log.warn("✗ {} worker disabled (watch root missing)", name.getKey());
            }
        }
        log.info("All services ready");
    }

    /**
     * 启动 Web 接口
     */
    public void startWebServer() {
        try {
            webServer = new WebServer(config.getWebPort());
            webServer.start(context, workerPool);
        } catch (Exception e) {
            log.error("Failed to start web server", e);
            log.warn("Web API unavailable, pipeline keeps running");
        }
    }

    /**
     * 启动目录监控、worker 和定期清理
     */
    public void startMonitoring() {
        log.info("=== Starting File Watchers ===");

        if (context.isEnabled(QueueName.INBOX)) {
            DirectoryWatcher inboxWatcher = new DirectoryWatcher(context.getInboxRoot())
                .withModifications()
                .addListener(context.debouncer(QueueName.INBOX)::observe);
            startWatcher(inboxWatcher);
        }

        if (context.isEnabled(QueueName.LIBRARY)) {
            DirectoryWatcher libraryWatcher = new DirectoryWatcher(context.getLibraryRoot())
                .addListener(context.debouncer(QueueName.LIBRARY)::observe)
                .addListener(context.debouncer(QueueName.COVER)::observe);
            startWatcher(libraryWatcher);
        }

        workerPool.start();

        int interval = config.getInboxCleanupIntervalMinutes();
        if (context.isEnabled(QueueName.INBOX) && interval > 0) {
            cleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "inbox-cleanup");
                thread.setDaemon(true);
                return thread;
            });
            cleanupScheduler.scheduleWithFixedDelay(this::runInboxCleanup, interval, interval, TimeUnit.MINUTES);
            log.info("✓ Inbox cleanup scheduled every {} minutes", interval);
        }
    }

    private void startWatcher(DirectoryWatcher watcher) {
        try {
            if (watcher.start()) {
                watchers.add(watcher);
            }
        } catch (IOException e) {
            log.error("启动目录监控失败: {}", watcher.getRoot(), e);
            context.getEventLog().error("Watcher failed to start: " + watcher.getRoot());
        }
    }

    private void runInboxCleanup() {
        try {
            context.getInboxCleanupService().cleanup();
        } catch (RuntimeException e) {
            log.error("Inbox cleanup scheduler error", e);
        }
    }

    /**
     * 优雅关闭所有服务
     * 正在执行的动作不会被打断，只等待宽限时间
     */
    public void shutdown() {
        log.info("Shutting down...");

        try {
            if (context != null) {
                context.requestStop();
            }

            if (webServer != null && webServer.isRunning()) {
                try {
                    webServer.stop();
                } catch (Exception e) {
                    log.warn("Error stopping web server", e);
                }
            }

            for (DirectoryWatcher watcher : watchers) {
                watcher.stop();
            }

            if (cleanupScheduler != null) {
                cleanupScheduler.shutdown();
            }

            if (workerPool != null) {
                workerPool.awaitStop(SHUTDOWN_GRACE);
            }

            if (context != null) {
                context.close();
            }

            log.info("Shutdown complete");
        } catch (Exception e) {
            log.error("Error during shutdown", e);
        }
    }
}
