package com.lux032.musicpipeline.service;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 目录监控服务
 * 递归监控一个根目录，把创建事件分发给绑定在该根目录上的监听器；
 * 修改事件只在 {@link #withModifications()} 打开后才分发
 */
@Slf4j
public class DirectoryWatcher {

    /**
     * 文件系统通知监听器
     */
    public interface Listener {
        void onChange(Path path, boolean directory);
    }

    private final Path root;
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final Map<WatchKey, Path> watchKeys = new ConcurrentHashMap<>();
    private WatchService watchService;
    private ExecutorService watcherExecutorService;
    private volatile boolean running;
    private boolean deliverModifications;

    public DirectoryWatcher(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * 同时分发文件修改事件(收件箱用它延长静默窗口)
     */
    public DirectoryWatcher withModifications() {
        this.deliverModifications = true;
        return this;
    }

    public DirectoryWatcher addListener(Listener listener) {
        listeners.add(listener);
        return this;
    }

    /**
     * 启动文件监控
     * @return 根目录不存在时返回 false
     */
    public synchronized boolean start() throws IOException {
        if (running) {
            log.warn("Watcher already running: {}", root);
            return true;
        }
        if (!Files.isDirectory(root)) {
            log.warn("✗ Watch root does not exist: {}", root);
            return false;
        }

        watchService = FileSystems.getDefault().newWatchService();
        registerDirectoryRecursively(root);
        running = true;

        String threadName = "watcher-" + root.getFileName();
        watcherExecutorService = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
        watcherExecutorService.submit(this::watchLoop);
        log.info("✓ Watcher started: {}", root);
        return true;
    }

    /**
     * 停止文件监控
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            watchService.close();
            watcherExecutorService.shutdown();
            if (!watcherExecutorService.awaitTermination(5, TimeUnit.SECONDS)) {
                watcherExecutorService.shutdownNow();
            }
            log.info("Watcher stopped: {}", root);
        } catch (IOException e) {
            log.error("停止文件监控失败: {}", root, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 监控循环
     */
    private void watchLoop() {
        while (running) {
            try {
                WatchKey key = watchService.poll(1, TimeUnit.SECONDS);
                if (key == null) {
                    continue;
                }

                Path dir = watchKeys.get(key);
                for (WatchEvent<?> event : key.pollEvents()) {
                    WatchEvent.Kind<?> kind = event.kind();
                    if (kind == StandardWatchEventKinds.OVERFLOW || dir == null) {
                        continue;
                    }

                    @SuppressWarnings("unchecked")
                    WatchEvent<Path> ev = (WatchEvent<Path>) event;
                    Path fullPath = dir.resolve(ev.context());
                    boolean directory = Files.isDirectory(fullPath);

                    // 新建的目录需要递归注册，并补发其中已有内容(整树移入时只有一个事件)
                    if (kind == StandardWatchEventKinds.ENTRY_CREATE && directory) {
                        try {
                            registerDirectoryRecursively(fullPath);
                            log.debug("检测到新子目录，已添加监控: {}", fullPath);
                        } catch (IOException e) {
                            log.error("注册子目录监控失败: {}", fullPath, e);
                        }
                        dispatch(fullPath, true);
                        emitContents(fullPath);
                    } else if (kind == StandardWatchEventKinds.ENTRY_CREATE && !directory) {
                        dispatch(fullPath, false);
                    } else if (kind == StandardWatchEventKinds.ENTRY_MODIFY && !directory && deliverModifications) {
                        // 目录的修改事件由其子项事件覆盖
                        dispatch(fullPath, false);
                    }
                }

                if (!key.reset()) {
                    watchKeys.remove(key);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }
        }
    }

    private void emitContents(Path directory) {
        try (Stream<Path> stream = Files.walk(directory)) {
            stream.filter(p -> !p.equals(directory))
                .forEach(p -> dispatch(p, Files.isDirectory(p)));
        } catch (IOException | RuntimeException e) {
            log.debug("遍历新目录失败: {} - {}", directory, e.getMessage());
        }
    }

    void dispatch(Path path, boolean directory) {
        for (Listener listener : listeners) {
            try {
                listener.onChange(path, directory);
            } catch (RuntimeException e) {
                log.error("处理文件事件失败: {}", path, e);
            }
        }
    }

    private void registerDirectoryRecursively(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                WatchKey key = deliverModifications
                    ? dir.register(watchService, StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_MODIFY)
                    : dir.register(watchService, StandardWatchEventKinds.ENTRY_CREATE);
                watchKeys.put(key, dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.debug("无法访问: {} - {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    public Path getRoot() {
        return root;
    }

    public boolean isDeliveringModifications() {
        return deliverModifications;
    }

    public boolean isRunning() {
        return running;
    }
}
