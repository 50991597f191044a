package com.lux032.musicpipeline.queue;

import com.lux032.musicpipeline.model.WorkItem;
import com.lux032.musicpipeline.util.FileSystemUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * 防抖器
 * 将某个监控根目录下的大量文件系统通知合并为规范化的任务目标，
 * 并为出队的任务计算剩余的静默等待时间
 */
@Slf4j
public class Debouncer {

    private static final long WAIT_SLICE_MS = 1000;

    private final Path root;
    private final WorkQueue queue;
    private final DebouncePolicy policy;
    private final long windowMillis;
    private final List<String> ignoreSubstrings;
    private final TargetResolver resolver;
    private final Clock clock;
    private final Map<String, Long> lastSeen = new ConcurrentHashMap<>();

    public Debouncer(Path root,
                     WorkQueue queue,
                     DebouncePolicy policy,
                     Duration window,
                     List<String> ignoreSubstrings,
                     TargetResolver resolver,
                     Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.queue = queue;
        this.policy = policy;
        this.windowMillis = window.toMillis();
        this.ignoreSubstrings = ignoreSubstrings == null ? new ArrayList<>() : new ArrayList<>(ignoreSubstrings);
        this.resolver = resolver;
        this.clock = clock;
    }

    /**
     * 处理一条文件系统通知
     * @return 是否产生了新的待处理任务
     */
    public boolean observe(Path path, boolean directory) {
        Optional<String> target = accept(path, directory);
        if (target.isEmpty()) {
            return false;
        }
        return record(target.get(), WorkItem.DEFAULT_PRIORITY);
    }

    /**
     * 显式触发(API、扫描、链式入队)，不经过路径过滤
     */
    public boolean trigger(String target) {
        return record(target, WorkItem.DEFAULT_PRIORITY);
    }

    public boolean trigger(String target, int priority) {
        return record(target, priority);
    }

    private boolean record(String target, int priority) {
        lastSeen.put(target, clock.millis());
        boolean created = queue.submit(target, priority, 0);
        if (!created) {
            log.debug("[{}] 合并通知: {}", queue.getName().getKey(), target);
        }
        return created;
    }

    /**
     * 过滤并解析通知路径
     * 拒绝: 根目录之外的路径、隐藏项(. 或 ~ 开头)、包含忽略子串的路径
     */
    public Optional<String> accept(Path path, boolean directory) {
        if (path == null) {
            return Optional.empty();
        }
        Path normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(root) || normalized.equals(root)) {
            return Optional.empty();
        }

        if (FileSystemUtils.isHidden(root, normalized)) {
            return Optional.empty();
        }

        String relativeText = root.relativize(normalized).toString();
        for (String ignored : ignoreSubstrings) {
            if (!ignored.isEmpty() && relativeText.contains(ignored)) {
                return Optional.empty();
            }
        }

        return resolver.resolve(root, normalized, directory);
    }

    /**
     * 计算出队任务还需等待的毫秒数
     * @param dequeuedAt 任务出队的时间
     */
    public long remainingQuietMillis(WorkItem item, long dequeuedAt) {
        long now = clock.millis();
        if (policy == DebouncePolicy.FIXED_DELAY) {
            return Math.max(0, dequeuedAt + windowMillis - now);
        }
        long seen = Math.max(item.getEnqueuedAt(), lastSeen.getOrDefault(item.getTarget(), 0L));
        return Math.max(0, seen + windowMillis - now);
    }

    /**
     * 阻塞直到任务满足静默条件
     * @return 被停止信号打断时返回 false
     */
    public boolean awaitQuiet(WorkItem item, long dequeuedAt, BooleanSupplier stopping) throws InterruptedException {
        long remaining = remainingQuietMillis(item, dequeuedAt);
        while (remaining > 0) {
            if (stopping.getAsBoolean()) {
                return false;
            }
            Thread.sleep(Math.min(remaining, WAIT_SLICE_MS));
            remaining = remainingQuietMillis(item, dequeuedAt);
        }
        return !stopping.getAsBoolean();
    }

    /**
     * 清除截止到 cutoff 的最后通知记录，之后到达的通知保留
     */
    public void forget(String target, long cutoff) {
        lastSeen.computeIfPresent(target, (key, seen) -> seen <= cutoff ? null : seen);
    }

    public Optional<Long> lastSeen(String target) {
        return Optional.ofNullable(lastSeen.get(target));
    }

    public Path getRoot() {
        return root;
    }

    public WorkQueue getQueue() {
        return queue;
    }

    public DebouncePolicy getPolicy() {
        return policy;
    }

    public Duration getWindow() {
        return Duration.ofMillis(windowMillis);
    }
}
