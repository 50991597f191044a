package com.lux032.musicpipeline.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * 滑动窗口限流器 + 冷却计时
 * 仅当没有生效的冷却且窗口内请求数小于上限时放行
 */
@Slf4j
public class SlidingWindowRateLimiter {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final int limit;
    private final long windowMillis;
    private final long cooldownMillis;
    private final Clock clock;

    private final Deque<Long> recentRequests = new ArrayDeque<>();
    private Long cooldownUntil;

    public SlidingWindowRateLimiter(int limit, Duration window, Duration cooldown, Clock clock) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        this.limit = limit;
        this.windowMillis = window.toMillis();
        this.cooldownMillis = cooldown.toMillis();
        this.clock = clock;
    }

    /**
     * 尝试占用一个请求名额，成功时记录本次请求
     */
    public synchronized boolean tryAcquire() {
        long now = clock.millis();
        if (isCoolingDown(now)) {
            return false;
        }
        prune(now);
        if (recentRequests.size() >= limit) {
            return false;
        }
        recentRequests.addLast(now);
        return true;
    }

    /**
     * 等待直到获得名额
     * @return 被停止信号打断时返回 false
     */
    public boolean awaitPermit(BooleanSupplier stopping, Duration pollInterval) throws InterruptedException {
        while (!tryAcquire()) {
            if (stopping.getAsBoolean()) {
                return false;
            }
            Thread.sleep(pollInterval.toMillis());
        }
        return true;
    }

    /**
     * 下游返回配额耗尽，开始冷却
     */
    public synchronized void recordQuotaExceeded() {
        cooldownUntil = clock.millis() + cooldownMillis;
        log.warn("收到配额耗尽信号，暂停 {} 秒", cooldownMillis / 1000);
    }

    /**
     * 手动暂停，与配额耗尽同样冷却一个周期
     */
    public synchronized void pause() {
        cooldownUntil = clock.millis() + cooldownMillis;
    }

    public synchronized void resume() {
        cooldownUntil = null;
    }

    public synchronized boolean isCoolingDown() {
        return isCoolingDown(clock.millis());
    }

    private boolean isCoolingDown(long now) {
        return cooldownUntil != null && now < cooldownUntil;
    }

    public synchronized Optional<Instant> getCooldownUntil() {
        if (!isCoolingDown(clock.millis())) {
            return Optional.empty();
        }
        return Optional.of(Instant.ofEpochMilli(cooldownUntil));
    }

    public synchronized int requestsInWindow() {
        prune(clock.millis());
        return recentRequests.size();
    }

    private void prune(long now) {
        while (!recentRequests.isEmpty() && now - recentRequests.peekFirst() >= windowMillis) {
            recentRequests.pollFirst();
        }
    }

    public int getLimit() {
        return limit;
    }

    public Duration getCooldown() {
        return Duration.ofMillis(cooldownMillis);
    }
}
