package com.lux032.musicpipeline.ratelimit;

import java.util.HashMap;
import java.util.Map;

/**
 * 重试账本
 * 记录每个目标的失败次数，达到上限后不再自动重试，直到被外部清除
 */
public class RetryLedger {

    private final int maxRetries;
    private final Map<String, Integer> failures = new HashMap<>();

    public RetryLedger(int maxRetries) {
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive: " + maxRetries);
        }
        this.maxRetries = maxRetries;
    }

    /**
     * 记录一次失败
     * @return 记录后的失败次数
     */
    public synchronized int recordFailure(String target) {
        return failures.merge(target, 1, Integer::sum);
    }

    public synchronized int failureCount(String target) {
        return failures.getOrDefault(target, 0);
    }

    public synchronized boolean isExhausted(String target) {
        return failureCount(target) >= maxRetries;
    }

    public synchronized void clear(String target) {
        failures.remove(target);
    }

    public synchronized void clearAll() {
        failures.clear();
    }

    /**
     * 已永久放弃的目标数量
     */
    public synchronized int exhaustedCount() {
        return (int) failures.values().stream().filter(count -> count >= maxRetries).count();
    }

    public synchronized int trackedCount() {
        return failures.size();
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
