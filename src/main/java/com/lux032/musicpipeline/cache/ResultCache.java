package com.lux032.musicpipeline.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 带 TTL 的聚合结果缓存
 * 缓存未命中时只有一个线程重新计算，其余调用方等待并复用结果
 */
@Slf4j
public class ResultCache<T> {

    private final String name;
    private final long ttlMillis;
    private final Supplier<T> loader;
    private final Clock clock;
    private final ReentrantLock computeLock = new ReentrantLock();

    private volatile CacheEntry<T> entry;
    private final AtomicLong generation = new AtomicLong();

    public ResultCache(String name, Duration ttl, Supplier<T> loader, Clock clock) {
        this.name = name;
        this.ttlMillis = ttl.toMillis();
        this.loader = loader;
        this.clock = clock;
    }

    public T get() {
        return get(false);
    }

    /**
     * 读取缓存
     * @param forceRefresh 为 true 时无视缓存重新计算
     */
    public T get(boolean forceRefresh) {
        if (!forceRefresh) {
            CacheEntry<T> current = entry;
            if (isFresh(current)) {
                log.debug("返回缓存的 {} (age: {}ms)", name, clock.millis() - current.computedAt);
                return current.payload;
            }
        }

        computeLock.lock();
        try {
            if (!forceRefresh) {
                CacheEntry<T> current = entry;
                if (isFresh(current)) {
                    return current.payload;
                }
            }
            long startGeneration = generation.get();
            log.info("重新计算 {}", name);
            T payload = loader.get();
            synchronized (this) {
                if (startGeneration == generation.get()) {
                    entry = new CacheEntry<>(payload, clock.millis());
                } else {
                    log.debug("{} 在计算期间被失效，结果不写入缓存", name);
                }
            }
            return payload;
        } finally {
            computeLock.unlock();
        }
    }

    /**
     * 无条件清除缓存，可重复调用
     */
    public synchronized void invalidate() {
        generation.incrementAndGet();
        if (entry != null) {
            entry = null;
            log.info("{} 缓存已失效", name);
        }
    }

    public Optional<Instant> getComputedAt() {
        CacheEntry<T> current = entry;
        return current == null ? Optional.empty() : Optional.of(Instant.ofEpochMilli(current.computedAt));
    }

    public boolean isCached() {
        return isFresh(entry);
    }

    public String getName() {
        return name;
    }

    private boolean isFresh(CacheEntry<T> candidate) {
        return candidate != null && clock.millis() - candidate.computedAt < ttlMillis;
    }

    private static final class CacheEntry<T> {
        private final T payload;
        private final long computedAt;

        private CacheEntry(T payload, long computedAt) {
            this.payload = payload;
            this.computedAt = computedAt;
        }
    }
}
