package com.lux032.musicpipeline.ratelimit;

import com.lux032.musicpipeline.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

class SlidingWindowRateLimiterTest {

    private MutableClock clock;
    private SlidingWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        limiter = new SlidingWindowRateLimiter(3, Duration.ofSeconds(60), Duration.ofHours(1), clock);
    }

    @Test
    void shouldAdmitUpToLimitWithinWindow() {
        Assertions.assertTrue(limiter.tryAcquire());
        clock.advance(Duration.ofSeconds(10));
        Assertions.assertTrue(limiter.tryAcquire());
        Assertions.assertTrue(limiter.tryAcquire());
        Assertions.assertFalse(limiter.tryAcquire());
        Assertions.assertEquals(3, limiter.requestsInWindow());

        // 第一个请求滑出窗口
        clock.advance(Duration.ofSeconds(50));
        Assertions.assertEquals(2, limiter.requestsInWindow());
        Assertions.assertTrue(limiter.tryAcquire());
        Assertions.assertFalse(limiter.tryAcquire());
    }

    @Test
    void shouldDenyForExactlyTheCooldownAfterQuotaSignal() {
        limiter.recordQuotaExceeded();
        Assertions.assertTrue(limiter.isCoolingDown());
        Assertions.assertEquals(clock.millis() + Duration.ofHours(1).toMillis(),
            limiter.getCooldownUntil().orElseThrow().toEpochMilli());

        clock.advance(Duration.ofHours(1).minusMillis(1));
        Assertions.assertFalse(limiter.tryAcquire());

        clock.advance(Duration.ofMillis(1));
        Assertions.assertFalse(limiter.isCoolingDown());
        Assertions.assertTrue(limiter.getCooldownUntil().isEmpty());
        Assertions.assertTrue(limiter.tryAcquire());
    }

    @Test
    void shouldPauseAndResumeManually() {
        limiter.pause();
        Assertions.assertFalse(limiter.tryAcquire());

        limiter.resume();
        Assertions.assertFalse(limiter.isCoolingDown());
        Assertions.assertTrue(limiter.tryAcquire());
    }

    @Test
    void shouldStopWaitingForPermitWhenStopping() throws Exception {
        limiter.recordQuotaExceeded();
        Assertions.assertFalse(limiter.awaitPermit(() -> true, Duration.ofMillis(10)));
    }

    @Test
    void shouldDeferRequestBeyondLimitUntilWindowAdvances() throws Exception {
        for (int i = 0; i < 3; i++) {
            Assertions.assertTrue(limiter.tryAcquire());
        }
        AtomicBoolean admitted = new AtomicBoolean();
        Thread waiter = new Thread(() -> {
            try {
                admitted.set(limiter.awaitPermit(() -> false, Duration.ofMillis(10)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        Thread.sleep(200);
        Assertions.assertTrue(waiter.isAlive());
        Assertions.assertEquals(3, limiter.requestsInWindow());

        clock.advance(Duration.ofSeconds(60));
        waiter.join(5000);

        Assertions.assertFalse(waiter.isAlive());
        Assertions.assertTrue(admitted.get());
        Assertions.assertEquals(1, limiter.requestsInWindow());
    }

    @Test
    void shouldHoldWaiterThroughCooldown() throws Exception {
        limiter.recordQuotaExceeded();
        AtomicBoolean admitted = new AtomicBoolean();
        Thread waiter = new Thread(() -> {
            try {
                admitted.set(limiter.awaitPermit(() -> false, Duration.ofMillis(10)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        Thread.sleep(200);
        Assertions.assertTrue(waiter.isAlive());

        clock.advance(Duration.ofHours(1));
        waiter.join(5000);

        Assertions.assertTrue(admitted.get());
        Assertions.assertEquals(1, limiter.requestsInWindow());
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        Assertions.assertThrows(IllegalArgumentException.class,
            () -> new SlidingWindowRateLimiter(0, Duration.ofSeconds(60), Duration.ofHours(1), clock));
    }
}
