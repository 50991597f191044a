package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.model.ActionResult;
import com.lux032.musicpipeline.model.CommandResult;
import com.lux032.musicpipeline.model.WorkItem;
import com.lux032.musicpipeline.queue.WorkQueue;
import com.lux032.musicpipeline.ratelimit.QuotaClassifier;
import com.lux032.musicpipeline.ratelimit.RetryLedger;
import com.lux032.musicpipeline.ratelimit.SlidingWindowRateLimiter;
import com.lux032.musicpipeline.worker.Action;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.function.BooleanSupplier;

/**
 * 歌词获取动作
 * 受滑动窗口限流，配额耗尽时冷却并降低优先级重新入队，失败次数达到上限后不再重试
 */
@Slf4j
public class LyricsFetchAction implements Action {

    private static final Duration PERMIT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final BeetsCli beets;
    private final SlidingWindowRateLimiter limiter;
    private final RetryLedger ledger;
    private final QuotaClassifier quotaClassifier;
    private final AudioTagInspector tagInspector;
    private final WorkQueue queue;
    private final EventLog eventLog;
    private final BooleanSupplier stopping;
    private final Duration timeout;

    public LyricsFetchAction(BeetsCli beets,
                             SlidingWindowRateLimiter limiter,
                             RetryLedger ledger,
                             QuotaClassifier quotaClassifier,
                             AudioTagInspector tagInspector,
                             WorkQueue queue,
                             EventLog eventLog,
                             BooleanSupplier stopping,
                             Duration timeout) {
        this.beets = beets;
        this.limiter = limiter;
        this.ledger = ledger;
        this.quotaClassifier = quotaClassifier;
        this.tagInspector = tagInspector;
        this.queue = queue;
        this.eventLog = eventLog;
        this.stopping = stopping;
        this.timeout = timeout;
    }

    @Override
    public String getName() {
        return "Lyrics fetch";
    }

    @Override
    public ActionResult execute(WorkItem item) throws InterruptedException {
        String target = item.getTarget();
        Path track = Paths.get(target);

        if (!Files.exists(track)) {
            return ActionResult.skipped("track missing");
        }
        if (tagInspector.hasLyrics(track)) {
            return ActionResult.skipped("already has lyrics");
        }
        if (ledger.isExhausted(target)) {
            log.debug("歌词重试次数已用完，跳过: {}", target);
            return ActionResult.skipped("retries exhausted");
        }

        // 名额不足时等待，不丢弃
        if (!limiter.awaitPermit(stopping, PERMIT_POLL_INTERVAL)) {
            queue.submit(target, item.getPriority(), item.getAttempt());
            return ActionResult.skipped("stopping");
        }

        String trackName = String.valueOf(track.getFileName());
        eventLog.info("Fetching lyrics: " + trackName);
        CommandResult result = beets.fetchLyrics(track, timeout);

        if (quotaClassifier.isQuotaExceeded(result)) {
            limiter.recordQuotaExceeded();
            eventLog.warning("Lyrics API rate limit hit, pausing for " + limiter.getCooldown().getSeconds() + "s");
            recordFailureAndRequeue(item);
            return ActionResult.failed("quota exceeded");
        }

        String output = result.getOutput().toLowerCase(Locale.ROOT);
        if (result.isSuccess() || output.contains("lyrics found")) {
            ledger.clear(target);
            eventLog.success("Lyrics found: " + trackName);
            return ActionResult.succeeded(trackName);
        }

        if (output.contains("not found")) {
            log.info("未找到歌词: {}", trackName);
            return ActionResult.skipped("lyrics not found");
        }

        recordFailureAndRequeue(item);
        return ActionResult.failed(result.abbreviatedOutput(200));
    }

    private void recordFailureAndRequeue(WorkItem item) {
        String target = item.getTarget();
        int failures = ledger.recordFailure(target);
        if (ledger.isExhausted(target)) {
            eventLog.warning("Lyrics fetch gave up after " + failures + " attempts: " + Paths.get(target).getFileName());
            return;
        }
        queue.submit(target, item.getPriority() + 1, item.getAttempt() + 1);
    }
}
