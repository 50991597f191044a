package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.MutableClock;
import com.lux032.musicpipeline.model.ActionResult;
import com.lux032.musicpipeline.model.CommandResult;
import com.lux032.musicpipeline.model.QueueName;
import com.lux032.musicpipeline.model.WorkItem;
import com.lux032.musicpipeline.queue.WorkQueue;
import com.lux032.musicpipeline.ratelimit.MarkerQuotaClassifier;
import com.lux032.musicpipeline.ratelimit.RetryLedger;
import com.lux032.musicpipeline.ratelimit.SlidingWindowRateLimiter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LyricsFetchActionTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    @TempDir
    Path library;

    @Mock
    private BeetsCli beets;

    @Mock
    private AudioTagInspector tagInspector;

    private MutableClock clock;
    private SlidingWindowRateLimiter limiter;
    private RetryLedger ledger;
    private WorkQueue queue;
    private EventLog eventLog;
    private AtomicBoolean stopping;
    private LyricsFetchAction action;
    private Path track;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock();
        limiter = new SlidingWindowRateLimiter(10, Duration.ofSeconds(60), Duration.ofHours(1), clock);
        ledger = new RetryLedger(3);
        queue = WorkQueue.prioritized(QueueName.LYRICS, clock);
        eventLog = new EventLog(100, clock);
        stopping = new AtomicBoolean();
        action = new LyricsFetchAction(beets, limiter, ledger,
            new MarkerQuotaClassifier(List.of("429", "Too Many Requests")),
            tagInspector, queue, eventLog, stopping::get, TIMEOUT);
        track = Files.createDirectories(library.resolve("Artist/Album")).resolve("01.flac");
        Files.write(track, new byte[]{1});
    }

    private WorkItem item(int priority, int attempt) {
        return new WorkItem(track.toString(), clock.millis(), priority, attempt, 1);
    }

    @Test
    void shouldCooldownAndRequeueAtLowerPriorityOnQuota() throws Exception {
        when(beets.fetchLyrics(track, TIMEOUT)).thenReturn(new CommandResult(1, "HTTP Error 429: Too Many Requests", false));

        ActionResult result = action.execute(item(2, 0));

        Assertions.assertEquals(ActionResult.Status.FAILED, result.getStatus());
        Assertions.assertTrue(limiter.isCoolingDown());
        Assertions.assertEquals(1, ledger.failureCount(track.toString()));

        WorkItem requeued = queue.poll(1, TimeUnit.SECONDS);
        Assertions.assertEquals(track.toString(), requeued.getTarget());
        Assertions.assertEquals(3, requeued.getPriority());
        Assertions.assertEquals(1, requeued.getAttempt());

        // 冷却期间不能再放行
        Assertions.assertFalse(limiter.tryAcquire());
        clock.advance(Duration.ofHours(1));
        Assertions.assertTrue(limiter.tryAcquire());
    }

    @Test
    void shouldStopRetryingAtCeiling() throws Exception {
        when(beets.fetchLyrics(track, TIMEOUT)).thenReturn(new CommandResult(1, "connection reset", false));

        for (int attempt = 0; attempt < 3; attempt++) {
            Assertions.assertEquals(ActionResult.Status.FAILED, action.execute(item(attempt, attempt)).getStatus());
            WorkItem next = queue.poll(10, TimeUnit.MILLISECONDS);
            if (attempt < 2) {
                Assertions.assertNotNull(next);
                queue.release(next.getTarget());
            } else {
                Assertions.assertNull(next);
            }
        }

        Assertions.assertTrue(ledger.isExhausted(track.toString()));
        ActionResult exhausted = action.execute(item(3, 3));
        Assertions.assertEquals("retries exhausted", exhausted.getDetail());
    }

    @Test
    void shouldClearLedgerOnSuccess() throws Exception {
        ledger.recordFailure(track.toString());
        when(beets.fetchLyrics(track, TIMEOUT)).thenReturn(new CommandResult(0, "lyrics found: 01", false));

        ActionResult result = action.execute(item(1, 1));

        Assertions.assertEquals(ActionResult.Status.SUCCEEDED, result.getStatus());
        Assertions.assertEquals(0, ledger.failureCount(track.toString()));
        Assertions.assertEquals(1, limiter.requestsInWindow());
        Assertions.assertEquals(0, queue.depth());
    }

    @Test
    void shouldNotRetryWhenLyricsNotFound() throws Exception {
        when(beets.fetchLyrics(track, TIMEOUT)).thenReturn(new CommandResult(1, "lyrics not found: 01", false));

        ActionResult result = action.execute(item(0, 0));

        Assertions.assertEquals(ActionResult.Status.SKIPPED, result.getStatus());
        Assertions.assertEquals(0, queue.depth());
        Assertions.assertEquals(0, ledger.failureCount(track.toString()));
    }

    @Test
    void shouldSkipTrackThatAlreadyHasLyricsWithoutUsingQuota() throws Exception {
        when(tagInspector.hasLyrics(track)).thenReturn(true);

        ActionResult result = action.execute(item(0, 0));

        Assertions.assertEquals("already has lyrics", result.getDetail());
        Assertions.assertEquals(0, limiter.requestsInWindow());
        verify(beets, never()).fetchLyrics(any(), any());
    }

    @Test
    void shouldSkipMissingTrack() throws Exception {
        WorkItem missing = new WorkItem(library.resolve("gone.flac").toString(), clock.millis(), 0, 0, 1);

        Assertions.assertEquals("track missing", action.execute(missing).getDetail());
        verify(beets, never()).fetchLyrics(any(), any());
    }

    @Test
    void shouldRequeueUnchangedWhenStoppingDuringCooldown() throws Exception {
        limiter.pause();
        stopping.set(true);

        ActionResult result = action.execute(item(2, 1));

        Assertions.assertEquals("stopping", result.getDetail());
        WorkItem requeued = queue.poll(1, TimeUnit.SECONDS);
        Assertions.assertEquals(2, requeued.getPriority());
        Assertions.assertEquals(1, requeued.getAttempt());
        verify(beets, never()).fetchLyrics(eq(track), any());
    }

    @Test
    void shouldDeferFetchDuringCooldownAndRunOnceAfterwards() throws Exception {
        when(beets.fetchLyrics(track, TIMEOUT)).thenReturn(new CommandResult(0, "lyrics found: 01", false));
        limiter.recordQuotaExceeded();
        AtomicReference<ActionResult> outcome = new AtomicReference<>();
        Thread worker = new Thread(() -> {
            try {
                outcome.set(action.execute(item(3, 1)));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        worker.start();

        Thread.sleep(300);
        Assertions.assertTrue(worker.isAlive());
        verify(beets, never()).fetchLyrics(any(), any());

        clock.advance(Duration.ofHours(1));
        worker.join(5000);

        Assertions.assertFalse(worker.isAlive());
        Assertions.assertEquals(ActionResult.Status.SUCCEEDED, outcome.get().getStatus());
        verify(beets, times(1)).fetchLyrics(track, TIMEOUT);
        Assertions.assertEquals(0, queue.depth());
    }
}
