package com.lux032.musicpipeline.web;

import com.lux032.musicpipeline.core.OrchestratorContext;
import com.lux032.musicpipeline.model.QueueName;
import com.lux032.musicpipeline.ratelimit.RetryLedger;
import com.lux032.musicpipeline.ratelimit.SlidingWindowRateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 歌词接口: 统计、暂停/恢复、全库扫描、清除失败记录、手动获取
 */
@Slf4j
public class LyricsServlet extends JsonServlet {

    private final OrchestratorContext context;

    public LyricsServlet(OrchestratorContext context) {
        this.context = context;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        if (!"stats".equals(action(req))) {
            writeError(resp, HttpServletResponse.SC_NOT_FOUND, "unknown endpoint");
            return;
        }
        SlidingWindowRateLimiter limiter = context.getLyricsLimiter();
        RetryLedger ledger = context.getLyricsLedger();

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("queueSize", context.queue(QueueName.LYRICS).depth());
        stats.put("requestsLastMinute", limiter.requestsInWindow());
        stats.put("rateLimit", limiter.getLimit());
        stats.put("pausedUntil", limiter.getCooldownUntil().map(Instant::toString).orElse(null));
        stats.put("failedTracks", ledger.exhaustedCount());
        stats.put("retryingTracks", ledger.trackedCount() - ledger.exhaustedCount());
        stats.put("maxRetries", ledger.getMaxRetries());
        writeJson(resp, HttpServletResponse.SC_OK, stats);
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String action = action(req);
        Map<String, Object> result = new LinkedHashMap<>();
        switch (action) {
            case "pause":
                context.getLyricsLimiter().pause();
                context.getEventLog().info("Lyrics fetching paused for "
                    + context.getLyricsLimiter().getCooldown().getSeconds() + "s");
                result.put("status", "paused");
                result.put("duration", context.getLyricsLimiter().getCooldown().getSeconds());
                writeJson(resp, HttpServletResponse.SC_OK, result);
                break;

            case "resume":
                context.getLyricsLimiter().resume();
                context.getEventLog().info("Lyrics fetching resumed");
                result.put("status", "resumed");
                writeJson(resp, HttpServletResponse.SC_OK, result);
                break;

            case "scan":
                if (!context.isEnabled(QueueName.LYRICS)) {
                    writeError(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "library directory not available");
                    return;
                }
                context.startLyricsScan();
                result.put("status", "started");
                writeJson(resp, HttpServletResponse.SC_ACCEPTED, result);
                break;

            case "failures/clear":
                int cleared = context.getLyricsLedger().trackedCount();
                context.getLyricsLedger().clearAll();
                context.getEventLog().info("Lyrics failure ledger cleared (" + cleared + " tracks)");
                result.put("status", "cleared");
                result.put("cleared", cleared);
                writeJson(resp, HttpServletResponse.SC_OK, result);
                break;

            case "fetch":
                String path = req.getParameter("path");
                if (path == null || path.isEmpty()) {
                    writeError(resp, HttpServletResponse.SC_BAD_REQUEST, "missing path");
                    return;
                }
                boolean queued;
                try {
                    queued = context.requestLyricsFetch(Paths.get(path));
                } catch (InvalidPathException e) {
                    queued = false;
                }
                if (!queued) {
                    writeError(resp, HttpServletResponse.SC_BAD_REQUEST, "not an audio file inside the library: " + path);
                    return;
                }
                result.put("status", "queued");
                writeJson(resp, HttpServletResponse.SC_ACCEPTED, result);
                break;

            default:
                writeError(resp, HttpServletResponse.SC_NOT_FOUND, "unknown action: " + action);
        }
    }
}
