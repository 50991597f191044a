package com.lux032.musicpipeline.web;

import com.lux032.musicpipeline.core.OrchestratorContext;
import com.lux032.musicpipeline.model.EventLogEntry;
import com.lux032.musicpipeline.model.QueueName;
import com.lux032.musicpipeline.queue.WorkQueue;
import com.lux032.musicpipeline.service.EventLog;
import com.lux032.musicpipeline.worker.Worker;
import com.lux032.musicpipeline.worker.WorkerPool;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 流水线状态接口 - 队列深度、租约状态和增量事件日志
 */
@Slf4j
public class WatcherStatusServlet extends JsonServlet {

    private static final int MAX_LIMIT = 200;

    private final OrchestratorContext context;
    private final WorkerPool workerPool;

    public WatcherStatusServlet(OrchestratorContext context, WorkerPool workerPool) {
        this.context = context;
        this.workerPool = workerPool;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        if (!"status".equals(action(req))) {
            writeError(resp, HttpServletResponse.SC_NOT_FOUND, "unknown endpoint");
            return;
        }

        Long sinceId;
        int limit = EventLog.DEFAULT_TAIL_LIMIT;
        try {
            sinceId = longParam(req, "since_id");
            Long limitParam = longParam(req, "limit");
            if (limitParam != null) {
                limit = (int) Math.max(0, Math.min(limitParam, MAX_LIMIT));
            }
        } catch (IllegalArgumentException e) {
            writeError(resp, HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
            return;
        }

        Map<String, Object> queues = new LinkedHashMap<>();
        Map<QueueName, Worker> workers = workerPool == null ? Map.of() : workerPool.getWorkers();
        for (QueueName name : QueueName.values()) {
            WorkQueue queue = context.queue(name);
            Map<String, Object> queueStatus = new LinkedHashMap<>();
            queueStatus.put("enabled", context.isEnabled(name));
            queueStatus.put("depth", queue.depth());
            queueStatus.put("pending", queue.pendingTargets());
            Worker worker = workers.get(name);
            if (worker != null) {
                queueStatus.put("current", worker.getCurrentTarget());
                queueStatus.put("succeeded", worker.getSucceededCount());
                queueStatus.put("failed", worker.getFailedCount());
                queueStatus.put("skipped", worker.getSkippedCount());
            }
            queues.put(name.getKey(), queueStatus);
        }

        Map<String, Object> lease = new LinkedHashMap<>();
        lease.put("name", context.getImportLease().getName());
        lease.put("held", context.getImportLease().isHeld());

        List<EventLogEntry> logs = context.getEventLog().tail(sinceId, limit);

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("queues", queues);
        status.put("importLease", lease);
        status.put("recentLogs", logs);
        status.put("lastLogId", context.getEventLog().getLastId());
        writeJson(resp, HttpServletResponse.SC_OK, status);
    }
}
