package com.lux032.musicpipeline.web;

import com.lux032.musicpipeline.core.OrchestratorContext;
import com.lux032.musicpipeline.model.InboxStats;
import com.lux032.musicpipeline.model.QueueName;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * 收件箱接口: 统计、手动导入、清理
 */
@Slf4j
public class InboxServlet extends JsonServlet {

    private final OrchestratorContext context;

    public InboxServlet(OrchestratorContext context) {
        this.context = context;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        if (!"stats".equals(action(req))) {
            writeError(resp, HttpServletResponse.SC_NOT_FOUND, "unknown endpoint");
            return;
        }
        try {
            InboxStats stats = context.getInboxStatsCache().get(booleanParam(req, "force_refresh"));
            writeJson(resp, HttpServletResponse.SC_OK, stats);
        } catch (RuntimeException e) {
            log.error("获取收件箱统计失败", e);
            writeError(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String action = action(req);
        Map<String, Object> result = new HashMap<>();
        try {
            switch (action) {
                case "stats/invalidate":
                    context.getInboxStatsCache().invalidate();
                    result.put("status", "invalidated");
                    writeJson(resp, HttpServletResponse.SC_OK, result);
                    break;

                case "import":
                    if (!context.isEnabled(QueueName.INBOX)) {
                        writeError(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "inbox directory not available");
                        return;
                    }
                    if (!context.startManualImport()) {
                        writeError(resp, HttpServletResponse.SC_CONFLICT, "Import already in progress");
                        return;
                    }
                    log.info("通过 API 触发手动导入");
                    result.put("status", "started");
                    writeJson(resp, HttpServletResponse.SC_ACCEPTED, result);
                    break;

                case "cleanup":
                    int removed = context.getInboxCleanupService().cleanup();
                    context.getInboxStatsCache().invalidate();
                    result.put("status", "ok");
                    result.put("removed", removed);
                    writeJson(resp, HttpServletResponse.SC_OK, result);
                    break;

                default:
                    writeError(resp, HttpServletResponse.SC_NOT_FOUND, "unknown action: " + action);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writeError(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "interrupted");
        } catch (RuntimeException e) {
            log.error("执行收件箱操作失败: {}", action, e);
            writeError(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }
}
