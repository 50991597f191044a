package com.lux032.musicpipeline.web;

import com.lux032.musicpipeline.core.OrchestratorContext;
import com.lux032.musicpipeline.model.CommandResult;
import com.lux032.musicpipeline.model.LibraryStats;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * 音乐库接口: 统计和同步刷新
 */
@Slf4j
public class LibraryServlet extends JsonServlet {

    private final OrchestratorContext context;

    public LibraryServlet(OrchestratorContext context) {
        this.context = context;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        if (!"stats".equals(action(req))) {
            writeError(resp, HttpServletResponse.SC_NOT_FOUND, "unknown endpoint");
            return;
        }
        try {
            LibraryStats stats = context.getLibraryStatsCache().get(booleanParam(req, "force_refresh"));
            writeJson(resp, HttpServletResponse.SC_OK, stats);
        } catch (RuntimeException e) {
            log.error("获取音乐库统计失败", e);
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
                    context.getLibraryStatsCache().invalidate();
                    result.put("status", "invalidated");
                    writeJson(resp, HttpServletResponse.SC_OK, result);
                    break;

                case "refresh":
                    CommandResult refresh = context.refreshLibrary();
                    if (!refresh.isSuccess()) {
                        writeError(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, refresh.getOutput());
                        return;
                    }
                    result.put("status", "ok");
                    result.put("detail", refresh.getOutput().trim());
                    writeJson(resp, HttpServletResponse.SC_OK, result);
                    break;

                default:
                    writeError(resp, HttpServletResponse.SC_NOT_FOUND, "unknown action: " + action);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writeError(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "interrupted");
        } catch (RuntimeException e) {
            log.error("执行音乐库操作失败: {}", action, e);
            writeError(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }
}
