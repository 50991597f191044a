package com.lux032.musicpipeline.web;

import com.lux032.musicpipeline.core.OrchestratorContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;

/**
 * 手动触发封面获取
 */
@Slf4j
public class CoverServlet extends JsonServlet {

    private final OrchestratorContext context;

    public CoverServlet(OrchestratorContext context) {
        this.context = context;
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        if (!"fetch".equals(action(req))) {
            writeError(resp, HttpServletResponse.SC_NOT_FOUND, "unknown endpoint");
            return;
        }
        String path = req.getParameter("path");
        if (path == null || path.isEmpty()) {
            writeError(resp, HttpServletResponse.SC_BAD_REQUEST, "missing path");
            return;
        }
        try {
            if (!context.requestCoverFetch(Paths.get(path))) {
                writeError(resp, HttpServletResponse.SC_BAD_REQUEST, "not an album directory inside the library: " + path);
                return;
            }
        } catch (InvalidPathException e) {
            writeError(resp, HttpServletResponse.SC_BAD_REQUEST, "invalid path: " + path);
            return;
        }
        log.info("通过 API 请求获取封面: {}", path);
        writeJson(resp, HttpServletResponse.SC_ACCEPTED, message("status", "queued"));
    }
}
