package com.lux032.musicpipeline.web;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.lux032.musicpipeline.model.SlskdSearchResult;
import com.lux032.musicpipeline.service.SlskdClient;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * slskd 代理接口: 搜索、加入下载、下载列表
 */
@Slf4j
public class SlskdServlet extends JsonServlet {

    private final SlskdClient slskdClient;

    public SlskdServlet(SlskdClient slskdClient) {
        this.slskdClient = slskdClient;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String action = action(req);
        try {
            switch (action) {
                case "search":
                    String query = req.getParameter("q");
                    if (query == null || query.trim().isEmpty()) {
                        writeError(resp, HttpServletResponse.SC_BAD_REQUEST, "missing q");
                        return;
                    }
                    String type = req.getParameter("type");
                    SlskdSearchResult result = slskdClient.search(query.trim(), type == null ? "flac" : type);
                    writeJson(resp, HttpServletResponse.SC_OK, result);
                    break;

                case "downloads":
                    writeJson(resp, HttpServletResponse.SC_OK, slskdClient.listDownloads().toString());
                    break;

                default:
                    writeError(resp, HttpServletResponse.SC_NOT_FOUND, "unknown endpoint");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writeError(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "interrupted");
        } catch (IOException e) {
            log.error("slskd 请求失败: {}", action, e);
            writeError(resp, HttpServletResponse.SC_BAD_GATEWAY, e.getMessage());
        }
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        if (!"download".equals(action(req))) {
            writeError(resp, HttpServletResponse.SC_NOT_FOUND, "unknown endpoint");
            return;
        }

        String username;
        String filename;
        long size;
        try (Reader reader = req.getReader()) {
            JsonObject body = JsonParser.parseReader(reader).getAsJsonObject();
            username = body.has("username") ? body.get("username").getAsString() : null;
            filename = body.has("filename") ? body.get("filename").getAsString() : null;
            size = body.has("size") ? body.get("size").getAsLong() : 0L;
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            writeError(resp, HttpServletResponse.SC_BAD_REQUEST, "invalid JSON body");
            return;
        }
        if (username == null || username.isEmpty() || filename == null || filename.isEmpty()) {
            writeError(resp, HttpServletResponse.SC_BAD_REQUEST, "username and filename are required");
            return;
        }

        try {
            slskdClient.enqueueDownload(username, filename, size);
        } catch (IOException e) {
            log.error("Download queue failed: {}", filename, e);
            writeError(resp, HttpServletResponse.SC_BAD_GATEWAY, e.getMessage());
            return;
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("message", "Download queued: " + filename);
        result.put("username", username);
        result.put("filename", filename);
        writeJson(resp, HttpServletResponse.SC_OK, result);
    }
}
