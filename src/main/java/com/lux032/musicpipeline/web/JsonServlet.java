package com.lux032.musicpipeline.web;

import com.google.gson.Gson;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * JSON 接口基类
 * 子路径(pathInfo)作为操作名分发
 */
public abstract class JsonServlet extends HttpServlet {

    protected final Gson gson = new Gson();

    protected void writeJson(HttpServletResponse resp, int status, Object body) throws IOException {
        resp.setStatus(status);
        resp.setContentType("application/json");
        resp.setCharacterEncoding("UTF-8");
        resp.getWriter().write(body instanceof String ? (String) body : gson.toJson(body));
    }

    protected void writeError(HttpServletResponse resp, int status, String message) throws IOException {
        Map<String, Object> error = new HashMap<>();
        error.put("error", message);
        writeJson(resp, status, error);
    }

    /**
     * 去掉开头的 / 后的操作名，没有时返回空串
     */
    protected static String action(HttpServletRequest req) {
        String pathInfo = req.getPathInfo();
        if (pathInfo == null || pathInfo.equals("/")) {
            return "";
        }
        return pathInfo.substring(1);
    }

    protected static boolean booleanParam(HttpServletRequest req, String name) {
        String value = req.getParameter(name);
        return value != null && ("true".equalsIgnoreCase(value) || "1".equals(value));
    }

    protected static Long longParam(HttpServletRequest req, String name) {
        String value = req.getParameter(name);
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + name + ": " + value);
        }
    }

    protected static Map<String, Object> message(String key, Object value) {
        Map<String, Object> result = new HashMap<>();
        result.put(key, value);
        return result;
    }
}
