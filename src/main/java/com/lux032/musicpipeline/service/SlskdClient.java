package com.lux032.musicpipeline.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lux032.musicpipeline.config.PipelineConfig;
import com.lux032.musicpipeline.model.SlskdFile;
import com.lux032.musicpipeline.model.SlskdSearchResult;
import com.lux032.musicpipeline.util.HttpClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;

import java.io.Closeable;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * slskd 点对点下载服务客户端
 * 只做转发，不实现任何协议
 */
@Slf4j
public class SlskdClient implements Closeable {

    private static final int TIMEOUT_SECONDS = 30;
    private static final int MAX_RESULTS = 50;

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration searchWait;

    public SlskdClient(PipelineConfig config) {
        this(HttpClientFactory.create(config, TIMEOUT_SECONDS),
            config.getSlskdUrl(),
            config.getSlskdApiKey(),
            Duration.ofSeconds(config.getSlskdSearchWaitSeconds()));
    }

    SlskdClient(CloseableHttpClient httpClient, String baseUrl, String apiKey, Duration searchWait) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.searchWait = searchWait;
    }

    /**
     * 发起搜索，等待结果后按扩展名过滤并按码率降序排列
     * @param fileType 扩展名(如 flac)，为空时不过滤
     */
    public SlskdSearchResult search(String query, String fileType) throws IOException, InterruptedException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("searchText", query);
        body.put("filterResponses", true);

        HttpPost start = new HttpPost(baseUrl + "/api/v0/searches");
        start.setEntity(new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
        JsonNode created = execute(start);
        String searchId = created.path("id").asText(null);
        if (searchId == null || searchId.isEmpty()) {
            throw new IOException("No search ID returned");
        }

        Thread.sleep(searchWait.toMillis());

        JsonNode results = execute(new HttpGet(baseUrl + "/api/v0/searches/" + encode(searchId) + "?includeResponses=true"));
        SlskdSearchResult result = parseResults(results, searchId, fileType);
        result.setQuery(query);
        log.info("slskd 搜索完成: {} -> {} 个结果", query, result.getTotalResults());
        return result;
    }

    SlskdSearchResult parseResults(JsonNode results, String searchId, String fileType) {
        String suffix = fileType == null || fileType.isEmpty() ? null : "." + fileType.toLowerCase(Locale.ROOT);
        List<SlskdFile> files = new ArrayList<>();

        for (JsonNode response : results.path("responses")) {
            String username = response.path("username").asText("Unknown");
            for (JsonNode file : response.path("files")) {
                String filename = file.path("filename").asText("");
                if (suffix != null && !filename.toLowerCase(Locale.ROOT).endsWith(suffix)) {
                    continue;
                }
                SlskdFile entry = new SlskdFile();
                entry.setUsername(username);
                entry.setFilename(filename);
                entry.setSize(file.path("size").asLong(0));
                entry.setBitrate(optionalInt(file, "bitRate"));
                entry.setLength(optionalInt(file, "length"));
                entry.setBitDepth(optionalInt(file, "bitDepth"));
                entry.setSearchId(searchId);
                files.add(entry);
            }
        }

        // 优先高码率
        files.sort(Comparator.comparingInt((SlskdFile f) -> f.getBitrate() == null ? 0 : f.getBitrate()).reversed());

        SlskdSearchResult result = new SlskdSearchResult();
        result.setSearchId(searchId);
        result.setTotalResults(files.size());
        result.setResults(new ArrayList<>(files.subList(0, Math.min(MAX_RESULTS, files.size()))));
        return result;
    }

    /**
     * 将文件加入 slskd 下载队列
     */
    public void enqueueDownload(String username, String filename, long size) throws IOException {
        ArrayNode body = objectMapper.createArrayNode();
        ObjectNode file = body.addObject();
        file.put("filename", filename);
        file.put("size", size);

        HttpPost post = new HttpPost(baseUrl + "/api/v0/transfers/downloads/" + encode(username));
        post.setEntity(new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
        execute(post);
        log.info("Queued download: {} from {}", filename, username);
    }

    public JsonNode listDownloads() throws IOException {
        return execute(new HttpGet(baseUrl + "/api/v0/transfers/downloads"));
    }

    private JsonNode execute(HttpUriRequestBase request) throws IOException {
        if (apiKey != null && !apiKey.isEmpty()) {
            request.setHeader("X-API-Key", apiKey);
        }
        request.setHeader("Accept", "application/json");

        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getCode();
            String responseBody = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity());
            if (statusCode < 200 || statusCode >= 300) {
                throw new IOException("slskd returned HTTP " + statusCode + " for " + request.getPath());
            }
            if (responseBody.isEmpty()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(responseBody);
        } catch (ParseException e) {
            throw new IOException("Failed to read slskd response", e);
        }
    }

    private static Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asInt();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
