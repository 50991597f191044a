package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.config.PipelineConfig;
import com.lux032.musicpipeline.util.HttpClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.core5.http.io.entity.EntityUtils;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * Cover Art Archive 客户端
 * 先取 500px 的正面封面，失败再取原图
 */
@Slf4j
public class CoverArtArchiveClient implements Closeable {

    private static final int TIMEOUT_SECONDS = 15;

    private final CloseableHttpClient httpClient;
    private final String apiUrl;
    private final String userAgent;

    public CoverArtArchiveClient(PipelineConfig config) {
        this(HttpClientFactory.create(config, TIMEOUT_SECONDS), config.getCoverArtApiUrl(), config.getUserAgent());
    }

    CoverArtArchiveClient(CloseableHttpClient httpClient, String apiUrl, String userAgent) {
        this.httpClient = httpClient;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.userAgent = userAgent;
    }

    /**
     * 下载 release 的正面封面
     */
    public Optional<byte[]> fetchFront(String releaseId) {
        if (releaseId == null || releaseId.isEmpty()) {
            return Optional.empty();
        }
        Optional<byte[]> data = download(String.format("%s/release/%s/front-500", apiUrl, releaseId));
        if (data.isPresent()) {
            return data;
        }
        return download(String.format("%s/release/%s/front", apiUrl, releaseId));
    }

    private Optional<byte[]> download(String url) {
        HttpGet httpGet = new HttpGet(url);
        httpGet.setHeader("User-Agent", userAgent);

        try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
            if (response.getCode() == 200 && response.getEntity() != null) {
                byte[] data = EntityUtils.toByteArray(response.getEntity());
                if (data.length > 0) {
                    return Optional.of(data);
                }
            }
            log.debug("Cover Art Archive 返回 {}: {}", response.getCode(), url);
        } catch (IOException e) {
            log.warn("下载封面图片失败: {} - {}", url, e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
