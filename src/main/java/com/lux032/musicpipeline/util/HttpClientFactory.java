package com.lux032.musicpipeline.util;

import com.lux032.musicpipeline.config.PipelineConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.util.Timeout;

/**
 * 创建 HttpClient,支持代理配置
 */
@Slf4j
public final class HttpClientFactory {

    private HttpClientFactory() {
    }

    public static CloseableHttpClient create(PipelineConfig config, int timeoutSeconds) {
        HttpClientBuilder builder = HttpClients.custom();

        // 设置超时
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofSeconds(timeoutSeconds))
            .setResponseTimeout(Timeout.ofSeconds(timeoutSeconds))
            .build();
        builder.setDefaultRequestConfig(requestConfig);

        // 配置代理
        if (config.isProxyEnabled() && config.getProxyHost() != null && !config.getProxyHost().isEmpty()) {
            HttpHost proxy = new HttpHost(config.getProxyHost(), config.getProxyPort());
            builder.setProxy(proxy);
            log.debug("HttpClient 使用代理: {}:{}", config.getProxyHost(), config.getProxyPort());
        }

        return builder.build();
    }
}
