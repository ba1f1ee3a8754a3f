package com.deepansh.chatagent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Shared pooled HttpClient behind every outbound RestClient
 * (reasoning service, chat gateway, HTTP-backed tools).
 *
 * The response timeout here is a transport ceiling; per-call budgets are
 * enforced by the orchestrator on top of it.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${http.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${http.response-timeout-ms:90000}")
    private long responseTimeoutMs;

    @Value("${http.max-connections:50}")
    private int maxConnections;

    @Bean(destroyMethod = "close")
    public CloseableHttpClient pooledHttpClient() {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
                        .build())
                .build();

        log.info("HttpClient configured [maxConnections={}, connectTimeout={}ms, responseTimeout={}ms]",
                maxConnections, connectTimeoutMs, responseTimeoutMs);
        return httpClient;
    }

    /**
     * Prototype-scoped so every consumer gets its own builder to set a base URL on.
     */
    @Bean
    @Scope("prototype")
    public RestClient.Builder pooledRestClientBuilder(CloseableHttpClient pooledHttpClient) {
        return RestClient.builder()
                .requestFactory(new HttpComponentsClientHttpRequestFactory(pooledHttpClient));
    }
}
