package com.twlb.loadbalancer.metrics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.twlb.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Service for querying Prometheus metrics using reactor-netty HttpClient.
 * <p>
 * Configuration:
 * - Local: Prometheus at http://prometheus:9090
 * - Kubernetes: Prometheus service at http://prometheus-service.monitoring.svc.cluster.local:9090
 * </p>
 */
public class PrometheusQueryService {
    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryService.class);

    private final HttpClient httpClient;

    /**
     * Creates a Prometheus query service.
     *
     * @param prometheusHost  Prometheus host (e.g., "prometheus")
     * @param prometheusPort  Prometheus port (typically 9090)
     * @param responseTimeout upper bound for a single HTTP exchange
     */
    public PrometheusQueryService(String prometheusHost, int prometheusPort, Duration responseTimeout) {
        this.httpClient = HttpClient.create()
                .host(prometheusHost)
                .port(prometheusPort)
                .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
                .responseTimeout(responseTimeout);

        log.info("PrometheusQueryService initialized with {}:{}", prometheusHost, prometheusPort);
    }

    /**
     * Executes an instant PromQL query and returns the result.
     * Transport errors, failed queries and unparseable bodies all yield an empty result.
     *
     * @param query PromQL query string
     * @return Mono<PrometheusQueryResult> containing query results
     */
    public Mono<PrometheusQueryResult> query(String query) {
        String encodedQuery = URLEncoder.encode(query, StandardCharsets.UTF_8);

        String uri = "/api/v1/query?query=" + encodedQuery;

        log.debug("Executing Prometheus query: {}", query);

        return httpClient.get()
                .uri(uri)
                .responseContent()
                .aggregate()
                .asString()
                .retry(1)
                .map(PrometheusQueryService::parse)
                .doOnError(err -> log.warn("Failed to query Prometheus: {}", err.getMessage()))
                .onErrorReturn(PrometheusQueryResult.empty());
    }

    /**
     * Decodes a Prometheus HTTP API body.
     *
     * @param responseBody raw JSON
     * @return decoded result, empty when the query failed or the body is malformed
     */
    static PrometheusQueryResult parse(String responseBody) {
        try {
            PrometheusResponse response = JsonUtils.readValue(responseBody, PrometheusResponse.class);

            if (!"success".equalsIgnoreCase(response.getStatus())) {
                log.error("Prometheus query failed: {}", response.getError());
                return PrometheusQueryResult.empty();
            }

            log.debug("Prometheus query successful, result count: {}",
                    response.getData() != null && response.getData().getResult() != null
                            ? response.getData().getResult().size() : 0);

            return PrometheusQueryResult.from(response);
        } catch (RuntimeException e) {
            log.error("Failed to parse Prometheus response: {}", e.getMessage());
            return PrometheusQueryResult.empty();
        }
    }

    /**
     * Health check - tests Prometheus connectivity.
     *
     * @return Mono<Boolean> true if Prometheus is reachable
     */
    public Mono<Boolean> healthCheck() {
        return httpClient.get()
                .uri("/-/healthy")
                .responseSingle((response, body) -> Mono.just(response.status().code() == 200))
                .timeout(Duration.ofSeconds(3))
                .doOnNext(healthy -> {
                    if (healthy) {
                        log.debug("Prometheus health check: OK");
                    } else {
                        log.warn("Prometheus health check: FAILED");
                    }
                })
                .onErrorReturn(false);
    }

    /**
     * Data class for Prometheus API response.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusResponse {
        private String status;
        private PrometheusData data;
        private String error;
        private String errorType;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusData {
        private String resultType;
        private List<PrometheusResult> result;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusResult {
        private Map<String, String> metric;
        private List<Object> value;
    }
}
