package com.twlb.loadbalancer.metrics;

import com.twlb.core.metrics.MetricsTags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Builds node observations from the meters every node exports to Prometheus.
 * <p>
 * Issues one query per metric per node. Each query is bounded by a timeout; a timeout, an
 * error or an empty result only zeroes that one metric.
 * </p>
 */
public class PrometheusObservationSource implements IObservationSource {
    private static final Logger log = LoggerFactory.getLogger(PrometheusObservationSource.class);

    private final PrometheusQueryService queryService;
    private final String window;
    private final Duration queryTimeout;
    private final Clock clock;

    public PrometheusObservationSource(PrometheusQueryService queryService, String window,
                                       Duration queryTimeout, Clock clock) {
        this.queryService = queryService;
        this.window = window;
        this.queryTimeout = queryTimeout;
        this.clock = clock;
    }

    /**
     * Average latency in seconds over the window.
     */
    String latencyQuery(String nodeId) {
        String selector = selector(nodeId);
        return "sum(rate(request_latency_seconds_sum" + selector + "[" + window + "]))"
                + " / sum(rate(request_latency_seconds_count" + selector + "[" + window + "]))";
    }

    /**
     * Number of HTTP 500 responses over the window.
     */
    String errorCountQuery(String nodeId) {
        return "sum(increase(http_requests_total{" + MetricsTags.NODE_ID + "=\"" + nodeId + "\","
                + MetricsTags.STATUS + "=\"500\"}[" + window + "]))";
    }

    /**
     * CPU usage as a fraction.
     */
    String cpuQuery(String nodeId) {
        return "avg(node_cpu_usage_percent" + selector(nodeId) + ") / 100";
    }

    /**
     * Resident memory in MB.
     */
    String memoryQuery(String nodeId) {
        return "avg(node_memory_mb" + selector(nodeId) + ")";
    }

    @Override
    public Mono<Observation> observe(String nodeId) {
        return Mono.zip(
                scalar(nodeId, "latency", latencyQuery(nodeId)),
                scalar(nodeId, "errors", errorCountQuery(nodeId)),
                scalar(nodeId, "cpu", cpuQuery(nodeId)),
                scalar(nodeId, "memory", memoryQuery(nodeId))
        ).map(tuple -> {
            Observation observation = Observation.builder()
                    .nodeId(nodeId)
                    .avgLatencySeconds(tuple.getT1())
                    .errorCount(tuple.getT2())
                    .cpuRate(tuple.getT3())
                    .memoryMb(tuple.getT4())
                    .observedAt(clock.instant())
                    .build();
            log.debug("Built observation for node {}: {}", nodeId, observation);
            return observation;
        });
    }

    private Mono<Double> scalar(String nodeId, String metric, String query) {
        return queryService.query(query)
                .map(result -> result.getValue().orElse(0.0))
                .defaultIfEmpty(0.0)
                .timeout(queryTimeout)
                .onErrorResume(err -> {
                    log.warn("No {} metric for {}: {}", metric, nodeId, err.toString());
                    return Mono.just(0.0);
                });
    }

    private static String selector(String nodeId) {
        return "{" + MetricsTags.NODE_ID + "=\"" + nodeId + "\"}";
    }
}
