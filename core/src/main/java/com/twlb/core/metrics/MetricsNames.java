package com.twlb.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * Node meters keep the names the trust classifier was trained against
 * ({@code http_requests_total}, {@code request_latency_seconds}, ...), so they carry no prefix.
 * Balancer meters use {@code twlb.<component>.<metric>}.
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: requests answered by a node.
     * <p>
     * Tags: node_id, status (200/500/error). Exported as {@code http_requests_total}.
     * </p>
     */
    public static final String HTTP_REQUESTS = "http.requests";

    /**
     * Timer: true request handling latency on a node.
     * <p>
     * Tags: node_id, status. Exported as {@code request_latency_seconds_*}.
     * </p>
     */
    public static final String REQUEST_LATENCY = "request.latency";

    /**
     * Gauge: simulated CPU usage, 0-100.
     */
    public static final String NODE_CPU_USAGE_PERCENT = "node.cpu.usage.percent";

    /**
     * Gauge: simulated resident memory in MB.
     */
    public static final String NODE_MEMORY_MB = "node.memory.mb";

    /**
     * Gauge: current routing weight of a node.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String LB_TRUST_WEIGHT = "twlb.trust.weight";

    /**
     * Gauge: last p_faulty computed for a node, -1 when unavailable.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String LB_TRUST_P_FAULTY = "twlb.trust.p.faulty";

    /**
     * Counter: routing table refresh cycles.
     * <p>
     * Tags: outcome (trust_weighted/round_robin)
     * </p>
     */
    public static final String LB_TRUST_REFRESH_TOTAL = "twlb.trust.refresh.total";

    /**
     * Counter: dispatched requests.
     * <p>
     * Tags: node_id, mode, outcome
     * </p>
     */
    public static final String LB_DISPATCH_TOTAL = "twlb.dispatch.total";

    /**
     * Timer: latency of dispatched requests as seen by the balancer.
     * <p>
     * Tags: mode
     * </p>
     */
    public static final String LB_DISPATCH_LATENCY = "twlb.dispatch.latency";
}
