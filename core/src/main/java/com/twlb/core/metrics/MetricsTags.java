package com.twlb.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Node-side and balancer-side meters share {@code node_id} so Prometheus queries can join them.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for response status (200/500/error).
     */
    public static final String STATUS = "status";

    /**
     * Tag key for routing mode (trust_weighted/round_robin).
     */
    public static final String MODE = "mode";

    /**
     * Tag key for dispatch or refresh outcome.
     */
    public static final String OUTCOME = "outcome";
}
