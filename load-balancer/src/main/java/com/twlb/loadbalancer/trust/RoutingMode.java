package com.twlb.loadbalancer.trust;

/**
 * How the dispatcher picks nodes from a routing table.
 */
public enum RoutingMode {
    /**
     * Weighted random draw over classifier-derived weights.
     */
    TRUST_WEIGHTED("trust_weighted"),
    /**
     * Rotation over every known node, ignoring weights.
     */
    ROUND_ROBIN("round_robin");

    private final String tag;

    RoutingMode(String tag) {
        this.tag = tag;
    }

    /**
     * @return lower-case form used in meter tags
     */
    public String tag() {
        return tag;
    }
}
