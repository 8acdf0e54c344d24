package com.twlb.loadbalancer.trust;

/**
 * Trust band a node falls into for one refresh cycle.
 */
public enum TrustTier {
    TRUSTED("trusted"),
    SUSPICIOUS("suspicious"),
    FAULTY("faulty");

    private final String label;

    TrustTier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
