package com.twlb.loadbalancer.trust;

/**
 * Stand-in used when no model artifacts could be loaded.
 */
public final class NullTrustClassifier implements ITrustClassifier {

    public static final NullTrustClassifier INSTANCE = new NullTrustClassifier();

    private NullTrustClassifier() {
    }

    @Override
    public ClassPrediction predict(double[] features) {
        throw new IllegalStateException("No trust classifier loaded");
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String describe() {
        return "none";
    }
}
