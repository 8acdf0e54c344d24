package com.twlb.loadbalancer.trust;

/**
 * Interface for fault classifiers (Dependency Inversion Principle).
 * <p>
 * Maps a node's feature vector {@code [latency_ms, error_500_count, cpu_usage_rate, resident_mem_mb]}
 * to per-class probabilities.
 * </p>
 */
public interface ITrustClassifier extends AutoCloseable {

    /**
     * @param features feature vector in training order
     * @return class probabilities summing to 1
     * @throws IllegalStateException    if the classifier is not available
     * @throws IllegalArgumentException if the vector has the wrong dimension
     */
    ClassPrediction predict(double[] features);

    /**
     * @return false when no model is loaded and routing must degrade to round robin
     */
    boolean isAvailable();

    /**
     * Short human-readable description for startup logs.
     */
    String describe();

    /**
     * Releases native resources held by the model.
     */
    @Override
    default void close() {
    }
}
