package com.twlb.loadbalancer.metrics;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Time-windowed telemetry of a single node, as seen by one refresh cycle.
 * <p>
 * Built fresh on every cycle and never mutated. Missing or non-finite values are replaced
 * by 0.0 at construction.
 * </p>
 */
@Value
public class Observation {

    /**
     * Length of {@link #toFeatures()}.
     */
    public static final int FEATURE_COUNT = 4;

    /**
     * Identifier of the observed node.
     */
    String nodeId;

    /**
     * Average request latency over the window, in seconds.
     */
    double avgLatencySeconds;

    /**
     * Number of error-status (HTTP 500) responses over the window.
     */
    double errorCount;

    /**
     * CPU usage as a fraction (0.0 to 1.0).
     */
    double cpuRate;

    /**
     * Resident memory in MB.
     */
    double memoryMb;

    Instant observedAt;

    @Builder
    private Observation(String nodeId, double avgLatencySeconds, double errorCount,
                        double cpuRate, double memoryMb, Instant observedAt) {
        this.nodeId = nodeId;
        this.avgLatencySeconds = neutralIfMissing(avgLatencySeconds);
        this.errorCount = neutralIfMissing(errorCount);
        this.cpuRate = neutralIfMissing(cpuRate);
        this.memoryMb = neutralIfMissing(memoryMb);
        this.observedAt = observedAt != null ? observedAt : Instant.now();
    }

    /**
     * All-zero observation used when nothing could be fetched for a node.
     */
    public static Observation neutral(String nodeId) {
        return Observation.builder().nodeId(nodeId).build();
    }

    /**
     * Classifier input, in training order:
     * {@code [latency_ms, error_500_count, cpu_usage_rate, resident_mem_mb]}.
     */
    public double[] toFeatures() {
        return new double[]{avgLatencySeconds * 1000.0, errorCount, cpuRate, memoryMb};
    }

    public double getAvgLatencyMs() {
        return avgLatencySeconds * 1000.0;
    }

    private static double neutralIfMissing(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    @Override
    public String toString() {
        return String.format(
                "Observation{nodeId='%s', latency=%.2fms, errors=%.0f, cpu=%.1f%%, mem=%.1fMB}",
                nodeId, getAvgLatencyMs(), errorCount, cpuRate * 100, memoryMb
        );
    }
}
