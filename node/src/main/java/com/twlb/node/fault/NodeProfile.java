package com.twlb.node.fault;

import lombok.Builder;
import lombok.Value;

import java.util.Random;

/**
 * Immutable performance baseline of a simulated node.
 * <p>
 * Drawn once at creation from a generator seeded by the node number, so the same node
 * reproduces the same baseline across restarts while every node differs from its peers.
 * </p>
 */
@Value
@Builder
public class NodeProfile {

    /**
     * Service time of an unloaded request, 10-50 ms.
     */
    double baseLatencyMs;

    /**
     * Baseline CPU load as a fraction, 0.20-0.50.
     */
    double baseCpu;

    /**
     * Amplitude of the traffic cycle as a fraction, 0.30-0.70.
     */
    double workloadVariation;

    /**
     * Spread of the network noise, 2-15 ms.
     */
    double jitterMs;

    /**
     * Probability that a request pays a retransmission penalty, 0.001-0.02.
     */
    double packetLoss;

    /**
     * 0.7-1.0; lower values widen the network noise.
     */
    double stability;

    /**
     * Draws the next profile from the given generator. Consumes exactly six values.
     *
     * @param random generator owned by the node
     * @return freshly drawn profile
     */
    public static NodeProfile draw(Random random) {
        return NodeProfile.builder()
            .baseLatencyMs(uniform(random, 10.0, 50.0))
            .baseCpu(uniform(random, 0.20, 0.50))
            .workloadVariation(uniform(random, 0.30, 0.70))
            .jitterMs(uniform(random, 2.0, 15.0))
            .packetLoss(uniform(random, 0.001, 0.02))
            .stability(uniform(random, 0.7, 1.0))
            .build();
    }

    static double uniform(Random random, double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    @Override
    public String toString() {
        return String.format(
            "NodeProfile{baseLatency=%.1fms, baseCpu=%.1f%%, variation=%.1f%%, jitter=%.1fms, packetLoss=%.2f%%, stability=%.2f}",
            baseLatencyMs, baseCpu * 100, workloadVariation * 100, jitterMs, packetLoss * 100, stability
        );
    }
}
