package com.twlb.node.fault;

import java.time.Duration;
import java.util.Random;

/**
 * Per-request load multiplier: a slow sinusoidal traffic cycle plus rare spikes.
 */
public class LoadModel {

    static final double SPIKE_PROBABILITY = 0.05;
    static final double SPIKE_MIN = 1.5;
    static final double SPIKE_MAX = 3.0;

    private final double amplitude;
    private final long periodMs;

    /**
     * @param workloadVariation node's variation factor; the cycle swings by half of it
     * @param period            length of one traffic cycle
     */
    public LoadModel(double workloadVariation, Duration period) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Load cycle period must be positive");
        }
        this.amplitude = workloadVariation / 2.0;
        this.periodMs = period.toMillis();
    }

    /**
     * Cycle component only, in {@code [1 - amplitude, 1 + amplitude]}.
     */
    public double cycleFactor(Duration elapsed) {
        double phase = 2.0 * Math.PI * (elapsed.toMillis() % periodMs) / periodMs;
        return 1.0 + amplitude * Math.sin(phase);
    }

    /**
     * Recomputed for every request.
     *
     * @param elapsed time since the node started
     * @param random  node-owned generator
     * @return load factor, always positive
     */
    public double loadFactor(Duration elapsed, Random random) {
        double factor = cycleFactor(elapsed);
        if (random.nextDouble() < SPIKE_PROBABILITY) {
            factor *= NodeProfile.uniform(random, SPIKE_MIN, SPIKE_MAX);
        }
        return factor;
    }
}
