package com.twlb.node.fault;

import com.twlb.core.model.FaultClass;

import java.time.Duration;

/**
 * Time-evolving misbehavior probability.
 * <p>
 * <b>Formula:</b> {@code p(t) = min(1, base * (1 + 0.5 * min(1, t / ramp)))}
 * <ul>
 *   <li>{@code base}: per-class probability ({@link FaultClass#baseProbability()})</li>
 *   <li>{@code t}: time since the node process started</li>
 *   <li>{@code ramp}: window after which the probability saturates at 1.5x base</li>
 * </ul>
 * </p>
 */
public final class FaultProbability {
    private FaultProbability() {
    }

    public static final double MAX_ESCALATION = 0.5;

    /**
     * @param faultClass class of the node
     * @param elapsed    time since the node started, negative values count as zero
     * @param ramp       escalation window; zero or negative means fully escalated
     * @return probability in [0, 1]
     */
    public static double at(FaultClass faultClass, Duration elapsed, Duration ramp) {
        double base = faultClass.baseProbability();
        if (base <= 0.0) {
            return 0.0;
        }
        double progress;
        if (ramp.isZero() || ramp.isNegative()) {
            progress = 1.0;
        } else {
            long elapsedMs = Math.max(0L, elapsed.toMillis());
            progress = Math.min(1.0, (double) elapsedMs / ramp.toMillis());
        }
        return Math.min(1.0, base * (1.0 + MAX_ESCALATION * progress));
    }
}
