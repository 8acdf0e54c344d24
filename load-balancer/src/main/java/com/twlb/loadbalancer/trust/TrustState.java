package com.twlb.loadbalancer.trust;

import com.twlb.loadbalancer.metrics.Observation;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Trust verdict for one node in one refresh cycle.
 */
@Value
@Builder(toBuilder = true)
public class TrustState {
    String nodeId;
    double weight;
    TrustTier tier;

    /**
     * Null when no prediction was made (degraded mode or a failed evaluation).
     */
    Double pFaulty;

    /**
     * Class probabilities of the prediction, empty when none was made.
     */
    @Builder.Default
    Map<String, Double> probabilities = Map.of();

    /**
     * Null when the evaluation failed before telemetry was fetched.
     */
    Observation observation;

    Instant updatedAt;

    /**
     * Full-weight state used before the first refresh and whenever a node cannot be evaluated.
     */
    public static TrustState fullTrust(String nodeId, double weight, Instant at) {
        return TrustState.builder()
            .nodeId(nodeId)
            .weight(weight)
            .tier(TrustTier.TRUSTED)
            .updatedAt(at)
            .build();
    }

    public boolean hasPrediction() {
        return pFaulty != null;
    }
}
