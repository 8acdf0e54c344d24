package com.twlb.loadbalancer.trust;

import lombok.Builder;
import lombok.Getter;

/**
 * Step function from {@code p_faulty} to routing weight.
 * <p>
 * Bands are closed on the left: {@code p < suspiciousThreshold} is trusted,
 * {@code suspiciousThreshold <= p < faultyThreshold} is suspicious and anything from
 * {@code faultyThreshold} up is faulty. A probability that is not a number maps to trusted.
 * </p>
 */
@Getter
public final class TrustBands {

    private final double suspiciousThreshold;
    private final double faultyThreshold;
    private final double trustedWeight;
    private final double suspiciousWeight;
    private final double faultyWeight;

    @Builder
    private TrustBands(double suspiciousThreshold, double faultyThreshold,
                       double trustedWeight, double suspiciousWeight, double faultyWeight) {
        if (!(suspiciousThreshold > 0.0 && suspiciousThreshold < faultyThreshold && faultyThreshold <= 1.0)) {
            throw new IllegalArgumentException(
                "Trust thresholds must satisfy 0 < suspicious < faulty <= 1, got "
                    + suspiciousThreshold + " / " + faultyThreshold);
        }
        if (trustedWeight <= 0.0 || suspiciousWeight < 0.0 || faultyWeight < 0.0) {
            throw new IllegalArgumentException("Trust weights must be non-negative and trusted weight positive");
        }
        this.suspiciousThreshold = suspiciousThreshold;
        this.faultyThreshold = faultyThreshold;
        this.trustedWeight = trustedWeight;
        this.suspiciousWeight = suspiciousWeight;
        this.faultyWeight = faultyWeight;
    }

    /**
     * 0.20 / 0.60 cut points with weights 1.0 / 0.5 / 0.1.
     */
    public static TrustBands defaults() {
        return TrustBands.builder()
            .suspiciousThreshold(0.20)
            .faultyThreshold(0.60)
            .trustedWeight(1.0)
            .suspiciousWeight(0.5)
            .faultyWeight(0.1)
            .build();
    }

    public TrustTier tierFor(double pFaulty) {
        if (Double.isNaN(pFaulty) || pFaulty < suspiciousThreshold) {
            return TrustTier.TRUSTED;
        }
        if (pFaulty < faultyThreshold) {
            return TrustTier.SUSPICIOUS;
        }
        return TrustTier.FAULTY;
    }

    public double weightFor(double pFaulty) {
        return weightOf(tierFor(pFaulty));
    }

    public double weightOf(TrustTier tier) {
        return switch (tier) {
            case TRUSTED -> trustedWeight;
            case SUSPICIOUS -> suspiciousWeight;
            case FAULTY -> faultyWeight;
        };
    }

    @Override
    public String toString() {
        return String.format("TrustBands{<%.2f -> %.2f, <%.2f -> %.2f, else %.2f}",
            suspiciousThreshold, trustedWeight, faultyThreshold, suspiciousWeight, faultyWeight);
    }
}
