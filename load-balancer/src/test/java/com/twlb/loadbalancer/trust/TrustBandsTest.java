package com.twlb.loadbalancer.trust;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TrustBandsTest {

    private final TrustBands bands = TrustBands.defaults();

    @Test
    @DisplayName("Representative probabilities land in their bands")
    void representativeValues() {
        assertEquals(1.0, bands.weightFor(0.05));
        assertEquals(0.5, bands.weightFor(0.45));
        assertEquals(0.1, bands.weightFor(0.95));
    }

    @Test
    @DisplayName("Bands are closed on the left")
    void boundaries() {
        assertEquals(TrustTier.TRUSTED, bands.tierFor(0.1999));
        assertEquals(TrustTier.SUSPICIOUS, bands.tierFor(0.20));
        assertEquals(TrustTier.SUSPICIOUS, bands.tierFor(0.5999));
        assertEquals(TrustTier.FAULTY, bands.tierFor(0.60));
        assertEquals(TrustTier.TRUSTED, bands.tierFor(0.0));
        assertEquals(TrustTier.FAULTY, bands.tierFor(1.0));
    }

    @Test
    void notANumberIsTrusted() {
        assertEquals(TrustTier.TRUSTED, bands.tierFor(Double.NaN));
        assertEquals(1.0, bands.weightFor(Double.NaN));
    }

    @Test
    void customBands() {
        TrustBands strict = TrustBands.builder()
            .suspiciousThreshold(0.1)
            .faultyThreshold(0.3)
            .trustedWeight(2.0)
            .suspiciousWeight(1.0)
            .faultyWeight(0.0)
            .build();

        assertEquals(2.0, strict.weightFor(0.05));
        assertEquals(1.0, strict.weightFor(0.2));
        assertEquals(0.0, strict.weightFor(0.3));
    }

    @Test
    void rejectsInvertedThresholds() {
        assertThrows(IllegalArgumentException.class, () -> TrustBands.builder()
            .suspiciousThreshold(0.6)
            .faultyThreshold(0.2)
            .trustedWeight(1.0)
            .suspiciousWeight(0.5)
            .faultyWeight(0.1)
            .build());
    }

    @Test
    void rejectsNonPositiveTrustedWeight() {
        assertThrows(IllegalArgumentException.class, () -> TrustBands.builder()
            .suspiciousThreshold(0.2)
            .faultyThreshold(0.6)
            .trustedWeight(0.0)
            .suspiciousWeight(0.5)
            .faultyWeight(0.1)
            .build());
    }
}
