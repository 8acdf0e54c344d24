package com.twlb.node.fault;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LoadModelTest {

    @Test
    void cycleStaysWithinAmplitude() {
        LoadModel model = new LoadModel(0.6, Duration.ofMinutes(5));
        for (long s = 0; s < 900; s += 7) {
            double factor = model.cycleFactor(Duration.ofSeconds(s));
            assertTrue(factor >= 0.7 - 1e-9 && factor <= 1.3 + 1e-9, "factor out of range: " + factor);
        }
        assertEquals(1.3, model.cycleFactor(Duration.ofSeconds(75)), 1e-9);
        assertEquals(0.7, model.cycleFactor(Duration.ofSeconds(225)), 1e-9);
    }

    @Test
    void spikesAreRare() {
        LoadModel model = new LoadModel(0.4, Duration.ofMinutes(5));
        Random random = new Random(42);
        int spikes = 0;
        int draws = 20_000;
        for (int i = 0; i < draws; i++) {
            double factor = model.loadFactor(Duration.ZERO, random);
            assertTrue(factor > 0.0);
            if (factor > 1.2) {
                spikes++;
            }
        }
        double rate = (double) spikes / draws;
        assertTrue(rate > 0.035 && rate < 0.065, "spike rate " + rate);
    }

    @Test
    void rejectsNonPositivePeriod() {
        assertThrows(IllegalArgumentException.class, () -> new LoadModel(0.5, Duration.ZERO));
    }
}
