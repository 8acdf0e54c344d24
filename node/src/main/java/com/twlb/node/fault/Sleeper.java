package com.twlb.node.fault;

import java.time.Duration;

/**
 * Blocking wait used for simulated network, I/O and stall latency.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);

    /**
     * Parks the calling thread. Interruption is restored on the thread and surfaced as an
     * {@link IllegalStateException} so the request fails instead of finishing early.
     */
    Sleeper THREAD = duration -> {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while simulating latency", e);
        }
    };
}
