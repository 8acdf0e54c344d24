package com.twlb.loadbalancer.metrics;

import reactor.core.publisher.Mono;

/**
 * Source of per-node telemetry (Dependency Inversion Principle).
 * <p>
 * Abstracts the time-series store the trust weight engine polls.
 * </p>
 */
public interface IObservationSource {

    /**
     * Fetches the current observation window for one node.
     * Implementations substitute 0.0 for any metric they cannot obtain.
     */
    Mono<Observation> observe(String nodeId);
}
