package com.twlb.loadbalancer.dispatch;

import reactor.core.publisher.Mono;

/**
 * Interface for request dispatch (Dependency Inversion Principle).
 */
public interface IDispatcher {

    /**
     * Picks the node for the next request from the current routing table.
     */
    NodeSelection select();

    /**
     * Selects a node and forwards one request to it. Never retries.
     *
     * @return Mono emitting the outcome; never errors for node failures
     */
    Mono<DispatchOutcome> dispatch();
}
