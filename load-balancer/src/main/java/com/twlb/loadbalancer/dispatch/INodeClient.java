package com.twlb.loadbalancer.dispatch;

import reactor.core.publisher.Mono;

/**
 * Transport to a backend node (Dependency Inversion Principle).
 */
public interface INodeClient {

    /**
     * Forwards one request to the node's processing endpoint.
     * <p>
     * Any HTTP answer, including 5xx, is emitted as a {@link NodeResponse}. Timeouts and
     * transport failures are signalled as errors.
     * </p>
     */
    Mono<NodeResponse> process(String nodeId);
}
