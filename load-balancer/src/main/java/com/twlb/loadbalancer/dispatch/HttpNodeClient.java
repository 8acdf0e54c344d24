package com.twlb.loadbalancer.dispatch;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Calls {@code GET http://<host>:<port>/process} on a node with reactor-netty.
 */
public class HttpNodeClient implements INodeClient {
    private static final Logger log = LoggerFactory.getLogger(HttpNodeClient.class);

    private final HttpClient httpClient;
    private final String hostTemplate;
    private final int port;
    private final Duration requestTimeout;

    /**
     * @param hostTemplate   {@link String#format} template applied to the node id, e.g. {@code %s}
     *                       for compose service names or {@code %s.nodes.svc} for a DNS suffix
     * @param port           node HTTP port
     * @param requestTimeout upper bound for one exchange
     */
    public HttpNodeClient(String hostTemplate, int port, Duration requestTimeout) {
        this.hostTemplate = hostTemplate;
        this.port = port;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.create()
            .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
            .responseTimeout(requestTimeout);

        log.info("HttpNodeClient initialized: host={}, port={}, timeout={}ms",
            hostTemplate, port, requestTimeout.toMillis());
    }

    String urlFor(String nodeId) {
        return "http://" + String.format(hostTemplate, nodeId) + ":" + port + "/process";
    }

    @Override
    public Mono<NodeResponse> process(String nodeId) {
        return httpClient.get()
            .uri(urlFor(nodeId))
            .responseSingle((response, body) -> body.asString()
                .defaultIfEmpty("")
                .map(content -> new NodeResponse(response.status().code(), content)))
            .timeout(requestTimeout);
    }
}
