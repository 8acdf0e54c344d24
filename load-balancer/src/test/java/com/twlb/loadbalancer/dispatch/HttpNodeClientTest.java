package com.twlb.loadbalancer.dispatch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpNodeClientTest {

    private DisposableServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(5));
        }
    }

    private DisposableServer startNode() {
        return HttpServer.create()
            .port(0)
            .route(routes -> routes
                .get("/process", (req, res) -> res.status(500)
                    .sendString(Mono.just("{\"error\":\"Internal Server Error\"}")))
                .get("/slow/process", (req, res) -> res.sendString(
                    Mono.delay(Duration.ofSeconds(3)).map(tick -> "late")))
                .get("/crash/process", (req, res) -> {
                    res.withConnection(Connection::dispose);
                    return Mono.empty();
                }))
            .bindNow(Duration.ofSeconds(10));
    }

    @Test
    void buildsProcessUrlFromTemplate() {
        HttpNodeClient client = new HttpNodeClient("%s.nodes.local", 8000, Duration.ofSeconds(1));

        assertEquals("http://node-4.nodes.local:8000/process", client.urlFor("node-4"));
    }

    @Test
    void errorStatusIsAResponse() {
        server = startNode();
        HttpNodeClient client = new HttpNodeClient("localhost", server.port(), Duration.ofSeconds(5));

        StepVerifier.create(client.process("node-1"))
            .assertNext(response -> {
                assertEquals(500, response.getHttpStatus());
                assertTrue(response.getBody().contains("Internal Server Error"));
            })
            .verifyComplete();
    }

    @Test
    void slowNodeTimesOut() {
        server = startNode();
        HttpNodeClient slow = new HttpNodeClient("localhost", server.port(), Duration.ofMillis(200)) {
            @Override
            String urlFor(String nodeId) {
                return "http://localhost:" + server.port() + "/slow/process";
            }
        };

        StepVerifier.create(slow.process("node-1"))
            .expectErrorMatches(err -> WeightedDispatcher.classify(err) == DispatchStatus.TIMEOUT)
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void droppedConnectionIsAFailure() {
        server = startNode();
        HttpNodeClient crashed = new HttpNodeClient("localhost", server.port(), Duration.ofSeconds(2)) {
            @Override
            String urlFor(String nodeId) {
                return "http://localhost:" + server.port() + "/crash/process";
            }
        };

        StepVerifier.create(crashed.process("node-1"))
            .expectErrorMatches(err -> WeightedDispatcher.classify(err) == DispatchStatus.CONNECTION_FAILURE)
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void refusedConnectionIsAFailure() {
        DisposableServer stopped = startNode();
        int port = stopped.port();
        stopped.disposeNow(Duration.ofSeconds(5));
        HttpNodeClient client = new HttpNodeClient("localhost", port, Duration.ofSeconds(2));

        StepVerifier.create(client.process("node-1"))
            .expectErrorMatches(err -> WeightedDispatcher.classify(err) == DispatchStatus.CONNECTION_FAILURE)
            .verify(Duration.ofSeconds(5));
    }
}
