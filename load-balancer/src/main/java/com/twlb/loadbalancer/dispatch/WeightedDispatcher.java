package com.twlb.loadbalancer.dispatch;

import com.twlb.core.metrics.MetricsNames;
import com.twlb.core.metrics.MetricsTags;
import com.twlb.loadbalancer.trust.RoutingMode;
import com.twlb.loadbalancer.trust.RoutingTable;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Routes requests to nodes in proportion to their trust weight.
 * <p>
 * Selection reads one routing table snapshot per request: node {@code i} is drawn with
 * probability {@code w_i / sum(w)}. When the snapshot is empty, has no positive weight or
 * was built without a classifier, selection rotates over every configured node instead.
 * </p>
 * <p>
 * A request is sent exactly once. Timeouts and connection failures are reported as
 * outcomes and the next request goes through selection again.
 * </p>
 */
public class WeightedDispatcher implements IDispatcher {
    private static final Logger log = LoggerFactory.getLogger(WeightedDispatcher.class);

    private final List<String> knownNodeIds;
    private final Supplier<RoutingTable> routingTable;
    private final INodeClient nodeClient;
    private final MeterRegistry meterRegistry;
    private final Supplier<? extends Random> random;

    private final AtomicLong roundRobinCursor = new AtomicLong();

    private final Sinks.Empty<Void> stopSignal = Sinks.empty();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile Disposable loop;

    /**
     * @param knownNodeIds every configured node, used for round-robin fallback
     * @param routingTable source of the current snapshot
     * @param random       generator per draw; must be safe for the calling thread
     */
    public WeightedDispatcher(List<String> knownNodeIds,
                              Supplier<RoutingTable> routingTable,
                              INodeClient nodeClient,
                              MeterRegistry meterRegistry,
                              Supplier<? extends Random> random) {
        if (knownNodeIds.isEmpty()) {
            throw new IllegalArgumentException("At least one node must be configured");
        }
        this.knownNodeIds = List.copyOf(knownNodeIds);
        this.routingTable = routingTable;
        this.nodeClient = nodeClient;
        this.meterRegistry = meterRegistry;
        this.random = random;
    }

    @Override
    public NodeSelection select() {
        RoutingTable table = routingTable.get();
        if (table == null || table.isEmpty() || table.getMode() == RoutingMode.ROUND_ROBIN) {
            return roundRobin();
        }
        double total = table.totalWeight();
        if (!(total > 0.0)) {
            return roundRobin();
        }

        double target = random.get().nextDouble() * total;
        double cumulative = 0.0;
        String last = null;
        for (String nodeId : table.getNodeIds()) {
            double weight = table.weightOf(nodeId);
            if (weight <= 0.0) {
                continue;
            }
            cumulative += weight;
            last = nodeId;
            if (target < cumulative) {
                return new NodeSelection(nodeId, RoutingMode.TRUST_WEIGHTED);
            }
        }
        // rounding left target at the very top of the range
        return new NodeSelection(last, RoutingMode.TRUST_WEIGHTED);
    }

    @Override
    public Mono<DispatchOutcome> dispatch() {
        return Mono.defer(() -> {
            NodeSelection selection = select();
            long startNanos = System.nanoTime();

            return nodeClient.process(selection.getNodeId())
                .map(response -> DispatchOutcome.builder()
                    .nodeId(selection.getNodeId())
                    .mode(selection.getMode())
                    .status(response.getHttpStatus() / 100 == 2 ? DispatchStatus.SUCCESS : DispatchStatus.ERROR_STATUS)
                    .httpStatus(response.getHttpStatus())
                    .latency(Duration.ofNanos(System.nanoTime() - startNanos))
                    .body(response.getBody())
                    .reason(response.getHttpStatus() / 100 == 2 ? null : "HTTP " + response.getHttpStatus())
                    .build())
                .switchIfEmpty(Mono.error(new IllegalStateException("No response from " + selection.getNodeId())))
                .onErrorResume(err -> Mono.just(DispatchOutcome.builder()
                    .nodeId(selection.getNodeId())
                    .mode(selection.getMode())
                    .status(classify(err))
                    .latency(Duration.ofNanos(System.nanoTime() - startNanos))
                    .reason(describe(err))
                    .build()))
                .doOnNext(this::record);
        });
    }

    /**
     * Dispatches one request per tick with at most {@code maxInFlight} outstanding.
     * Ticks arriving while the limit is reached are skipped.
     */
    public synchronized void start(Duration interval, int maxInFlight) {
        if (loop != null) {
            return;
        }
        log.info("Starting dispatch loop: interval={}ms, maxInFlight={}", interval.toMillis(), maxInFlight);

        loop = Flux.interval(interval)
            .onBackpressureDrop(tick -> log.debug("Max in-flight reached, skipping tick {}", tick))
            .takeUntilOther(stopSignal.asMono())
            .flatMap(tick -> dispatch(), maxInFlight)
            .doFinally(signal -> stopped.countDown())
            .subscribe(
                outcome -> { },
                err -> log.error("Dispatch loop terminated unexpectedly", err)
            );
    }

    /**
     * Stops issuing requests and waits for in-flight ones to complete.
     *
     * @param grace upper bound on the wait; remaining requests are cancelled when it elapses
     */
    public void stop(Duration grace) {
        Disposable running = loop;
        if (running == null) {
            return;
        }
        stopSignal.tryEmitEmpty();
        try {
            if (!stopped.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("In-flight dispatches did not finish within {}ms, cancelling", grace.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running.dispose();
        }
        log.info("Dispatch loop stopped");
    }

    private NodeSelection roundRobin() {
        int index = (int) Math.floorMod(roundRobinCursor.getAndIncrement(), (long) knownNodeIds.size());
        return new NodeSelection(knownNodeIds.get(index), RoutingMode.ROUND_ROBIN);
    }

    private void record(DispatchOutcome outcome) {
        Counter.builder(MetricsNames.LB_DISPATCH_TOTAL)
            .tag(MetricsTags.NODE_ID, outcome.getNodeId())
            .tag(MetricsTags.MODE, outcome.getMode().tag())
            .tag(MetricsTags.OUTCOME, outcome.getStatus().tag())
            .register(meterRegistry)
            .increment();
        Timer.builder(MetricsNames.LB_DISPATCH_LATENCY)
            .tag(MetricsTags.MODE, outcome.getMode().tag())
            .register(meterRegistry)
            .record(outcome.getLatency());

        String status = outcome.hasResponse()
            ? String.valueOf(outcome.getHttpStatus())
            : outcome.getStatus().tag();
        String line = String.format("ROUTE -> %s (mode=%s) | status=%s | %.3fs",
            outcome.getNodeId(), outcome.getMode(), status, outcome.getLatency().toNanos() / 1e9);
        if (outcome.getStatus().isFailure()) {
            log.warn(line);
        } else {
            log.info(line);
        }
    }

    static DispatchStatus classify(Throwable err) {
        if (err instanceof TimeoutException || err instanceof ReadTimeoutException) {
            return DispatchStatus.TIMEOUT;
        }
        return DispatchStatus.CONNECTION_FAILURE;
    }

    private static String describe(Throwable err) {
        if (err instanceof TimeoutException || err instanceof ReadTimeoutException) {
            return "timeout";
        }
        return err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
    }
}
