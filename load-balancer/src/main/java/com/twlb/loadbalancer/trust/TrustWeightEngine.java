package com.twlb.loadbalancer.trust;

import com.twlb.core.metrics.MetricsNames;
import com.twlb.core.metrics.MetricsTags;
import com.twlb.loadbalancer.config.LBConfig;
import com.twlb.loadbalancer.metrics.IObservationSource;
import com.twlb.loadbalancer.metrics.Observation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Periodically turns node telemetry into routing weights.
 * <p>
 * Each refresh evaluates every configured node independently:
 * observe, classify, map {@code p_faulty} to a weight with {@link TrustBands}. A node that
 * cannot be evaluated keeps full weight for that cycle and never affects the others. The
 * finished {@link RoutingTable} is published with a single reference swap.
 * </p>
 * <p>
 * Without an available classifier the engine runs degraded: every node gets full weight and
 * the table is marked {@link RoutingMode#ROUND_ROBIN}.
 * </p>
 */
public class TrustWeightEngine implements Supplier<RoutingTable> {
    private static final Logger log = LoggerFactory.getLogger(TrustWeightEngine.class);

    private final List<String> nodeIds;
    private final IObservationSource observationSource;
    private final ITrustClassifier classifier;
    private final TrustBands bands;
    private final String primaryFaultClass;
    private final Duration observationTimeout;
    private final Duration classifierTimeout;
    private final Duration refreshInterval;
    private final Clock clock;

    private final AtomicReference<RoutingTable> current;
    private final Map<RoutingMode, Counter> refreshCounters = new EnumMap<>(RoutingMode.class);

    private final Sinks.Empty<Void> stopSignal = Sinks.empty();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile Disposable loop;

    public TrustWeightEngine(LBConfig config,
                             IObservationSource observationSource,
                             ITrustClassifier classifier,
                             MeterRegistry meterRegistry,
                             Clock clock) {
        this.nodeIds = List.copyOf(config.nodeIds());
        this.observationSource = observationSource;
        this.classifier = classifier;
        this.bands = config.trustBands();
        this.primaryFaultClass = config.getPrimaryFaultClass();
        // every metric query runs in parallel and is bounded on its own
        this.observationTimeout = config.getMetricsQueryTimeout().multipliedBy(2);
        this.classifierTimeout = config.getClassifierTimeout();
        this.refreshInterval = config.getRefreshInterval();
        this.clock = clock;

        this.current = new AtomicReference<>(
            RoutingTable.initial(nodeIds, bands.getTrustedWeight(), modeOf(isDegraded()), clock.instant()));

        if (isDegraded()) {
            log.warn("No trust classifier available, routing degrades to round robin over {} nodes",
                nodeIds.size());
        } else {
            log.info("Trust classifier: {}, bands: {}", classifier.describe(), bands);
        }

        // Metrics
        for (String nodeId : nodeIds) {
            Gauge.builder(MetricsNames.LB_TRUST_WEIGHT, this, e -> e.current().weightOf(nodeId))
                .tag(MetricsTags.NODE_ID, nodeId)
                .register(meterRegistry);
            Gauge.builder(MetricsNames.LB_TRUST_P_FAULTY, this, e -> e.pFaultyOf(nodeId))
                .tag(MetricsTags.NODE_ID, nodeId)
                .register(meterRegistry);
        }
        for (RoutingMode mode : RoutingMode.values()) {
            refreshCounters.put(mode, Counter.builder(MetricsNames.LB_TRUST_REFRESH_TOTAL)
                .tag(MetricsTags.OUTCOME, mode.tag())
                .register(meterRegistry));
        }
    }

    /**
     * @return the most recently published routing table
     */
    public RoutingTable current() {
        return current.get();
    }

    @Override
    public RoutingTable get() {
        return current();
    }

    public boolean isDegraded() {
        return !classifier.isAvailable();
    }

    /**
     * Runs one refresh cycle and publishes its table.
     *
     * @return Mono emitting the published table
     */
    public Mono<RoutingTable> refresh() {
        boolean degraded = isDegraded();
        Instant now = clock.instant();

        return Flux.fromIterable(nodeIds)
            .flatMap(nodeId -> evaluate(nodeId, degraded, now))
            .collectMap(TrustState::getNodeId)
            .map(byNode -> {
                List<TrustState> ordered = new ArrayList<>(nodeIds.size());
                for (String nodeId : nodeIds) {
                    ordered.add(byNode.getOrDefault(nodeId,
                        TrustState.fullTrust(nodeId, bands.getTrustedWeight(), now)));
                }
                return RoutingTable.of(ordered, modeOf(degraded), now);
            })
            .doOnNext(this::publish);
    }

    /**
     * Starts the periodic refresh. The first cycle runs immediately.
     */
    public synchronized void start() {
        if (loop != null) {
            return;
        }
        log.info("Starting trust weight refresh every {}s for {} nodes",
            refreshInterval.toMillis() / 1000.0, nodeIds.size());

        loop = Flux.interval(Duration.ZERO, refreshInterval)
            .onBackpressureDrop(tick -> log.debug("Refresh still running, skipping tick {}", tick))
            .takeUntilOther(stopSignal.asMono())
            .flatMap(tick -> refresh()
                .onErrorResume(err -> {
                    log.error("Routing table refresh failed, keeping previous table", err);
                    return Mono.empty();
                }), 1)
            .doFinally(signal -> stopped.countDown())
            .subscribe();
    }

    /**
     * Stops scheduling new cycles and waits for an in-flight cycle to publish.
     *
     * @param grace upper bound on the wait; the cycle is cancelled when it elapses
     */
    public void stop(Duration grace) {
        Disposable running = loop;
        if (running == null) {
            return;
        }
        stopSignal.tryEmitEmpty();
        try {
            if (!stopped.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Refresh did not finish within {}ms, cancelling", grace.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running.dispose();
        }
        log.info("Trust weight engine stopped");
    }

    private Mono<TrustState> evaluate(String nodeId, boolean degraded, Instant now) {
        Mono<Observation> observation = observationSource.observe(nodeId)
            .timeout(observationTimeout)
            .defaultIfEmpty(Observation.neutral(nodeId))
            .onErrorResume(err -> {
                log.warn("No telemetry for {}: {}", nodeId, err.toString());
                return Mono.just(Observation.neutral(nodeId));
            });

        Mono<TrustState> state;
        if (degraded) {
            state = observation.map(obs -> TrustState.fullTrust(nodeId, bands.getTrustedWeight(), now)
                .toBuilder()
                .observation(obs)
                .build());
        } else {
            state = observation.flatMap(obs -> Mono.fromCallable(() -> classifier.predict(obs.toFeatures()))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(classifierTimeout)
                .map(prediction -> toState(nodeId, obs, prediction, now)));
        }

        return state.onErrorResume(err -> {
            log.warn("Trust evaluation failed for {}, using full weight this cycle: {}", nodeId, err.toString());
            return Mono.just(TrustState.fullTrust(nodeId, bands.getTrustedWeight(), now));
        });
    }

    private TrustState toState(String nodeId, Observation observation, ClassPrediction prediction, Instant now) {
        double pFaulty = prediction.pFaulty(primaryFaultClass);
        TrustTier tier = bands.tierFor(pFaulty);
        log.debug("P_Faulty({})={} -> {} ({})", nodeId, String.format("%.3f", pFaulty), tier.label(), observation);

        return TrustState.builder()
            .nodeId(nodeId)
            .weight(bands.weightOf(tier))
            .tier(tier)
            .pFaulty(Double.isNaN(pFaulty) ? null : pFaulty)
            .probabilities(prediction.asMap())
            .observation(observation)
            .updatedAt(now)
            .build();
    }

    private void publish(RoutingTable table) {
        current.set(table);
        refreshCounters.get(table.getMode()).increment();

        Map<String, Double> adjusted = table.nonDefaultWeights(bands.getTrustedWeight());
        if (adjusted.isEmpty()) {
            log.info("Routing table refreshed: mode={}, all {} nodes at full weight", table.getMode(), table.size());
        } else {
            log.info("Routing table refreshed: mode={}, adjusted weights={}", table.getMode(), adjusted);
        }
    }

    private double pFaultyOf(String nodeId) {
        TrustState state = current().getStates().get(nodeId);
        return state != null && state.hasPrediction() ? state.getPFaulty() : -1.0;
    }

    private static RoutingMode modeOf(boolean degraded) {
        return degraded ? RoutingMode.ROUND_ROBIN : RoutingMode.TRUST_WEIGHTED;
    }
}
