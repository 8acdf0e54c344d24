package com.twlb.node.fault;

import com.twlb.core.model.FaultClass;
import com.twlb.core.model.NodeIds;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulates the observable behavior of one backend under a fixed fault class.
 * <p>
 * Every request goes through the same pipeline:
 * <ol>
 *   <li>network noise (Gaussian jitter plus an occasional retransmission penalty)</li>
 *   <li>load factor (traffic cycle with rare spikes)</li>
 *   <li>fault decision against the time-evolving probability, one handler per fault class</li>
 *   <li>workload (CPU loop, service wait, occasional extra I/O)</li>
 *   <li>resource gauge update</li>
 * </ol>
 * Only the crash handler aborts the pipeline; every other path produces an outcome.
 * </p>
 * <p>
 * The engine owns its generator, seeded by the node number, and never shares it.
 * </p>
 */
public class FaultEngine {
    private static final Logger log = LoggerFactory.getLogger(FaultEngine.class);

    static final double RETRANSMIT_MIN_MS = 50.0;
    static final double RETRANSMIT_MAX_MS = 150.0;
    static final double STALL_MIN_MS = 6000.0;
    static final double STALL_MAX_MS = 7000.0;
    static final double LIE_PATH_MIN_MS = 3000.0;
    static final double LIE_PATH_MAX_MS = 4000.0;
    static final double REQUEST_VARIATION = 0.2;
    static final double EXTRA_IO_PROBABILITY = 0.3;
    static final double EXTRA_IO_MIN_MS = 10.0;
    static final double EXTRA_IO_MAX_MS = 80.0;
    static final double CPU_NOISE_PERCENT = 10.0;
    static final double MEMORY_BASE_MB = 64.0;
    static final double MEMORY_LEAK_PER_REQUEST_MB = 0.05;
    static final long MEMORY_RESET_WINDOW = 1000;
    static final double MEMORY_NOISE_MB = 0.5;

    @Getter
    private final String nodeId;
    @Getter
    private final FaultClass faultClass;
    @Getter
    private final NodeProfile profile;
    private final Random random;
    private final LoadModel loadModel;
    private final Clock clock;
    private final Instant startedAt;
    private final Duration rampWindow;
    private final Sleeper sleeper;
    private final long workloadIterations;

    private final AtomicLong requestCount = new AtomicLong();
    private volatile double cpuPercent;
    private volatile double memoryMb = MEMORY_BASE_MB;
    private volatile boolean crashed;

    // Keeps the CPU loop from being optimized away
    private volatile long workloadSink;

    public FaultEngine(String nodeId,
                       FaultClass faultClass,
                       Duration rampWindow,
                       Duration loadCyclePeriod,
                       long workloadIterations,
                       Clock clock,
                       Sleeper sleeper) {
        this.nodeId = nodeId;
        this.faultClass = faultClass;
        this.random = new Random(NodeIds.parse(nodeId));
        this.profile = NodeProfile.draw(random);
        this.loadModel = new LoadModel(profile.getWorkloadVariation(), loadCyclePeriod);
        this.rampWindow = rampWindow;
        this.workloadIterations = workloadIterations;
        this.clock = clock;
        this.sleeper = sleeper;
        this.startedAt = clock.instant();
        this.cpuPercent = profile.getBaseCpu() * 100.0;

        log.info("Node {} initialized: fault={}, {}", nodeId, faultClass, profile);
    }

    /**
     * Handles one request.
     *
     * @return outcome with status, true latency and reported latency
     * @throws NodeCrashedException if the crash fault fires now or fired earlier
     */
    public ProcessOutcome handleRequest() {
        if (crashed) {
            throw new NodeCrashedException(nodeId);
        }
        Attempt attempt = new Attempt(requestCount.incrementAndGet());

        double networkMs = networkDelayMs();
        attempt.networkMs = networkMs;
        attempt.pause(networkMs);

        attempt.loadFactor = loadModel.loadFactor(elapsed(), random);

        boolean misbehave = random.nextDouble() < currentFaultProbability();

        ProcessOutcome outcome = switch (faultClass) {
            case BENIGN -> serve(attempt);
            case ERROR_500 -> misbehave ? fail(attempt) : serve(attempt);
            case DELAY -> misbehave ? stall(attempt) : serve(attempt);
            case CRASH -> misbehave ? crash(attempt) : serve(attempt);
            case LIE_LATENCY -> misbehave ? lie(attempt) : serve(attempt);
        };

        updateGauges(attempt.loadFactor, attempt.requestNum);
        return outcome;
    }

    /**
     * @return misbehavior probability at the current instant
     */
    public double currentFaultProbability() {
        return FaultProbability.at(faultClass, elapsed(), rampWindow);
    }

    public NodeHealth health() {
        return NodeHealth.builder()
            .node(nodeId)
            .status(crashed ? "crashed" : "healthy")
            .uptimeSeconds(elapsed().toMillis() / 1000.0)
            .faultType(faultClass.label())
            .totalRequests(requestCount.get())
            .build();
    }

    public long getTotalRequests() {
        return requestCount.get();
    }

    public double getCpuPercent() {
        return cpuPercent;
    }

    public double getMemoryMb() {
        return memoryMb;
    }

    public boolean isCrashed() {
        return crashed;
    }

    private ProcessOutcome serve(Attempt attempt) {
        runWorkload(attempt);
        return attempt.complete(ProcessOutcome.Status.OK, null);
    }

    private ProcessOutcome fail(Attempt attempt) {
        log.debug("[{}] error-500 fault triggered on request {}", nodeId, attempt.requestNum);
        return attempt.complete(ProcessOutcome.Status.ERROR, null);
    }

    private ProcessOutcome stall(Attempt attempt) {
        double stallMs = NodeProfile.uniform(random, STALL_MIN_MS, STALL_MAX_MS)
            + Math.abs(random.nextGaussian()) * profile.getJitterMs();
        log.debug("[{}] delay fault triggered, stalling {} ms", nodeId, Math.round(stallMs));
        attempt.pause(stallMs);
        return serve(attempt);
    }

    private ProcessOutcome crash(Attempt attempt) {
        crashed = true;
        log.error("[{}] crash fault triggered on request {}", nodeId, attempt.requestNum);
        throw new NodeCrashedException(nodeId);
    }

    private ProcessOutcome lie(Attempt attempt) {
        attempt.pause(NodeProfile.uniform(random, LIE_PATH_MIN_MS, LIE_PATH_MAX_MS));
        runWorkload(attempt);
        Duration claimed = millis(attempt.networkMs + profile.getBaseLatencyMs());
        log.debug("[{}] lie-latency fault triggered, claiming {} ms", nodeId, claimed.toMillis());
        return attempt.complete(ProcessOutcome.Status.OK, claimed);
    }

    // N(0, jitter / stability) clamped at 0
    private double networkDelayMs() {
        double spread = profile.getJitterMs() / profile.getStability();
        double delay = Math.max(0.0, random.nextGaussian() * spread);
        if (random.nextDouble() < profile.getPacketLoss()) {
            delay += NodeProfile.uniform(random, RETRANSMIT_MIN_MS, RETRANSMIT_MAX_MS);
        }
        return delay;
    }

    private void runWorkload(Attempt attempt) {
        double variation = NodeProfile.uniform(random, 1.0 - REQUEST_VARIATION, 1.0 + REQUEST_VARIATION);
        double scale = attempt.loadFactor * variation;

        long iterations = (long) (workloadIterations * scale);
        long sum = 0;
        for (long i = 0; i < iterations; i++) {
            sum += i * i;
        }
        workloadSink = sum;

        attempt.pause(profile.getBaseLatencyMs() * scale);
        if (random.nextDouble() < EXTRA_IO_PROBABILITY) {
            attempt.pause(NodeProfile.uniform(random, EXTRA_IO_MIN_MS, EXTRA_IO_MAX_MS));
        }
    }

    private void updateGauges(double loadFactor, long requestNum) {
        double cpu = profile.getBaseCpu() * loadFactor * 100.0 + random.nextGaussian() * CPU_NOISE_PERCENT;
        cpuPercent = clamp(cpu, 0.0, 100.0);

        double leaked = (requestNum % MEMORY_RESET_WINDOW) * MEMORY_LEAK_PER_REQUEST_MB;
        memoryMb = Math.max(0.0, MEMORY_BASE_MB + leaked + random.nextGaussian() * MEMORY_NOISE_MB);
    }

    private Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static Duration millis(double ms) {
        return Duration.ofNanos((long) (ms * 1_000_000.0));
    }

    /**
     * Mutable per-request accumulator. Latency is the simulated waits plus measured compute.
     */
    private final class Attempt {
        final long requestNum;
        final long startNanos = System.nanoTime();
        double loadFactor = 1.0;
        double networkMs;
        double waitedMs;
        long sleptNanos;

        Attempt(long requestNum) {
            this.requestNum = requestNum;
        }

        void pause(double ms) {
            Duration duration = millis(ms);
            long before = System.nanoTime();
            sleeper.sleep(duration);
            sleptNanos += System.nanoTime() - before;
            waitedMs += ms;
        }

        ProcessOutcome complete(ProcessOutcome.Status status, Duration reported) {
            long computeNanos = Math.max(0L, System.nanoTime() - startNanos - sleptNanos);
            Duration latency = millis(waitedMs).plusNanos(computeNanos);
            return ProcessOutcome.builder()
                .nodeId(nodeId)
                .status(status)
                .latency(latency)
                .reportedLatency(reported != null ? reported : latency)
                .loadFactor(loadFactor)
                .requestNum(requestNum)
                .build();
        }
    }
}
