package com.rollup.coordinator.metrics;

import com.rollup.coordinator.cancel.CancellationReason;
import com.rollup.coordinator.pool.PoolStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link ProverPoolMetrics}.
 *
 * <p>Recorded metrics, all tagged with {@code pool}:</p>
 * <ul>
 *   <li>{@code prover.pool.acquire.wait}: Timer, time from acquire call to handout</li>
 *   <li>{@code prover.pool.acquired}: Counter</li>
 *   <li>{@code prover.pool.added}, {@code prover.pool.released}, {@code prover.pool.discarded}: Counters</li>
 *   <li>{@code prover.pool.cancelled}: Counter (extra tags: operation, reason)</li>
 *   <li>{@code prover.pool.available}, {@code prover.pool.checked_out},
 *       {@code prover.pool.waiting}: Gauges</li>
 * </ul>
 *
 * <p>Gauges are keyed by pool name. Registering a second pool under a name already in use
 * logs a warning and points that name's gauges at the newer pool.</p>
 */
public class MicrometerProverPoolMetrics implements ProverPoolMetrics {
    private static final Logger log = LoggerFactory.getLogger(MicrometerProverPoolMetrics.class);

    private final MeterRegistry registry;
    private final Map<String, AtomicReference<Supplier<PoolStats>>> poolStats = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerProverPoolMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void registerPool(String pool, Supplier<PoolStats> stats) {
        AtomicReference<Supplier<PoolStats>> created = new AtomicReference<>(stats);
        AtomicReference<Supplier<PoolStats>> existing = poolStats.putIfAbsent(pool, created);
        if (existing != null) {
            existing.set(stats);
            log.warn("Prover pool '{}' registered again on the same meter registry; gauges now track the newer pool", pool);
            return;
        }

        Gauge.builder("prover.pool.available", created, s -> s.get().get().available())
                .description("Provers ready to be acquired")
                .tag("pool", pool)
                .strongReference(true)
                .register(registry);
        Gauge.builder("prover.pool.checked_out", created, s -> s.get().get().checkedOut())
                .description("Provers currently held by workers")
                .tag("pool", pool)
                .strongReference(true)
                .register(registry);
        Gauge.builder("prover.pool.waiting", created, s -> s.get().get().waitingAcquirers())
                .description("Callers blocked waiting for a prover")
                .tag("pool", pool)
                .strongReference(true)
                .register(registry);
    }

    @Override
    public void recordAcquireWait(String pool, Duration waited) {
        Timer timer = timerCache.computeIfAbsent(pool, k ->
                Timer.builder("prover.pool.acquire.wait")
                        .description("Time spent waiting for a prover")
                        .tag("pool", pool)
                        .register(registry));
        timer.record(waited);
        counter("acquired:" + pool, "prover.pool.acquired", "Provers handed out", pool).increment();
    }

    @Override
    public void incrementAdded(String pool) {
        counter("added:" + pool, "prover.pool.added", "Provers added to the pool", pool).increment();
    }

    @Override
    public void incrementReleased(String pool) {
        counter("released:" + pool, "prover.pool.released", "Provers returned to the pool", pool).increment();
    }

    @Override
    public void incrementDiscarded(String pool) {
        counter("discarded:" + pool, "prover.pool.discarded", "Provers dropped from the pool", pool).increment();
    }

    @Override
    public void incrementCancelled(String pool, String operation, CancellationReason reason) {
        String key = "cancelled:" + pool + ":" + operation + ":" + reason.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("prover.pool.cancelled")
                        .description("Pool operations that ended cancelled")
                        .tag("pool", pool)
                        .tag("operation", operation)
                        .tag("reason", reason.name())
                        .register(registry));
        counter.increment();
    }

    private Counter counter(String key, String name, String description, String pool) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("pool", pool)
                        .register(registry));
    }
}
