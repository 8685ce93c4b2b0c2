package com.rollup.coordinator.pool;

import com.rollup.coordinator.cancel.CancellationReason;
import com.rollup.coordinator.cancel.CancellationSignal;
import com.rollup.coordinator.cancel.OperationCancelledException;
import com.rollup.coordinator.metrics.NoOpProverPoolMetrics;
import com.rollup.coordinator.metrics.ProverPoolMetrics;
import com.rollup.coordinator.prover.ProverClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe {@link ProverPool} backed by a FIFO deque of available provers and an identity
 * set of checked-out ones, both guarded by a single {@link ReentrantLock}.
 *
 * <p>Acquirers wait on {@code proverAvailable}, adders on {@code capacityAvailable}. A
 * {@link CancellationSignal} callback wakes both conditions on explicit cancellation;
 * deadlines are honoured with timed waits. Every wait re-checks the signal and the closed
 * flag before touching the deque, so a cancelled call never mutates the pool.</p>
 *
 * <p>Capacity counts resident provers (available plus checked out), so the pool never holds
 * more than {@link PoolConfig#getCapacity()} provers, whoever currently has them.</p>
 */
public class BoundedProverPool implements ProverPool {
    private static final Logger log = LoggerFactory.getLogger(BoundedProverPool.class);

    private final PoolConfig config;
    private final String name;
    private final ProverPoolMetrics metrics;
    private final ReentrantLock lock;
    private final Condition proverAvailable;
    private final Condition capacityAvailable;
    private final Deque<ProverClient> available = new ArrayDeque<>();
    private final Set<ProverClient> checkedOut = Collections.newSetFromMap(new IdentityHashMap<>());

    private boolean closed;
    private int waitingAcquirers;
    private int waitingAdders;
    private long totalAdded;
    private long totalAcquired;
    private long totalReleased;
    private long totalDiscarded;
    private long totalCancelled;

    public BoundedProverPool(int capacity) {
        this(PoolConfig.ofCapacity(capacity));
    }

    public BoundedProverPool(PoolConfig config) {
        this(config, new NoOpProverPoolMetrics());
    }

    public BoundedProverPool(PoolConfig config, ProverPoolMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.name = config.getName();
        this.lock = new ReentrantLock(config.isFair());
        this.proverAvailable = lock.newCondition();
        this.capacityAvailable = lock.newCondition();

        metrics.registerPool(name, this::getStats);
        log.info("Prover pool initialized: {}", config);
    }

    @Override
    public boolean add(CancellationSignal signal, ProverClient prover) {
        Objects.requireNonNull(signal, "signal");
        Objects.requireNonNull(prover, "prover");

        CancellationReason cancelled = null;
        try (CancellationSignal.Registration ignored = signal.onCancel(this::wakeWaiters)) {
            lock.lock();
            try {
                waitingAdders++;
                try {
                    while (true) {
                        if (isResident(prover)) {
                            throw new ProverPoolMisuseException(
                                    "Prover " + prover.getId() + " is already in pool '" + name + "'");
                        }
                        cancelled = cancellationReason(signal);
                        if (cancelled != null) {
                            break;
                        }
                        if (residentCount() < config.getCapacity()) {
                            available.addLast(prover);
                            totalAdded++;
                            proverAvailable.signal();
                            break;
                        }
                        cancelled = await(capacityAvailable, signal);
                        if (cancelled != null) {
                            break;
                        }
                    }
                } finally {
                    waitingAdders--;
                    if (cancelled != null) {
                        totalCancelled++;
                    }
                    // hand a wakeup we may have consumed to the next adder
                    if (waitingAdders > 0 && residentCount() < config.getCapacity()) {
                        capacityAvailable.signal();
                    }
                }
            } finally {
                lock.unlock();
            }
        }

        if (cancelled != null) {
            metrics.incrementCancelled(name, "add", cancelled);
            log.info("Prover pool '{}' add done ({}), prover {} not stored", name, cancelled, prover.getId());
            return false;
        }
        metrics.incrementAdded(name);
        log.debug("Prover {} added to pool '{}'", prover.getId(), name);
        return true;
    }

    @Override
    public ProverClient acquire(CancellationSignal signal) {
        Objects.requireNonNull(signal, "signal");

        long start = System.nanoTime();
        ProverClient prover = null;
        CancellationReason cancelled = null;
        try (CancellationSignal.Registration ignored = signal.onCancel(this::wakeWaiters)) {
            lock.lock();
            try {
                waitingAcquirers++;
                try {
                    while (true) {
                        cancelled = cancellationReason(signal);
                        if (cancelled != null) {
                            break;
                        }
                        prover = available.pollFirst();
                        if (prover != null) {
                            checkedOut.add(prover);
                            totalAcquired++;
                            break;
                        }
                        cancelled = await(proverAvailable, signal);
                        if (cancelled != null) {
                            break;
                        }
                    }
                } finally {
                    waitingAcquirers--;
                    if (cancelled != null) {
                        totalCancelled++;
                    }
                    if (waitingAcquirers > 0 && !available.isEmpty()) {
                        proverAvailable.signal();
                    }
                }
            } finally {
                lock.unlock();
            }
        }

        if (cancelled != null) {
            metrics.incrementCancelled(name, "acquire", cancelled);
            log.info("Prover pool '{}' acquire done ({})", name, cancelled);
            throw new OperationCancelledException(
                    "Acquire from prover pool '" + name + "' cancelled: " + cancelled, cancelled);
        }
        metrics.recordAcquireWait(name, Duration.ofNanos(System.nanoTime() - start));
        log.debug("Prover {} acquired from pool '{}'", prover.getId(), name);
        return prover;
    }

    @Override
    public Optional<ProverClient> tryAcquire() {
        ProverClient prover;
        lock.lock();
        try {
            if (closed) {
                return Optional.empty();
            }
            prover = available.pollFirst();
            if (prover == null) {
                return Optional.empty();
            }
            checkedOut.add(prover);
            totalAcquired++;
        } finally {
            lock.unlock();
        }
        metrics.recordAcquireWait(name, Duration.ZERO);
        log.debug("Prover {} acquired from pool '{}' without waiting", prover.getId(), name);
        return Optional.of(prover);
    }

    @Override
    public void release(ProverClient prover) {
        Objects.requireNonNull(prover, "prover");
        lock.lock();
        try {
            if (!checkedOut.remove(prover)) {
                throw notCheckedOut("release", prover);
            }
            available.addLast(prover);
            totalReleased++;
            proverAvailable.signal();
        } finally {
            lock.unlock();
        }
        metrics.incrementReleased(name);
        log.debug("Prover {} released to pool '{}'", prover.getId(), name);
    }

    @Override
    public void discard(ProverClient prover) {
        Objects.requireNonNull(prover, "prover");
        lock.lock();
        try {
            if (!checkedOut.remove(prover)) {
                throw notCheckedOut("discard", prover);
            }
            totalDiscarded++;
            capacityAvailable.signal();
        } finally {
            lock.unlock();
        }
        metrics.incrementDiscarded(name);
        log.info("Prover {} discarded from pool '{}'", prover.getId(), name);
    }

    @Override
    public PoolStats getStats() {
        lock.lock();
        try {
            return new PoolStats(
                    config.getCapacity(),
                    available.size(),
                    checkedOut.size(),
                    waitingAcquirers,
                    waitingAdders,
                    totalAdded,
                    totalAcquired,
                    totalReleased,
                    totalDiscarded,
                    totalCancelled,
                    closed
            );
        } finally {
            lock.unlock();
        }
    }

    public PoolConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            proverAvailable.signalAll();
            capacityAvailable.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("Prover pool '{}' closed", name);
    }

    private CancellationReason cancellationReason(CancellationSignal signal) {
        if (closed) {
            return CancellationReason.POOL_CLOSED;
        }
        return signal.reason();
    }

    /**
     * Waits on {@code condition} for at most the signal's remaining time. Returns
     * {@link CancellationReason#INTERRUPTED} if the thread was interrupted, null otherwise;
     * the caller re-checks state either way.
     */
    private CancellationReason await(Condition condition, CancellationSignal signal) {
        long remaining = signal.remainingNanos();
        try {
            if (remaining == Long.MAX_VALUE) {
                condition.await();
            } else if (remaining > 0) {
                condition.awaitNanos(remaining);
            }
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CancellationReason.INTERRUPTED;
        }
    }

    private void wakeWaiters() {
        lock.lock();
        try {
            proverAvailable.signalAll();
            capacityAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private boolean isResident(ProverClient prover) {
        if (checkedOut.contains(prover)) {
            return true;
        }
        for (ProverClient candidate : available) {
            if (candidate == prover) {
                return true;
            }
        }
        return false;
    }

    private int residentCount() {
        return available.size() + checkedOut.size();
    }

    private ProverPoolMisuseException notCheckedOut(String operation, ProverClient prover) {
        log.warn("Rejected {} of prover {}: not checked out from pool '{}'", operation, prover.getId(), name);
        return new ProverPoolMisuseException(
                "Cannot " + operation + " prover " + prover.getId() + ": not checked out from pool '" + name + "'");
    }
}
