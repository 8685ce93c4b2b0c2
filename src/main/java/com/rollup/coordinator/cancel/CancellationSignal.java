package com.rollup.coordinator.cancel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-operation cancellation token passed into every blocking pool call.
 *
 * <p>A signal fires at most once, either because {@link #cancel()} was called, because its
 * deadline passed, or because its parent fired. Once fired it stays fired and
 * {@link #reason()} reports why.</p>
 *
 * <p>Typical usage, scoping a deadline to one acquisition:</p>
 * <pre>
 * try (CancellationSignal signal = shutdown.withTimeout(Duration.ofSeconds(30))) {
 *     ProverClient prover = pool.acquire(signal);
 *     ...
 * } // detaches the child from its parent
 * </pre>
 *
 * <p>Callbacks registered with {@link #onCancel(Runnable)} run on explicit or parent
 * cancellation only. Checking the signal never runs callbacks, so it is safe under a lock.
 * Blocked waiters honour deadlines through {@link #remainingNanos()} and timed waits.</p>
 *
 * <p>Close child signals when done with them; an open child stays registered on its parent.</p>
 */
public final class CancellationSignal implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private static final long NO_DEADLINE = Long.MAX_VALUE;
    private static final Registration NOOP_REGISTRATION = () -> { };
    private static final CancellationSignal NEVER = new CancellationSignal(null, false, 0L, false);

    private final CancellationSignal parent;
    private final boolean hasDeadline;
    private final long deadlineNanos;
    private final boolean cancellable;
    private final Object lock = new Object();

    private CancellationReason fired;
    private List<Runnable> callbacks = new ArrayList<>();
    private Registration parentRegistration = NOOP_REGISTRATION;

    private CancellationSignal(CancellationSignal parent, boolean hasDeadline, long deadlineNanos,
                               boolean cancellable) {
        this.parent = parent;
        this.hasDeadline = hasDeadline;
        this.deadlineNanos = deadlineNanos;
        this.cancellable = cancellable;
    }

    /**
     * Creates a root signal that fires only when {@link #cancel()} is called.
     */
    public static CancellationSignal create() {
        return new CancellationSignal(null, false, 0L, true);
    }

    /**
     * Returns a shared signal that never fires and cannot be cancelled.
     */
    public static CancellationSignal never() {
        return NEVER;
    }

    /**
     * Creates a child signal without a deadline of its own.
     */
    public CancellationSignal child() {
        return attach(new CancellationSignal(this, hasDeadline, deadlineNanos, true));
    }

    /**
     * Creates a child signal that fires after {@code timeout}, or earlier if this signal fires.
     */
    public CancellationSignal withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        long timeoutNanos = saturatedNanos(timeout);
        long childDeadline = System.nanoTime() + timeoutNanos;
        if (hasDeadline && deadlineNanos - childDeadline < 0) {
            childDeadline = deadlineNanos;
        }
        return attach(new CancellationSignal(this, true, childDeadline, true));
    }

    /**
     * Creates a child signal that fires at the wall-clock {@code deadline}, or earlier if this
     * signal fires.
     */
    public CancellationSignal withDeadline(Instant deadline) {
        Objects.requireNonNull(deadline, "deadline");
        Duration remaining = Duration.between(Instant.now(), deadline);
        return withTimeout(remaining.isNegative() ? Duration.ZERO : remaining);
    }

    /**
     * Fires this signal with reason {@link CancellationReason#CANCELLED}. Idempotent.
     *
     * @throws UnsupportedOperationException on {@link #never()}
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("The never-firing signal cannot be cancelled");
        }
        fire(CancellationReason.CANCELLED);
    }

    /**
     * Same as {@link #cancel()}, so a child signal can be scoped with try-with-resources.
     * Closing {@link #never()} does nothing.
     */
    @Override
    public void close() {
        if (cancellable) {
            fire(CancellationReason.CANCELLED);
        }
    }

    public boolean isCancelled() {
        return reason() != null;
    }

    /**
     * Returns why this signal fired, or {@code null} if it has not fired.
     */
    public CancellationReason reason() {
        synchronized (lock) {
            if (fired != null) {
                return fired;
            }
        }
        if (parent != null) {
            CancellationReason parentReason = parent.reason();
            if (parentReason != null) {
                return parentReason;
            }
        }
        if (hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
            return CancellationReason.DEADLINE_EXCEEDED;
        }
        return null;
    }

    /**
     * Nanoseconds left before the earliest deadline on this signal's chain, zero if it has
     * passed, or {@link Long#MAX_VALUE} if there is no deadline.
     */
    public long remainingNanos() {
        if (!hasDeadline) {
            return NO_DEADLINE;
        }
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }

    /**
     * Throws {@link OperationCancelledException} if this signal has fired.
     */
    public void throwIfCancelled() {
        CancellationReason reason = reason();
        if (reason != null) {
            throw new OperationCancelledException("Operation cancelled: " + reason, reason);
        }
    }

    /**
     * Registers a callback to run once when this signal fires. If it already fired, the
     * callback runs immediately on the calling thread.
     *
     * @return a registration that unregisters the callback when closed
     */
    public Registration onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        if (!cancellable) {
            return NOOP_REGISTRATION;
        }
        synchronized (lock) {
            if (fired == null) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        if (callbacks != null) {
                            callbacks.remove(callback);
                        }
                    }
                };
            }
        }
        callback.run();
        return NOOP_REGISTRATION;
    }

    private CancellationSignal attach(CancellationSignal child) {
        Registration registration = onCancel(() -> child.fire(reason()));
        synchronized (child.lock) {
            child.parentRegistration = registration;
        }
        return child;
    }

    private void fire(CancellationReason reason) {
        List<Runnable> toRun;
        Registration detach;
        synchronized (lock) {
            if (fired != null) {
                return;
            }
            fired = reason;
            toRun = callbacks;
            callbacks = null;
            detach = parentRegistration;
            parentRegistration = NOOP_REGISTRATION;
        }
        detach.close();
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed: {}", e.getMessage(), e);
            }
        }
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return Math.max(0L, duration.toNanos());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE / 2;
        }
    }

    /**
     * Handle for an {@link #onCancel(Runnable)} callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
