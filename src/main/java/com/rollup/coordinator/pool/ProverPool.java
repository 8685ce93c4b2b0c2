package com.rollup.coordinator.pool;

import com.rollup.coordinator.cancel.CancellationSignal;
import com.rollup.coordinator.cancel.OperationCancelledException;
import com.rollup.coordinator.prover.ProverClient;

import java.util.Optional;

/**
 * Bounded pool arbitrating exclusive access to a set of interchangeable {@link ProverClient}s.
 * A prover handed out by {@link #acquire} belongs to the caller until it is released or
 * discarded, and is never handed to a second caller in the meantime.
 */
public interface ProverPool extends AutoCloseable {

    /**
     * Adds a prover to the pool. Blocks while the pool already holds its capacity in resident
     * provers (available or checked out).
     *
     * @param signal cancels the wait
     * @param prover the prover to add
     * @return true if the prover was stored, false if the wait was cancelled or the pool is
     *         closed, in which case the prover was not stored
     * @throws ProverPoolMisuseException if the prover is already resident in this pool
     */
    boolean add(CancellationSignal signal, ProverClient prover);

    /**
     * Acquires the next available prover, blocking until one is added or released.
     *
     * @param signal cancels the wait
     * @return a prover for exclusive use by the caller
     * @throws OperationCancelledException if the signal fired, the thread was interrupted, or
     *         the pool is closed. Nothing was removed from the pool in that case.
     */
    ProverClient acquire(CancellationSignal signal);

    /**
     * Acquires a prover only if one is available right now.
     */
    Optional<ProverClient> tryAcquire();

    /**
     * Returns a checked-out prover to the pool. Never blocks.
     *
     * @throws ProverPoolMisuseException if the prover is not checked out from this pool
     */
    void release(ProverClient prover);

    /**
     * Removes a checked-out prover from the pool for good, freeing its capacity for a
     * replacement. The pool does not close the prover.
     *
     * @throws ProverPoolMisuseException if the prover is not checked out from this pool
     */
    void discard(ProverClient prover);

    /**
     * Returns current pool statistics.
     */
    PoolStats getStats();

    /**
     * Closes the pool. Blocked and future acquire/add calls end cancelled with
     * {@code POOL_CLOSED}; release and discard keep working. Provers are not closed.
     */
    @Override
    void close();
}
