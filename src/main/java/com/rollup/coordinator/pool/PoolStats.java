package com.rollup.coordinator.pool;

/**
 * Point-in-time statistics for a {@link ProverPool}.
 *
 * @param capacity         maximum number of resident provers
 * @param available        provers ready to be acquired
 * @param checkedOut       provers currently held by workers
 * @param waitingAcquirers callers blocked in acquire
 * @param waitingAdders    callers blocked in add
 * @param totalAdded       cumulative successful adds
 * @param totalAcquired    cumulative successful acquisitions
 * @param totalReleased    cumulative releases
 * @param totalDiscarded   cumulative discards
 * @param totalCancelled   cumulative acquire and add calls that ended cancelled
 * @param closed           whether the pool has been closed
 */
public record PoolStats(
        int capacity,
        int available,
        int checkedOut,
        int waitingAcquirers,
        int waitingAdders,
        long totalAdded,
        long totalAcquired,
        long totalReleased,
        long totalDiscarded,
        long totalCancelled,
        boolean closed
) {

    /**
     * Provers resident in the pool: available plus checked out.
     */
    public int resident() {
        return available + checkedOut;
    }

    /**
     * Fraction of resident provers that are checked out, or 0 when none are resident.
     */
    public double utilization() {
        int resident = resident();
        return resident > 0 ? (double) checkedOut / resident : 0.0;
    }
}
