package com.rollup.coordinator.cancel;

/**
 * Why a blocking operation gave up before completing.
 */
public enum CancellationReason {
    /** The caller's signal was cancelled explicitly. */
    CANCELLED,
    /** The caller's signal (or one of its parents) passed its deadline. */
    DEADLINE_EXCEEDED,
    /** The waiting thread was interrupted. */
    INTERRUPTED,
    /** The pool was closed while, or before, the operation waited. */
    POOL_CLOSED
}
