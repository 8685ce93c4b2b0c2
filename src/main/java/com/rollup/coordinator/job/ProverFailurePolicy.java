package com.rollup.coordinator.job;

/**
 * What {@link ProverJobRunner} does with a prover whose task failed.
 */
public enum ProverFailurePolicy {
    /** Return the prover to the pool; the failure is assumed to be job-specific. */
    RELEASE,
    /** Drop the prover from the pool, freeing its capacity for a replacement. */
    DISCARD
}
