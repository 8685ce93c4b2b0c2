package com.rollup.coordinator.prover;

/**
 * Handle to one external prover connection or session.
 *
 * <p>Handles are constructed and owned by whatever component connects to the provers. The
 * pool treats them as opaque: it compares them by identity and never calls prover operations
 * on them.</p>
 */
public interface ProverClient {

    /**
     * Stable identifier used in logs and diagnostics, typically the prover's URL.
     */
    String getId();
}
