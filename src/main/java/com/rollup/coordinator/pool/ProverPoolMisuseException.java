package com.rollup.coordinator.pool;

/**
 * Thrown on a programmer error against a {@link ProverPool}: releasing or discarding a prover
 * that is not checked out (double release, foreign handle), or adding a prover that is
 * already resident. The pool state is left unchanged.
 */
public class ProverPoolMisuseException extends IllegalStateException {

    public ProverPoolMisuseException(String message) {
        super(message);
    }
}
