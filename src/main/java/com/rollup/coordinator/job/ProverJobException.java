package com.rollup.coordinator.job;

/**
 * Runtime exception thrown when a prover task fails. Distinct from
 * {@link com.rollup.coordinator.cancel.OperationCancelledException}, which means the job was
 * cancelled rather than failed.
 */
public class ProverJobException extends RuntimeException {

    private final String proverId;

    public ProverJobException(String message, String proverId, Throwable cause) {
        super(message, cause);
        this.proverId = proverId;
    }

    public String getProverId() {
        return proverId;
    }
}
