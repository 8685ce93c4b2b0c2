package com.rollup.coordinator.cancel;

/**
 * Runtime exception signalling that an operation returned early because its
 * {@link CancellationSignal} fired, its thread was interrupted, or the pool closed.
 *
 * <p>This is an expected outcome of caller-driven cancellation (shutdown, request deadline),
 * not a malfunction. Callers decide whether to abort the enclosing task or retry later.</p>
 */
public class OperationCancelledException extends RuntimeException {

    private final CancellationReason reason;

    public OperationCancelledException(String message, CancellationReason reason) {
        super(message);
        this.reason = reason;
    }

    public OperationCancelledException(String message, CancellationReason reason, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public CancellationReason getReason() {
        return reason;
    }

    /**
     * Returns true if {@code error}, or any throwable in its cause chain, is an
     * {@link OperationCancelledException}. Wrappers such as {@code CompletionException}
     * and {@code ExecutionException} are looked through.
     */
    public static boolean isCancellation(Throwable error) {
        return reasonOf(error) != null;
    }

    /**
     * Returns the reason of the first {@link OperationCancelledException} in the cause chain of
     * {@code error}, or {@code null} if there is none.
     */
    public static CancellationReason reasonOf(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 32) {
            if (current instanceof OperationCancelledException) {
                return ((OperationCancelledException) current).getReason();
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}
