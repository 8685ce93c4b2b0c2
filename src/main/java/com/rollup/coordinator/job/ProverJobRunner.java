package com.rollup.coordinator.job;

import com.rollup.coordinator.cancel.CancellationReason;
import com.rollup.coordinator.cancel.CancellationSignal;
import com.rollup.coordinator.cancel.OperationCancelledException;
import com.rollup.coordinator.logging.LogContext;
import com.rollup.coordinator.pool.ProverPool;
import com.rollup.coordinator.prover.ProverClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs tasks on provers borrowed from a {@link ProverPool}: acquires a prover, runs the task
 * with exclusive use of it, then hands it back.
 *
 * <p>On success or cancellation the prover is released. A cancellation wrapped by a future or
 * executor counts as cancellation and is rethrown as {@link OperationCancelledException}. On any
 * other failure the {@link ProverFailurePolicy} decides whether it is released or discarded, and
 * the failure is rethrown as {@link ProverJobException}.</p>
 */
public class ProverJobRunner {
    private static final Logger log = LoggerFactory.getLogger(ProverJobRunner.class);

    private final ProverPool pool;
    private final ProverFailurePolicy failurePolicy;

    public ProverJobRunner(ProverPool pool) {
        this(pool, ProverFailurePolicy.RELEASE);
    }

    public ProverJobRunner(ProverPool pool, ProverFailurePolicy failurePolicy) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
    }

    /**
     * Acquires a prover under {@code signal} and runs {@code task} with it.
     *
     * @throws OperationCancelledException if acquisition was cancelled or the task reported
     *         cancellation (including thread interruption)
     * @throws ProverJobException if the task failed
     */
    public <T> T run(CancellationSignal signal, String jobName, ProverTask<T> task) {
        Objects.requireNonNull(task, "task");
        ProverClient prover = pool.acquire(signal);

        boolean discard = false;
        try (LogContext ctx = LogContext.forProverJob(jobName, prover.getId())
                .with("correlationId", LogContext.generateCorrelationId())) {
            long start = System.nanoTime();
            log.debug("prover.job.started");
            T result = task.execute(prover);
            log.debug("prover.job.completed durationMs={}", (System.nanoTime() - start) / 1_000_000);
            return result;
        } catch (OperationCancelledException e) {
            log.info("prover.job.cancelled jobName={} proverId={} reason={}", jobName, prover.getId(), e.getReason());
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(
                    "Prover job '" + jobName + "' interrupted", CancellationReason.INTERRUPTED, e);
        } catch (Exception e) {
            // cancellation wrapped by a future or executor is still cancellation
            CancellationReason reason = OperationCancelledException.reasonOf(e);
            if (reason != null) {
                log.info("prover.job.cancelled jobName={} proverId={} reason={}", jobName, prover.getId(), reason);
                throw new OperationCancelledException(
                        "Prover job '" + jobName + "' cancelled: " + reason, reason, e);
            }
            discard = failurePolicy == ProverFailurePolicy.DISCARD;
            log.warn("prover.job.failed jobName={} proverId={} policy={}: {}",
                    jobName, prover.getId(), failurePolicy, e.getMessage());
            throw new ProverJobException(
                    "Prover job '" + jobName + "' failed on prover " + prover.getId(), prover.getId(), e);
        } finally {
            if (discard) {
                pool.discard(prover);
            } else {
                pool.release(prover);
            }
        }
    }
}
