package com.rollup.coordinator.job;

import com.rollup.coordinator.cancel.CancellationReason;
import com.rollup.coordinator.cancel.CancellationSignal;
import com.rollup.coordinator.cancel.OperationCancelledException;
import com.rollup.coordinator.pool.BoundedProverPool;
import com.rollup.coordinator.pool.PoolStats;
import com.rollup.coordinator.pool.ProverPool;
import com.rollup.coordinator.prover.ProverClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProverJobRunnerTest {

    private static final CancellationSignal NEVER = CancellationSignal.never();

    @Mock
    private ProverClient prover;

    private BoundedProverPool pool;

    @BeforeEach
    void setUp() {
        when(prover.getId()).thenReturn("http://prover-1:9000");
        pool = new BoundedProverPool(1);
        pool.add(NEVER, prover);
    }

    @AfterEach
    void tearDown() {
        pool.close();
        MDC.clear();
    }

    @Test
    @DisplayName("Should run the task on an acquired prover and release it")
    void runsAndReleases() {
        ProverJobRunner runner = new ProverJobRunner(pool);

        String proof = runner.run(NEVER, "batch-1", p -> {
            assertSame(prover, p);
            assertEquals(0, pool.getStats().available(), "Prover should be checked out during the job");
            return "proof-1";
        });

        assertEquals("proof-1", proof);
        PoolStats stats = pool.getStats();
        assertEquals(1, stats.available());
        assertEquals(1, stats.totalReleased());
    }

    @Test
    @DisplayName("Should expose job and prover ids in MDC while the task runs")
    void setsLogContext() {
        ProverJobRunner runner = new ProverJobRunner(pool);
        AtomicReference<String> jobName = new AtomicReference<>();
        AtomicReference<String> proverId = new AtomicReference<>();

        runner.run(NEVER, "batch-7", p -> {
            jobName.set(MDC.get("jobName"));
            proverId.set(MDC.get("proverId"));
            return null;
        });

        assertEquals("batch-7", jobName.get());
        assertEquals("http://prover-1:9000", proverId.get());
        assertNull(MDC.get("jobName"), "MDC should be cleared after the job");
    }

    @Test
    @DisplayName("Failed task with RELEASE policy should return the prover and wrap the error")
    void failureReleases() {
        ProverJobRunner runner = new ProverJobRunner(pool, ProverFailurePolicy.RELEASE);
        IOException failure = new IOException("connection reset");

        ProverJobException ex = assertThrows(ProverJobException.class,
                () -> runner.run(NEVER, "batch-2", p -> {
                    throw failure;
                }));

        assertSame(failure, ex.getCause());
        assertEquals("http://prover-1:9000", ex.getProverId());
        assertFalse(OperationCancelledException.isCancellation(ex));
        assertEquals(1, pool.getStats().available());
    }

    @Test
    @DisplayName("Failed task with DISCARD policy should drop the prover")
    void failureDiscards() {
        ProverJobRunner runner = new ProverJobRunner(pool, ProverFailurePolicy.DISCARD);

        assertThrows(ProverJobException.class,
                () -> runner.run(NEVER, "batch-3", p -> {
                    throw new IllegalStateException("proof generation failed");
                }));

        PoolStats stats = pool.getStats();
        assertEquals(0, stats.resident());
        assertEquals(1, stats.totalDiscarded());
    }

    @Test
    @DisplayName("Cancellation inside the task should release the prover and propagate as-is")
    void taskCancellationReleases() {
        ProverJobRunner runner = new ProverJobRunner(pool, ProverFailurePolicy.DISCARD);
        OperationCancelledException cancelled =
                new OperationCancelledException("shutdown", CancellationReason.CANCELLED);

        OperationCancelledException ex = assertThrows(OperationCancelledException.class,
                () -> runner.run(NEVER, "batch-4", p -> {
                    throw cancelled;
                }));

        assertSame(cancelled, ex);
        assertEquals(1, pool.getStats().available());
        assertEquals(0, pool.getStats().totalDiscarded());
    }

    @Test
    @DisplayName("Cancellation wrapped by a future should release the prover under DISCARD policy")
    void wrappedCancellationReleases() {
        ProverJobRunner runner = new ProverJobRunner(pool, ProverFailurePolicy.DISCARD);
        CompletionException wrapped = new CompletionException(
                new OperationCancelledException("deadline", CancellationReason.DEADLINE_EXCEEDED));

        OperationCancelledException ex = assertThrows(OperationCancelledException.class,
                () -> runner.run(NEVER, "batch-9", p -> {
                    throw wrapped;
                }));

        assertEquals(CancellationReason.DEADLINE_EXCEEDED, ex.getReason());
        assertSame(wrapped, ex.getCause());
        PoolStats stats = pool.getStats();
        assertEquals(1, stats.resident());
        assertEquals(1, stats.available());
        assertEquals(0, stats.totalDiscarded());
    }

    @Test
    @DisplayName("Checked wrapper around a cancellation should also count as cancellation")
    void executionExceptionCancellation() {
        ProverJobRunner runner = new ProverJobRunner(pool, ProverFailurePolicy.DISCARD);

        OperationCancelledException ex = assertThrows(OperationCancelledException.class,
                () -> runner.run(NEVER, "batch-10", p -> {
                    throw new ExecutionException(
                            new OperationCancelledException("closed", CancellationReason.POOL_CLOSED));
                }));

        assertEquals(CancellationReason.POOL_CLOSED, ex.getReason());
        assertEquals(1, pool.getStats().available());
    }

    @Test
    @DisplayName("Interrupted task should surface as INTERRUPTED cancellation")
    void taskInterrupted() {
        ProverJobRunner runner = new ProverJobRunner(pool);
        try {
            OperationCancelledException ex = assertThrows(OperationCancelledException.class,
                    () -> runner.run(NEVER, "batch-5", p -> {
                        throw new InterruptedException();
                    }));
            assertEquals(CancellationReason.INTERRUPTED, ex.getReason());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        assertEquals(1, pool.getStats().available());
    }

    @Test
    @DisplayName("Cancelled acquisition should not run the task")
    void acquireCancelled() {
        ProverPool mockPool = mock(ProverPool.class);
        when(mockPool.acquire(any())).thenThrow(
                new OperationCancelledException("closed", CancellationReason.POOL_CLOSED));
        ProverJobRunner runner = new ProverJobRunner(mockPool);
        ProverTask<String> task = p -> fail("Task must not run");

        assertThrows(OperationCancelledException.class, () -> runner.run(NEVER, "batch-6", task));
        verify(mockPool, never()).release(any());
        verify(mockPool, never()).discard(any());
    }

    @Test
    @DisplayName("Should release through the pool interface exactly once")
    void releasesOnceThroughInterface() {
        ProverPool mockPool = mock(ProverPool.class);
        when(mockPool.acquire(any())).thenReturn(prover);
        ProverJobRunner runner = new ProverJobRunner(mockPool);

        runner.run(NEVER, "batch-8", p -> 42);

        verify(mockPool).acquire(NEVER);
        verify(mockPool, times(1)).release(prover);
        verify(mockPool, never()).discard(any());
    }
}
