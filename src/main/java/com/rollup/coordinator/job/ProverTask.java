package com.rollup.coordinator.job;

import com.rollup.coordinator.prover.ProverClient;

/**
 * Unit of work run against a prover held exclusively for its duration.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ProverTask<T> {

    T execute(ProverClient prover) throws Exception;
}
