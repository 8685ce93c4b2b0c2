package com.rollup.coordinator.prover;

/**
 * Minimal {@link ProverClient} for tests. Equality is deliberately left as identity so two
 * stubs with the same id are still distinct handles.
 */
public final class StubProverClient implements ProverClient {

    private final String id;

    public StubProverClient(String id) {
        this.id = id;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return "StubProverClient{" + id + '}';
    }
}
