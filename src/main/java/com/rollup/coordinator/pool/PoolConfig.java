package com.rollup.coordinator.pool;

/**
 * Configuration for {@link BoundedProverPool}.
 */
public class PoolConfig {

    private final int capacity;
    private final String name;
    private final boolean fair;

    private PoolConfig(Builder builder) {
        this.capacity = builder.capacity;
        this.name = builder.name;
        this.fair = builder.fair;
    }

    /** Maximum number of provers resident in the pool, available or checked out. */
    public int getCapacity() { return capacity; }
    public String getName() { return name; }
    public boolean isFair() { return fair; }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for a pool with the given capacity and default settings.
     */
    public static PoolConfig ofCapacity(int capacity) {
        return builder().capacity(capacity).build();
    }

    public static class Builder {
        private int capacity = 1;
        private String name = "provers";
        private boolean fair = true;

        public Builder capacity(int capacity) {
            if (capacity < 0) throw new IllegalArgumentException("capacity must be >= 0");
            this.capacity = capacity;
            return this;
        }

        public Builder name(String name) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
            this.name = name;
            return this;
        }

        public Builder fair(boolean fair) {
            this.fair = fair;
            return this;
        }

        public PoolConfig build() {
            return new PoolConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "capacity=" + capacity +
                ", name='" + name + '\'' +
                ", fair=" + fair +
                '}';
    }
}
