package com.umitunal.tenantq.config;

import java.time.Duration;

/**
 * Settings consumed by the worker pool.
 */
public class WorkerConfig {
    private final int maxAttempts;
    private final Duration dequeueTimeout;
    private final int poolSize;
    private final Duration errorBackoff;
    private final Duration drainTimeout;

    private WorkerConfig(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.dequeueTimeout = builder.dequeueTimeout;
        this.poolSize = builder.poolSize;
        this.errorBackoff = builder.errorBackoff;
        this.drainTimeout = builder.drainTimeout;
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getDequeueTimeout() { return dequeueTimeout; }
    public int getPoolSize() { return poolSize; }
    public Duration getErrorBackoff() { return errorBackoff; }
    public Duration getDrainTimeout() { return drainTimeout; }

    public static WorkerConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("WorkerConfig{maxAttempts=%d, dequeueTimeout=%s, poolSize=%d, errorBackoff=%s}",
                maxAttempts, dequeueTimeout, poolSize, errorBackoff);
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration dequeueTimeout = Duration.ofSeconds(5);
        private int poolSize = 1;
        private Duration errorBackoff = Duration.ofSeconds(1);
        private Duration drainTimeout = Duration.ofSeconds(30);

        private Builder() {
        }

        /**
         * Inclusive ceiling on started attempts per job.
         * Default: 3
         */
        public Builder withMaxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * How long one dequeue call waits for an entry.
         * Default: 5 seconds
         */
        public Builder withDequeueTimeout(Duration timeout) {
            this.dequeueTimeout = timeout;
            return this;
        }

        /**
         * Number of parallel worker loops.
         * Default: 1
         */
        public Builder withPoolSize(int poolSize) {
            if (poolSize < 1) {
                throw new IllegalArgumentException("poolSize must be at least 1: " + poolSize);
            }
            this.poolSize = poolSize;
            return this;
        }

        /**
         * Pause after a store or queue failure before the loop continues.
         * Default: 1 second
         */
        public Builder withErrorBackoff(Duration backoff) {
            this.errorBackoff = backoff;
            return this;
        }

        /**
         * How long a graceful stop waits for in-flight jobs.
         * Default: 30 seconds
         */
        public Builder withDrainTimeout(Duration timeout) {
            this.drainTimeout = timeout;
            return this;
        }

        public WorkerConfig build() {
            return new WorkerConfig(this);
        }
    }
}
