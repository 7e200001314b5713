package com.umitunal.cronlite.config;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Configuration for the job scheduler's tick loop.
 */
public class SchedulerConfig {
    private final long tickIntervalMs;
    private final long executionTimeoutMs;
    private final ZoneId zone;

    private SchedulerConfig(Builder builder) {
        this.tickIntervalMs = builder.tickIntervalMs;
        this.executionTimeoutMs = builder.executionTimeoutMs;
        this.zone = builder.zone;
    }

    /**
     * Polling cadence. A job due at T runs somewhere in [T, T + tickInterval).
     */
    public long getTickIntervalMs() { return tickIntervalMs; }

    /**
     * Per-job handler deadline, 0 when handlers may run indefinitely.
     */
    public long getExecutionTimeoutMs() { return executionTimeoutMs; }

    public boolean hasExecutionTimeout() { return executionTimeoutMs > 0; }

    /**
     * Time zone in which cron expressions are evaluated.
     */
    public ZoneId getZone() { return zone; }

    public static SchedulerConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private long tickIntervalMs = 1000;
        private long executionTimeoutMs = 0;
        private ZoneId zone = ZoneId.systemDefault();

        private Builder() {
        }

        /**
         * Set the tick interval in milliseconds.
         * Default: 1000 ms
         */
        public Builder withTickInterval(long millis) {
            this.tickIntervalMs = millis;
            return this;
        }

        /**
         * Set the handler execution timeout in milliseconds, 0 to disable.
         * Default: 0
         */
        public Builder withExecutionTimeout(long millis) {
            this.executionTimeoutMs = millis;
            return this;
        }

        /**
         * Set the cron evaluation time zone.
         * Default: system zone
         */
        public Builder withZone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone, "zone");
            return this;
        }

        public SchedulerConfig build() {
            if (tickIntervalMs <= 0) {
                throw new IllegalArgumentException("Tick interval must be positive: " + tickIntervalMs);
            }
            if (executionTimeoutMs < 0) {
                throw new IllegalArgumentException("Execution timeout must not be negative: " + executionTimeoutMs);
            }
            return new SchedulerConfig(this);
        }
    }
}
