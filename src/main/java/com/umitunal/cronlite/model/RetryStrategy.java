package com.umitunal.cronlite.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Retry policy descriptor attached to a job.
 *
 * The scheduler stores and round-trips this policy but does not apply it yet:
 * failed jobs are retained without automatic retry regardless of its values.
 */
public class RetryStrategy {
    private final int maxAttempts;
    private final long backoffMs;

    @JsonCreator
    public RetryStrategy(@JsonProperty("maxAttempts") int maxAttempts,
                         @JsonProperty("backoffMs") long backoffMs) {
        this.maxAttempts = maxAttempts;
        this.backoffMs = backoffMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBackoffMs() {
        return backoffMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryStrategy)) return false;
        RetryStrategy that = (RetryStrategy) o;
        return maxAttempts == that.maxAttempts && backoffMs == that.backoffMs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxAttempts, backoffMs);
    }

    @Override
    public String toString() {
        return "RetryStrategy{maxAttempts=" + maxAttempts + ", backoffMs=" + backoffMs + '}';
    }
}
