package com.umitunal.cronlite.model;

import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.error.ValidationException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Concrete job entity with lifecycle state management.
 *
 * Mutations are not synchronized; the owning job store serializes them.
 */
public class ScheduledJob implements Job {
    private final String id;
    private final String handlerName;
    private final Map<String, Object> data;
    private final boolean recurring;
    private final String cronExpression;
    private final Long intervalMs;
    private final RetryStrategy retryStrategy;

    private long scheduleTime;
    private Status status;
    private long createdAt;
    private Long executedAt;
    private String lastError;
    private int retryCount;

    private ScheduledJob(Builder builder) {
        this.id = builder.id;
        this.scheduleTime = builder.scheduleTime;
        this.handlerName = builder.handlerName;
        this.data = builder.data;
        this.recurring = builder.recurring;
        this.cronExpression = builder.cronExpression;
        this.intervalMs = builder.intervalMs;
        this.retryStrategy = builder.retryStrategy;
        this.createdAt = builder.createdAt;
        this.status = Status.PENDING;
        this.retryCount = 0;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public long getScheduleTime() {
        return scheduleTime;
    }

    @Override
    public String getHandlerName() {
        return handlerName;
    }

    @Override
    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public Status getStatus() {
        return status;
    }

    @Override
    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public Long getExecutedAt() {
        return executedAt;
    }

    @Override
    public String getLastError() {
        return lastError;
    }

    @Override
    public int getRetryCount() {
        return retryCount;
    }

    @Override
    public String getCronExpression() {
        return cronExpression;
    }

    @Override
    public Long getIntervalMs() {
        return intervalMs;
    }

    @Override
    public RetryStrategy getRetryStrategy() {
        return retryStrategy;
    }

    @Override
    public boolean isRecurring() {
        return recurring && (hasCronExpression() || hasInterval());
    }

    public boolean hasCronExpression() {
        return cronExpression != null && !cronExpression.isBlank();
    }

    public boolean hasInterval() {
        return intervalMs != null && intervalMs > 0;
    }

    /**
     * Gets a human-readable description of the schedule.
     */
    public String getScheduleDescription() {
        if (isRecurring()) {
            return hasCronExpression()
                    ? "Recurring: " + cronExpression
                    : "Recurring: every " + intervalMs + " ms";
        }
        return "One-time: " + Instant.ofEpochMilli(scheduleTime);
    }

    // Package-private setters for record mapping
    void setStatus(Status status) {
        this.status = status;
    }

    void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    void setExecutedAt(Long executedAt) {
        this.executedAt = executedAt;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    /**
     * Move to the given status within the current execution cycle.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void transitionTo(Status next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Job " + id + " cannot move from " + status.wireName() + " to " + next.wireName());
        }
        this.status = next;
    }

    /**
     * Record the outcome of an execution attempt. A null error completes the job,
     * anything else fails it.
     */
    public void recordExecution(long executedAt, String lastError, int retryCount) {
        transitionTo(lastError == null ? Status.COMPLETED : Status.FAILED);
        this.executedAt = executedAt;
        this.lastError = lastError;
        this.retryCount = retryCount;
    }

    /**
     * Reset a finished recurring job for its next execution cycle.
     */
    public void resetForNextRun(long nextScheduleTime) {
        if (status != Status.COMPLETED && status != Status.FAILED) {
            throw new IllegalStateException(
                    "Job " + id + " cannot be reset while " + status.wireName());
        }
        this.status = Status.PENDING;
        this.scheduleTime = nextScheduleTime;
        this.executedAt = null;
        this.lastError = null;
        this.retryCount = 0;
    }

    @Override
    public String toString() {
        return String.format("ScheduledJob{id='%s', handler='%s', status=%s, scheduled=%d, retries=%d, recurring=%s}",
                id, handlerName, status.wireName(), scheduleTime, retryCount, isRecurring());
    }

    public static Builder builder(String id, long scheduleTime, String handlerName) {
        return new Builder(id, scheduleTime, handlerName);
    }

    public static class Builder {
        private final String id;
        private final long scheduleTime;
        private final String handlerName;
        private Map<String, Object> data = Collections.emptyMap();
        private boolean recurring;
        private String cronExpression;
        private Long intervalMs;
        private RetryStrategy retryStrategy;
        private long createdAt = System.currentTimeMillis();

        private Builder(String id, long scheduleTime, String handlerName) {
            this.id = id;
            this.scheduleTime = scheduleTime;
            this.handlerName = handlerName;
        }

        public Builder withData(Map<String, Object> data) {
            this.data = data == null ? Collections.emptyMap() : new LinkedHashMap<>(data);
            return this;
        }

        /**
         * Make the job recur on a cron schedule. Takes precedence over an interval.
         */
        public Builder withCronExpression(String cronExpression) {
            this.recurring = true;
            this.cronExpression = cronExpression;
            return this;
        }

        /**
         * Make the job recur at a fixed interval after each execution.
         */
        public Builder withIntervalMs(long intervalMs) {
            this.recurring = true;
            this.intervalMs = intervalMs;
            return this;
        }

        public Builder withRetryStrategy(RetryStrategy retryStrategy) {
            this.retryStrategy = retryStrategy;
            return this;
        }

        public Builder withCreatedAt(long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public ScheduledJob build() {
            if (id == null || id.isBlank()) {
                throw new ValidationException("Job id is required");
            }
            if (handlerName == null || handlerName.isBlank()) {
                throw new ValidationException("Handler name is required for job " + id);
            }
            if (intervalMs != null && intervalMs <= 0) {
                throw new ValidationException("Interval must be positive for job " + id);
            }
            if (recurring && (cronExpression == null || cronExpression.isBlank()) && intervalMs == null) {
                throw new ValidationException("Recurring job " + id + " needs a cron expression or an interval");
            }
            return new ScheduledJob(this);
        }
    }
}
