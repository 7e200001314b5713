package com.umitunal.cronlite.core;

import com.umitunal.cronlite.model.RetryStrategy;

import java.util.Map;

/**
 * Read-only view of a unit of deferred work.
 * A job references its logic by handler name only, so it stays serializable.
 */
public interface Job {

    /**
     * Gets the unique identifier for this job.
     */
    String getId();

    /**
     * Gets the instant (millis since epoch) at which the job becomes eligible to run.
     */
    long getScheduleTime();

    /**
     * Gets the name under which the job's handler is registered.
     */
    String getHandlerName();

    /**
     * Gets the payload passed to the handler.
     */
    Map<String, Object> getData();

    /**
     * Gets the current lifecycle status.
     */
    Status getStatus();

    long getCreatedAt();

    /**
     * Gets the completion instant of the last execution attempt, or null if never run.
     */
    Long getExecutedAt();

    /**
     * Gets the message of the most recent failure, or null.
     */
    String getLastError();

    /**
     * Gets the number of failed attempts.
     */
    int getRetryCount();

    String getCronExpression();

    /**
     * Gets the fixed recurrence interval in milliseconds, or null.
     */
    Long getIntervalMs();

    /**
     * Gets the stored retry policy, or null.
     */
    RetryStrategy getRetryStrategy();

    /**
     * Checks if this job reschedules itself after each execution.
     */
    boolean isRecurring();

    /**
     * Checks if this job is due at the given instant.
     */
    default boolean isDue(long now) {
        return getStatus() == Status.PENDING && getScheduleTime() <= now;
    }

    /**
     * Lifecycle states of a job.
     */
    enum Status {
        PENDING("pending"),      // Waiting for its schedule time
        RUNNING("running"),      // Handler invocation in progress
        COMPLETED("completed"),  // Last attempt succeeded
        FAILED("failed");        // Last attempt failed

        private final String wireName;

        Status(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        /**
         * Checks if one execution cycle may move a job from this status to the next.
         * Returning to PENDING is reserved for the recurrence reset.
         */
        public boolean canTransitionTo(Status next) {
            return switch (this) {
                case PENDING -> next == RUNNING;
                case RUNNING -> next == COMPLETED || next == FAILED;
                case COMPLETED, FAILED -> false;
            };
        }

        public static Status fromWireName(String value) {
            for (Status status : values()) {
                if (status.wireName.equals(value)) {
                    return status;
                }
            }
            throw new IllegalArgumentException("Unknown job status: " + value);
        }
    }
}
