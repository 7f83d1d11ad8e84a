package com.umitunal.preemptq.core;

import java.util.Map;

/**
 * Read-only view of a schedulable unit of work.
 */
public interface Job {

    int MIN_PRIORITY = 1;
    int MAX_PRIORITY = 10;

    /**
     * Gets the unique identifier for this job.
     */
    String getId();

    /**
     * Gets the job type, used to pick the payload handler.
     */
    Type getType();

    /**
     * Gets the type-specific payload fields.
     */
    Map<String, Object> getPayload();

    /**
     * Gets the current scheduling status.
     */
    Status getStatus();

    /**
     * Gets the stored priority (1 lowest, 10 highest).
     */
    int getPriority();

    /**
     * Gets the number of failed attempts so far.
     */
    int getRetryCount();

    /**
     * Gets the number of retries allowed before the job fails permanently.
     */
    int getMaxRetries();

    /**
     * Gets the seconds of work required once the job is running.
     */
    int getExecutionTimeSecs();

    /**
     * Gets the activation delay after creation, in milliseconds.
     */
    long getDelayMs();

    /**
     * Gets the creation time in milliseconds since epoch.
     */
    long getCreatedAt();

    /**
     * Gets the earliest time a scheduled retry may run (0 when none).
     */
    long getNextAttemptAt();

    /**
     * Checks if a PENDING job has waited out both its activation delay and any retry backoff.
     */
    boolean isDue(long now);

    /**
     * Checks if another failure would still be retried.
     */
    boolean canRetry();

    /**
     * Kinds of work the scheduler knows how to hand off.
     */
    enum Type {
        DELAY,
        EMAIL,
        WEBHOOK
    }

    /**
     * Scheduling states. Transitions outside {@link #canTransitionTo(Status)} are rejected.
     */
    enum Status {
        PENDING,     // Created, waiting on a delay, or scheduled for retry
        READY,       // Enqueued in a priority lane
        RUNNING,     // Owned by a dispatch loop
        SUSPENDED,   // Preempted, checkpoint persisted
        SUCCESS,
        FAILED;

        public boolean canTransitionTo(Status target) {
            return switch (this) {
                case PENDING -> target == READY || target == RUNNING;
                case READY -> target == RUNNING;
                case RUNNING -> target == SUSPENDED || target == SUCCESS
                        || target == PENDING || target == FAILED;
                case SUSPENDED -> target == READY;
                case SUCCESS, FAILED -> false;
            };
        }

        /**
         * Whether a dispatch loop may take ownership of a job in this state.
         */
        public boolean isDispatchable() {
            return this == PENDING || this == READY;
        }

        /**
         * Whether the job sits in a lane (or is about to) and is subject to aging.
         */
        public boolean isWaiting() {
            return this == READY || this == SUSPENDED;
        }

        public boolean isTerminal() {
            return this == SUCCESS || this == FAILED;
        }
    }
}
