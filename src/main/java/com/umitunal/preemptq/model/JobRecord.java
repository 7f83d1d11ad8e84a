package com.umitunal.preemptq.model;

import com.umitunal.preemptq.core.Job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Concrete job with full state management.
 *
 * Every status change goes through {@link #transitionTo(Status)}, which rejects moves
 * the scheduling state machine does not allow.
 */
public class JobRecord implements Job {
    private final String id;
    private final Type type;
    private final Map<String, Object> payload;
    private final int maxRetries;
    private final int executionTimeSecs;
    private final long delayMs;

    private Status status;
    private int priority;
    private int retryCount;
    private long createdAt;
    private long nextAttemptAt;
    private long lastModified;
    private String lastError;
    private long version;  // For optimistic concurrency

    public JobRecord(String id, Type type, Map<String, Object> payload, int priority,
                     int maxRetries, int executionTimeSecs, long delayMs, long createdAt) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Job id must not be empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Job type must not be null");
        }
        if (maxRetries < 0 || executionTimeSecs < 0 || delayMs < 0) {
            throw new IllegalArgumentException(
                    "maxRetries, executionTimeSecs and delayMs must not be negative");
        }
        this.id = id;
        this.type = type;
        this.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        this.priority = checkPriority(priority);
        this.maxRetries = maxRetries;
        this.executionTimeSecs = executionTimeSecs;
        this.delayMs = delayMs;
        this.status = Status.PENDING;
        this.createdAt = createdAt;
        this.lastModified = createdAt;
        this.version = 0;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    @Override
    public Status getStatus() {
        return status;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    public int getRetryCount() {
        return retryCount;
    }

    @Override
    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public int getExecutionTimeSecs() {
        return executionTimeSecs;
    }

    @Override
    public long getDelayMs() {
        return delayMs;
    }

    @Override
    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public long getNextAttemptAt() {
        return nextAttemptAt;
    }

    @Override
    public boolean isDue(long now) {
        return now - createdAt >= delayMs && now >= nextAttemptAt;
    }

    @Override
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    public long millisUntilDue(long now) {
        long activation = createdAt + delayMs;
        return Math.max(0, Math.max(activation, nextAttemptAt) - now);
    }

    public long getLastModified() {
        return lastModified;
    }

    public String getLastError() {
        return lastError;
    }

    public long getVersion() {
        return version;
    }

    // Package-private setters for deserialization
    void setStatus(Status status) {
        this.status = status;
    }

    void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    void setNextAttemptAt(long nextAttemptAt) {
        this.nextAttemptAt = nextAttemptAt;
    }

    void setLastModified(long lastModified) {
        this.lastModified = lastModified;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    void setVersion(long version) {
        this.version = version;
    }

    public void markReady() {
        transitionTo(Status.READY);
    }

    public void markRunning() {
        transitionTo(Status.RUNNING);
    }

    public void markSuspended() {
        transitionTo(Status.SUSPENDED);
    }

    public void markSuccess() {
        transitionTo(Status.SUCCESS);
        this.lastError = null;
    }

    /**
     * Count a failed attempt. The caller decides between retry and permanent failure.
     *
     * @return the new retry count
     */
    public int recordFailure(String reason) {
        this.retryCount++;
        this.lastError = reason;
        return retryCount;
    }

    public void scheduleRetry(long readyAt) {
        transitionTo(Status.PENDING);
        this.nextAttemptAt = readyAt;
    }

    public void markFailed() {
        transitionTo(Status.FAILED);
    }

    /**
     * Return an orphaned RUNNING job to PENDING (crash recovery, shutdown).
     */
    public void resetToPending() {
        transitionTo(Status.PENDING);
    }

    /**
     * Raise the stored priority. Lower values are ignored, priority never decreases.
     */
    public boolean boostPriority(int newPriority) {
        int checked = checkPriority(newPriority);
        if (checked <= priority) {
            return false;
        }
        this.priority = checked;
        return true;
    }

    /**
     * Called by the store on every write.
     */
    public void touch(long now) {
        this.lastModified = now;
        this.version++;
    }

    private void transitionTo(Status target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Job " + id + " cannot move from " + status + " to " + target);
        }
        this.status = target;
    }

    private static int checkPriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException(
                    "Priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY + ": " + priority);
        }
        return priority;
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id='%s', type=%s, status=%s, priority=%d, retries=%d/%d, exec=%ds, delay=%dms}",
                id, type, status, priority, retryCount, maxRetries, executionTimeSecs, delayMs);
    }

    public static Builder builder(Type type) {
        return new Builder(type);
    }

    public static class Builder {
        private final Type type;
        private String id;
        private Map<String, Object> payload = new LinkedHashMap<>();
        private int priority = 5;
        private int maxRetries = 3;
        private int executionTimeSecs = 10;
        private long delayMs = 0;
        private Long createdAt;

        private Builder(Type type) {
            this.type = type;
        }

        /**
         * Default: random UUID
         */
        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withPayload(Map<String, Object> payload) {
            this.payload = new LinkedHashMap<>(payload);
            return this;
        }

        public Builder withPayloadField(String name, Object value) {
            this.payload.put(name, value);
            return this;
        }

        /**
         * Default: 5
         */
        public Builder withPriority(int priority) {
            this.priority = priority;
            return this;
        }

        /**
         * Default: 3
         */
        public Builder withMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Default: 10 seconds
         */
        public Builder withExecutionTimeSecs(int executionTimeSecs) {
            this.executionTimeSecs = executionTimeSecs;
            return this;
        }

        /**
         * Default: 0 (eligible immediately)
         */
        public Builder withDelayMs(long delayMs) {
            this.delayMs = delayMs;
            return this;
        }

        /**
         * Default: current time
         */
        public Builder withCreatedAt(long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public JobRecord build() {
            return new JobRecord(
                    id != null ? id : UUID.randomUUID().toString(),
                    type,
                    payload,
                    priority,
                    maxRetries,
                    executionTimeSecs,
                    delayMs,
                    createdAt != null ? createdAt : System.currentTimeMillis());
        }
    }
}
