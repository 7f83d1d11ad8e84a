package com.umitunal.preemptq.config;

/**
 * Timing and sizing of the scheduler's loops.
 */
public class SchedulerConfig {
    private final int workerCount;
    private final long dispatchPollIntervalMs;
    private final long sliceMs;
    private final long checkpointIntervalMs;
    private final long executionTimeoutMs;
    private final long agingIntervalMs;
    private final long resumptionIntervalMs;
    private final long promotionIntervalMs;
    private final long shutdownTimeoutMs;

    private SchedulerConfig(Builder builder) {
        this.workerCount = builder.workerCount;
        this.dispatchPollIntervalMs = builder.dispatchPollIntervalMs;
        this.sliceMs = builder.sliceMs;
        this.checkpointIntervalMs = builder.checkpointIntervalMs;
        this.executionTimeoutMs = builder.executionTimeoutMs;
        this.agingIntervalMs = builder.agingIntervalMs;
        this.resumptionIntervalMs = builder.resumptionIntervalMs;
        this.promotionIntervalMs = builder.promotionIntervalMs;
        this.shutdownTimeoutMs = builder.shutdownTimeoutMs;
    }

    public int getWorkerCount() { return workerCount; }
    public long getDispatchPollIntervalMs() { return dispatchPollIntervalMs; }
    public long getSliceMs() { return sliceMs; }
    public long getCheckpointIntervalMs() { return checkpointIntervalMs; }
    public long getExecutionTimeoutMs() { return executionTimeoutMs; }
    public long getAgingIntervalMs() { return agingIntervalMs; }
    public long getResumptionIntervalMs() { return resumptionIntervalMs; }
    public long getPromotionIntervalMs() { return promotionIntervalMs; }
    public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }

    public static SchedulerConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format(
            "SchedulerConfig{workers=%d, poll=%dms, slice=%dms, checkpoint=%dms, timeout=%dms, "
                + "aging=%dms, resumption=%dms, promotion=%dms}",
            workerCount, dispatchPollIntervalMs, sliceMs, checkpointIntervalMs, executionTimeoutMs,
            agingIntervalMs, resumptionIntervalMs, promotionIntervalMs);
    }

    public static class Builder {
        private int workerCount = 1;
        private long dispatchPollIntervalMs = 1000;
        private long sliceMs = 100;
        private long checkpointIntervalMs = 500;
        private long executionTimeoutMs = 60000;
        private long agingIntervalMs = 1000;
        private long resumptionIntervalMs = 2000;
        private long promotionIntervalMs = 1000;
        private long shutdownTimeoutMs = 5000;

        private Builder() {
        }

        /**
         * Number of dispatch loops in this process.
         * Default: 1
         */
        public Builder withWorkerCount(int count) {
            this.workerCount = requirePositive(count, "workerCount");
            return this;
        }

        /**
         * Sleep between dispatch attempts when every lane is empty.
         * Default: 1000 ms
         */
        public Builder withDispatchPollInterval(long millis) {
            this.dispatchPollIntervalMs = requirePositive(millis, "dispatchPollInterval");
            return this;
        }

        /**
         * Execution time slice between preemption checks.
         * Default: 100 ms
         */
        public Builder withSlice(long millis) {
            this.sliceMs = requirePositive(millis, "slice");
            return this;
        }

        /**
         * Maximum time between checkpoint writes during a run.
         * Default: 500 ms
         */
        public Builder withCheckpointInterval(long millis) {
            this.checkpointIntervalMs = requirePositive(millis, "checkpointInterval");
            return this;
        }

        /**
         * Hard ceiling on the execution phase of one run. Delay phases are not bounded.
         * Default: 60000 ms
         */
        public Builder withExecutionTimeout(long millis) {
            this.executionTimeoutMs = requirePositive(millis, "executionTimeout");
            return this;
        }

        /**
         * Default: 1000 ms
         */
        public Builder withAgingInterval(long millis) {
            this.agingIntervalMs = requirePositive(millis, "agingInterval");
            return this;
        }

        /**
         * Default: 2000 ms
         */
        public Builder withResumptionInterval(long millis) {
            this.resumptionIntervalMs = requirePositive(millis, "resumptionInterval");
            return this;
        }

        /**
         * Default: 1000 ms
         */
        public Builder withPromotionInterval(long millis) {
            this.promotionIntervalMs = requirePositive(millis, "promotionInterval");
            return this;
        }

        /**
         * How long close() waits for each loop thread to exit.
         * Default: 5000 ms
         */
        public Builder withShutdownTimeout(long millis) {
            this.shutdownTimeoutMs = requirePositive(millis, "shutdownTimeout");
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }

        private static long requirePositive(long value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
