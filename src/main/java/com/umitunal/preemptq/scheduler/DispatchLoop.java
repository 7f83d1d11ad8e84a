package com.umitunal.preemptq.scheduler;

import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.core.JobStore;
import com.umitunal.preemptq.core.PriorityLanes;
import com.umitunal.preemptq.core.PriorityLanes.LaneEntry;
import com.umitunal.preemptq.execution.ExecutionController;
import com.umitunal.preemptq.execution.ExecutionOutcome;
import com.umitunal.preemptq.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One worker: takes the highest-priority job off the lanes, runs it and settles the outcome.
 *
 * Several dispatch loops, in one process or many, may share the same lanes; the atomic pop
 * hands each entry to exactly one of them.
 */
public class DispatchLoop extends PollingLoop {
    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    private final String workerId;
    private final PriorityLanes lanes;
    private final JobStore jobStore;
    private final ExecutionController controller;
    private final Clock clock;
    private final AtomicLong completedCount;
    private final AtomicLong preemptedCount;
    private final AtomicLong failedCount;

    private DispatchLoop(Builder builder) {
        super("DispatchLoop-" + builder.workerId, builder.pollInterval);
        this.workerId = builder.workerId;
        this.lanes = builder.lanes;
        this.jobStore = builder.jobStore;
        this.controller = builder.controller;
        this.clock = builder.clock;
        this.completedCount = new AtomicLong(0);
        this.preemptedCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
    }

    @Override
    protected boolean runOnce() throws Exception {
        return processOne();
    }

    /**
     * Take and run a single job synchronously.
     *
     * @return false if every lane was empty
     * @throws InterruptedException if the worker is stopping; the job is back in its lane as PENDING
     */
    public boolean processOne() throws Exception {
        LaneEntry entry = lanes.popHighest();

        if (entry == null) {
            return false;
        }

        String jobId = entry.getJobId();
        Optional<JobRecord> claimed = jobStore.update(jobId, job -> {
            if (!job.getStatus().isDispatchable()) {
                return false;
            }
            job.markRunning();
            return true;
        });

        if (claimed.isEmpty()) {
            if (jobStore.findById(jobId).isEmpty()) {
                log.warn("[Worker {}] Job {} not found, skipping", workerId, jobId);
            } else {
                log.debug("[Worker {}] Job {} is no longer dispatchable, dropping stale lane entry",
                        workerId, jobId);
            }
            return true;
        }

        JobRecord job = claimed.get();
        long startedAt = clock.millis();
        log.info("[Worker {}] Picked job {} (lane {}, priority {})",
                workerId, jobId, entry.getPriority(), job.getPriority());

        ExecutionOutcome outcome;
        try {
            outcome = controller.execute(job);
        } catch (InterruptedException e) {
            requeue(jobId);
            throw e;
        } catch (Exception e) {
            outcome = ExecutionOutcome.failed(String.valueOf(e.getMessage()), e);
        }

        long duration = clock.millis() - startedAt;
        switch (outcome.getKind()) {
            case COMPLETED -> complete(jobId, duration);
            case PREEMPTED -> {
                preemptedCount.incrementAndGet();
                log.info("[Worker {}] Job {} was preempted and will be resumed later", workerId, jobId);
            }
            case FAILED -> fail(jobId, outcome, duration);
        }
        return true;
    }

    private void complete(String jobId, long duration) throws Exception {
        jobStore.update(jobId, job -> {
            if (job.getStatus() != Job.Status.RUNNING) {
                return false;
            }
            job.markSuccess();
            return true;
        });
        completedCount.incrementAndGet();
        log.info("[Worker {}] Job completed: {} ({}ms)", workerId, jobId, duration);
    }

    private void fail(String jobId, ExecutionOutcome outcome, long duration) throws Exception {
        failedCount.incrementAndGet();
        log.error("[Worker {}] Job failed: {} ({}ms): {}", workerId, jobId, duration, outcome.getReason(),
                outcome.getCause());

        long now = clock.millis();
        Optional<JobRecord> updated = jobStore.update(jobId, job -> {
            if (job.getStatus() != Job.Status.RUNNING) {
                return false;
            }
            boolean retry = job.canRetry();
            int retryCount = job.recordFailure(outcome.getReason());
            if (retry) {
                job.scheduleRetry(now + backoffMillis(retryCount));
            } else {
                job.markFailed();
            }
            return true;
        });

        if (updated.isEmpty()) {
            return;
        }

        JobRecord job = updated.get();
        if (job.getStatus() == Job.Status.PENDING) {
            lanes.delayedAdd(jobId, job.getNextAttemptAt());
            log.info("[Worker {}] Retry {}/{} scheduled for job {} after {}ms", workerId,
                    job.getRetryCount(), job.getMaxRetries(), jobId, backoffMillis(job.getRetryCount()));
        } else {
            log.warn("[Worker {}] Job permanently failed: {} after {} attempts", workerId, jobId,
                    job.getRetryCount());
        }
    }

    /**
     * Hand an interrupted job back: PENDING, then pushed to its lane.
     */
    private void requeue(String jobId) throws Exception {
        Optional<JobRecord> reset = jobStore.update(jobId, job -> {
            if (job.getStatus() != Job.Status.RUNNING) {
                return false;
            }
            job.resetToPending();
            return true;
        });
        if (reset.isPresent()) {
            lanes.push(reset.get().getPriority(), jobId);
            log.info("[Worker {}] Job {} reset to PENDING and re-queued on shutdown", workerId, jobId);
        }
    }

    /**
     * Exponential retry backoff: 2^retryCount seconds.
     */
    public static long backoffMillis(int retryCount) {
        return (1L << Math.min(retryCount, 30)) * 1000;
    }

    public String getWorkerId() { return workerId; }
    public long getCompletedCount() { return completedCount.get(); }
    public long getPreemptedCount() { return preemptedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }

    public static Builder builder(String workerId, PriorityLanes lanes, JobStore jobStore,
                                  ExecutionController controller) {
        return new Builder(workerId, lanes, jobStore, controller);
    }

    public static class Builder {
        private final String workerId;
        private final PriorityLanes lanes;
        private final JobStore jobStore;
        private final ExecutionController controller;
        private long pollInterval = 1000;
        private Clock clock = Clock.systemUTC();

        private Builder(String workerId, PriorityLanes lanes, JobStore jobStore, ExecutionController controller) {
            this.workerId = workerId;
            this.lanes = lanes;
            this.jobStore = jobStore;
            this.controller = controller;
        }

        public Builder withPollInterval(long millis) {
            this.pollInterval = millis;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DispatchLoop build() {
            return new DispatchLoop(this);
        }
    }
}
