package com.umitunal.preemptq.model;

/**
 * Durable execution state of one job, modelled on an operating system's process control block.
 *
 * Progress is tracked in milliseconds. {@code executionTimeDoneMs} never decreases and never
 * exceeds {@code executionTimeMs}; the same holds for the delay phase counters.
 *
 * Mutable with a public no-arg constructor so Kryo can rebuild it.
 */
public class ProcessControlBlock {

    public enum Status {
        RUNNING,
        SUSPENDED,
        READY,
        COMPLETED
    }

    /**
     * The two sliced phases of a run.
     */
    public enum Phase {
        DELAY,
        WORK
    }

    private String jobId;
    private Status status;
    private long startTime;
    private long elapsedTimeMs;
    private long expectedDurationMs;
    private long deadlineTime;
    private long executionTimeMs;
    private long executionTimeDoneMs;
    private DelayProgress delayProgress;
    private long suspendedAt;
    private int resumeCount;
    private long lastModified;

    public ProcessControlBlock() {
    }

    /**
     * Create the PCB for a job's first execution attempt.
     */
    public static ProcessControlBlock start(String jobId, long executionTimeMs, long delayPhaseMs, long now) {
        ProcessControlBlock pcb = new ProcessControlBlock();
        pcb.jobId = jobId;
        pcb.status = Status.RUNNING;
        pcb.startTime = now;
        pcb.executionTimeMs = Math.max(0, executionTimeMs);
        pcb.delayProgress = new DelayProgress(Math.max(0, delayPhaseMs), 0);
        pcb.expectedDurationMs = pcb.executionTimeMs + pcb.delayProgress.getTotalDelayMs();
        pcb.deadlineTime = now + pcb.expectedDurationMs;
        pcb.lastModified = now;
        return pcb;
    }

    public String getJobId() { return jobId; }
    public Status getStatus() { return status; }
    public long getStartTime() { return startTime; }
    public long getElapsedTimeMs() { return elapsedTimeMs; }
    public long getExpectedDurationMs() { return expectedDurationMs; }
    public long getDeadlineTime() { return deadlineTime; }
    public long getExecutionTimeMs() { return executionTimeMs; }
    public long getExecutionTimeDoneMs() { return executionTimeDoneMs; }
    public DelayProgress getDelayProgress() { return delayProgress; }
    public long getSuspendedAt() { return suspendedAt; }
    public int getResumeCount() { return resumeCount; }
    public long getLastModified() { return lastModified; }

    public double getExecutionTimeSecs() {
        return executionTimeMs / 1000.0;
    }

    public double getExecutionTimeDoneSecs() {
        return executionTimeDoneMs / 1000.0;
    }

    public long remainingMs(Phase phase) {
        return switch (phase) {
            case DELAY -> delayProgress.getTotalDelayMs() - delayProgress.getDelayedSoFarMs();
            case WORK -> executionTimeMs - executionTimeDoneMs;
        };
    }

    /**
     * Advance a phase's checkpoint by the time actually spent, never past what the phase requires.
     *
     * @return the milliseconds credited
     */
    public long advance(Phase phase, long elapsedMs) {
        long credited = Math.max(0, Math.min(elapsedMs, remainingMs(phase)));
        switch (phase) {
            case DELAY -> delayProgress.delayedSoFarMs += credited;
            case WORK -> executionTimeDoneMs += credited;
        }
        elapsedTimeMs += credited;
        return credited;
    }

    /**
     * A suspended (or re-queued) PCB picked up again.
     */
    public void resume() {
        if (status != Status.SUSPENDED && status != Status.READY) {
            throw new IllegalStateException("PCB of job " + jobId + " is " + status + ", not resumable");
        }
        this.status = Status.RUNNING;
        this.resumeCount++;
    }

    public void suspend(long now) {
        if (status != Status.RUNNING) {
            throw new IllegalStateException("PCB of job " + jobId + " is " + status + ", cannot suspend");
        }
        this.status = Status.SUSPENDED;
        this.suspendedAt = now;
    }

    /**
     * Suspended PCB handed back to the lanes.
     */
    public void markReady() {
        if (status != Status.SUSPENDED) {
            throw new IllegalStateException("PCB of job " + jobId + " is " + status + ", not suspended");
        }
        this.status = Status.READY;
    }

    public void complete() {
        if (status == Status.COMPLETED) {
            return;
        }
        this.status = Status.COMPLETED;
        delayProgress.delayedSoFarMs = delayProgress.getTotalDelayMs();
        this.executionTimeDoneMs = executionTimeMs;
    }

    public void touch(long now) {
        this.lastModified = now;
    }

    @Override
    public String toString() {
        return String.format("PCB{jobId='%s', status=%s, work=%d/%dms, delay=%d/%dms, resumes=%d}",
                jobId, status, executionTimeDoneMs, executionTimeMs,
                delayProgress.getDelayedSoFarMs(), delayProgress.getTotalDelayMs(), resumeCount);
    }

    /**
     * Progress through a job's pre-execution delay phase.
     */
    public static class DelayProgress {
        private long totalDelayMs;
        private long delayedSoFarMs;

        public DelayProgress() {
        }

        public DelayProgress(long totalDelayMs, long delayedSoFarMs) {
            this.totalDelayMs = totalDelayMs;
            this.delayedSoFarMs = delayedSoFarMs;
        }

        public long getTotalDelayMs() { return totalDelayMs; }
        public long getDelayedSoFarMs() { return delayedSoFarMs; }
    }
}
