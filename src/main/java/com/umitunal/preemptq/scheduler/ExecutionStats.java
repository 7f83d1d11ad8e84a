package com.umitunal.preemptq.scheduler;

import com.umitunal.preemptq.model.ProcessControlBlock;

/**
 * Snapshot of one job's execution progress, read from its PCB.
 */
public class ExecutionStats {
    private final String jobId;
    private final ProcessControlBlock.Status status;
    private final long startTime;
    private final long elapsedTimeMs;
    private final long expectedDurationMs;
    private final long remainingTimeMs;
    private final long deadlineTime;
    private final long timeUntilDeadlineMs;
    private final int resumeCount;
    private final long totalDelayMs;
    private final long delayedSoFarMs;

    ExecutionStats(ProcessControlBlock pcb, long now) {
        this.jobId = pcb.getJobId();
        this.status = pcb.getStatus();
        this.startTime = pcb.getStartTime();
        this.elapsedTimeMs = pcb.getElapsedTimeMs();
        this.expectedDurationMs = pcb.getExpectedDurationMs();
        this.remainingTimeMs = Math.max(0, pcb.getExpectedDurationMs() - pcb.getElapsedTimeMs());
        this.deadlineTime = pcb.getDeadlineTime();
        this.timeUntilDeadlineMs = Math.max(0, pcb.getDeadlineTime() - now);
        this.resumeCount = pcb.getResumeCount();
        this.totalDelayMs = pcb.getDelayProgress().getTotalDelayMs();
        this.delayedSoFarMs = pcb.getDelayProgress().getDelayedSoFarMs();
    }

    public String getJobId() { return jobId; }
    public ProcessControlBlock.Status getStatus() { return status; }
    public long getStartTime() { return startTime; }
    public long getElapsedTimeMs() { return elapsedTimeMs; }
    public long getExpectedDurationMs() { return expectedDurationMs; }
    public long getRemainingTimeMs() { return remainingTimeMs; }
    public long getDeadlineTime() { return deadlineTime; }
    public long getTimeUntilDeadlineMs() { return timeUntilDeadlineMs; }
    public int getResumeCount() { return resumeCount; }
    public long getTotalDelayMs() { return totalDelayMs; }
    public long getDelayedSoFarMs() { return delayedSoFarMs; }

    @Override
    public String toString() {
        return String.format("ExecutionStats{jobId='%s', status=%s, elapsed=%d/%dms, remaining=%dms, resumes=%d}",
                jobId, status, elapsedTimeMs, expectedDurationMs, remainingTimeMs, resumeCount);
    }
}
