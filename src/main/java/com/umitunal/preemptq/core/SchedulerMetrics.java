package com.umitunal.preemptq.core;

/**
 * Point-in-time counts for scheduler monitoring.
 */
public class SchedulerMetrics {
    private final long pendingJobs;
    private final long readyJobs;
    private final long runningJobs;
    private final long suspendedJobs;
    private final long successfulJobs;
    private final long failedJobs;
    private final long suspendedStates;
    private final long waitingInLanes;
    private final long delayedEntries;

    public SchedulerMetrics(long pendingJobs, long readyJobs, long runningJobs, long suspendedJobs,
                            long successfulJobs, long failedJobs, long suspendedStates,
                            long waitingInLanes, long delayedEntries) {
        this.pendingJobs = pendingJobs;
        this.readyJobs = readyJobs;
        this.runningJobs = runningJobs;
        this.suspendedJobs = suspendedJobs;
        this.successfulJobs = successfulJobs;
        this.failedJobs = failedJobs;
        this.suspendedStates = suspendedStates;
        this.waitingInLanes = waitingInLanes;
        this.delayedEntries = delayedEntries;
    }

    public long getPendingJobs() { return pendingJobs; }
    public long getReadyJobs() { return readyJobs; }
    public long getRunningJobs() { return runningJobs; }
    public long getSuspendedJobs() { return suspendedJobs; }
    public long getSuccessfulJobs() { return successfulJobs; }
    public long getFailedJobs() { return failedJobs; }
    public long getSuspendedStates() { return suspendedStates; }
    public long getWaitingInLanes() { return waitingInLanes; }
    public long getDelayedEntries() { return delayedEntries; }

    public long getTotalJobs() {
        return pendingJobs + readyJobs + runningJobs + suspendedJobs + successfulJobs + failedJobs;
    }

    @Override
    public String toString() {
        return String.format(
            "SchedulerMetrics{pending=%d, ready=%d, running=%d, suspended=%d, success=%d, failed=%d, "
                + "suspendedPcbs=%d, inLanes=%d, delayed=%d}",
            pendingJobs, readyJobs, runningJobs, suspendedJobs, successfulJobs, failedJobs,
            suspendedStates, waitingInLanes, delayedEntries
        );
    }
}
