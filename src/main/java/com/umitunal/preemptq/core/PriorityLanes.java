package com.umitunal.preemptq.core;

import java.util.List;

/**
 * Ten FIFO lanes, one per priority level, plus a time-ordered set of delayed entries.
 *
 * The atomic remove in {@link #popHighest()} is the only mutual-exclusion primitive the
 * scheduler relies on: a lane entry is handed to exactly one caller.
 */
public interface PriorityLanes {

    /**
     * Atomically remove the oldest entry of the highest non-empty lane, scanning 10 down to 1.
     *
     * @return the removed entry, or null if every lane is empty
     */
    LaneEntry popHighest() throws Exception;

    /**
     * Append a job id to the tail of a lane.
     */
    void push(int priority, String jobId) throws Exception;

    /**
     * Number of entries waiting in a lane.
     */
    long length(int priority) throws Exception;

    /**
     * Highest lane holding at least one entry, or 0 when all lanes are empty.
     * Stops probing at the first non-empty lane.
     */
    int highestWaitingPriority() throws Exception;

    /**
     * Best-effort duplicate guard: is the job id present in any lane.
     */
    boolean contains(String jobId) throws Exception;

    /**
     * Add (or move) a job id in the delayed set, keyed by its ready time.
     */
    void delayedAdd(String jobId, long readyAt) throws Exception;

    /**
     * Atomically remove and return every delayed entry whose ready time has passed.
     */
    List<String> delayedPopReady(long now) throws Exception;

    /**
     * Remove a job id from the delayed set.
     *
     * @return true if an entry was removed
     */
    boolean delayedRemove(String jobId) throws Exception;

    /**
     * Number of entries in the delayed set.
     */
    long delayedSize() throws Exception;

    /**
     * A job id taken from a lane, with the lane it came from.
     */
    final class LaneEntry {
        private final int priority;
        private final String jobId;

        public LaneEntry(int priority, String jobId) {
            this.priority = priority;
            this.jobId = jobId;
        }

        public int getPriority() { return priority; }
        public String getJobId() { return jobId; }

        @Override
        public String toString() {
            return "LaneEntry{priority=" + priority + ", jobId='" + jobId + "'}";
        }
    }
}
