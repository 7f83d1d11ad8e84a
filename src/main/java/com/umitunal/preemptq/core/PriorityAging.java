package com.umitunal.preemptq.core;

/**
 * Wait-time based priority boost: one level per second since creation, capped at {@link Job#MAX_PRIORITY}.
 */
public final class PriorityAging {

    private PriorityAging() {
    }

    public static long ageSeconds(Job job, long now) {
        return Math.max(0, (now - job.getCreatedAt()) / 1000);
    }

    public static int effectivePriority(Job job, long now) {
        return (int) Math.min(job.getPriority() + ageSeconds(job, now), Job.MAX_PRIORITY);
    }
}
