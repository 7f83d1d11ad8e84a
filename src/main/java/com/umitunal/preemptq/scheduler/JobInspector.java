package com.umitunal.preemptq.scheduler;

import com.umitunal.preemptq.core.ExecutionStateStore;
import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.core.JobStore;
import com.umitunal.preemptq.core.PriorityLanes;
import com.umitunal.preemptq.core.SchedulerMetrics;
import com.umitunal.preemptq.model.JobRecord;
import com.umitunal.preemptq.model.ProcessControlBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Read-only views over the stores for monitoring and dashboards.
 */
public class JobInspector {
    private static final Logger log = LoggerFactory.getLogger(JobInspector.class);
    private static final int DELAYED_SAMPLE = 5;

    private final JobStore jobStore;
    private final ExecutionStateStore stateStore;
    private final PriorityLanes lanes;
    private final Clock clock;

    public JobInspector(JobStore jobStore, ExecutionStateStore stateStore, PriorityLanes lanes, Clock clock) {
        this.jobStore = jobStore;
        this.stateStore = stateStore;
        this.lanes = lanes;
        this.clock = clock;
    }

    public SchedulerMetrics metrics() throws Exception {
        long inLanes = 0;
        for (int p = Job.MIN_PRIORITY; p <= Job.MAX_PRIORITY; p++) {
            inLanes += lanes.length(p);
        }
        return new SchedulerMetrics(
                jobStore.countByStatus(Job.Status.PENDING),
                jobStore.countByStatus(Job.Status.READY),
                jobStore.countByStatus(Job.Status.RUNNING),
                jobStore.countByStatus(Job.Status.SUSPENDED),
                jobStore.countByStatus(Job.Status.SUCCESS),
                jobStore.countByStatus(Job.Status.FAILED),
                stateStore.countByStatus(ProcessControlBlock.Status.SUSPENDED),
                inLanes,
                lanes.delayedSize());
    }

    /**
     * Execution progress of a job, empty if it has never been picked up.
     */
    public Optional<ExecutionStats> stats(String jobId) throws Exception {
        long now = clock.millis();
        return stateStore.findByJobId(jobId).map(pcb -> new ExecutionStats(pcb, now));
    }

    /**
     * Most recently created jobs first.
     */
    public List<JobRecord> recentJobs(int limit) throws Exception {
        return jobStore.findRecent(limit);
    }

    public long millisUntilDue(JobRecord job) {
        return job.millisUntilDue(clock.millis());
    }

    /**
     * Log running and suspended jobs, like {@code ps}, plus a sample of jobs still waiting out a delay.
     */
    public void logQueueStatus() throws Exception {
        StringBuilder out = new StringBuilder("\n========== PCB QUEUE STATUS ==========\nRUNNING:\n");
        for (ProcessControlBlock pcb : stateStore.findByStatus(ProcessControlBlock.Status.RUNNING)) {
            appendPcb(out, pcb, false);
        }
        out.append("\nSUSPENDED (Preempted):\n");
        for (ProcessControlBlock pcb : stateStore.findByStatus(ProcessControlBlock.Status.SUSPENDED)) {
            appendPcb(out, pcb, true);
        }

        long now = clock.millis();
        List<JobRecord> waiting = jobStore.findByStatus(Job.Status.PENDING, 0, DELAYED_SAMPLE);
        if (!waiting.isEmpty()) {
            out.append("\nDELAYED:\n");
            for (JobRecord job : waiting) {
                out.append(String.format("  - Job %s: %dms remaining (priority %d)%n",
                        job.getId(), job.millisUntilDue(now), job.getPriority()));
            }
        }
        out.append("=====================================");
        log.info(out.toString());
    }

    private void appendPcb(StringBuilder out, ProcessControlBlock pcb, boolean withResumes) throws Exception {
        Optional<JobRecord> job = jobStore.findById(pcb.getJobId());
        long remaining = Math.max(0, pcb.getExpectedDurationMs() - pcb.getElapsedTimeMs());
        out.append(String.format("  - Job %s (%s) [Priority: %s]%n    Elapsed: %dms / Expected: %dms | Remaining: %dms",
                pcb.getJobId(),
                job.map(j -> j.getType().name()).orElse("?"),
                job.map(j -> String.valueOf(j.getPriority())).orElse("?"),
                pcb.getElapsedTimeMs(), pcb.getExpectedDurationMs(), remaining));
        if (withResumes) {
            out.append(" | Resumes: ").append(pcb.getResumeCount());
        }
        out.append('\n');
    }

    /**
     * Log job counts per status, as after a recovery run.
     */
    public void logRecoveryStats() throws Exception {
        log.info("Recovery stats: PENDING={}, RUNNING={}, SUSPENDED={}, COMPLETED={}, FAILED={}",
                jobStore.countByStatus(Job.Status.PENDING),
                jobStore.countByStatus(Job.Status.RUNNING),
                stateStore.countByStatus(ProcessControlBlock.Status.SUSPENDED),
                jobStore.countByStatus(Job.Status.SUCCESS),
                jobStore.countByStatus(Job.Status.FAILED));
    }
}
