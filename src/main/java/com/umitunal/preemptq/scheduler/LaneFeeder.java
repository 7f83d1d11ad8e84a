package com.umitunal.preemptq.scheduler;

import com.umitunal.preemptq.core.ExecutionStateStore;
import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.core.JobStore;
import com.umitunal.preemptq.core.PriorityAging;
import com.umitunal.preemptq.core.PriorityLanes;
import com.umitunal.preemptq.model.JobRecord;
import com.umitunal.preemptq.model.ProcessControlBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Puts jobs back onto the lanes for the background loops and recovery.
 *
 * The status write always lands before the push, so a crash in between leaves a job that
 * recovery can find rather than a lane entry pointing at a stale status. Pushes skip jobs
 * already in a lane; that check is best effort and the dispatch loop drops any duplicate.
 */
final class LaneFeeder {
    private static final Logger log = LoggerFactory.getLogger(LaneFeeder.class);

    private final JobStore jobStore;
    private final ExecutionStateStore stateStore;
    private final PriorityLanes lanes;

    LaneFeeder(JobStore jobStore, ExecutionStateStore stateStore, PriorityLanes lanes) {
        this.jobStore = jobStore;
        this.stateStore = stateStore;
        this.lanes = lanes;
    }

    /**
     * PENDING job whose delay and retry backoff have passed: mark READY and push.
     *
     * @return true if the job was promoted and pushed; a job already sitting in a lane is
     *         marked READY but not reported
     */
    boolean promote(String jobId, long now) throws Exception {
        Optional<JobRecord> promoted = jobStore.update(jobId, job -> {
            if (job.getStatus() != Job.Status.PENDING || !job.isDue(now)) {
                return false;
            }
            job.markReady();
            return true;
        });

        if (promoted.isEmpty()) {
            return false;
        }
        JobRecord job = promoted.get();
        if (!pushOnce(job.getPriority(), jobId)) {
            return false;
        }
        log.info("Promoted job {} to READY (priority {})", jobId, job.getPriority());
        return true;
    }

    /**
     * Orphaned RUNNING job: reset to PENDING and push.
     */
    boolean resetOrphan(String jobId) throws Exception {
        Optional<JobRecord> reset = jobStore.update(jobId, job -> {
            if (job.getStatus() != Job.Status.RUNNING) {
                return false;
            }
            job.resetToPending();
            return true;
        });

        if (reset.isEmpty()) {
            return false;
        }
        return pushOnce(reset.get().getPriority(), jobId);
    }

    /**
     * Suspended job: mark the job and its PCB READY and push it, optionally applying the aging
     * boost first.
     *
     * @return true if the job was re-queued
     */
    boolean requeueSuspended(ProcessControlBlock pcb, boolean applyAging, long now) throws Exception {
        String jobId = pcb.getJobId();
        Optional<JobRecord> current = jobStore.findById(jobId);
        if (current.isEmpty()) {
            log.warn("Suspended PCB {} has no job, skipping", jobId);
            return false;
        }

        int[] before = {current.get().getPriority()};
        if (current.get().getStatus() == Job.Status.SUSPENDED) {
            current = jobStore.update(jobId, job -> {
                if (job.getStatus() != Job.Status.SUSPENDED) {
                    return false;
                }
                before[0] = job.getPriority();
                if (applyAging) {
                    job.boostPriority(PriorityAging.effectivePriority(job, now));
                }
                job.markReady();
                return true;
            });
            if (current.isEmpty()) {
                return false;
            }
        } else if (!current.get().getStatus().isDispatchable()) {
            log.debug("Job {} is {}, leaving its suspended PCB alone", jobId, current.get().getStatus());
            return false;
        }

        JobRecord job = current.get();
        if (job.getPriority() > before[0]) {
            log.info("[PCB] Suspended job {} priority boosted during suspension: {} -> {}",
                    jobId, before[0], job.getPriority());
        }

        stateStore.update(jobId, state -> {
            if (state.getStatus() != ProcessControlBlock.Status.SUSPENDED) {
                return false;
            }
            state.markReady();
            return true;
        });

        if (!pushOnce(job.getPriority(), jobId)) {
            return false;
        }
        log.info("[PCB] Re-queued suspended job {} for resumption (priority {}, resume attempt {})",
                jobId, job.getPriority(), pcb.getResumeCount() + 1);
        return true;
    }

    /**
     * Push unless the job already sits in some lane.
     *
     * @return true if pushed
     */
    boolean pushOnce(int priority, String jobId) throws Exception {
        if (lanes.contains(jobId)) {
            log.debug("Job {} already queued, not pushing again", jobId);
            return false;
        }
        lanes.push(priority, jobId);
        return true;
    }
}
