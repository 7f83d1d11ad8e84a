package com.umitunal.preemptq.scheduler;

import com.umitunal.preemptq.core.ExecutionStateStore;
import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.core.JobStore;
import com.umitunal.preemptq.core.PriorityLanes;
import com.umitunal.preemptq.model.JobRecord;
import com.umitunal.preemptq.model.ProcessControlBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Repairs the stores after a crash. Runs once at startup, before any dispatch loop.
 *
 * <ol>
 *   <li>Due PENDING jobs are promoted; jobs still inside their delay stay PENDING.</li>
 *   <li>RUNNING jobs have no live owner: reset to PENDING and re-queued.</li>
 *   <li>SUSPENDED PCBs are set READY and their job re-queued at its stored priority.</li>
 *   <li>READY jobs found in no lane are re-queued.</li>
 * </ol>
 *
 * Every push skips jobs already queued, so a second run re-queues nothing. A failing record
 * is logged and the scan moves on.
 */
public class RecoveryCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    private final JobStore jobStore;
    private final ExecutionStateStore stateStore;
    private final PriorityLanes lanes;
    private final LaneFeeder feeder;
    private final JobInspector inspector;
    private final Clock clock;

    RecoveryCoordinator(JobStore jobStore, ExecutionStateStore stateStore, PriorityLanes lanes,
                        LaneFeeder feeder, JobInspector inspector, Clock clock) {
        this.jobStore = jobStore;
        this.stateStore = stateStore;
        this.lanes = lanes;
        this.feeder = feeder;
        this.inspector = inspector;
        this.clock = clock;
    }

    public RecoveryReport recover() throws Exception {
        log.info("[Recovery] Starting job recovery...");
        RecoveryReport report = new RecoveryReport();

        List<JobRecord> pending = jobStore.findByStatus(Job.Status.PENDING);
        log.info("[Recovery] Found {} PENDING jobs", pending.size());
        for (JobRecord job : pending) {
            try {
                if (feeder.promote(job.getId(), clock.millis())) {
                    report.promotedPending(job.getId());
                } else if (!job.isDue(clock.millis())) {
                    log.debug("[Recovery] PENDING job {} still due in {}ms", job.getId(),
                            job.millisUntilDue(clock.millis()));
                }
            } catch (Exception e) {
                report.error();
                log.error("[Recovery] Failed to recover PENDING job {}", job.getId(), e);
            }
        }

        List<JobRecord> running = jobStore.findByStatus(Job.Status.RUNNING);
        log.info("[Recovery] Found {} RUNNING jobs (interrupted)", running.size());
        for (JobRecord job : running) {
            try {
                if (feeder.resetOrphan(job.getId())) {
                    report.resetRunning(job.getId());
                    log.info("[Recovery] Reset and re-queued RUNNING job {} (priority {})",
                            job.getId(), job.getPriority());
                }
            } catch (Exception e) {
                report.error();
                log.error("[Recovery] Failed to recover RUNNING job {}", job.getId(), e);
            }
        }

        List<ProcessControlBlock> suspended = stateStore.findByStatus(ProcessControlBlock.Status.SUSPENDED);
        log.info("[Recovery] Found {} SUSPENDED jobs", suspended.size());
        for (ProcessControlBlock pcb : suspended) {
            try {
                if (feeder.requeueSuspended(pcb, false, clock.millis())) {
                    report.requeuedSuspended(pcb.getJobId());
                }
            } catch (Exception e) {
                report.error();
                log.error("[Recovery] Failed to recover SUSPENDED job {}", pcb.getJobId(), e);
            }
        }

        List<JobRecord> ready = jobStore.findByStatus(Job.Status.READY);
        for (JobRecord job : ready) {
            try {
                if (!report.getRequeued().contains(job.getId()) && feeder.pushOnce(job.getPriority(), job.getId())) {
                    report.requeuedReady(job.getId());
                    log.info("[Recovery] Re-queued READY job {} missing from its lane", job.getId());
                }
            } catch (Exception e) {
                report.error();
                log.error("[Recovery] Failed to recover READY job {}", job.getId(), e);
            }
        }

        log.info("[Recovery] Recovery complete! Re-queued {} jobs: {}", report.getRequeued().size(), report);
        inspector.logRecoveryStats();
        return report;
    }
}
