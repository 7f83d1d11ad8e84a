package com.umitunal.preemptq.scheduler;

import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.core.JobStore;
import com.umitunal.preemptq.core.PriorityAging;
import com.umitunal.preemptq.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Raises the stored priority of jobs waiting in READY or SUSPENDED so they cannot starve.
 *
 * PENDING jobs are waiting out a delay, not competing, and RUNNING jobs already own a worker;
 * neither is aged. A boost is permanent.
 */
public class AgingEngine extends PollingLoop {
    private static final Logger log = LoggerFactory.getLogger(AgingEngine.class);

    private final JobStore jobStore;
    private final Clock clock;

    public AgingEngine(JobStore jobStore, Clock clock, long interval) {
        super("AgingEngine", interval);
        this.jobStore = jobStore;
        this.clock = clock;
    }

    @Override
    protected boolean runOnce() throws Exception {
        ageJobs();
        return false;
    }

    /**
     * One aging pass.
     *
     * @return number of jobs whose priority was raised
     */
    public int ageJobs() throws Exception {
        int boosted = 0;
        for (Job.Status status : new Job.Status[]{Job.Status.READY, Job.Status.SUSPENDED}) {
            for (JobRecord candidate : jobStore.findByStatus(status)) {
                try {
                    if (age(candidate.getId())) {
                        boosted++;
                    }
                } catch (Exception e) {
                    log.error("Failed to age job {}", candidate.getId(), e);
                }
            }
        }
        return boosted;
    }

    private boolean age(String jobId) throws Exception {
        long now = clock.millis();
        int[] before = new int[1];
        Optional<JobRecord> updated = jobStore.update(jobId, job -> {
            if (!job.getStatus().isWaiting()) {
                return false;
            }
            before[0] = job.getPriority();
            return job.boostPriority(PriorityAging.effectivePriority(job, now));
        });

        updated.ifPresent(job -> log.info("[Aging] Job {} priority boosted {} -> {} (waited {}s)",
                job.getId(), before[0], job.getPriority(), PriorityAging.ageSeconds(job, now)));
        return updated.isPresent();
    }
}
