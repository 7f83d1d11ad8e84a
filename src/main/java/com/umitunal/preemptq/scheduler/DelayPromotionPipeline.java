package com.umitunal.preemptq.scheduler;

import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.core.JobStore;
import com.umitunal.preemptq.core.PriorityLanes;
import com.umitunal.preemptq.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Moves PENDING jobs onto the lanes once they are due.
 *
 * Each tick first drains due retries from the delayed set, then scans PENDING jobs whose
 * activation delay has elapsed. Re-running a tick is harmless: promotion re-checks the status
 * and skips jobs already queued.
 */
public class DelayPromotionPipeline extends PollingLoop {
    private static final Logger log = LoggerFactory.getLogger(DelayPromotionPipeline.class);

    private final JobStore jobStore;
    private final PriorityLanes lanes;
    private final LaneFeeder feeder;
    private final Clock clock;

    DelayPromotionPipeline(JobStore jobStore, PriorityLanes lanes, LaneFeeder feeder, Clock clock, long interval) {
        super("DelayPromotionPipeline", interval);
        this.jobStore = jobStore;
        this.lanes = lanes;
        this.feeder = feeder;
        this.clock = clock;
    }

    @Override
    protected boolean runOnce() throws Exception {
        moveDueRetries();
        promoteReadyJobs();
        return false;
    }

    /**
     * Pop every retry whose backoff has expired and promote it.
     *
     * @return number of jobs promoted
     */
    public int moveDueRetries() throws Exception {
        long now = clock.millis();
        List<String> due = lanes.delayedPopReady(now);
        int moved = 0;

        for (String jobId : due) {
            try {
                if (feeder.promote(jobId, now)) {
                    moved++;
                    log.info("Moved job {} from delayed set to its lane", jobId);
                } else {
                    log.debug("Delayed entry {} no longer promotable, dropped", jobId);
                }
            } catch (Exception e) {
                log.error("Failed to move delayed job {}", jobId, e);
            }
        }
        return moved;
    }

    /**
     * Promote PENDING jobs whose activation delay has elapsed.
     *
     * @return number of jobs promoted
     */
    public int promoteReadyJobs() throws Exception {
        long now = clock.millis();
        int promoted = 0;

        for (JobRecord job : jobStore.findByStatus(Job.Status.PENDING)) {
            if (!job.isDue(now)) {
                continue;
            }
            try {
                if (feeder.promote(job.getId(), now)) {
                    promoted++;
                }
            } catch (Exception e) {
                log.error("Failed to promote job {}", job.getId(), e);
            }
        }
        return promoted;
    }

    /**
     * Promote a freshly submitted job straight away if it has no delay to wait out.
     */
    public boolean promoteIfDue(JobRecord job) throws Exception {
        return job.isDue(clock.millis()) && feeder.promote(job.getId(), clock.millis());
    }
}
