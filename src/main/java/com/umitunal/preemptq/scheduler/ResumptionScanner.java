package com.umitunal.preemptq.scheduler;

import com.umitunal.preemptq.core.ExecutionStateStore;
import com.umitunal.preemptq.model.ProcessControlBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Hands preempted jobs back to the lanes at their aged priority, with their PCB set to READY
 * so the next pickup resumes from the checkpoint.
 */
public class ResumptionScanner extends PollingLoop {
    private static final Logger log = LoggerFactory.getLogger(ResumptionScanner.class);

    private final ExecutionStateStore stateStore;
    private final LaneFeeder feeder;
    private final Clock clock;

    ResumptionScanner(ExecutionStateStore stateStore, LaneFeeder feeder, Clock clock, long interval) {
        super("ResumptionScanner", interval);
        this.stateStore = stateStore;
        this.feeder = feeder;
        this.clock = clock;
    }

    @Override
    protected boolean runOnce() throws Exception {
        resumeSuspended();
        return false;
    }

    /**
     * @return number of jobs re-queued
     */
    public int resumeSuspended() throws Exception {
        int requeued = 0;
        for (ProcessControlBlock pcb : stateStore.findByStatus(ProcessControlBlock.Status.SUSPENDED)) {
            try {
                if (feeder.requeueSuspended(pcb, true, clock.millis())) {
                    requeued++;
                }
            } catch (Exception e) {
                log.error("Failed to re-queue suspended job {}", pcb.getJobId(), e);
            }
        }
        return requeued;
    }
}
