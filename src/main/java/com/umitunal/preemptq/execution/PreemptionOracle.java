package com.umitunal.preemptq.execution;

import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.core.PriorityAging;
import com.umitunal.preemptq.core.PriorityLanes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Decides whether a running job should yield to a waiting one.
 *
 * Advisory only: the waiting job may be taken by another worker before this one yields.
 */
public class PreemptionOracle {
    private static final Logger log = LoggerFactory.getLogger(PreemptionOracle.class);

    private final PriorityLanes lanes;
    private final Clock clock;

    public PreemptionOracle(PriorityLanes lanes, Clock clock) {
        this.lanes = lanes;
        this.clock = clock;
    }

    /**
     * True iff some lane holding a waiting job is strictly above the job's effective priority.
     */
    public boolean shouldPreempt(Job current) throws Exception {
        int waiting = lanes.highestWaitingPriority();
        if (waiting == 0) {
            return false;
        }

        int effective = PriorityAging.effectivePriority(current, clock.millis());
        if (waiting > effective) {
            log.info("Job {} (effective priority {}) yields to waiting priority {}",
                    current.getId(), effective, waiting);
            return true;
        }
        return false;
    }
}
