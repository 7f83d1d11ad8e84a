package com.umitunal.preemptq.execution.handlers;

import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.execution.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DELAY jobs have no side effect, their wait is the delay phase itself.
 */
public class DelayHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(DelayHandler.class);

    @Override
    public void handle(Job job) {
        log.info("Delay job {} finished", job.getId());
    }
}
