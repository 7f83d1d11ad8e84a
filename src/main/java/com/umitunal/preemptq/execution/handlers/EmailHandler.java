package com.umitunal.preemptq.execution.handlers;

import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.execution.JobHandler;
import com.umitunal.preemptq.execution.JobHandlerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends an email to the payload's {@code to} address. Delivery itself is simulated.
 */
public class EmailHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(EmailHandler.class);

    @Override
    public void handle(Job job) throws JobHandlerException {
        Object to = job.getPayload().get("to");
        if (to == null || to.toString().isBlank()) {
            throw new JobHandlerException("Missing email recipient");
        }
        log.info("Sending email to {} for job {}", to, job.getId());
    }
}
