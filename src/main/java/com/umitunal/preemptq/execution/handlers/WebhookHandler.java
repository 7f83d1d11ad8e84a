package com.umitunal.preemptq.execution.handlers;

import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.execution.JobHandler;
import com.umitunal.preemptq.execution.JobHandlerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * Calls the payload's {@code url}. The HTTP call itself is simulated.
 */
public class WebhookHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(WebhookHandler.class);

    @Override
    public void handle(Job job) throws JobHandlerException {
        Object url = job.getPayload().get("url");
        if (url == null || url.toString().isBlank()) {
            throw new JobHandlerException("Missing webhook URL");
        }

        URI target;
        try {
            target = URI.create(url.toString());
        } catch (IllegalArgumentException e) {
            throw new JobHandlerException("Invalid webhook URL: " + url, e);
        }
        log.info("Calling webhook {} for job {}", target, job.getId());
    }
}
