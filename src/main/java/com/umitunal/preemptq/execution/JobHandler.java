package com.umitunal.preemptq.execution;

import com.umitunal.preemptq.core.Job;

/**
 * Performs the type-specific side effect of a job once its required work is done.
 * Runs as a single unit and is not preemptible.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * @throws JobHandlerException if the payload is invalid or the side effect failed
     */
    void handle(Job job) throws JobHandlerException;
}
