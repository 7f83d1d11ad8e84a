package com.umitunal.preemptq.execution;

/**
 * A run failed in a way that counts against the job's retries.
 */
public class JobExecutionException extends Exception {

    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
