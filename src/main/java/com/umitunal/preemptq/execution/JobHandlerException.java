package com.umitunal.preemptq.execution;

/**
 * Raised by a payload handler: invalid payload, failed side effect, or no handler for the type.
 */
public class JobHandlerException extends JobExecutionException {

    public JobHandlerException(String message) {
        super(message);
    }

    public JobHandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
