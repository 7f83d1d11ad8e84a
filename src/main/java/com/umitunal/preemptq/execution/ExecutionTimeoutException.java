package com.umitunal.preemptq.execution;

public class ExecutionTimeoutException extends JobExecutionException {

    public ExecutionTimeoutException(String jobId, long timeoutMs) {
        super("Job " + jobId + " exceeded execution timeout of " + timeoutMs + "ms");
    }
}
