package com.umitunal.preemptq.execution;

import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.execution.handlers.DelayHandler;
import com.umitunal.preemptq.execution.handlers.EmailHandler;
import com.umitunal.preemptq.execution.handlers.WebhookHandler;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps each job type to its handler.
 */
public class JobHandlerRegistry {
    private final Map<Job.Type, JobHandler> handlers = new EnumMap<>(Job.Type.class);

    /**
     * Registry with the built-in handlers for every job type.
     */
    public static JobHandlerRegistry defaults() {
        return new JobHandlerRegistry()
                .register(Job.Type.DELAY, new DelayHandler())
                .register(Job.Type.EMAIL, new EmailHandler())
                .register(Job.Type.WEBHOOK, new WebhookHandler());
    }

    /**
     * Register (or replace) the handler for a type.
     */
    public JobHandlerRegistry register(Job.Type type, JobHandler handler) {
        if (type == null || handler == null) {
            throw new IllegalArgumentException("Type and handler are required");
        }
        handlers.put(type, handler);
        return this;
    }

    public JobHandler handlerFor(Job.Type type) throws JobHandlerException {
        JobHandler handler = handlers.get(type);
        if (handler == null) {
            throw new JobHandlerException("No handler registered for job type " + type);
        }
        return handler;
    }
}
