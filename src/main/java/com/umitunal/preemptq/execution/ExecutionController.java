package com.umitunal.preemptq.execution;

import com.umitunal.preemptq.config.SchedulerConfig;
import com.umitunal.preemptq.core.ExecutionStateStore;
import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.core.JobStore;
import com.umitunal.preemptq.model.JobRecord;
import com.umitunal.preemptq.model.ProcessControlBlock;
import com.umitunal.preemptq.model.ProcessControlBlock.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one job through its delay and work phases in fixed time slices, checkpointing progress
 * into the job's PCB and yielding whenever the preemption oracle says so.
 *
 * <p>Exactly one controller touches a given PCB at a time; the atomic lane pop guarantees it.
 *
 * <p>The execution timeout bounds the work phase and, separately, the payload handler. The handler
 * runs on a pool owned by the controller and is cancelled once it overruns; a handler that
 * returned normally always counts as completed.
 *
 * <p>An interrupt persists the checkpoint and propagates, leaving the PCB RUNNING so the next
 * pickup continues where this one stopped.
 */
public class ExecutionController implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);

    /** Payload field holding a DELAY job's pre-execution wait. */
    public static final String DELAY_PAYLOAD_FIELD = "delayMs";

    private final ExecutionStateStore stateStore;
    private final JobStore jobStore;
    private final PreemptionOracle oracle;
    private final JobHandlerRegistry handlers;
    private final long sliceMs;
    private final long checkpointIntervalMs;
    private final long executionTimeoutMs;
    private final Clock clock;
    private final ExecutorService handlerPool;

    public ExecutionController(ExecutionStateStore stateStore, JobStore jobStore, PreemptionOracle oracle,
                               JobHandlerRegistry handlers, SchedulerConfig config, Clock clock) {
        this.stateStore = stateStore;
        this.jobStore = jobStore;
        this.oracle = oracle;
        this.handlers = handlers;
        this.sliceMs = config.getSliceMs();
        this.checkpointIntervalMs = config.getCheckpointIntervalMs();
        this.executionTimeoutMs = config.getExecutionTimeoutMs();
        this.clock = clock;
        this.handlerPool = Executors.newCachedThreadPool(new HandlerThreadFactory());
    }

    /**
     * Run a job the caller has already marked RUNNING.
     *
     * @return COMPLETED when the work and the handler both finished, PREEMPTED when the job
     *         yielded (it is then SUSPENDED in both stores), FAILED for a handler error or timeout
     * @throws InterruptedException if the worker is shutting down; the checkpoint is saved first
     * @throws Exception on storage errors
     */
    public ExecutionOutcome execute(JobRecord job) throws Exception {
        try {
            ProcessControlBlock pcb = loadOrCreate(job);

            if (pcb.getStatus() != ProcessControlBlock.Status.COMPLETED) {
                // The delay phase is an expected wait and has no deadline
                if (!runPhase(job, pcb, Phase.DELAY, 0)) {
                    return ExecutionOutcome.preempted();
                }

                if (!runPhase(job, pcb, Phase.WORK, deadlineFromNow())) {
                    return ExecutionOutcome.preempted();
                }

                pcb.complete();
                stateStore.save(pcb);
                log.debug("Job {} finished its required work: {}", job.getId(), pcb);
            }

            runHandler(job);
            return ExecutionOutcome.completed();
        } catch (JobExecutionException e) {
            return ExecutionOutcome.failed(e.getMessage(), e);
        }
    }

    private long deadlineFromNow() {
        return System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(executionTimeoutMs);
    }

    /**
     * Run the job's payload handler on the handler pool, waiting at most the execution timeout.
     */
    private void runHandler(JobRecord job) throws JobExecutionException, InterruptedException {
        JobHandler handler = handlers.handlerFor(job.getType());
        Future<?> run = handlerPool.submit(() -> {
            handler.handle(job);
            return null;
        });

        try {
            run.get(executionTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            run.cancel(true);
            log.warn("Handler for job {} overran {}ms, cancelled", job.getId(), executionTimeoutMs);
            throw new ExecutionTimeoutException(job.getId(), executionTimeoutMs);
        } catch (InterruptedException e) {
            run.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof JobExecutionException) {
                throw (JobExecutionException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new JobHandlerException("Handler for job " + job.getId() + " failed: " + cause, cause);
        }
    }

    /**
     * Stop the handler pool, interrupting any handler still running.
     */
    @Override
    public void close() {
        handlerPool.shutdownNow();
    }

    ProcessControlBlock loadOrCreate(JobRecord job) throws Exception {
        long now = clock.millis();
        Optional<ProcessControlBlock> existing = stateStore.findByJobId(job.getId());

        if (existing.isEmpty()) {
            ProcessControlBlock pcb = ProcessControlBlock.start(job.getId(),
                    TimeUnit.SECONDS.toMillis(job.getExecutionTimeSecs()), delayPhaseMs(job), now);
            stateStore.create(pcb);
            log.debug("Created PCB for job {}: {}", job.getId(), pcb);
            return pcb;
        }

        ProcessControlBlock pcb = existing.get();
        switch (pcb.getStatus()) {
            case SUSPENDED, READY -> {
                pcb.resume();
                stateStore.save(pcb);
                log.info("Resuming job {} from {}/{}ms of work (resume #{})", job.getId(),
                        pcb.getExecutionTimeDoneMs(), pcb.getExecutionTimeMs(), pcb.getResumeCount());
            }
            case RUNNING -> log.info("Continuing job {} from checkpoint {}/{}ms", job.getId(),
                    pcb.getExecutionTimeDoneMs(), pcb.getExecutionTimeMs());
            case COMPLETED -> log.debug("Job {} already finished its work, running handler only", job.getId());
        }
        return pcb;
    }

    /**
     * Sleep through a phase slice by slice.
     *
     * @return false if the job was preempted and suspended
     */
    private boolean runPhase(JobRecord job, ProcessControlBlock pcb, Phase phase, long deadlineNanos)
            throws Exception {
        long lastCheckpoint = System.nanoTime();

        while (pcb.remainingMs(phase) > 0) {
            long slice = Math.min(sliceMs, pcb.remainingMs(phase));
            long sliceStart = System.nanoTime();
            try {
                Thread.sleep(slice);
            } catch (InterruptedException e) {
                pcb.advance(phase, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - sliceStart));
                stateStore.save(pcb);
                log.info("Job {} interrupted, checkpoint saved: {}", job.getId(), pcb);
                throw e;
            }
            pcb.advance(phase, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - sliceStart));

            long now = System.nanoTime();
            if (now - lastCheckpoint >= TimeUnit.MILLISECONDS.toNanos(checkpointIntervalMs)) {
                stateStore.save(pcb);
                lastCheckpoint = now;
            }

            if (phase == Phase.WORK && now - deadlineNanos > 0 && pcb.remainingMs(phase) > 0) {
                stateStore.save(pcb);
                throw new ExecutionTimeoutException(job.getId(), executionTimeoutMs);
            }

            if (pcb.remainingMs(phase) > 0 && oracle.shouldPreempt(job)) {
                suspend(job, pcb);
                return false;
            }
        }
        return true;
    }

    private void suspend(JobRecord job, ProcessControlBlock pcb) throws Exception {
        pcb.suspend(clock.millis());
        stateStore.save(pcb);

        jobStore.update(job.getId(), stored -> {
            if (stored.getStatus() != Job.Status.RUNNING) {
                return false;
            }
            stored.markSuspended();
            return true;
        });
        job.markSuspended();

        log.info("Job {} preempted at {}/{}ms of work", job.getId(),
                pcb.getExecutionTimeDoneMs(), pcb.getExecutionTimeMs());
    }

    static long delayPhaseMs(Job job) throws JobHandlerException {
        if (job.getType() != Job.Type.DELAY) {
            return 0;
        }
        Object value = job.getPayload().get(DELAY_PAYLOAD_FIELD);
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return Math.max(0, ((Number) value).longValue());
        }
        try {
            return Math.max(0, Long.parseLong(value.toString().trim()));
        } catch (NumberFormatException e) {
            throw new JobHandlerException("Invalid " + DELAY_PAYLOAD_FIELD + " in payload: " + value, e);
        }
    }

    private static final class HandlerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "job-handler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
