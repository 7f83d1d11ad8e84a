package com.umitunal.preemptq.execution;

import com.umitunal.preemptq.config.SchedulerConfig;
import com.umitunal.preemptq.config.StorageConfig;
import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.model.JobRecord;
import com.umitunal.preemptq.model.ProcessControlBlock;
import com.umitunal.preemptq.storage.RocksDatabase;
import com.umitunal.preemptq.storage.RocksExecutionStateStore;
import com.umitunal.preemptq.storage.RocksJobStore;
import com.umitunal.preemptq.storage.RocksPriorityLanes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class ExecutionControllerTest {

    @TempDir
    Path tempDir;

    private RocksDatabase database;
    private RocksJobStore jobStore;
    private RocksExecutionStateStore stateStore;
    private RocksPriorityLanes lanes;
    private JobHandlerRegistry handlers;
    private final List<ExecutionController> controllers = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        database = new RocksDatabase(StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build());
        jobStore = new RocksJobStore(database);
        stateStore = new RocksExecutionStateStore(database);
        lanes = new RocksPriorityLanes(database);
        handlers = JobHandlerRegistry.defaults();
    }

    @AfterEach
    void tearDown() {
        controllers.forEach(ExecutionController::close);
        if (database != null) {
            database.close();
        }
    }

    private ExecutionController controller(long executionTimeoutMs) {
        SchedulerConfig config = SchedulerConfig.newBuilder()
                .withSlice(50)
                .withCheckpointInterval(100)
                .withExecutionTimeout(executionTimeoutMs)
                .build();
        Clock clock = Clock.systemUTC();
        ExecutionController controller = new ExecutionController(stateStore, jobStore,
                new PreemptionOracle(lanes, clock), handlers, config, clock);
        controllers.add(controller);
        return controller;
    }

    private JobRecord running(JobRecord job) throws Exception {
        jobStore.create(job);
        return jobStore.update(job.getId(), stored -> {
            stored.markRunning();
            return true;
        }).orElseThrow();
    }

    @Test
    @DisplayName("Should run all required work and complete the PCB")
    void testCompletes() throws Exception {
        // Given
        JobRecord job = running(JobRecord.builder(Job.Type.DELAY).withExecutionTimeSecs(1).build());

        // When
        ExecutionOutcome outcome = controller(60_000).execute(job);

        // Then
        assertThat(outcome.isCompleted()).isTrue();
        ProcessControlBlock pcb = stateStore.findByJobId(job.getId()).orElseThrow();
        assertThat(pcb.getStatus()).isEqualTo(ProcessControlBlock.Status.COMPLETED);
        assertThat(pcb.getExecutionTimeDoneMs()).isEqualTo(pcb.getExecutionTimeMs()).isEqualTo(1000);
        assertThat(pcb.getResumeCount()).isZero();
    }

    @Test
    @DisplayName("Should run a DELAY job's delay phase before its work")
    void testDelayPhase() throws Exception {
        // Given
        JobRecord job = running(JobRecord.builder(Job.Type.DELAY)
                .withPayloadField("delayMs", 300)
                .withExecutionTimeSecs(0)
                .build());

        // When
        long started = System.nanoTime();
        ExecutionOutcome outcome = controller(60_000).execute(job);
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        // Then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(tookMs).isGreaterThanOrEqualTo(300);
        ProcessControlBlock pcb = stateStore.findByJobId(job.getId()).orElseThrow();
        assertThat(pcb.getDelayProgress().getTotalDelayMs()).isEqualTo(300);
        assertThat(pcb.getDelayProgress().getDelayedSoFarMs()).isEqualTo(300);
        assertThat(pcb.getExpectedDurationMs()).isEqualTo(300);
    }

    @Test
    @DisplayName("Should yield to a higher-priority waiting job and keep its checkpoint")
    void testPreemption() throws Exception {
        // Given
        JobRecord job = running(JobRecord.builder(Job.Type.DELAY)
                .withPriority(3)
                .withExecutionTimeSecs(5)
                .build());
        lanes.push(9, "urgent-job");

        // When
        ExecutionOutcome outcome = controller(60_000).execute(job);

        // Then
        assertThat(outcome.isPreempted()).isTrue();
        assertThat(jobStore.findById(job.getId()).orElseThrow().getStatus()).isEqualTo(Job.Status.SUSPENDED);
        ProcessControlBlock pcb = stateStore.findByJobId(job.getId()).orElseThrow();
        assertThat(pcb.getStatus()).isEqualTo(ProcessControlBlock.Status.SUSPENDED);
        assertThat(pcb.getSuspendedAt()).isPositive();
        assertThat(pcb.getExecutionTimeDoneMs()).isBetween(1L, 4999L);
    }

    @Test
    @DisplayName("Should resume from the checkpoint and count the resume once")
    void testResume() throws Exception {
        // Given - preempted after its first slice
        JobRecord job = running(JobRecord.builder(Job.Type.DELAY)
                .withPriority(3)
                .withExecutionTimeSecs(1)
                .build());
        lanes.push(9, "urgent-job");
        ExecutionController controller = controller(60_000);
        assertThat(controller.execute(job).isPreempted()).isTrue();
        long checkpoint = stateStore.findByJobId(job.getId()).orElseThrow().getExecutionTimeDoneMs();

        // Given - the urgent job was taken and the suspended one re-queued
        lanes.popHighest();
        stateStore.update(job.getId(), pcb -> {
            pcb.markReady();
            return true;
        });
        JobRecord resumed = jobStore.update(job.getId(), stored -> {
            stored.markReady();
            stored.markRunning();
            return true;
        }).orElseThrow();

        // When
        long started = System.nanoTime();
        ExecutionOutcome outcome = controller.execute(resumed);
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        // Then
        assertThat(outcome.isCompleted()).isTrue();
        ProcessControlBlock pcb = stateStore.findByJobId(job.getId()).orElseThrow();
        assertThat(pcb.getResumeCount()).isEqualTo(1);
        assertThat(pcb.getExecutionTimeDoneMs()).isEqualTo(1000);
        assertThat(tookMs).isLessThan(1000 - checkpoint + 500);
    }

    @Test
    @DisplayName("Should report a handler error as a failure, not an exception")
    void testHandlerFailure() throws Exception {
        // Given
        JobRecord job = running(JobRecord.builder(Job.Type.EMAIL).withExecutionTimeSecs(0).build());

        // When
        ExecutionOutcome outcome = controller(60_000).execute(job);

        // Then
        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.getReason()).isEqualTo("Missing email recipient");
        assertThat(outcome.getCause()).isInstanceOf(JobHandlerException.class);
        assertThat(stateStore.findByJobId(job.getId()).orElseThrow().getStatus())
                .isEqualTo(ProcessControlBlock.Status.COMPLETED);
    }

    @Test
    @DisplayName("Should fail with a timeout when the work phase exceeds the ceiling")
    void testTimeout() throws Exception {
        // Given
        JobRecord job = running(JobRecord.builder(Job.Type.DELAY).withExecutionTimeSecs(5).build());

        // When
        ExecutionOutcome outcome = controller(300).execute(job);

        // Then
        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.getCause()).isInstanceOf(ExecutionTimeoutException.class);
        ProcessControlBlock pcb = stateStore.findByJobId(job.getId()).orElseThrow();
        assertThat(pcb.getStatus()).isEqualTo(ProcessControlBlock.Status.RUNNING);
        assertThat(pcb.getExecutionTimeDoneMs()).isBetween(250L, 1000L);
    }

    @Test
    @DisplayName("Should fail when no handler is registered for the type")
    void testUnknownType() throws Exception {
        // Given
        handlers = new JobHandlerRegistry();
        JobRecord job = running(JobRecord.builder(Job.Type.WEBHOOK).withExecutionTimeSecs(0).build());

        // When
        ExecutionOutcome outcome = controller(60_000).execute(job);

        // Then
        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.getReason()).contains("No handler registered");
    }

    @Test
    @DisplayName("Should complete a job whose work ends at the ceiling and run its handler once")
    void testWorkEndingAtCeiling() throws Exception {
        // Given
        AtomicInteger sent = new AtomicInteger();
        handlers = JobHandlerRegistry.defaults().register(Job.Type.EMAIL, job -> sent.incrementAndGet());
        JobRecord job = running(JobRecord.builder(Job.Type.EMAIL)
                .withPayloadField("to", "ops@example.com")
                .withExecutionTimeSecs(1)
                .build());

        // When
        ExecutionOutcome outcome = controller(1000).execute(job);

        // Then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(sent.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should cancel a handler that runs past the ceiling")
    void testHandlerOverrun() throws Exception {
        // Given
        AtomicBoolean interrupted = new AtomicBoolean(false);
        handlers = JobHandlerRegistry.defaults().register(Job.Type.WEBHOOK, job -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                interrupted.set(true);
                Thread.currentThread().interrupt();
            }
        });
        JobRecord job = running(JobRecord.builder(Job.Type.WEBHOOK)
                .withPayloadField("url", "https://hooks.example.com/jobs")
                .withExecutionTimeSecs(0)
                .build());

        // When
        long started = System.nanoTime();
        ExecutionOutcome outcome = controller(500).execute(job);
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        // Then
        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.getCause()).isInstanceOf(ExecutionTimeoutException.class);
        assertThat(tookMs).isBetween(500L, 1500L);
        await().atMost(1, TimeUnit.SECONDS).untilTrue(interrupted);
        assertThat(stateStore.findByJobId(job.getId()).orElseThrow().getStatus())
                .isEqualTo(ProcessControlBlock.Status.COMPLETED);
    }

    @Test
    @DisplayName("Should give the handler its own window after long work")
    void testHandlerWindowAfterWork() throws Exception {
        // Given - work takes most of the ceiling, the handler needs a bit more
        AtomicInteger calls = new AtomicInteger();
        handlers = JobHandlerRegistry.defaults().register(Job.Type.DELAY, job -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new JobHandlerException("Interrupted", e);
            }
            calls.incrementAndGet();
        });
        JobRecord job = running(JobRecord.builder(Job.Type.DELAY).withExecutionTimeSecs(1).build());

        // When
        ExecutionOutcome outcome = controller(1200).execute(job);

        // Then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should propagate an unexpected handler error to the caller")
    void testHandlerRuntimeError() throws Exception {
        // Given
        handlers = JobHandlerRegistry.defaults().register(Job.Type.DELAY, job -> {
            throw new IllegalStateException("handler bug");
        });
        JobRecord job = running(JobRecord.builder(Job.Type.DELAY).withExecutionTimeSecs(0).build());

        // Then
        assertThatThrownBy(() -> controller(60_000).execute(job))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("handler bug");
    }

    @Test
    @DisplayName("Should save the checkpoint and propagate an interrupt")
    void testInterrupt() throws Exception {
        // Given
        JobRecord job = running(JobRecord.builder(Job.Type.DELAY).withExecutionTimeSecs(5).build());
        ExecutionController controller = controller(60_000);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        // When
        Future<ExecutionOutcome> run = executor.submit(() -> controller.execute(job));
        await().atMost(2, TimeUnit.SECONDS)
               .until(() -> stateStore.findByJobId(job.getId())
                       .map(ProcessControlBlock::getExecutionTimeDoneMs).orElse(0L) > 0);
        executor.shutdownNow();

        // Then
        assertThat(executor.awaitTermination(2, TimeUnit.SECONDS)).isTrue();
        assertThatThrownBy(run::get).hasCauseInstanceOf(InterruptedException.class);
        ProcessControlBlock pcb = stateStore.findByJobId(job.getId()).orElseThrow();
        assertThat(pcb.getStatus()).isEqualTo(ProcessControlBlock.Status.RUNNING);
        assertThat(pcb.getExecutionTimeDoneMs()).isPositive();
    }
}
