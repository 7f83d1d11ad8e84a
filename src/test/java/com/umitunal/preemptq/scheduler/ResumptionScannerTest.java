package com.umitunal.preemptq.scheduler;

import com.umitunal.preemptq.TestClock;
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

import static org.assertj.core.api.Assertions.*;

class ResumptionScannerTest {
    private static final long START = 1_700_000_000_000L;

    @TempDir
    Path tempDir;

    private RocksDatabase database;
    private RocksJobStore jobStore;
    private RocksExecutionStateStore stateStore;
    private RocksPriorityLanes lanes;
    private TestClock clock;
    private ResumptionScanner scanner;

    @BeforeEach
    void setUp() throws Exception {
        database = new RocksDatabase(StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build());
        jobStore = new RocksJobStore(database);
        stateStore = new RocksExecutionStateStore(database);
        lanes = new RocksPriorityLanes(database);
        clock = new TestClock(START);
        scanner = new ResumptionScanner(stateStore, new LaneFeeder(jobStore, stateStore, lanes), clock, 2000);
    }

    @AfterEach
    void tearDown() {
        scanner.close();
        if (database != null) {
            database.close();
        }
    }

    private JobRecord suspendedJob(int priority) throws Exception {
        JobRecord job = jobStore.create(JobRecord.builder(Job.Type.DELAY)
                .withPriority(priority)
                .withExecutionTimeSecs(5)
                .withCreatedAt(START)
                .build());
        jobStore.update(job.getId(), stored -> {
            stored.markReady();
            stored.markRunning();
            stored.markSuspended();
            return true;
        });
        ProcessControlBlock pcb = ProcessControlBlock.start(job.getId(), 5000, 0, START);
        pcb.advance(ProcessControlBlock.Phase.WORK, 1200);
        pcb.suspend(START + 1200);
        stateStore.create(pcb);
        return job;
    }

    @Test
    @DisplayName("Should re-queue a suspended job at its aged priority")
    void testRequeuesWithAging() throws Exception {
        // Given
        JobRecord job = suspendedJob(2);
        clock.advance(3000);

        // When
        int requeued = scanner.resumeSuspended();

        // Then
        assertThat(requeued).isEqualTo(1);
        JobRecord stored = jobStore.findById(job.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(Job.Status.READY);
        assertThat(stored.getPriority()).isEqualTo(5);
        assertThat(lanes.length(5)).isEqualTo(1);

        ProcessControlBlock pcb = stateStore.findByJobId(job.getId()).orElseThrow();
        assertThat(pcb.getStatus()).isEqualTo(ProcessControlBlock.Status.READY);
        assertThat(pcb.getExecutionTimeDoneMs()).isEqualTo(1200);
    }

    @Test
    @DisplayName("Should not re-queue the same job twice")
    void testIdempotent() throws Exception {
        // Given
        JobRecord job = suspendedJob(6);
        scanner.resumeSuspended();

        // When
        int second = scanner.resumeSuspended();

        // Then
        assertThat(second).isZero();
        assertThat(lanes.length(6)).isEqualTo(1);
        assertThat(lanes.contains(job.getId())).isTrue();
    }

    @Test
    @DisplayName("Should finish a re-queue whose job was already marked READY")
    void testHalfDoneRequeue() throws Exception {
        // Given - job marked READY, crash before the PCB was updated and the push
        JobRecord job = suspendedJob(4);
        jobStore.update(job.getId(), stored -> {
            stored.markReady();
            return true;
        });

        // When
        int requeued = scanner.resumeSuspended();

        // Then
        assertThat(requeued).isEqualTo(1);
        assertThat(lanes.contains(job.getId())).isTrue();
        assertThat(stateStore.findByJobId(job.getId()).orElseThrow().getStatus())
                .isEqualTo(ProcessControlBlock.Status.READY);
    }

    @Test
    @DisplayName("Should skip a suspended PCB without a job")
    void testOrphanPcb() throws Exception {
        // Given
        ProcessControlBlock pcb = ProcessControlBlock.start("gone", 5000, 0, START);
        pcb.suspend(START);
        stateStore.create(pcb);

        // When
        int requeued = scanner.resumeSuspended();

        // Then
        assertThat(requeued).isZero();
        assertThat(lanes.highestWaitingPriority()).isZero();
    }
}
