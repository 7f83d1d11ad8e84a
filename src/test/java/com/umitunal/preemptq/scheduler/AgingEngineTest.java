package com.umitunal.preemptq.scheduler;

import com.umitunal.preemptq.TestClock;
import com.umitunal.preemptq.config.StorageConfig;
import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.model.JobRecord;
import com.umitunal.preemptq.storage.RocksDatabase;
import com.umitunal.preemptq.storage.RocksJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class AgingEngineTest {
    private static final long START = 1_700_000_000_000L;

    @TempDir
    Path tempDir;

    private RocksDatabase database;
    private RocksJobStore jobStore;
    private TestClock clock;
    private AgingEngine agingEngine;

    @BeforeEach
    void setUp() throws Exception {
        database = new RocksDatabase(StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build());
        jobStore = new RocksJobStore(database);
        clock = new TestClock(START);
        agingEngine = new AgingEngine(jobStore, clock, 1000);
    }

    @AfterEach
    void tearDown() {
        agingEngine.close();
        if (database != null) {
            database.close();
        }
    }

    private JobRecord createIn(Job.Status status, int priority) throws Exception {
        JobRecord job = jobStore.create(JobRecord.builder(Job.Type.DELAY)
                .withPriority(priority)
                .withCreatedAt(START)
                .build());
        jobStore.update(job.getId(), stored -> {
            switch (status) {
                case PENDING -> { }
                case READY -> stored.markReady();
                case RUNNING -> {
                    stored.markReady();
                    stored.markRunning();
                }
                case SUSPENDED -> {
                    stored.markReady();
                    stored.markRunning();
                    stored.markSuspended();
                }
                default -> throw new IllegalArgumentException("Unsupported status " + status);
            }
            return true;
        });
        return job;
    }

    private int priorityOf(JobRecord job) throws Exception {
        return jobStore.findById(job.getId()).orElseThrow().getPriority();
    }

    @Test
    @DisplayName("Should not boost anything before a second has passed")
    void testNoBoostYet() throws Exception {
        // Given
        JobRecord job = createIn(Job.Status.READY, 2);
        clock.advance(999);

        // When
        int boosted = agingEngine.ageJobs();

        // Then
        assertThat(boosted).isZero();
        assertThat(priorityOf(job)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should boost READY and SUSPENDED jobs by their wait in seconds")
    void testBoostsWaitingJobs() throws Exception {
        // Given
        JobRecord ready = createIn(Job.Status.READY, 2);
        JobRecord suspended = createIn(Job.Status.SUSPENDED, 4);
        clock.advance(3000);

        // When
        int boosted = agingEngine.ageJobs();

        // Then
        assertThat(boosted).isEqualTo(2);
        assertThat(priorityOf(ready)).isEqualTo(5);
        assertThat(priorityOf(suspended)).isEqualTo(7);
    }

    @Test
    @DisplayName("Should leave PENDING and RUNNING jobs alone")
    void testSkipsOtherStatuses() throws Exception {
        // Given
        JobRecord pending = createIn(Job.Status.PENDING, 2);
        JobRecord running = createIn(Job.Status.RUNNING, 2);
        clock.advance(5000);

        // When
        int boosted = agingEngine.ageJobs();

        // Then
        assertThat(boosted).isZero();
        assertThat(priorityOf(pending)).isEqualTo(2);
        assertThat(priorityOf(running)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should build on the stored priority each pass and stop at 10")
    void testCompoundsUpToCap() throws Exception {
        // Given
        JobRecord job = createIn(Job.Status.READY, 2);
        clock.advance(3000);

        // When / Then
        agingEngine.ageJobs();
        assertThat(priorityOf(job)).isEqualTo(5);

        agingEngine.ageJobs();
        assertThat(priorityOf(job)).isEqualTo(8);

        agingEngine.ageJobs();
        assertThat(priorityOf(job)).isEqualTo(10);

        assertThat(agingEngine.ageJobs()).isZero();
        assertThat(priorityOf(job)).isEqualTo(10);
    }
}
