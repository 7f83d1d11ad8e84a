package com.umitunal.preemptq.execution;

import com.umitunal.preemptq.TestClock;
import com.umitunal.preemptq.config.StorageConfig;
import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.model.JobRecord;
import com.umitunal.preemptq.storage.RocksDatabase;
import com.umitunal.preemptq.storage.RocksPriorityLanes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class PreemptionOracleTest {
    private static final long START = 1_700_000_000_000L;

    @TempDir
    Path tempDir;

    private RocksDatabase database;
    private RocksPriorityLanes lanes;
    private TestClock clock;
    private PreemptionOracle oracle;

    @BeforeEach
    void setUp() throws Exception {
        database = new RocksDatabase(StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build());
        lanes = new RocksPriorityLanes(database);
        clock = new TestClock(START);
        oracle = new PreemptionOracle(lanes, clock);
    }

    @AfterEach
    void tearDown() {
        if (database != null) {
            database.close();
        }
    }

    private JobRecord job(int priority) {
        return JobRecord.builder(Job.Type.DELAY)
                .withPriority(priority)
                .withCreatedAt(START)
                .build();
    }

    @Test
    @DisplayName("Should not preempt when every lane is empty")
    void testEmptyLanes() throws Exception {
        assertThat(oracle.shouldPreempt(job(1))).isFalse();
    }

    @Test
    @DisplayName("Should preempt only for a strictly higher waiting lane")
    void testStrictlyHigher() throws Exception {
        // Given
        lanes.push(5, "waiting");

        // Then
        assertThat(oracle.shouldPreempt(job(4))).isTrue();
        assertThat(oracle.shouldPreempt(job(5))).isFalse();
        assertThat(oracle.shouldPreempt(job(7))).isFalse();
    }

    @Test
    @DisplayName("Should compare against the aged priority of the running job")
    void testAgedRunningJob() throws Exception {
        // Given
        lanes.push(6, "waiting");
        JobRecord running = job(3);
        assertThat(oracle.shouldPreempt(running)).isTrue();

        // When - three seconds of waiting lift it to 6
        clock.advance(3000);

        // Then
        assertThat(oracle.shouldPreempt(running)).isFalse();
    }

    @Test
    @DisplayName("Should never preempt a job at the top priority")
    void testTopPriority() throws Exception {
        // Given
        lanes.push(10, "waiting");

        // Then
        assertThat(oracle.shouldPreempt(job(10))).isFalse();
        assertThat(oracle.shouldPreempt(job(9))).isTrue();
    }
}
