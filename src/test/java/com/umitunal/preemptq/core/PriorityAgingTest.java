package com.umitunal.preemptq.core;

import com.umitunal.preemptq.model.JobRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PriorityAgingTest {
    private static final long CREATED = 1_700_000_000_000L;

    private JobRecord job(int priority) {
        return JobRecord.builder(Job.Type.DELAY)
                .withPriority(priority)
                .withCreatedAt(CREATED)
                .build();
    }

    @Test
    @DisplayName("Should add one level per whole second waited")
    void testBoost() {
        JobRecord job = job(2);

        assertThat(PriorityAging.effectivePriority(job, CREATED)).isEqualTo(2);
        assertThat(PriorityAging.effectivePriority(job, CREATED + 999)).isEqualTo(2);
        assertThat(PriorityAging.effectivePriority(job, CREATED + 3500)).isEqualTo(5);
    }

    @Test
    @DisplayName("Should cap the effective priority at 10")
    void testCap() {
        assertThat(PriorityAging.effectivePriority(job(8), CREATED + 60_000)).isEqualTo(10);
    }

    @Test
    @DisplayName("Should treat a clock behind creation as zero age")
    void testClockSkew() {
        assertThat(PriorityAging.ageSeconds(job(4), CREATED - 5000)).isZero();
        assertThat(PriorityAging.effectivePriority(job(4), CREATED - 5000)).isEqualTo(4);
    }
}
