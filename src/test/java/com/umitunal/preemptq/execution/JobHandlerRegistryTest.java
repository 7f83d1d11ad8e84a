package com.umitunal.preemptq.execution;

import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.model.JobRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class JobHandlerRegistryTest {

    @Test
    @DisplayName("Should provide a handler for every built-in type")
    void testDefaults() throws Exception {
        JobHandlerRegistry registry = JobHandlerRegistry.defaults();

        for (Job.Type type : Job.Type.values()) {
            assertThat(registry.handlerFor(type)).isNotNull();
        }
    }

    @Test
    @DisplayName("Should fail lookup for an unregistered type")
    void testMissingHandler() {
        JobHandlerRegistry registry = new JobHandlerRegistry();

        assertThatThrownBy(() -> registry.handlerFor(Job.Type.WEBHOOK))
                .isInstanceOf(JobHandlerException.class)
                .hasMessage("No handler registered for job type WEBHOOK");
    }

    @Test
    @DisplayName("Should replace a built-in handler")
    void testRegisterReplaces() throws Exception {
        // Given
        AtomicInteger calls = new AtomicInteger();
        JobHandlerRegistry registry = JobHandlerRegistry.defaults()
                .register(Job.Type.EMAIL, job -> calls.incrementAndGet());

        // When
        registry.handlerFor(Job.Type.EMAIL).handle(JobRecord.builder(Job.Type.EMAIL).build());

        // Then
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject null registrations")
    void testRejectsNull() {
        JobHandlerRegistry registry = new JobHandlerRegistry();

        assertThatThrownBy(() -> registry.register(Job.Type.DELAY, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(null, job -> { }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
