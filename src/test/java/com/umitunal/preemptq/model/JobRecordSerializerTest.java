package com.umitunal.preemptq.model;

import com.umitunal.preemptq.core.Job;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JobRecordSerializerTest {

    @Test
    @DisplayName("Should serialize and deserialize a fresh job")
    void testSimpleJob() {
        // Given
        JobRecordSerializer serializer = new JobRecordSerializer();
        JobRecord original = JobRecord.builder(Job.Type.EMAIL)
                .withId("job-1")
                .withPayloadField("to", "test@example.com")
                .withPriority(7)
                .withExecutionTimeSecs(4)
                .withDelayMs(1500)
                .build();

        // When
        JobRecord decoded = serializer.decode(serializer.encode(original));

        // Then
        assertThat(decoded.getId()).isEqualTo("job-1");
        assertThat(decoded.getType()).isEqualTo(Job.Type.EMAIL);
        assertThat(decoded.getPayload()).containsEntry("to", "test@example.com");
        assertThat(decoded.getPriority()).isEqualTo(7);
        assertThat(decoded.getExecutionTimeSecs()).isEqualTo(4);
        assertThat(decoded.getDelayMs()).isEqualTo(1500);
        assertThat(decoded.getCreatedAt()).isEqualTo(original.getCreatedAt());
        assertThat(decoded.getStatus()).isEqualTo(Job.Status.PENDING);
        assertThat(decoded.getLastError()).isNull();
    }

    @Test
    @DisplayName("Should preserve retry state and metadata")
    void testMetadataPreservation() {
        // Given
        JobRecordSerializer serializer = new JobRecordSerializer();
        JobRecord original = JobRecord.builder(Job.Type.WEBHOOK)
                .withPayloadField("url", "https://example.com/hook")
                .withMaxRetries(5)
                .build();
        original.markRunning();
        original.recordFailure("Connection timeout");
        original.scheduleRetry(original.getCreatedAt() + 2000);
        original.touch(original.getCreatedAt() + 10);

        // When
        JobRecord decoded = serializer.decode(serializer.encode(original));

        // Then
        assertThat(decoded.getStatus()).isEqualTo(Job.Status.PENDING);
        assertThat(decoded.getRetryCount()).isEqualTo(1);
        assertThat(decoded.getMaxRetries()).isEqualTo(5);
        assertThat(decoded.getNextAttemptAt()).isEqualTo(original.getCreatedAt() + 2000);
        assertThat(decoded.getLastError()).isEqualTo("Connection timeout");
        assertThat(decoded.getLastModified()).isEqualTo(original.getLastModified());
        assertThat(decoded.getVersion()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep structured payload values")
    void testStructuredPayload() {
        // Given
        JobRecordSerializer serializer = new JobRecordSerializer();
        JobRecord original = JobRecord.builder(Job.Type.DELAY)
                .withPayload(Map.of("delayMs", 3000, "tags", List.of("a", "b")))
                .build();

        // When
        JobRecord decoded = serializer.decode(serializer.encode(original));

        // Then
        assertThat(decoded.getPayload().get("delayMs")).isEqualTo(3000);
        assertThat(decoded.getPayload().get("tags")).isEqualTo(List.of("a", "b"));
    }
}
