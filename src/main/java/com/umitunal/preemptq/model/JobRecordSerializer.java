package com.umitunal.preemptq.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.serialization.JsonCodec;
import com.umitunal.preemptq.serialization.PayloadCodec;

import java.nio.ByteBuffer;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary serializer for JobRecord using ByteBuffer.
 *
 * Binary format:
 * - id length (4 bytes) + id bytes (UTF-8)
 * - type name length (4 bytes) + type name bytes (UTF-8)
 * - payload length (4 bytes) + payload bytes (JSON)
 * - priority (4 bytes)
 * - maxRetries (4 bytes)
 * - executionTimeSecs (4 bytes)
 * - delayMs (8 bytes)
 * - status ordinal (4 bytes)
 * - retryCount (4 bytes)
 * - createdAt (8 bytes)
 * - nextAttemptAt (8 bytes)
 * - lastModified (8 bytes)
 * - lastError length (4 bytes) + error bytes (UTF-8)
 * - version (8 bytes)
 */
public class JobRecordSerializer implements PayloadCodec<JobRecord> {

    private final PayloadCodec<Map<String, Object>> payloadCodec;

    public JobRecordSerializer() {
        this(new JsonCodec<>(new TypeReference<Map<String, Object>>() { }));
    }

    public JobRecordSerializer(PayloadCodec<Map<String, Object>> payloadCodec) {
        this.payloadCodec = payloadCodec;
    }

    @Override
    public byte[] encode(JobRecord job) {
        byte[] idBytes = job.getId().getBytes(UTF_8);
        byte[] typeBytes = job.getType().name().getBytes(UTF_8);
        byte[] payloadBytes = payloadCodec.encode(job.getPayload());
        byte[] errorBytes = job.getLastError() != null
            ? job.getLastError().getBytes(UTF_8)
            : new byte[0];

        int totalSize = 4 + idBytes.length +           // id
                       4 + typeBytes.length +          // type
                       4 + payloadBytes.length +       // payload
                       4 +                             // priority
                       4 +                             // maxRetries
                       4 +                             // executionTimeSecs
                       8 +                             // delayMs
                       4 +                             // status ordinal
                       4 +                             // retryCount
                       8 +                             // createdAt
                       8 +                             // nextAttemptAt
                       8 +                             // lastModified
                       4 + errorBytes.length +         // lastError
                       8;                              // version

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);

        putBytes(buffer, idBytes);
        putBytes(buffer, typeBytes);
        putBytes(buffer, payloadBytes);

        buffer.putInt(job.getPriority());
        buffer.putInt(job.getMaxRetries());
        buffer.putInt(job.getExecutionTimeSecs());
        buffer.putLong(job.getDelayMs());

        buffer.putInt(job.getStatus().ordinal());
        buffer.putInt(job.getRetryCount());

        buffer.putLong(job.getCreatedAt());
        buffer.putLong(job.getNextAttemptAt());
        buffer.putLong(job.getLastModified());

        putBytes(buffer, errorBytes);

        buffer.putLong(job.getVersion());

        return buffer.array();
    }

    @Override
    public JobRecord decode(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);

        String id = new String(getBytes(buffer), UTF_8);
        Job.Type type = Job.Type.valueOf(new String(getBytes(buffer), UTF_8));
        Map<String, Object> payload = payloadCodec.decode(getBytes(buffer));

        int priority = buffer.getInt();
        int maxRetries = buffer.getInt();
        int executionTimeSecs = buffer.getInt();
        long delayMs = buffer.getLong();

        Job.Status status = Job.Status.values()[buffer.getInt()];
        int retryCount = buffer.getInt();
        long createdAt = buffer.getLong();

        JobRecord job = new JobRecord(id, type, payload, priority, maxRetries,
                executionTimeSecs, delayMs, createdAt);

        // Restore internal state
        job.setStatus(status);
        job.setRetryCount(retryCount);
        job.setNextAttemptAt(buffer.getLong());
        job.setLastModified(buffer.getLong());

        byte[] errorBytes = getBytes(buffer);
        if (errorBytes.length > 0) {
            job.setLastError(new String(errorBytes, UTF_8));
        }

        job.setVersion(buffer.getLong());

        return job;
    }

    private static void putBytes(ByteBuffer buffer, byte[] bytes) {
        buffer.putInt(bytes.length);
        buffer.put(bytes);
    }

    private static byte[] getBytes(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.getInt()];
        buffer.get(bytes);
        return bytes;
    }
}
