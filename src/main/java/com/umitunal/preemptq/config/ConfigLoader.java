package com.umitunal.preemptq.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;

/**
 * Builds the storage and scheduler configuration from layered sources.
 *
 * Later layers win: {@code preemptq.properties} on the classpath, then {@code preemptq.*}
 * system properties, then the environment ({@code PREEMPTQ_DATA_DIR}, {@code JOB_TIMEOUT_MS}).
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String RESOURCE = "preemptq.properties";
    private static final String PREFIX = "preemptq.";

    private ConfigLoader() {
    }

    public static Properties load() {
        return load(System.getProperties(), System.getenv());
    }

    static Properties load(Properties systemProperties, Map<String, String> env) {
        Properties props = new Properties();

        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                log.debug("No {} on classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }

        for (String name : systemProperties.stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                props.setProperty(name, systemProperties.getProperty(name));
            }
        }

        if (env.get("PREEMPTQ_DATA_DIR") != null) {
            props.setProperty(PREFIX + "storage.dataDirectory", env.get("PREEMPTQ_DATA_DIR"));
        }
        if (env.get("JOB_TIMEOUT_MS") != null) {
            props.setProperty(PREFIX + "scheduler.executionTimeoutMs", env.get("JOB_TIMEOUT_MS"));
        }

        return props;
    }

    public static StorageConfig storageConfig(Properties props) {
        StorageConfig.Builder builder = StorageConfig.newBuilder(
                props.getProperty(PREFIX + "storage.dataDirectory", "data/preemptq"));

        String durable = props.getProperty(PREFIX + "storage.durableWrites");
        if (durable != null) {
            builder.withDurableWrites(Boolean.parseBoolean(durable.trim()));
        }
        Integer bufferSize = intValue(props, "storage.memoryBufferSizeMB");
        if (bufferSize != null) {
            builder.withMemoryBufferSize(bufferSize);
        }
        Integer buffers = intValue(props, "storage.maxMemoryBuffers");
        if (buffers != null) {
            builder.withMaxMemoryBuffers(buffers);
        }
        Integer threads = intValue(props, "storage.backgroundThreads");
        if (threads != null) {
            builder.withBackgroundThreads(threads);
        }
        Integer cache = intValue(props, "storage.blockCacheSizeMB");
        if (cache != null) {
            builder.withBlockCacheSize(cache);
        }
        return builder.build();
    }

    public static SchedulerConfig schedulerConfig(Properties props) {
        SchedulerConfig.Builder builder = SchedulerConfig.newBuilder();

        Integer workers = intValue(props, "scheduler.workerCount");
        if (workers != null) {
            builder.withWorkerCount(workers);
        }
        Long value;
        if ((value = longValue(props, "scheduler.dispatchPollIntervalMs")) != null) {
            builder.withDispatchPollInterval(value);
        }
        if ((value = longValue(props, "scheduler.sliceMs")) != null) {
            builder.withSlice(value);
        }
        if ((value = longValue(props, "scheduler.checkpointIntervalMs")) != null) {
            builder.withCheckpointInterval(value);
        }
        if ((value = longValue(props, "scheduler.executionTimeoutMs")) != null) {
            builder.withExecutionTimeout(value);
        }
        if ((value = longValue(props, "scheduler.agingIntervalMs")) != null) {
            builder.withAgingInterval(value);
        }
        if ((value = longValue(props, "scheduler.resumptionIntervalMs")) != null) {
            builder.withResumptionInterval(value);
        }
        if ((value = longValue(props, "scheduler.promotionIntervalMs")) != null) {
            builder.withPromotionInterval(value);
        }
        if ((value = longValue(props, "scheduler.shutdownTimeoutMs")) != null) {
            builder.withShutdownTimeout(value);
        }
        return builder.build();
    }

    private static Integer intValue(Properties props, String key) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + raw, e);
        }
    }

    private static Long longValue(Properties props, String key) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + PREFIX + key + ": " + raw, e);
        }
    }
}
