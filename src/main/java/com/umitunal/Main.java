package com.umitunal;

import com.umitunal.preemptq.config.ConfigLoader;
import com.umitunal.preemptq.config.SchedulerConfig;
import com.umitunal.preemptq.config.StorageConfig;
import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.model.JobRecord;
import com.umitunal.preemptq.scheduler.SchedulerNode;
import com.umitunal.preemptq.storage.RocksDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs a scheduler worker until the JVM is asked to shut down.
 *
 * With the {@code demo} argument it also submits a long low-priority job followed by an
 * urgent one, so preemption and resumption show up in the log.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final long STATUS_INTERVAL_SECONDS = 10;

    public static void main(String[] args) throws Exception {
        Properties props = ConfigLoader.load();
        StorageConfig storageConfig = ConfigLoader.storageConfig(props);
        SchedulerConfig schedulerConfig = ConfigLoader.schedulerConfig(props);

        CountDownLatch shutdownRequested = new CountDownLatch(1);
        CountDownLatch closed = new CountDownLatch(1);

        try (RocksDatabase database = new RocksDatabase(storageConfig);
             SchedulerNode node = SchedulerNode.newBuilder(database, schedulerConfig).build()) {

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Received shutdown signal");
                shutdownRequested.countDown();
                try {
                    // The JVM halts once hooks return, wait for the database to close
                    closed.await(schedulerConfig.getShutdownTimeoutMs() * 2, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "preemptq-shutdown"));

            node.start();
            log.info("Worker started, data in {}", storageConfig.getDataDirectory());

            if (args.length > 0 && "demo".equalsIgnoreCase(args[0])) {
                submitDemoJobs(node);
            }

            while (!shutdownRequested.await(STATUS_INTERVAL_SECONDS, TimeUnit.SECONDS)) {
                node.getInspector().logQueueStatus();
            }
        } finally {
            closed.countDown();
        }
    }

    private static void submitDemoJobs(SchedulerNode node) throws Exception {
        JobRecord background = node.submit(JobRecord.builder(Job.Type.DELAY)
                .withPriority(3)
                .withExecutionTimeSecs(5)
                .build());

        Thread.sleep(1000);

        JobRecord urgent = node.submit(JobRecord.builder(Job.Type.EMAIL)
                .withPayloadField("to", "ops@example.com")
                .withPriority(9)
                .withExecutionTimeSecs(1)
                .build());

        log.info("Demo jobs submitted: background={}, urgent={}", background.getId(), urgent.getId());
    }
}
