package com.umitunal.preemptq.scheduler;

import com.umitunal.preemptq.config.SchedulerConfig;
import com.umitunal.preemptq.core.ExecutionStateStore;
import com.umitunal.preemptq.core.JobStore;
import com.umitunal.preemptq.core.PriorityLanes;
import com.umitunal.preemptq.execution.ExecutionController;
import com.umitunal.preemptq.execution.JobHandlerRegistry;
import com.umitunal.preemptq.execution.PreemptionOracle;
import com.umitunal.preemptq.model.JobRecord;
import com.umitunal.preemptq.storage.RocksDatabase;
import com.umitunal.preemptq.storage.RocksExecutionStateStore;
import com.umitunal.preemptq.storage.RocksJobStore;
import com.umitunal.preemptq.storage.RocksPriorityLanes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One scheduler process: its dispatch loops plus the aging, resumption and promotion loops,
 * all sharing one database.
 *
 * <p>{@link #start()} runs crash recovery before any loop starts. {@link #close()} stops the
 * dispatch loops first; a job interrupted mid-run is saved at its checkpoint, reset to PENDING
 * and re-queued. The database itself is owned by the caller.
 */
public class SchedulerNode implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchedulerNode.class);

    private final SchedulerConfig config;
    private final Clock clock;
    private final JobStore jobStore;
    private final ExecutionStateStore stateStore;
    private final PriorityLanes lanes;
    private final JobInspector inspector;
    private final RecoveryCoordinator recoveryCoordinator;
    private final DelayPromotionPipeline promotionPipeline;
    private final AgingEngine agingEngine;
    private final ResumptionScanner resumptionScanner;
    private final ExecutionController controller;
    private final List<DispatchLoop> dispatchLoops;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private SchedulerNode(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.jobStore = new RocksJobStore(builder.database);
        this.stateStore = new RocksExecutionStateStore(builder.database);
        this.lanes = new RocksPriorityLanes(builder.database);

        LaneFeeder feeder = new LaneFeeder(jobStore, stateStore, lanes);
        this.inspector = new JobInspector(jobStore, stateStore, lanes, clock);
        this.recoveryCoordinator = new RecoveryCoordinator(jobStore, stateStore, lanes, feeder, inspector, clock);
        this.promotionPipeline = new DelayPromotionPipeline(jobStore, lanes, feeder, clock,
                config.getPromotionIntervalMs());
        this.agingEngine = new AgingEngine(jobStore, clock, config.getAgingIntervalMs());
        this.resumptionScanner = new ResumptionScanner(stateStore, feeder, clock, config.getResumptionIntervalMs());

        PreemptionOracle oracle = new PreemptionOracle(lanes, clock);
        this.controller = new ExecutionController(
                stateStore, jobStore, oracle, builder.handlers, config, clock);

        List<DispatchLoop> loops = new ArrayList<>();
        for (int i = 1; i <= config.getWorkerCount(); i++) {
            loops.add(DispatchLoop.builder(builder.nodeId + "-" + i, lanes, jobStore, controller)
                    .withPollInterval(config.getDispatchPollIntervalMs())
                    .withClock(clock)
                    .build());
        }
        this.dispatchLoops = Collections.unmodifiableList(loops);

        for (PollingLoop loop : allLoops()) {
            loop.setJoinTimeout(config.getShutdownTimeoutMs());
        }
    }

    /**
     * Recover from any previous crash, then start every loop.
     */
    public RecoveryReport start() throws Exception {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Scheduler node already started");
        }
        log.info("Starting scheduler node with {}", config);
        RecoveryReport report = recoveryCoordinator.recover();

        promotionPipeline.start();
        agingEngine.start();
        resumptionScanner.start();
        for (DispatchLoop loop : dispatchLoops) {
            loop.start();
        }
        return report;
    }

    /**
     * Persist a new job and, if it has no delay to wait out, put it straight onto its lane.
     */
    public JobRecord submit(JobRecord job) throws Exception {
        jobStore.create(job);
        if (promotionPipeline.promoteIfDue(job)) {
            log.info("Job {} submitted to lane {}", job.getId(), job.getPriority());
        } else {
            log.info("Job {} submitted, waiting {}ms before it becomes ready",
                    job.getId(), inspector.millisUntilDue(job));
        }
        return job;
    }

    public void stop() {
        log.info("Shutting down scheduler node gracefully...");
        for (DispatchLoop loop : dispatchLoops) {
            loop.stop();
        }
        controller.close();
        resumptionScanner.stop();
        agingEngine.stop();
        promotionPipeline.stop();
        log.info("Scheduler node stopped");
    }

    private List<PollingLoop> allLoops() {
        List<PollingLoop> all = new ArrayList<>(dispatchLoops);
        all.add(promotionPipeline);
        all.add(agingEngine);
        all.add(resumptionScanner);
        return all;
    }

    public JobStore getJobStore() { return jobStore; }
    public ExecutionStateStore getStateStore() { return stateStore; }
    public PriorityLanes getLanes() { return lanes; }
    public JobInspector getInspector() { return inspector; }
    public RecoveryCoordinator getRecoveryCoordinator() { return recoveryCoordinator; }
    public List<DispatchLoop> getDispatchLoops() { return dispatchLoops; }

    @Override
    public void close() {
        stop();
    }

    public static Builder newBuilder(RocksDatabase database, SchedulerConfig config) {
        return new Builder(database, config);
    }

    public static class Builder {
        private final RocksDatabase database;
        private final SchedulerConfig config;
        private JobHandlerRegistry handlers = JobHandlerRegistry.defaults();
        private Clock clock = Clock.systemUTC();
        private String nodeId = "worker";

        private Builder(RocksDatabase database, SchedulerConfig config) {
            if (database == null || config == null) {
                throw new IllegalArgumentException("Database and config are required");
            }
            this.database = database;
            this.config = config;
        }

        public Builder withHandlers(JobHandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withNodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public SchedulerNode build() {
            return new SchedulerNode(this);
        }
    }
}
