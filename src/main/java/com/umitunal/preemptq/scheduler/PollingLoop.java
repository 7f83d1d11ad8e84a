package com.umitunal.preemptq.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A background task that repeatedly runs one iteration and sleeps its poll interval when idle.
 *
 * Loops share nothing in memory; they coordinate only through the durable stores and lanes.
 * An iteration error is logged and the loop carries on after its interval.
 */
public abstract class PollingLoop implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PollingLoop.class);

    private final String name;
    private final long pollInterval;
    private final AtomicBoolean running;
    private final AtomicLong iterationErrors;

    private volatile long joinTimeout = 5000;
    private Thread loopThread;

    protected PollingLoop(String name, long pollInterval) {
        this.name = name;
        this.pollInterval = pollInterval;
        this.running = new AtomicBoolean(false);
        this.iterationErrors = new AtomicLong(0);
    }

    /**
     * Run one iteration.
     *
     * @return true if work was found, in which case the next iteration starts without sleeping
     */
    protected abstract boolean runOnce() throws Exception;

    /**
     * Start the loop in the background.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            loopThread = new Thread(this::run, name);
            loopThread.setDaemon(false);
            loopThread.start();
            log.info("{} started (interval {}ms)", name, pollInterval);
        }
    }

    /**
     * Stop the loop, interrupting any sleep or in-flight iteration, and wait for it to exit.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (loopThread != null) {
            loopThread.interrupt();
            try {
                loopThread.join(joinTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (loopThread.isAlive()) {
                log.warn("{} did not stop within {}ms", name, joinTimeout);
            }
        }
        log.info("{} stopped", name);
    }

    private void run() {
        while (running.get()) {
            try {
                boolean busy = runOnce();

                if (!busy) {
                    Thread.sleep(pollInterval);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                iterationErrors.incrementAndGet();
                log.error("{} iteration failed", name, e);
                try {
                    Thread.sleep(pollInterval);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    void setJoinTimeout(long millis) {
        this.joinTimeout = millis;
    }

    public String getName() { return name; }
    public long getPollInterval() { return pollInterval; }
    public long getIterationErrors() { return iterationErrors.get(); }
    public boolean isRunning() { return running.get(); }

    @Override
    public void close() {
        stop();
    }
}
