package com.umitunal.preemptq.scheduler;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What one recovery run re-queued, per scan.
 */
public class RecoveryReport {
    private final Set<String> promotedPending = new LinkedHashSet<>();
    private final Set<String> resetRunning = new LinkedHashSet<>();
    private final Set<String> requeuedSuspended = new LinkedHashSet<>();
    private final Set<String> requeuedReady = new LinkedHashSet<>();
    private int errors;

    void promotedPending(String jobId) { promotedPending.add(jobId); }
    void resetRunning(String jobId) { resetRunning.add(jobId); }
    void requeuedSuspended(String jobId) { requeuedSuspended.add(jobId); }
    void requeuedReady(String jobId) { requeuedReady.add(jobId); }
    void error() { errors++; }

    public Set<String> getPromotedPending() { return Collections.unmodifiableSet(promotedPending); }
    public Set<String> getResetRunning() { return Collections.unmodifiableSet(resetRunning); }
    public Set<String> getRequeuedSuspended() { return Collections.unmodifiableSet(requeuedSuspended); }
    public Set<String> getRequeuedReady() { return Collections.unmodifiableSet(requeuedReady); }
    public int getErrors() { return errors; }

    /**
     * Every job id this run pushed onto a lane.
     */
    public Set<String> getRequeued() {
        Set<String> all = new LinkedHashSet<>(promotedPending);
        all.addAll(resetRunning);
        all.addAll(requeuedSuspended);
        all.addAll(requeuedReady);
        return all;
    }

    @Override
    public String toString() {
        return String.format("RecoveryReport{pending=%d, running=%d, suspended=%d, ready=%d, errors=%d}",
                promotedPending.size(), resetRunning.size(), requeuedSuspended.size(),
                requeuedReady.size(), errors);
    }
}
