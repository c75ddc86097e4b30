package com.shortlink.jobs;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cumulative health of one job across the process lifetime. Owned by the scheduler.
 * The running flag is a compare-and-set guard so at most one run of the job is in flight;
 * counters are updated under this object's monitor.
 */
public class JobStatus {

    private final AtomicBoolean running = new AtomicBoolean(false);

    private Instant lastExecution;
    private Instant lastSuccess;
    private Instant lastFailure;
    private int consecutiveFailures;
    private long totalExecutions;
    private long totalSuccesses;
    private long totalFailures;

    /** Claims the job for a run. Returns false when a run is already in flight. */
    public boolean tryStart() {
        return running.compareAndSet(false, true);
    }

    /** Records the run outcome and releases the guard. */
    public synchronized void finish(JobResult result) {
        lastExecution = result.timestamp();
        totalExecutions++;
        if (result.success()) {
            lastSuccess = result.timestamp();
            totalSuccesses++;
            consecutiveFailures = 0;
        } else {
            lastFailure = result.timestamp();
            totalFailures++;
            consecutiveFailures++;
        }
        running.set(false);
    }

    /** Back to the initial zero state. Leaves the running flag alone so an in-flight run still finishes cleanly. */
    public synchronized void resetCounters() {
        lastExecution = null;
        lastSuccess = null;
        lastFailure = null;
        consecutiveFailures = 0;
        totalExecutions = 0;
        totalSuccesses = 0;
        totalFailures = 0;
    }

    public boolean isRunning() {
        return running.get();
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized JobStatusSnapshot snapshot() {
        return new JobStatusSnapshot(running.get(), lastExecution, lastSuccess, lastFailure,
                consecutiveFailures, totalExecutions, totalSuccesses, totalFailures);
    }
}
