package com.umitunal.cronlite.core;

/**
 * Snapshot of job counts held by a job store.
 */
public class StoreMetrics {
    private final long totalJobs;
    private final long pendingJobs;
    private final long runningJobs;
    private final long completedJobs;
    private final long failedJobs;
    private final long indexedJobs;

    public StoreMetrics(long totalJobs, long pendingJobs, long runningJobs,
                        long completedJobs, long failedJobs, long indexedJobs) {
        this.totalJobs = totalJobs;
        this.pendingJobs = pendingJobs;
        this.runningJobs = runningJobs;
        this.completedJobs = completedJobs;
        this.failedJobs = failedJobs;
        this.indexedJobs = indexedJobs;
    }

    public long getTotalJobs() { return totalJobs; }
    public long getPendingJobs() { return pendingJobs; }
    public long getRunningJobs() { return runningJobs; }
    public long getCompletedJobs() { return completedJobs; }
    public long getFailedJobs() { return failedJobs; }

    /**
     * Number of jobs still referenced by the time index.
     */
    public long getIndexedJobs() { return indexedJobs; }

    @Override
    public String toString() {
        return String.format(
            "StoreMetrics{total=%d, pending=%d, running=%d, completed=%d, failed=%d, indexed=%d}",
            totalJobs, pendingJobs, runningJobs, completedJobs, failedJobs, indexedJobs
        );
    }
}
