package com.umitunal.tenantq.core;

/**
 * Job counts per status, for monitoring.
 */
public class JobMetrics {
    private final long totalJobs;
    private final long pendingJobs;
    private final long runningJobs;
    private final long completedJobs;
    private final long failedJobs;

    public JobMetrics(long totalJobs, long pendingJobs, long runningJobs,
                      long completedJobs, long failedJobs) {
        this.totalJobs = totalJobs;
        this.pendingJobs = pendingJobs;
        this.runningJobs = runningJobs;
        this.completedJobs = completedJobs;
        this.failedJobs = failedJobs;
    }

    public long getTotalJobs() { return totalJobs; }
    public long getPendingJobs() { return pendingJobs; }
    public long getRunningJobs() { return runningJobs; }
    public long getCompletedJobs() { return completedJobs; }
    public long getFailedJobs() { return failedJobs; }

    @Override
    public String toString() {
        return String.format(
            "JobMetrics{total=%d, pending=%d, running=%d, completed=%d, failed=%d}",
            totalJobs, pendingJobs, runningJobs, completedJobs, failedJobs
        );
    }
}
