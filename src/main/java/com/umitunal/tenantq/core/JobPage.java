package com.umitunal.tenantq.core;

import java.util.List;

/**
 * One page of a job listing together with the total number of matches.
 */
public class JobPage {
    private final List<Job> jobs;
    private final long total;

    public JobPage(List<Job> jobs, long total) {
        this.jobs = List.copyOf(jobs);
        this.total = total;
    }

    public List<Job> getJobs() { return jobs; }
    public long getTotal() { return total; }

    @Override
    public String toString() {
        return String.format("JobPage{size=%d, total=%d}", jobs.size(), total);
    }
}
