package com.umitunal.tenantq.core;

import java.util.Objects;

/**
 * Status change of one job, published once per transition.
 */
public final class UpdateEvent {
    private final String tenantId;
    private final String jobId;
    private final JobStatus status;
    private final String error;

    public UpdateEvent(String tenantId, String jobId, JobStatus status, String error) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.status = Objects.requireNonNull(status, "status");
        this.error = error;
    }

    public static UpdateEvent of(Job job, JobStatus status, String error) {
        return new UpdateEvent(job.getTenantId(), job.getId(), status, error);
    }

    public String getTenantId() { return tenantId; }
    public String getJobId() { return jobId; }
    public JobStatus getStatus() { return status; }
    public String getError() { return error; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UpdateEvent)) return false;
        UpdateEvent that = (UpdateEvent) o;
        return tenantId.equals(that.tenantId)
                && jobId.equals(that.jobId)
                && status == that.status
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, jobId, status, error);
    }

    @Override
    public String toString() {
        return String.format("UpdateEvent{tenant='%s', job='%s', status=%s, error=%s}",
                tenantId, jobId, status, error);
    }
}
