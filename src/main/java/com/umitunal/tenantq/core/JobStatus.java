package com.umitunal.tenantq.core;

/**
 * Lifecycle states of a job.
 *
 * PENDING is the initial state and is re-entered on retry. RUNNING is held
 * while a worker owns the job. COMPLETED and FAILED are terminal.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
