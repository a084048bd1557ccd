package com.umitunal.tenantq.core;

/**
 * Outcome of a status update against the {@link JobStore}.
 */
public enum UpdateResult {
    UPDATED,
    NOT_FOUND,
    /** The job was not in the expected state, or is already terminal. */
    CONFLICT
}
