package com.umitunal.tenantq.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Read-only view of a job record held by the {@link JobStore}.
 */
public interface Job {

    /**
     * Gets the unique identifier generated at creation.
     */
    String getId();

    /**
     * Gets the tenant that owns this job.
     */
    String getTenantId();

    /**
     * Gets the type name used to select a processor.
     */
    String getType();

    /**
     * Gets the job payload. Its shape depends on the type.
     */
    JsonNode getPayload();

    /**
     * Gets the current lifecycle state.
     */
    JobStatus getStatus();

    /**
     * Gets the number of started processing attempts.
     */
    int getAttempts();

    /**
     * Gets the last failure message, or null.
     */
    String getError();

    /**
     * Gets the creation time in milliseconds since epoch.
     */
    long getCreatedAt();

    /**
     * Gets the last modification time in milliseconds since epoch.
     */
    long getUpdatedAt();
}
