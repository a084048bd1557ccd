package com.umitunal.tenantq.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of every job: identity, payload, status and attempt count.
 *
 * Implementations must be safe for concurrent use by many workers.
 */
public interface JobStore extends AutoCloseable {

    /**
     * Create a new job in {@link JobStatus#PENDING} with zero attempts.
     *
     * @return the generated job id
     */
    String create(String tenantId, String type, JsonNode payload) throws StorageException;

    /**
     * Fetch a job by id.
     */
    Optional<Job> get(String id) throws StorageException;

    /**
     * Set the status of a job, add {@code attemptsDelta} to its attempt count
     * and replace its error message ({@code null} clears it).
     *
     * @param attemptsDelta non-negative increment
     * @return {@link UpdateResult#NOT_FOUND} for an unknown id,
     *         {@link UpdateResult#CONFLICT} if the job is already terminal
     */
    UpdateResult updateStatus(String id, JobStatus status, int attemptsDelta, String error)
            throws StorageException;

    /**
     * Same as {@link #updateStatus} but only applied while the job is still in
     * {@code expected}. The check and the write are atomic.
     */
    UpdateResult updateStatusIf(String id, JobStatus expected, JobStatus status,
                                int attemptsDelta, String error) throws StorageException;

    /**
     * List a tenant's jobs, newest first.
     *
     * @param statusFilter only jobs in this status, or null for all
     */
    JobPage list(String tenantId, JobStatus statusFilter, int limit, int offset) throws StorageException;

    /**
     * Find jobs in {@code status} whose last update is older than {@code cutoffMillis}.
     * Supports reconciliation of jobs left RUNNING by a lost worker.
     */
    List<Job> findByStatusOlderThan(JobStatus status, long cutoffMillis) throws StorageException;

    /**
     * Get job counts per status.
     */
    JobMetrics getMetrics() throws StorageException;

    @Override
    void close();
}
