package com.umitunal.tenantq.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.umitunal.tenantq.core.Job;
import com.umitunal.tenantq.core.JobPage;
import com.umitunal.tenantq.core.JobQueue;
import com.umitunal.tenantq.core.JobStatus;
import com.umitunal.tenantq.core.JobStore;
import com.umitunal.tenantq.core.StorageException;
import com.umitunal.tenantq.worker.ProcessorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tenant-facing operations: submit, look up and list jobs.
 */
public class JobService {
    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    public static final int MAX_TENANT_ID_LENGTH = 100;
    public static final int DEFAULT_LIST_LIMIT = 20;
    public static final int MAX_LIST_LIMIT = 100;

    private final JobStore store;
    private final JobQueue queue;
    private final ProcessorRegistry processors;

    public JobService(JobStore store, JobQueue queue, ProcessorRegistry processors) {
        this.store = store;
        this.queue = queue;
        this.processors = processors;
    }

    /**
     * Validate, persist as PENDING, then enqueue.
     *
     * If the enqueue fails the job stays PENDING in the store without a queue
     * entry and the exception propagates.
     *
     * @return the new job id
     * @throws ValidationException if the tenant, type or payload is invalid
     */
    public String submit(String tenantId, String type, JsonNode payload) throws StorageException {
        List<String> violations = new ArrayList<>();

        if (tenantId == null || tenantId.isBlank()) {
            violations.add("tenantId is required");
        } else if (tenantId.length() > MAX_TENANT_ID_LENGTH) {
            violations.add("tenantId must be at most " + MAX_TENANT_ID_LENGTH + " characters");
        }

        if (!processors.supports(type)) {
            violations.add("Unknown job type: " + type);
        } else {
            violations.addAll(processors.validate(type, payload));
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        String id = store.create(tenantId, type, payload);
        queue.enqueue(id);
        log.info("Submitted {} job {} for tenant {}", type, id, tenantId);
        return id;
    }

    public Optional<Job> get(String id) throws StorageException {
        return store.get(id);
    }

    /**
     * List a tenant's jobs newest first.
     *
     * @param limit page size, or null for the default of 20
     * @param offset number of jobs to skip, or null for 0
     */
    public JobPage list(String tenantId, JobStatus status, Integer limit, Integer offset)
            throws StorageException {
        int pageSize = limit != null ? limit : DEFAULT_LIST_LIMIT;
        int skip = offset != null ? offset : 0;

        List<String> violations = new ArrayList<>();
        if (pageSize < 1 || pageSize > MAX_LIST_LIMIT) {
            violations.add("limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        if (skip < 0) {
            violations.add("offset must not be negative");
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        return store.list(tenantId, status, pageSize, skip);
    }
}
