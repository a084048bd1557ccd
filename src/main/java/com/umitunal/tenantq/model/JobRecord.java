package com.umitunal.tenantq.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.umitunal.tenantq.core.Job;
import com.umitunal.tenantq.core.JobStatus;
import com.umitunal.tenantq.serialization.PayloadCodec;

/**
 * Concrete job record with its mutable lifecycle state.
 */
public class JobRecord implements Job {
    private final String id;
    private final String tenantId;
    private final String type;
    private final JsonNode payload;

    private JobStatus status;
    private int attempts;
    private String error;
    private long createdAt;
    private long updatedAt;

    public JobRecord(String id, String tenantId, String type, JsonNode payload, long createdAt) {
        this.id = id;
        this.tenantId = tenantId;
        this.type = type;
        this.payload = payload;
        this.status = JobStatus.PENDING;
        this.attempts = 0;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    @Override
    public String getType() {
        return type;
    }

    @Override
    public JsonNode getPayload() {
        return payload;
    }

    @Override
    public JobStatus getStatus() {
        return status;
    }

    @Override
    public int getAttempts() {
        return attempts;
    }

    @Override
    public String getError() {
        return error;
    }

    @Override
    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public long getUpdatedAt() {
        return updatedAt;
    }

    // Package-private setters for deserialization
    void setStatus(JobStatus status) {
        this.status = status;
    }

    void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    void setError(String error) {
        this.error = error;
    }

    void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    /**
     * Apply a status transition. Attempts only ever grow.
     */
    public void transition(JobStatus newStatus, int attemptsDelta, String newError, long now) {
        if (attemptsDelta < 0) {
            throw new IllegalArgumentException("attemptsDelta must not be negative: " + attemptsDelta);
        }
        this.status = newStatus;
        this.attempts += attemptsDelta;
        this.error = newError;
        this.updatedAt = now;
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id='%s', tenant='%s', type='%s', status=%s, attempts=%d, error=%s}",
                id, tenantId, type, status, attempts, error);
    }

    /**
     * Serialize to bytes for storage.
     * Delegates to JobRecordSerializer for actual serialization logic.
     */
    public byte[] serialize(PayloadCodec<JsonNode> codec) {
        return new JobRecordSerializer(codec).serialize(this);
    }

    /**
     * Deserialize from bytes.
     * Delegates to JobRecordSerializer for actual deserialization logic.
     */
    public static JobRecord deserialize(byte[] bytes, PayloadCodec<JsonNode> codec) {
        return new JobRecordSerializer(codec).deserialize(bytes);
    }
}
