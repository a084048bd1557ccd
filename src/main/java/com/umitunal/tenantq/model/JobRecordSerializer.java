package com.umitunal.tenantq.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.umitunal.tenantq.core.JobStatus;
import com.umitunal.tenantq.serialization.PayloadCodec;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary serializer for JobRecord using ByteBuffer.
 *
 * Binary format:
 * - id length (4 bytes) + id bytes (UTF-8)
 * - tenantId length (4 bytes) + tenantId bytes (UTF-8)
 * - type length (4 bytes) + type bytes (UTF-8)
 * - payload length (4 bytes) + payload bytes
 * - status ordinal (4 bytes)
 * - attempts (4 bytes)
 * - error length (4 bytes, -1 for null) + error bytes (UTF-8)
 * - createdAt (8 bytes)
 * - updatedAt (8 bytes)
 */
public class JobRecordSerializer {

    private static final int NULL_LENGTH = -1;

    private final PayloadCodec<JsonNode> payloadCodec;

    public JobRecordSerializer(PayloadCodec<JsonNode> payloadCodec) {
        this.payloadCodec = payloadCodec;
    }

    public byte[] serialize(JobRecord record) {
        byte[] idBytes = record.getId().getBytes(UTF_8);
        byte[] tenantBytes = record.getTenantId().getBytes(UTF_8);
        byte[] typeBytes = record.getType().getBytes(UTF_8);
        byte[] payloadBytes = payloadCodec.encode(record.getPayload());
        byte[] errorBytes = record.getError() != null
            ? record.getError().getBytes(UTF_8)
            : null;

        int totalSize = 4 + idBytes.length +
                       4 + tenantBytes.length +
                       4 + typeBytes.length +
                       4 + payloadBytes.length +
                       4 +                                             // status ordinal
                       4 +                                             // attempts
                       4 + (errorBytes != null ? errorBytes.length : 0) +
                       8 +                                             // createdAt
                       8;                                              // updatedAt

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);

        putBytes(buffer, idBytes);
        putBytes(buffer, tenantBytes);
        putBytes(buffer, typeBytes);
        putBytes(buffer, payloadBytes);

        buffer.putInt(record.getStatus().ordinal());
        buffer.putInt(record.getAttempts());

        if (errorBytes == null) {
            buffer.putInt(NULL_LENGTH);
        } else {
            putBytes(buffer, errorBytes);
        }

        buffer.putLong(record.getCreatedAt());
        buffer.putLong(record.getUpdatedAt());

        return buffer.array();
    }

    public JobRecord deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);

        String id = new String(getBytes(buffer), UTF_8);
        String tenantId = new String(getBytes(buffer), UTF_8);
        String type = new String(getBytes(buffer), UTF_8);
        JsonNode payload = payloadCodec.decode(getBytes(buffer));

        JobStatus status = JobStatus.values()[buffer.getInt()];
        int attempts = buffer.getInt();

        String error = null;
        int errorLength = buffer.getInt();
        if (errorLength != NULL_LENGTH) {
            byte[] errorBytes = new byte[errorLength];
            buffer.get(errorBytes);
            error = new String(errorBytes, UTF_8);
        }

        long createdAt = buffer.getLong();
        long updatedAt = buffer.getLong();

        JobRecord record = new JobRecord(id, tenantId, type, payload, createdAt);
        record.setStatus(status);
        record.setAttempts(attempts);
        record.setError(error);
        record.setCreatedAt(createdAt);
        record.setUpdatedAt(updatedAt);
        return record;
    }

    private static void putBytes(ByteBuffer buffer, byte[] bytes) {
        buffer.putInt(bytes.length);
        buffer.put(bytes);
    }

    private static byte[] getBytes(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.getInt()];
        buffer.get(bytes);
        return bytes;
    }
}
