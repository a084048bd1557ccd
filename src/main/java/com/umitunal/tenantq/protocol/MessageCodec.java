package com.umitunal.tenantq.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.tenantq.core.UpdateEvent;
import com.umitunal.tenantq.serialization.JsonCodec;

import java.io.UncheckedIOException;

/**
 * JSON text frames for live connections.
 *
 * <pre>
 * client: {"type":"SUBSCRIBE","tenantId":"t1"}
 *         {"type":"UNSUBSCRIBE","tenantId":"t1"}
 * server: {"type":"CONNECTED","message":"..."}
 *         {"type":"JOB_UPDATE","jobId":"...","status":"RUNNING","error":null}
 *         {"type":"ERROR","message":"..."}
 * </pre>
 */
public class MessageCodec {
    private final ObjectMapper mapper;

    public MessageCodec() {
        this(JsonCodec.createDefaultMapper());
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ClientMessage decode(String text) throws MessageFormatException {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MessageFormatException("Invalid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MessageFormatException("Message must be a JSON object");
        }

        MessageType type = parseType(root.path("type").asText(null));
        if (type != MessageType.SUBSCRIBE && type != MessageType.UNSUBSCRIBE) {
            throw new MessageFormatException("Unsupported message type: " + type);
        }

        JsonNode tenant = root.get("tenantId");
        if (tenant == null || !tenant.isTextual() || tenant.asText().isBlank()) {
            throw new MessageFormatException("tenantId is required");
        }
        return new ClientMessage(type, tenant.asText());
    }

    public String jobUpdate(UpdateEvent event) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", MessageType.JOB_UPDATE.name());
        node.put("jobId", event.getJobId());
        node.put("status", event.getStatus().name());
        node.put("error", event.getError());
        return write(node);
    }

    public String connected(String message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", MessageType.CONNECTED.name());
        node.put("message", message);
        return write(node);
    }

    public String error(String message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", MessageType.ERROR.name());
        node.put("message", message);
        return write(node);
    }

    private static MessageType parseType(String raw) throws MessageFormatException {
        if (raw == null) {
            throw new MessageFormatException("type is required");
        }
        try {
            return MessageType.valueOf(raw);
        } catch (IllegalArgumentException e) {
            throw new MessageFormatException("Unknown message type: " + raw, e);
        }
    }

    private String write(ObjectNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write frame", e);
        }
    }
}
