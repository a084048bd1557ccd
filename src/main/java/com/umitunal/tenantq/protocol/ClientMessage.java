package com.umitunal.tenantq.protocol;

/**
 * A decoded SUBSCRIBE or UNSUBSCRIBE frame.
 */
public class ClientMessage {
    private final MessageType type;
    private final String tenantId;

    public ClientMessage(MessageType type, String tenantId) {
        this.type = type;
        this.tenantId = tenantId;
    }

    public MessageType getType() { return type; }
    public String getTenantId() { return tenantId; }

    @Override
    public String toString() {
        return "ClientMessage{type=" + type + ", tenantId='" + tenantId + "'}";
    }
}
