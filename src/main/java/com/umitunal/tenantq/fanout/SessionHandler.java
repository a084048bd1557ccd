package com.umitunal.tenantq.fanout;

import com.umitunal.tenantq.protocol.ClientMessage;
import com.umitunal.tenantq.protocol.MessageCodec;
import com.umitunal.tenantq.protocol.MessageFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Connection lifecycle callbacks for a transport such as a WebSocket endpoint.
 *
 * Translates client frames into registry changes and guarantees cleanup when
 * the connection goes away.
 */
public class SessionHandler {
    private static final Logger log = LoggerFactory.getLogger(SessionHandler.class);

    static final String WELCOME = "Connected to job updates";

    private final SubscriptionRegistry registry;
    private final MessageCodec codec;

    public SessionHandler(SubscriptionRegistry registry, MessageCodec codec) {
        this.registry = registry;
        this.codec = codec;
    }

    public void onOpen(LiveConnection connection) {
        log.debug("Connection {} opened", connection.getId());
        reply(connection, codec.connected(WELCOME));
    }

    public void onMessage(LiveConnection connection, String text) {
        ClientMessage message;
        try {
            message = codec.decode(text);
        } catch (MessageFormatException e) {
            log.debug("Rejected frame from {}: {}", connection.getId(), e.getMessage());
            reply(connection, codec.error(e.getMessage()));
            return;
        }

        switch (message.getType()) {
            case SUBSCRIBE -> registry.addSubscription(connection, message.getTenantId());
            case UNSUBSCRIBE -> registry.removeSubscription(connection, message.getTenantId());
            default -> reply(connection, codec.error("Unsupported message type: " + message.getType()));
        }
    }

    public void onClose(LiveConnection connection) {
        int removed = registry.removeAllForConnection(connection);
        log.debug("Connection {} closed, {} subscriptions removed", connection.getId(), removed);
    }

    private void reply(LiveConnection connection, String frame) {
        try {
            connection.send(frame);
        } catch (IOException e) {
            log.debug("Reply to {} failed, treating as disconnected", connection.getId(), e);
            onClose(connection);
        }
    }
}
