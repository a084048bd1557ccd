package com.umitunal.tenantq.fanout;

import java.io.IOException;

/**
 * A connected client that can receive text frames, such as a WebSocket session.
 *
 * Implementations must tolerate {@link #send} being called from the bus
 * dispatch thread and from the connection's own handler thread.
 */
public interface LiveConnection {

    /**
     * Stable identifier, unique among open connections.
     */
    String getId();

    /**
     * Send a text frame.
     * Must not block: it runs on the single bus dispatch thread, so a stalled
     * send delays every tenant's updates. Queue the frame or write with a
     * bounded timeout instead.
     *
     * @throws IOException if the connection is closed or the write fails
     */
    void send(String message) throws IOException;

    boolean isOpen();
}
