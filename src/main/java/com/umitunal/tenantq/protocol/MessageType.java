package com.umitunal.tenantq.protocol;

/**
 * Frame types exchanged with live connections.
 */
public enum MessageType {
    /** Client asks for a tenant's updates. */
    SUBSCRIBE,
    /** Client stops a tenant's updates. */
    UNSUBSCRIBE,
    JOB_UPDATE,
    ERROR,
    CONNECTED
}
