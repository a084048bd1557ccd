package com.umitunal.tenantq.bus;

import com.umitunal.tenantq.core.UpdateEvent;

/**
 * Publish/subscribe channel for job status changes, partitioned by tenant.
 *
 * Delivery is best-effort and at-most-once: a subscriber only sees events
 * published while it is subscribed, and nothing is replayed.
 */
public interface NotificationBus extends AutoCloseable {

    /**
     * Hand an event to the bus. Never blocks the caller; if the bus buffer is
     * full the event is dropped.
     *
     * @return true if the event was accepted for delivery
     */
    boolean publish(UpdateEvent event);

    /**
     * Open a stream of events for one tenant. The stream stays active until
     * it is closed or the bus shuts down.
     */
    EventStream subscribe(String tenantId);

    /**
     * Register a listener for events of every tenant.
     */
    void addListener(UpdateListener listener);

    void removeListener(UpdateListener listener);

    @Override
    void close();
}
