package com.umitunal.tenantq.bus;

import com.umitunal.tenantq.core.UpdateEvent;

/**
 * Receives every event published on the bus, whatever the tenant.
 */
@FunctionalInterface
public interface UpdateListener {

    /**
     * Called on the bus dispatch thread. Must not block for long.
     */
    void onUpdate(UpdateEvent event);
}
