package com.umitunal.tenantq.fanout;

import java.util.HashSet;
import java.util.Set;

/**
 * Registry-side state of one connection.
 *
 * The handle's monitor guards its tenant set and every send to the
 * connection, so a send can never run after the matching removal returned.
 */
final class ConnectionHandle {
    private final LiveConnection connection;
    private final Set<String> tenants = new HashSet<>();
    private boolean retired;

    ConnectionHandle(LiveConnection connection) {
        this.connection = connection;
    }

    LiveConnection connection() {
        return connection;
    }

    // All methods below require the handle's monitor

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
        tenants.clear();
    }

    boolean addTenant(String tenantId) {
        return tenants.add(tenantId);
    }

    boolean removeTenant(String tenantId) {
        return tenants.remove(tenantId);
    }

    boolean hasTenant(String tenantId) {
        return tenants.contains(tenantId);
    }

    Set<String> tenants() {
        return Set.copyOf(tenants);
    }

    boolean isEmpty() {
        return tenants.isEmpty();
    }
}
