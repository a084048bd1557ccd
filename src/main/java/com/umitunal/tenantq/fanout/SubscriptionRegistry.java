package com.umitunal.tenantq.fanout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks which live connections want updates for which tenant.
 *
 * One instance is shared by the session handler (mutations driven by
 * connection lifecycle) and the fan-out dispatcher (reads driven by the bus).
 * All operations are idempotent and safe to call concurrently.
 */
public class SubscriptionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ConcurrentMap<String, ConnectionHandle> connections = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<ConnectionHandle>> tenants = new ConcurrentHashMap<>();

    /**
     * Subscribe a connection to a tenant.
     *
     * @return false if the subscription already existed
     */
    public boolean addSubscription(LiveConnection connection, String tenantId) {
        while (true) {
            ConnectionHandle handle = connections.computeIfAbsent(connection.getId(),
                    id -> new ConnectionHandle(connection));
            boolean added;
            synchronized (handle) {
                if (handle.isRetired()) {
                    // Lost a race with removeAllForConnection; the handle is gone, take a fresh one
                    continue;
                }
                added = handle.addTenant(tenantId);
                if (added) {
                    tenants.compute(tenantId, (tenant, set) -> {
                        Set<ConnectionHandle> target = set != null ? set : ConcurrentHashMap.newKeySet();
                        target.add(handle);
                        return target;
                    });
                }
            }
            if (added) {
                log.debug("Connection {} subscribed to tenant {}", connection.getId(), tenantId);
            }
            return added;
        }
    }

    /**
     * Unsubscribe a connection from one tenant. Once this returns the
     * connection receives no further events for that tenant.
     *
     * @return false if there was no such subscription
     */
    public boolean removeSubscription(LiveConnection connection, String tenantId) {
        ConnectionHandle handle = connections.get(connection.getId());
        if (handle == null) {
            return false;
        }

        boolean removed;
        synchronized (handle) {
            removed = handle.removeTenant(tenantId);
            if (removed) {
                detach(tenantId, handle);
            }
            if (handle.isEmpty() && !handle.isRetired()) {
                handle.retire();
                connections.remove(connection.getId(), handle);
            }
        }
        if (removed) {
            log.debug("Connection {} unsubscribed from tenant {}", connection.getId(), tenantId);
        }
        return removed;
    }

    /**
     * Drop every subscription of a connection. Called on disconnect.
     *
     * @return the number of subscriptions removed
     */
    public int removeAllForConnection(LiveConnection connection) {
        ConnectionHandle handle = connections.get(connection.getId());
        if (handle == null) {
            return 0;
        }

        Set<String> removedTenants;
        synchronized (handle) {
            if (handle.isRetired()) {
                return 0;
            }
            removedTenants = handle.tenants();
            for (String tenantId : removedTenants) {
                detach(tenantId, handle);
            }
            handle.retire();
            connections.remove(connection.getId(), handle);
        }
        if (!removedTenants.isEmpty()) {
            log.debug("Connection {} removed from {} tenants", connection.getId(), removedTenants.size());
        }
        return removedTenants.size();
    }

    public boolean isSubscribed(LiveConnection connection, String tenantId) {
        ConnectionHandle handle = connections.get(connection.getId());
        if (handle == null) {
            return false;
        }
        synchronized (handle) {
            return handle.hasTenant(tenantId);
        }
    }

    /**
     * Tenants a connection is currently subscribed to.
     */
    public Set<String> tenantsOf(LiveConnection connection) {
        ConnectionHandle handle = connections.get(connection.getId());
        if (handle == null) {
            return Set.of();
        }
        synchronized (handle) {
            return handle.tenants();
        }
    }

    public int subscriberCount(String tenantId) {
        Set<ConnectionHandle> set = tenants.get(tenantId);
        return set == null ? 0 : set.size();
    }

    public int connectionCount() {
        return connections.size();
    }

    /**
     * Snapshot of the handles subscribed to a tenant. Callers must re-check
     * {@link ConnectionHandle#hasTenant} under the handle's monitor before sending.
     */
    Collection<ConnectionHandle> handlesFor(String tenantId) {
        Set<ConnectionHandle> set = tenants.get(tenantId);
        return set == null ? List.of() : new ArrayList<>(set);
    }

    private void detach(String tenantId, ConnectionHandle handle) {
        tenants.computeIfPresent(tenantId, (tenant, set) -> {
            set.remove(handle);
            return set.isEmpty() ? null : set;
        });
    }
}
