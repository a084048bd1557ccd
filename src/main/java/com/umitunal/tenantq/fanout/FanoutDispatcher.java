package com.umitunal.tenantq.fanout;

import com.umitunal.tenantq.bus.NotificationBus;
import com.umitunal.tenantq.bus.UpdateListener;
import com.umitunal.tenantq.core.UpdateEvent;
import com.umitunal.tenantq.protocol.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivers bus events to every connection subscribed to the event's tenant.
 *
 * A connection that fails a send is dropped from the registry; the remaining
 * connections still get the event. Sends run on the bus dispatch thread, so a
 * connection whose send takes longer than the slow-send threshold is dropped
 * as well, after its frame went out.
 */
public class FanoutDispatcher implements UpdateListener {
    private static final Logger log = LoggerFactory.getLogger(FanoutDispatcher.class);

    public static final Duration DEFAULT_SLOW_SEND_THRESHOLD = Duration.ofSeconds(1);

    private final SubscriptionRegistry registry;
    private final MessageCodec codec;
    private final long slowSendThresholdNanos;
    private final AtomicLong deliveredCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);

    public FanoutDispatcher(SubscriptionRegistry registry, MessageCodec codec) {
        this(registry, codec, DEFAULT_SLOW_SEND_THRESHOLD);
    }

    public FanoutDispatcher(SubscriptionRegistry registry, MessageCodec codec, Duration slowSendThreshold) {
        if (slowSendThreshold.isNegative() || slowSendThreshold.isZero()) {
            throw new IllegalArgumentException("slowSendThreshold must be positive: " + slowSendThreshold);
        }
        this.registry = registry;
        this.codec = codec;
        this.slowSendThresholdNanos = slowSendThreshold.toNanos();
    }

    /**
     * Start receiving events from the bus.
     */
    public void attach(NotificationBus bus) {
        bus.addListener(this);
    }

    public void detach(NotificationBus bus) {
        bus.removeListener(this);
    }

    @Override
    public void onUpdate(UpdateEvent event) {
        deliver(event.getTenantId(), codec.jobUpdate(event));
    }

    /**
     * Send a frame to the tenant's current subscribers.
     *
     * @return the number of connections that received it
     */
    public int deliver(String tenantId, String frame) {
        int delivered = 0;
        List<LiveConnection> broken = new ArrayList<>();

        for (ConnectionHandle handle : registry.handlesFor(tenantId)) {
            synchronized (handle) {
                if (!handle.hasTenant(tenantId)) {
                    continue;
                }
                LiveConnection connection = handle.connection();
                if (!connection.isOpen()) {
                    broken.add(connection);
                    continue;
                }
                try {
                    long started = System.nanoTime();
                    connection.send(frame);
                    delivered++;
                    long elapsed = System.nanoTime() - started;
                    if (elapsed > slowSendThresholdNanos) {
                        log.warn("Send to connection {} took {} ms, dropping its subscriptions",
                                connection.getId(), elapsed / 1_000_000);
                        broken.add(connection);
                    }
                } catch (IOException | RuntimeException e) {
                    log.warn("Send to connection {} failed, dropping its subscriptions: {}",
                            connection.getId(), e.getMessage());
                    broken.add(connection);
                }
            }
        }

        for (LiveConnection connection : broken) {
            registry.removeAllForConnection(connection);
        }
        deliveredCount.addAndGet(delivered);
        failedCount.addAndGet(broken.size());
        return delivered;
    }

    public long getDeliveredCount() { return deliveredCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
}
