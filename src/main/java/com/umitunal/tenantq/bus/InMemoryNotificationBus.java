package com.umitunal.tenantq.bus;

import com.umitunal.tenantq.core.UpdateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process notification bus.
 *
 * Publishers drop events into a bounded buffer; a single dispatch thread
 * hands them to tenant streams and listeners in publish order. Publishers
 * never wait on subscribers.
 */
public class InMemoryNotificationBus implements NotificationBus {
    private static final Logger log = LoggerFactory.getLogger(InMemoryNotificationBus.class);

    private static final long POLL_MILLIS = 100;

    private final BlockingQueue<UpdateEvent> pending;
    private final ConcurrentMap<String, Set<EventStream>> streams = new ConcurrentHashMap<>();
    private final List<UpdateListener> listeners = new CopyOnWriteArrayList<>();
    private final int streamBufferSize;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong publishedCount = new AtomicLong(0);
    private final AtomicLong droppedCount = new AtomicLong(0);
    private final AtomicLong deliveredCount = new AtomicLong(0);
    private final Thread dispatchThread;

    public InMemoryNotificationBus() {
        this(1024, 256);
    }

    /**
     * @param bufferSize       events waiting for dispatch before publishes are dropped
     * @param streamBufferSize events buffered per tenant stream
     */
    public InMemoryNotificationBus(int bufferSize, int streamBufferSize) {
        this.pending = new ArrayBlockingQueue<>(bufferSize);
        this.streamBufferSize = streamBufferSize;
        this.dispatchThread = new Thread(this::run, "NotificationBus-dispatch");
        this.dispatchThread.setDaemon(true);
        this.dispatchThread.start();
    }

    @Override
    public boolean publish(UpdateEvent event) {
        if (!running.get()) {
            log.debug("Bus closed, dropping {}", event);
            return false;
        }
        if (!pending.offer(event)) {
            droppedCount.incrementAndGet();
            log.warn("Bus buffer full, dropping {}", event);
            return false;
        }
        publishedCount.incrementAndGet();
        return true;
    }

    @Override
    public EventStream subscribe(String tenantId) {
        if (!running.get()) {
            throw new IllegalStateException("Notification bus is closed");
        }
        EventStream stream = new EventStream(tenantId, streamBufferSize, this::unsubscribe);
        streams.compute(tenantId, (tenant, set) -> {
            Set<EventStream> target = set != null ? set : ConcurrentHashMap.newKeySet();
            target.add(stream);
            return target;
        });
        return stream;
    }

    @Override
    public void addListener(UpdateListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(UpdateListener listener) {
        listeners.remove(listener);
    }

    public long getPublishedCount() { return publishedCount.get(); }
    public long getDroppedCount() { return droppedCount.get(); }
    public long getDeliveredCount() { return deliveredCount.get(); }

    /**
     * Number of events accepted but not yet dispatched.
     */
    public int getPendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            dispatchThread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (Set<EventStream> set : streams.values()) {
            set.forEach(EventStream::close);
        }
        streams.clear();
        listeners.clear();
        log.info("Notification bus closed: published={}, dropped={}", publishedCount.get(), droppedCount.get());
    }

    private void unsubscribe(EventStream stream) {
        streams.computeIfPresent(stream.getTenantId(), (tenant, set) -> {
            set.remove(stream);
            return set.isEmpty() ? null : set;
        });
    }

    private void run() {
        // Keep dispatching until closed and the buffer is empty
        while (running.get() || !pending.isEmpty()) {
            try {
                UpdateEvent event = pending.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    dispatch(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private void dispatch(UpdateEvent event) {
        Set<EventStream> tenantStreams = streams.get(event.getTenantId());
        if (tenantStreams != null) {
            for (EventStream stream : tenantStreams) {
                if (stream.offer(event)) {
                    deliveredCount.incrementAndGet();
                }
            }
        }

        for (UpdateListener listener : listeners) {
            try {
                listener.onUpdate(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {}", listener, event, e);
            }
        }
    }
}
