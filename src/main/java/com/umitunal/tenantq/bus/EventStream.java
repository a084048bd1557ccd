package com.umitunal.tenantq.bus;

import com.umitunal.tenantq.core.UpdateEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Live sequence of events for a single tenant.
 *
 * Events are buffered up to a fixed capacity; when a slow reader lets the
 * buffer fill, newer events are dropped for this stream only.
 */
public class EventStream implements AutoCloseable {
    private final String tenantId;
    private final BlockingQueue<UpdateEvent> buffer;
    private final Consumer<EventStream> onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong droppedCount = new AtomicLong(0);

    EventStream(String tenantId, int capacity, Consumer<EventStream> onClose) {
        this.tenantId = tenantId;
        this.buffer = new LinkedBlockingQueue<>(capacity);
        this.onClose = onClose;
    }

    public String getTenantId() { return tenantId; }
    public boolean isClosed() { return closed.get(); }
    public long getDroppedCount() { return droppedCount.get(); }

    /**
     * Wait up to the given time for the next event.
     *
     * @return the next event, or null on timeout or once the stream is closed
     */
    public UpdateEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (closed.get()) {
            return null;
        }
        UpdateEvent event = buffer.poll(timeout, unit);
        return closed.get() ? null : event;
    }

    /**
     * Take every buffered event without waiting.
     */
    public List<UpdateEvent> drain() {
        List<UpdateEvent> events = new ArrayList<>();
        if (!closed.get()) {
            buffer.drainTo(events);
        }
        return events;
    }

    boolean offer(UpdateEvent event) {
        if (closed.get()) {
            return false;
        }
        if (!buffer.offer(event)) {
            droppedCount.incrementAndGet();
            return false;
        }
        return true;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            buffer.clear();
            onClose.accept(this);
        }
    }

    @Override
    public String toString() {
        return String.format("EventStream{tenant='%s', buffered=%d, dropped=%d, closed=%s}",
                tenantId, buffer.size(), droppedCount.get(), closed.get());
    }
}
