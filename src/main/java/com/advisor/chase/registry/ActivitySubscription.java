package com.advisor.chase.registry;

import com.advisor.chase.model.ActivityEvent;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One observer's bounded view of the event stream. Events are delivered from the moment of
 * subscription onwards; when the buffer is full new events are dropped for this observer only.
 */
public class ActivitySubscription implements AutoCloseable {

    private final ActivityEventBus bus;
    private final BlockingQueue<ActivityEvent> buffer;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();

    ActivitySubscription(ActivityEventBus bus, int capacity) {
        this.bus = bus;
        this.buffer = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    boolean offer(ActivityEvent event) {
        if (buffer.offer(event)) {
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }

    /**
     * Next event, waiting up to {@code timeout}; null if none arrived.
     */
    public ActivityEvent poll(Duration timeout) throws InterruptedException {
        return buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public ActivityEvent poll() {
        return buffer.poll();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            bus.unsubscribe(this);
            buffer.clear();
        }
    }
}
