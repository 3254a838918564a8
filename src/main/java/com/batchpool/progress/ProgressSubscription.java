package com.batchpool.progress;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, lossy event stream for one subscriber.
 * When the buffer is full the oldest event is dropped and counted as missed;
 * publishers never block on a slow subscriber.
 */
public class ProgressSubscription implements AutoCloseable {

    private final ProgressTracker tracker;
    private final int capacity;
    private final ArrayDeque<ProgressEvent> buffer;
    private long missedEvents;
    private boolean closed;

    ProgressSubscription(ProgressTracker tracker, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Subscription capacity must be at least 1");
        }
        this.tracker = tracker;
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(Math.min(capacity, 64));
    }

    synchronized void offer(ProgressEvent event) {
        if (closed) {
            return;
        }
        if (buffer.size() >= capacity) {
            buffer.pollFirst();
            missedEvents++;
        }
        buffer.addLast(event);
        notifyAll();
    }

    /**
     * Next buffered event, without waiting.
     */
    public synchronized Optional<ProgressEvent> poll() {
        return Optional.ofNullable(buffer.pollFirst());
    }

    /**
     * Next event, waiting up to {@code timeout} for one to arrive.
     *
     * @return the event, or empty on timeout or once closed and drained
     */
    public synchronized Optional<ProgressEvent> poll(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (buffer.isEmpty() && !closed) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            wait(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(remaining)));
        }
        return Optional.ofNullable(buffer.pollFirst());
    }

    /**
     * Remove and return every buffered event.
     */
    public synchronized List<ProgressEvent> drain() {
        List<ProgressEvent> events = new ArrayList<>(buffer);
        buffer.clear();
        return events;
    }

    /**
     * Events dropped because this subscriber fell behind.
     */
    public synchronized long missedEvents() {
        return missedEvents;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            notifyAll();
        }
        tracker.unsubscribe(this);
    }
}
