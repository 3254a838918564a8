package com.batchpool.scheduler;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A dequeued {@link WorkItem} together with the concurrency permit it holds.
 * <p>
 * The permit belongs to the semaphore that granted it, so a configuration swap
 * while the job runs never leaks or double-counts permits. Releasing is idempotent.
 *
 * @param <I> Input reference type
 */
public final class JobLease<I> implements AutoCloseable {

    private final WorkItem<I> item;
    private final Semaphore slots;
    private final AtomicBoolean released = new AtomicBoolean(false);

    JobLease(WorkItem<I> item, Semaphore slots) {
        this.item = item;
        this.slots = slots;
    }

    public WorkItem<I> item() {
        return item;
    }

    public long id() {
        return item.id();
    }

    public I input() {
        return item.input();
    }

    /**
     * Return the permit. Only the first call has an effect.
     */
    public void release() {
        if (released.compareAndSet(false, true)) {
            slots.release();
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        release();
    }

    @Override
    public String toString() {
        return "JobLease{id=" + item.id() + ", priority=" + item.priority() + ", released=" + released.get() + "}";
    }
}
