package com.batchpool.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped memory accounting: allocates on creation, deallocates on close.
 * <pre>
 * try (MemoryTracker tracker = MemoryTracker.acquire(monitor, item.estimatedMemory())) {
 *     ...
 * }
 * </pre>
 */
public final class MemoryTracker implements AutoCloseable {

    private final MemoryMonitor monitor;
    private final long allocatedSize;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private MemoryTracker(MemoryMonitor monitor, long allocatedSize) {
        this.monitor = monitor;
        this.allocatedSize = allocatedSize;
        monitor.allocate(allocatedSize);
    }

    /**
     * Track {@code size} bytes only if they fit under the monitor's ceiling.
     *
     * @return the tracker, or empty if the allocation would exceed the ceiling
     */
    public static Optional<MemoryTracker> tryAcquire(MemoryMonitor monitor, long size) {
        if (!monitor.canAllocate(size)) {
            return Optional.empty();
        }
        return Optional.of(new MemoryTracker(monitor, size));
    }

    /**
     * Track {@code size} bytes unconditionally.
     */
    public static MemoryTracker acquire(MemoryMonitor monitor, long size) {
        return new MemoryTracker(monitor, size);
    }

    public long getAllocatedSize() {
        return allocatedSize;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            monitor.deallocate(allocatedSize);
        }
    }
}
