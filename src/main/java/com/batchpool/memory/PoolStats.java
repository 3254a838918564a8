package com.batchpool.memory;

/**
 * Snapshot of {@link MemoryPool} counters.
 *
 * @param smallAllocated    Fresh small buffers allocated
 * @param smallReused       Small buffers served from the free list
 * @param mediumAllocated   Fresh medium buffers allocated
 * @param mediumReused      Medium buffers served from the free list
 * @param largeAllocated    Fresh large buffers allocated
 * @param largeReused       Large buffers served from the free list
 * @param totalMemorySaved  Bytes served from reused buffers
 */
public record PoolStats(
        long smallAllocated,
        long smallReused,
        long mediumAllocated,
        long mediumReused,
        long largeAllocated,
        long largeReused,
        long totalMemorySaved
) {
    public long allocated(BufferSizeClass sizeClass) {
        return switch (sizeClass) {
            case SMALL -> smallAllocated;
            case MEDIUM -> mediumAllocated;
            case LARGE -> largeAllocated;
        };
    }

    public long reused(BufferSizeClass sizeClass) {
        return switch (sizeClass) {
            case SMALL -> smallReused;
            case MEDIUM -> mediumReused;
            case LARGE -> largeReused;
        };
    }

    /**
     * Share of acquisitions served from the pool, 0-100.
     */
    public double reuseRate() {
        long reused = smallReused + mediumReused + largeReused;
        long total = reused + smallAllocated + mediumAllocated + largeAllocated;
        return total == 0 ? 0.0 : reused * 100.0 / total;
    }
}
