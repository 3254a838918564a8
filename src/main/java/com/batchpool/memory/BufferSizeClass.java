package com.batchpool.memory;

/**
 * Buffer size classes of the {@link MemoryPool}.
 * Each class keeps its own free list with its own slot cap.
 */
public enum BufferSizeClass {

    /**
     * Below 1MB. Many slots, cheap to keep.
     */
    SMALL(100),

    /**
     * 1MB up to 10MB.
     */
    MEDIUM(50),

    /**
     * 10MB and above. Few slots, expensive to keep.
     */
    LARGE(20);

    static final int SMALL_LIMIT = 1024 * 1024;
    static final int MEDIUM_LIMIT = 10 * 1024 * 1024;

    private final int maxPooled;

    BufferSizeClass(int maxPooled) {
        this.maxPooled = maxPooled;
    }

    /**
     * Maximum number of free buffers kept for this class.
     */
    public int maxPooled() {
        return maxPooled;
    }

    /**
     * Size class for a requested minimum size.
     */
    public static BufferSizeClass forSize(long size) {
        if (size < SMALL_LIMIT) {
            return SMALL;
        }
        if (size < MEDIUM_LIMIT) {
            return MEDIUM;
        }
        return LARGE;
    }
}
