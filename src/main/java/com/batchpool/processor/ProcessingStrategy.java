package com.batchpool.processor;

/**
 * Execution strategies of the {@link ParallelProcessor}.
 */
public enum ProcessingStrategy {

    /**
     * One task per item, admission gated by a semaphore.
     * Suited to small batches and I/O-bound transforms.
     */
    ASYNC,

    /**
     * Work-stealing parallel map over all items.
     * Suited to large batches with plenty of memory.
     */
    CPU_INTENSIVE,

    /**
     * Items processed in small chunks with a pause in between so memory can be reclaimed.
     * Suited to medium batches or low memory.
     */
    HYBRID,

    /**
     * Pick one of the above from batch size and available memory.
     */
    AUTO;

    static final int SMALL_BATCH_LIMIT = 10;
    static final int LARGE_BATCH_LIMIT = 100;
    static final long LOW_MEMORY_LIMIT = 2L * 1024 * 1024 * 1024;

    /**
     * Choose a concrete strategy:
     * fewer than 10 items run ASYNC; under 2GB available memory runs HYBRID;
     * more than 100 items run CPU_INTENSIVE; everything else runs HYBRID.
     */
    public static ProcessingStrategy chooseAuto(int itemCount, long availableMemory) {
        if (itemCount < SMALL_BATCH_LIMIT) {
            return ASYNC;
        }
        if (availableMemory < LOW_MEMORY_LIMIT) {
            return HYBRID;
        }
        if (itemCount > LARGE_BATCH_LIMIT) {
            return CPU_INTENSIVE;
        }
        return HYBRID;
    }
}
