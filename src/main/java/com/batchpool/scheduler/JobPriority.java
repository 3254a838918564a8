package com.batchpool.scheduler;

import com.batchpool.config.SchedulerConfig;

/**
 * Fixed three-tier job priority. Declaration order is the priority order (LOW lowest).
 */
public enum JobPriority {
    LOW,
    NORMAL,
    HIGH;

    /**
     * Priority for an input of the given size.
     * Large inputs go first so they do not block the tail of a batch.
     */
    public static JobPriority forSize(long size, SchedulerConfig config) {
        if (size >= config.largeFileThreshold()) {
            return HIGH;
        }
        if (size < config.smallFileThreshold()) {
            return LOW;
        }
        return NORMAL;
    }
}
