package com.batchpool.scheduler;

/**
 * Point-in-time queue depth per priority.
 */
public record QueueStatus(
        int highPriorityCount,
        int normalPriorityCount,
        int lowPriorityCount,
        int totalCount
) {
    public boolean isEmpty() {
        return totalCount == 0;
    }

    /**
     * Compact depth summary, e.g. {@code H:2 N:5 L:3}.
     */
    public String depthByPriority() {
        return "H:" + highPriorityCount + " N:" + normalPriorityCount + " L:" + lowPriorityCount;
    }
}
