package com.batchpool.scheduler;

import java.time.Duration;

/**
 * Cumulative scheduler statistics snapshot.
 *
 * @param jobsQueued                 Jobs admitted since start
 * @param jobsCompleted              Jobs completed successfully
 * @param jobsFailed                 Jobs completed with failure
 * @param totalWaitTime              Sum of time spent in {@code nextJob} until a job was handed out
 * @param totalProcessingTime        Sum of reported processing times
 * @param averageQueueLength         Queue length seen at the last admission or dequeue
 * @param memoryPressureEvents       Failed memory checks while waiting to dequeue
 * @param throughputItemsPerSecond   Finished jobs divided by total processing time
 */
public record SchedulerStats(
        long jobsQueued,
        long jobsCompleted,
        long jobsFailed,
        Duration totalWaitTime,
        Duration totalProcessingTime,
        double averageQueueLength,
        long memoryPressureEvents,
        double throughputItemsPerSecond
) {
    public static SchedulerStats empty() {
        return new SchedulerStats(0, 0, 0, Duration.ZERO, Duration.ZERO, 0.0, 0, 0.0);
    }

    /**
     * Completed plus failed jobs.
     */
    public long jobsFinished() {
        return jobsCompleted + jobsFailed;
    }
}
