package com.batchpool.scheduler;

import com.batchpool.config.SchedulerConfig;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One scheduled unit of work.
 * Priority and estimates are derived once at creation and never change.
 *
 * @param id                      Unique, monotonically increasing job ID
 * @param input                   Input reference handed to the transform
 * @param estimatedSize           Input size in bytes
 * @param priority                Priority derived from the size
 * @param createdAtNanos          Creation time ({@link System#nanoTime()})
 * @param estimatedMemory         Heuristic memory footprint in bytes
 * @param estimatedProcessingTime Coarse processing time estimate
 * @param <I>                     Input reference type
 */
public record WorkItem<I>(
        long id,
        I input,
        long estimatedSize,
        JobPriority priority,
        long createdAtNanos,
        long estimatedMemory,
        Duration estimatedProcessingTime
) {
    // Duration buckets use decimal megabytes
    public static final long FAST_BUCKET_LIMIT = 1_000_000L;
    public static final long MEDIUM_BUCKET_LIMIT = 10_000_000L;
    public static final long SLOW_BUCKET_LIMIT = 50_000_000L;

    public static final Duration FAST_ESTIMATE = Duration.ofMillis(100);
    public static final Duration MEDIUM_ESTIMATE = Duration.ofMillis(500);
    public static final Duration SLOW_ESTIMATE = Duration.ofSeconds(2);
    public static final Duration SLOWEST_ESTIMATE = Duration.ofSeconds(5);

    private static final AtomicLong ID_SEQUENCE = new AtomicLong(1);

    /**
     * Create a work item with priority and estimates derived from {@code size}.
     */
    public static <I> WorkItem<I> create(I input, long size, SchedulerConfig config) {
        return new WorkItem<>(
                ID_SEQUENCE.getAndIncrement(),
                input,
                size,
                JobPriority.forSize(size, config),
                System.nanoTime(),
                estimateMemoryUsage(size, config.memoryMultiplier()),
                estimateProcessingTime(size)
        );
    }

    /**
     * Estimated memory footprint: {@code size * multiplier}, saturating at {@link Long#MAX_VALUE}.
     */
    public static long estimateMemoryUsage(long size, long multiplier) {
        if (size > Long.MAX_VALUE / multiplier) {
            return Long.MAX_VALUE;
        }
        return size * multiplier;
    }

    /**
     * Step-function processing time estimate by size bucket.
     */
    public static Duration estimateProcessingTime(long size) {
        if (size <= FAST_BUCKET_LIMIT) {
            return FAST_ESTIMATE;
        }
        if (size <= MEDIUM_BUCKET_LIMIT) {
            return MEDIUM_ESTIMATE;
        }
        if (size <= SLOW_BUCKET_LIMIT) {
            return SLOW_ESTIMATE;
        }
        return SLOWEST_ESTIMATE;
    }

    public boolean isHighPriority() {
        return priority == JobPriority.HIGH;
    }

    /**
     * Time since creation.
     */
    public Duration age() {
        return Duration.ofNanos(System.nanoTime() - createdAtNanos);
    }
}
