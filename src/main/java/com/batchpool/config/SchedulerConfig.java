package com.batchpool.config;

import com.batchpool.exception.ConfigurationException;

import java.time.Duration;

/**
 * Configuration snapshot for the work scheduler.
 * Immutable; a change is published as a whole new instance.
 *
 * @param maxConcurrent          Maximum jobs holding a slot at once
 * @param targetMemoryUsage      Memory usage percentage below which jobs may start (0-100]
 * @param batchSize              Preferred number of small items grouped together
 * @param largeFileThreshold     Size at or above which an item is HIGH priority (bytes)
 * @param smallFileThreshold     Size below which an item is LOW priority (bytes)
 * @param largeFilePriorityBoost Priority boost reported for large items
 * @param maxWaitTime            Maximum wait for a concurrency slot
 * @param memoryWaitTime         Maximum wait for memory pressure to drop
 * @param memoryCheckInterval    Poll interval while waiting for memory
 * @param memoryMultiplier       Estimated memory footprint as a multiple of input size
 */
public record SchedulerConfig(
        int maxConcurrent,
        double targetMemoryUsage,
        int batchSize,
        long largeFileThreshold,
        long smallFileThreshold,
        int largeFilePriorityBoost,
        Duration maxWaitTime,
        Duration memoryWaitTime,
        Duration memoryCheckInterval,
        long memoryMultiplier
) {
    public static final long DEFAULT_LARGE_FILE_THRESHOLD = 50L * 1024 * 1024;
    public static final long DEFAULT_SMALL_FILE_THRESHOLD = 1024L * 1024;
    // Decoded RGBA is ~4 bytes/pixel and a compressed file ~10% of raw, so 40x is a worst case.
    public static final long DEFAULT_MEMORY_MULTIPLIER = 40;

    public SchedulerConfig {
        if (maxConcurrent < 1) {
            throw new ConfigurationException("max-concurrent must be at least 1, got " + maxConcurrent);
        }
        if (targetMemoryUsage <= 0 || targetMemoryUsage > 100) {
            throw new ConfigurationException("target-memory-usage must be in (0, 100], got " + targetMemoryUsage);
        }
        if (batchSize < 1) {
            throw new ConfigurationException("batch-size must be at least 1, got " + batchSize);
        }
        if (smallFileThreshold < 0 || largeFileThreshold < smallFileThreshold) {
            throw new ConfigurationException("Invalid file thresholds: small=" + smallFileThreshold
                    + ", large=" + largeFileThreshold);
        }
        if (maxWaitTime == null || memoryWaitTime == null || memoryCheckInterval == null) {
            throw new ConfigurationException("Wait durations cannot be null");
        }
        if (memoryCheckInterval.isZero() || memoryCheckInterval.isNegative()) {
            throw new ConfigurationException("memory-check-interval must be positive");
        }
        if (memoryMultiplier < 1) {
            throw new ConfigurationException("memory-multiplier must be at least 1, got " + memoryMultiplier);
        }
    }

    /**
     * Default scheduler configuration.
     */
    public static SchedulerConfig defaults() {
        return new SchedulerConfig(
                Math.min(Runtime.getRuntime().availableProcessors(), 16),
                75.0,
                10,
                DEFAULT_LARGE_FILE_THRESHOLD,
                DEFAULT_SMALL_FILE_THRESHOLD,
                10,
                Duration.ofSeconds(300),
                Duration.ofSeconds(30),
                Duration.ofMillis(500),
                DEFAULT_MEMORY_MULTIPLIER
        );
    }

    public SchedulerConfig withMaxConcurrent(int value) {
        return new SchedulerConfig(value, targetMemoryUsage, batchSize, largeFileThreshold,
                smallFileThreshold, largeFilePriorityBoost, maxWaitTime, memoryWaitTime,
                memoryCheckInterval, memoryMultiplier);
    }

    public SchedulerConfig withTargetMemoryUsage(double value) {
        return new SchedulerConfig(maxConcurrent, value, batchSize, largeFileThreshold,
                smallFileThreshold, largeFilePriorityBoost, maxWaitTime, memoryWaitTime,
                memoryCheckInterval, memoryMultiplier);
    }

    public SchedulerConfig withWaitTimes(Duration slotWait, Duration memoryWait, Duration checkInterval) {
        return new SchedulerConfig(maxConcurrent, targetMemoryUsage, batchSize, largeFileThreshold,
                smallFileThreshold, largeFilePriorityBoost, slotWait, memoryWait,
                checkInterval, memoryMultiplier);
    }
}
