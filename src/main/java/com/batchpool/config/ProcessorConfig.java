package com.batchpool.config;

import com.batchpool.exception.ConfigurationException;
import com.batchpool.processor.ProcessingStrategy;

import java.time.Duration;

/**
 * Parallel processor configuration.
 *
 * @param maxConcurrent      Concurrency limit for the ASYNC and HYBRID strategies
 * @param strategy           Default strategy for batches
 * @param chunkPause         Pause between HYBRID chunks
 * @param progressBufferSize Events buffered per progress subscriber
 * @param threadNamePrefix   Prefix for worker thread names
 */
public record ProcessorConfig(
        int maxConcurrent,
        ProcessingStrategy strategy,
        Duration chunkPause,
        int progressBufferSize,
        String threadNamePrefix
) {
    public ProcessorConfig {
        if (maxConcurrent < 1) {
            throw new ConfigurationException("processor max-concurrent must be at least 1, got " + maxConcurrent);
        }
        if (strategy == null) {
            throw new ConfigurationException("processor strategy cannot be null");
        }
        if (chunkPause == null || chunkPause.isNegative()) {
            throw new ConfigurationException("chunk-pause cannot be negative");
        }
        if (progressBufferSize < 1) {
            throw new ConfigurationException("progress-buffer must be at least 1, got " + progressBufferSize);
        }
    }

    /**
     * Default processor configuration: one worker per CPU (at most 16), AUTO strategy.
     */
    public static ProcessorConfig defaults() {
        return new ProcessorConfig(
                Math.min(Runtime.getRuntime().availableProcessors(), 16),
                ProcessingStrategy.AUTO,
                Duration.ofMillis(100),
                1000,
                "batch-worker-"
        );
    }

    /**
     * Defaults with a fixed concurrency limit.
     */
    public static ProcessorConfig withConcurrency(int maxConcurrent) {
        ProcessorConfig defaults = defaults();
        return new ProcessorConfig(maxConcurrent, defaults.strategy(), defaults.chunkPause(),
                defaults.progressBufferSize(), defaults.threadNamePrefix());
    }
}
