package com.batchpool.config;

import com.batchpool.exception.ConfigurationException;

import java.time.Duration;

/**
 * Scheduler auto-tuning configuration.
 *
 * @param enabled             Whether the optimizer runs at all
 * @param interval            Delay between optimization passes
 * @param pressureThreshold   New pressure events per interval above which concurrency shrinks
 * @param throughputThreshold Items/sec above which concurrency grows (if no pressure)
 * @param maxConcurrentCap    Hard cap when growing
 * @param reducedMemoryTarget Memory target applied when shrinking
 */
public record OptimizerConfig(
        boolean enabled,
        Duration interval,
        long pressureThreshold,
        double throughputThreshold,
        int maxConcurrentCap,
        double reducedMemoryTarget
) {
    public OptimizerConfig {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ConfigurationException("optimizer interval must be positive");
        }
        if (maxConcurrentCap < 1) {
            throw new ConfigurationException("optimizer max-concurrent-cap must be at least 1");
        }
        if (reducedMemoryTarget <= 0 || reducedMemoryTarget > 100) {
            throw new ConfigurationException("optimizer reduced-memory-target must be in (0, 100]");
        }
    }

    public static OptimizerConfig defaults() {
        return new OptimizerConfig(true, Duration.ofSeconds(60), 20, 2.0, 32, 65.0);
    }

    public static OptimizerConfig disabled() {
        OptimizerConfig defaults = defaults();
        return new OptimizerConfig(false, defaults.interval(), defaults.pressureThreshold(),
                defaults.throughputThreshold(), defaults.maxConcurrentCap(), defaults.reducedMemoryTarget());
    }
}
