package com.batchpool.config;

/**
 * Root configuration.
 *
 * @param name      Instance name, used in logs
 * @param scheduler Work scheduler configuration
 * @param memory    Memory ceiling configuration
 * @param processor Parallel processor configuration
 * @param optimizer Auto-tuning configuration
 */
public record BatchPoolConfig(
        String name,
        SchedulerConfig scheduler,
        MemoryConfig memory,
        ProcessorConfig processor,
        OptimizerConfig optimizer
) {
    /**
     * Configuration with every section at its defaults.
     */
    public static BatchPoolConfig defaults() {
        return new BatchPoolConfig(
                "default-batch-pool",
                SchedulerConfig.defaults(),
                MemoryConfig.autoDetect(),
                ProcessorConfig.defaults(),
                OptimizerConfig.defaults()
        );
    }
}
