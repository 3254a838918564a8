package com.batchpool.config;

import com.batchpool.exception.ConfigurationException;

/**
 * Memory ceiling configuration.
 *
 * @param limitMb Ceiling in megabytes; 0 means auto-detect from available system memory
 */
public record MemoryConfig(long limitMb) {

    public MemoryConfig {
        if (limitMb < 0) {
            throw new ConfigurationException("memory limit-mb cannot be negative, got " + limitMb);
        }
    }

    public static MemoryConfig autoDetect() {
        return new MemoryConfig(0);
    }

    public boolean isAutoDetect() {
        return limitMb == 0;
    }
}
