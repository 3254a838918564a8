package com.batchpool.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads host memory from the platform MXBean.
 * Falls back to JVM heap figures when the platform bean is not available.
 */
public class OperatingSystemMemory implements SystemMemory {

    private static final Logger log = LoggerFactory.getLogger(OperatingSystemMemory.class);

    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public long totalBytes() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean platform) {
            return platform.getTotalMemorySize();
        }
        log.debug("Platform memory bean unavailable, using JVM max heap");
        return Runtime.getRuntime().maxMemory();
    }

    @Override
    public long availableBytes() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean platform) {
            return platform.getFreeMemorySize();
        }
        Runtime runtime = Runtime.getRuntime();
        return runtime.maxMemory() - (runtime.totalMemory() - runtime.freeMemory());
    }
}
