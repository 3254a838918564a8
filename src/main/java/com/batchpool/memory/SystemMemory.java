package com.batchpool.memory;

/**
 * Source of physical memory figures for the host.
 * Used only to derive default ceilings and to pick a processing strategy.
 */
public interface SystemMemory {

    /**
     * Total physical memory in bytes.
     */
    long totalBytes();

    /**
     * Currently available physical memory in bytes.
     */
    long availableBytes();

    /**
     * Memory figures of the running host.
     */
    static SystemMemory host() {
        return new OperatingSystemMemory();
    }

    /**
     * Fixed figures, mostly for tests and for hosts that misreport.
     */
    static SystemMemory fixed(long totalBytes, long availableBytes) {
        return new SystemMemory() {
            @Override
            public long totalBytes() {
                return totalBytes;
            }

            @Override
            public long availableBytes() {
                return availableBytes;
            }
        };
    }
}
