package com.batchpool.memory;

import com.batchpool.config.SchedulerConfig;
import com.batchpool.scheduler.WorkItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.batchpool.memory.MemoryMonitor.MIB;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MemoryMonitor.
 */
class MemoryMonitorTest {

    private MemoryMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = MemoryMonitor.ofMegabytes(100);
    }

    @Test
    @DisplayName("Should report usage percentage after allocate and deallocate")
    void shouldReportUsagePercentage() {
        monitor.allocate(50 * MIB);
        assertEquals(50.0, monitor.usagePercentage(), 0.0001);

        monitor.deallocate(25 * MIB);
        assertEquals(25.0, monitor.usagePercentage(), 0.0001);

        assertFalse(monitor.canAllocate(80 * MIB));
        assertTrue(monitor.canAllocate(75 * MIB));
    }

    @Test
    @DisplayName("Should return to zero after paired allocations")
    void shouldReturnToZeroAfterPairs() {
        long[] sizes = {1, 1024, 5 * MIB, 17, 33 * MIB};
        for (long size : sizes) {
            monitor.allocate(size);
        }
        for (long size : sizes) {
            monitor.deallocate(size);
        }
        assertEquals(0, monitor.currentUsage());
    }

    @Test
    @DisplayName("Should never go below zero on unmatched deallocate")
    void shouldSaturateAtZero() {
        monitor.allocate(10);
        monitor.deallocate(1000);
        assertEquals(0, monitor.currentUsage());

        monitor.deallocate(5);
        assertEquals(0, monitor.currentUsage());
        assertEquals(0.0, monitor.usagePercentage());
    }

    @Test
    @DisplayName("Should cap usage percentage at 100")
    void shouldCapPercentage() {
        monitor.allocate(250 * MIB);
        assertEquals(100.0, monitor.usagePercentage());
        assertEquals(250 * MIB, monitor.currentUsage());
    }

    @Test
    @DisplayName("Should flag pressure only above 80 percent")
    void shouldFlagPressure() {
        monitor.allocate(80 * MIB);
        assertFalse(monitor.isMemoryPressure());

        monitor.allocate(1 * MIB);
        assertTrue(monitor.isMemoryPressure());
    }

    @Test
    @DisplayName("Should derive ceiling from available memory with 512MB floor")
    void shouldAutoDetectCeiling() {
        MemoryMonitor large = MemoryMonitor.autoDetect(SystemMemory.fixed(16_384 * MIB, 8_192 * MIB));
        assertEquals(6_144 * MIB, large.maxUsage());

        MemoryMonitor small = MemoryMonitor.autoDetect(SystemMemory.fixed(1_024 * MIB, 256 * MIB));
        assertEquals(MemoryMonitor.MIN_AUTO_CEILING, small.maxUsage());
    }

    @Test
    @DisplayName("Should reject non-positive ceiling")
    void shouldRejectInvalidCeiling() {
        assertThrows(IllegalArgumentException.class, () -> new MemoryMonitor(0));
        assertThrows(IllegalArgumentException.class, () -> new MemoryMonitor(-1));
    }

    @Test
    @DisplayName("Should keep balanced accounting under concurrent use")
    void shouldStayBalancedConcurrently() throws InterruptedException {
        int threads = 8;
        int iterations = 1000;
        List<Thread> workers = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            Thread worker = new Thread(() -> {
                for (int i = 0; i < iterations; i++) {
                    monitor.allocate(4096);
                    monitor.deallocate(4096);
                }
            });
            workers.add(worker);
            worker.start();
        }
        for (Thread worker : workers) {
            worker.join();
        }

        assertEquals(0, monitor.currentUsage());
    }

    @Test
    @DisplayName("Should saturate instead of wrapping on a huge allocation")
    void shouldSaturateHugeAllocation() {
        long estimate = WorkItem.estimateMemoryUsage(Long.MAX_VALUE / 8, SchedulerConfig.DEFAULT_MEMORY_MULTIPLIER);
        assertEquals(Long.MAX_VALUE, estimate);

        monitor.allocate(1 * MIB);
        assertFalse(monitor.canAllocate(estimate));

        monitor.allocate(estimate);

        assertEquals(Long.MAX_VALUE, monitor.currentUsage());
        assertEquals(100.0, monitor.usagePercentage());
        assertTrue(monitor.isMemoryPressure());
        assertFalse(monitor.canAllocate(1));
    }

    @Test
    @DisplayName("Should reject negative sizes")
    void shouldRejectNegativeSizes() {
        assertThrows(IllegalArgumentException.class, () -> monitor.canAllocate(-1));
        assertThrows(IllegalArgumentException.class, () -> monitor.allocate(-1));
        assertThrows(IllegalArgumentException.class, () -> monitor.deallocate(-1));
        assertEquals(0, monitor.currentUsage());
    }
}
