package com.batchpool.processor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for automatic strategy selection.
 */
class ProcessingStrategyTest {

    private static final long GIB = 1024L * 1024 * 1024;

    @Test
    @DisplayName("Should choose ASYNC, HYBRID and CPU_INTENSIVE for the reference cases")
    void shouldChooseReferenceCases() {
        assertEquals(ProcessingStrategy.ASYNC, ProcessingStrategy.chooseAuto(5, 8 * GIB));
        assertEquals(ProcessingStrategy.HYBRID, ProcessingStrategy.chooseAuto(50, 1 * GIB));
        assertEquals(ProcessingStrategy.CPU_INTENSIVE, ProcessingStrategy.chooseAuto(150, 8 * GIB));
    }

    @ParameterizedTest
    @DisplayName("Should apply thresholds in order")
    @CsvSource({
            "0, 0, ASYNC",
            "9, 0, ASYNC",
            "10, 8589934592, HYBRID",
            "100, 8589934592, HYBRID",
            "101, 8589934592, CPU_INTENSIVE",
            "500, 2147483647, HYBRID",
            "500, 2147483648, CPU_INTENSIVE"
    })
    void shouldApplyThresholds(int items, long memory, ProcessingStrategy expected) {
        assertEquals(expected, ProcessingStrategy.chooseAuto(items, memory));
    }

    @Test
    @DisplayName("Should clamp HYBRID chunk size to 1..10")
    void shouldClampChunkSize() {
        assertEquals(1, ParallelProcessor.chunkSize(5, 8));
        assertEquals(8, ParallelProcessor.chunkSize(25, 3));
        assertEquals(10, ParallelProcessor.chunkSize(200, 4));
        assertEquals(1, ParallelProcessor.chunkSize(0, 4));
    }
}
