package com.batchpool.processor;

import com.batchpool.config.ConfigLoader;
import com.batchpool.config.BatchPoolConfig;
import com.batchpool.memory.MemoryMonitor;
import com.batchpool.memory.MemoryPool;
import com.batchpool.memory.SystemMemory;
import com.batchpool.progress.ProgressTracker;
import com.batchpool.scheduler.SchedulerStats;
import com.batchpool.scheduler.SizeEstimator;
import com.batchpool.scheduler.WorkScheduler;
import com.batchpool.transform.ChecksumAlgorithm;
import com.batchpool.transform.ChecksumOutput;
import com.batchpool.transform.ChecksumTransform;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.zip.CRC32;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Files checksummed end to end through the scheduler.
 */
class ScheduledChecksumTest {

    @TempDir
    Path dir;

    private BatchPoolConfig config;
    private MemoryMonitor monitor;
    private ParallelProcessor processor;

    @BeforeEach
    void setUp() {
        config = ConfigLoader.load("classpath:batch-pool-test.yaml");
        monitor = MemoryMonitor.ofMegabytes(config.memory().limitMb());
        processor = new ParallelProcessor(config.processor(), new MemoryPool(),
                new ProgressTracker(config.processor().progressBufferSize()),
                SystemMemory.fixed(16L << 30, 8L << 30));
    }

    @AfterEach
    void tearDown() {
        processor.close();
    }

    @Test
    @DisplayName("Should checksum every file and release all memory")
    void shouldChecksumFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            byte[] data = new byte[1000 * (i + 1)];
            for (int b = 0; b < data.length; b++) {
                data[b] = (byte) (b * 31 + i);
            }
            files.add(Files.write(dir.resolve("file-" + i + ".bin"), data));
        }
        WorkScheduler<Path> scheduler = new WorkScheduler<>(config.scheduler(), monitor, SizeEstimator.fileSize());

        BatchProcessingResult<ChecksumOutput> result = processor.processScheduled(
                files, scheduler, new ChecksumTransform(), ChecksumAlgorithm.CRC32);

        assertEquals(12, result.successful());
        assertEquals(0, result.failed());
        Map<Path, ChecksumOutput> byPath = result.outputs().stream()
                .collect(Collectors.toMap(ChecksumOutput::input, Function.identity()));
        for (Path file : files) {
            CRC32 expected = new CRC32();
            expected.update(Files.readAllBytes(file));
            assertEquals(expected.getValue(), byPath.get(file).checksum(), file.toString());
        }
        assertEquals(78_000, result.totalInputBytes());

        SchedulerStats stats = scheduler.getStats();
        assertEquals(12, stats.jobsQueued());
        assertEquals(12, stats.jobsCompleted());
        assertEquals(0, monitor.currentUsage());
        assertEquals(config.scheduler().maxConcurrent(), scheduler.availableSlots());
        assertTrue(scheduler.getQueueStatus().isEmpty());
    }

    @Test
    @DisplayName("Should report files that vanish before admission")
    void shouldReportMissingFiles() throws IOException {
        Path present = Files.write(dir.resolve("present.bin"), new byte[]{1, 2, 3});
        Path missing = dir.resolve("missing.bin");
        WorkScheduler<Path> scheduler = new WorkScheduler<>(config.scheduler(), monitor, SizeEstimator.fileSize());

        BatchProcessingResult<ChecksumOutput> result = processor.processScheduled(
                List.of(present, missing), scheduler, new ChecksumTransform(), ChecksumAlgorithm.CRC32);

        assertEquals(1, result.successful());
        assertEquals(1, result.failed());
        assertEquals(2, processor.getProgress().processedItems());
    }
}
