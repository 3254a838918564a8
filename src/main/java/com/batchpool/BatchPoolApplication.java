package com.batchpool;

import com.batchpool.memory.MemoryPool;
import com.batchpool.processor.BatchProcessingResult;
import com.batchpool.processor.ParallelProcessor;
import com.batchpool.progress.LoggingProgressReporter;
import com.batchpool.scheduler.SchedulerStats;
import com.batchpool.scheduler.WorkScheduler;
import com.batchpool.spring.EnableBatchPool;
import com.batchpool.transform.ChecksumAlgorithm;
import com.batchpool.transform.ChecksumOutput;
import com.batchpool.transform.ChecksumTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Example Spring Boot application: checksums every regular file of a directory
 * through the scheduler and logs the batch summary.
 * <p>
 * Usage: {@code java -jar batch-pool.jar [directory]} (defaults to the working directory).
 */
@SpringBootApplication
@EnableBatchPool
public class BatchPoolApplication {

    private static final Logger log = LoggerFactory.getLogger(BatchPoolApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(BatchPoolApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(WorkScheduler<Path> workScheduler,
                                  ParallelProcessor parallelProcessor,
                                  MemoryPool memoryPool) {
        return args -> {
            Path directory = Paths.get(args.length > 0 ? args[0] : ".");
            log.info("=== Batch Pool Demo Started: {} ===", directory.toAbsolutePath());

            List<Path> files;
            try (Stream<Path> listing = Files.list(directory)) {
                files = listing.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
            }
            log.info("Found {} files", files.size());

            BatchProcessingResult<ChecksumOutput> result;
            try (LoggingProgressReporter reporter =
                         new LoggingProgressReporter(parallelProcessor.getProgressTracker(), true)) {
                reporter.start();
                result = parallelProcessor.processScheduled(
                        files, workScheduler, new ChecksumTransform(), ChecksumAlgorithm.CRC32);
                reporter.awaitTermination(Duration.ofSeconds(5));
            }

            for (ChecksumOutput output : result.outputs()) {
                log.info("{}  {}", output.hexChecksum(), output.input().getFileName());
            }
            log.info("\n{}", result.summary());

            SchedulerStats stats = workScheduler.getStats();
            log.info("Scheduler: queued={}, completed={}, failed={}, pressureEvents={}, throughput={} items/sec",
                    stats.jobsQueued(), stats.jobsCompleted(), stats.jobsFailed(),
                    stats.memoryPressureEvents(), String.format("%.2f", stats.throughputItemsPerSecond()));
            log.info("Buffer pool: {}", memoryPool.getStats());
            log.info("=== Batch Pool Demo Completed ===");
        };
    }
}
