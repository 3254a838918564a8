package com.batchpool.adapter.spring;

import com.batchpool.config.BatchPoolConfig;
import com.batchpool.config.ConfigLoader;
import com.batchpool.memory.MemoryMonitor;
import com.batchpool.memory.MemoryPool;
import com.batchpool.memory.SystemMemory;
import com.batchpool.processor.ParallelProcessor;
import com.batchpool.progress.ProgressTracker;
import com.batchpool.scheduler.SchedulerOptimizer;
import com.batchpool.scheduler.SizeEstimator;
import com.batchpool.scheduler.WorkScheduler;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring Boot auto-configuration for batch-pool.
 * Builds the memory monitor, buffer pool, file scheduler, optimizer and processor
 * from the YAML file named by {@code batch-pool.config-path}.
 */
@Configuration
@ConditionalOnProperty(prefix = "batch-pool", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(BatchPoolProperties.class)
public class BatchPoolAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BatchPoolAutoConfiguration.class);

    private ParallelProcessor parallelProcessor;
    private SchedulerOptimizer schedulerOptimizer;

    @Bean
    @ConditionalOnMissingBean
    public BatchPoolConfig batchPoolConfig(BatchPoolProperties properties) {
        log.info("Loading batch-pool configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public MemoryMonitor memoryMonitor(BatchPoolConfig config) {
        if (config.memory().isAutoDetect()) {
            return MemoryMonitor.autoDetect(SystemMemory.host());
        }
        return MemoryMonitor.ofMegabytes(config.memory().limitMb());
    }

    @Bean
    @ConditionalOnMissingBean
    public MemoryPool memoryPool() {
        return new MemoryPool();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProgressTracker progressTracker(BatchPoolConfig config) {
        return new ProgressTracker(config.processor().progressBufferSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkScheduler<Path> workScheduler(BatchPoolConfig config, MemoryMonitor memoryMonitor) {
        log.info("Creating WorkScheduler: {}", config.name());
        return new WorkScheduler<>(config.scheduler(), memoryMonitor, SizeEstimator.fileSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerOptimizer schedulerOptimizer(BatchPoolConfig config, WorkScheduler<Path> workScheduler) {
        this.schedulerOptimizer = new SchedulerOptimizer(workScheduler, config.optimizer());
        if (config.optimizer().enabled()) {
            schedulerOptimizer.start();
        }
        return schedulerOptimizer;
    }

    @Bean
    @ConditionalOnMissingBean
    public ParallelProcessor parallelProcessor(BatchPoolConfig config,
                                               MemoryPool memoryPool,
                                               ProgressTracker progressTracker) {
        log.info("Creating ParallelProcessor: {}", config.name());
        this.parallelProcessor = new ParallelProcessor(config.processor(), memoryPool, progressTracker,
                SystemMemory.host());
        return this.parallelProcessor;
    }

    @PreDestroy
    public void shutdown() {
        if (schedulerOptimizer != null) {
            schedulerOptimizer.close();
        }
        if (parallelProcessor != null && !parallelProcessor.isShutdown()) {
            log.info("Shutting down ParallelProcessor");
            parallelProcessor.close();
        }
    }
}
