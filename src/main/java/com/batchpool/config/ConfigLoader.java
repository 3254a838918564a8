package com.batchpool.config;

import com.batchpool.exception.ConfigurationException;
import com.batchpool.processor.ProcessingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;

/**
 * Loads batch-pool configuration from YAML files.
 * <p>
 * Expected layout (every key optional):
 * <pre>
 * batch-pool:
 *   name: images
 *   scheduler:
 *     max-concurrent: 8
 *     target-memory-usage: 75.0
 *     large-file-threshold: 52428800
 *     max-wait-seconds: 300
 *   memory:
 *     limit-mb: 4096
 *   processor:
 *     strategy: AUTO
 *   optimizer:
 *     enabled: true
 *     interval-seconds: 60
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static BatchPoolConfig load(String path) {
        log.info("Loading batch-pool configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parse(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse configuration from a YAML stream.
     */
    @SuppressWarnings("unchecked")
    public static BatchPoolConfig parse(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Configuration is not a valid YAML mapping", e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The section may sit at the root or under 'batch-pool'
        Map<String, Object> poolMap = root.containsKey("batch-pool")
                ? section(root, "batch-pool")
                : root;

        BatchPoolConfig defaults = BatchPoolConfig.defaults();
        String name = getString(poolMap, "name", defaults.name());
        SchedulerConfig scheduler = parseScheduler(section(poolMap, "scheduler"), defaults.scheduler());
        MemoryConfig memory = parseMemory(section(poolMap, "memory"));
        ProcessorConfig processor = parseProcessor(section(poolMap, "processor"), defaults.processor());
        OptimizerConfig optimizer = parseOptimizer(section(poolMap, "optimizer"), defaults.optimizer());

        BatchPoolConfig config = new BatchPoolConfig(name, scheduler, memory, processor, optimizer);

        log.info("Loaded batch-pool configuration: {} (maxConcurrent={}, targetMemory={}%, memoryLimit={}, strategy={}, optimizer={})",
                name, scheduler.maxConcurrent(), scheduler.targetMemoryUsage(),
                memory.isAutoDetect() ? "auto" : memory.limitMb() + "MB",
                processor.strategy(), optimizer.enabled() ? "on" : "off");

        return config;
    }

    private static SchedulerConfig parseScheduler(Map<String, Object> map, SchedulerConfig defaults) {
        if (map == null) {
            return defaults;
        }
        return new SchedulerConfig(
                getInt(map, "max-concurrent", defaults.maxConcurrent()),
                getDouble(map, "target-memory-usage", defaults.targetMemoryUsage()),
                getInt(map, "batch-size", defaults.batchSize()),
                getLong(map, "large-file-threshold", defaults.largeFileThreshold()),
                getLong(map, "small-file-threshold", defaults.smallFileThreshold()),
                getInt(map, "large-file-priority-boost", defaults.largeFilePriorityBoost()),
                Duration.ofSeconds(getLong(map, "max-wait-seconds", defaults.maxWaitTime().toSeconds())),
                Duration.ofSeconds(getLong(map, "memory-wait-seconds", defaults.memoryWaitTime().toSeconds())),
                Duration.ofMillis(getLong(map, "memory-check-interval-ms", defaults.memoryCheckInterval().toMillis())),
                getLong(map, "memory-multiplier", defaults.memoryMultiplier())
        );
    }

    private static MemoryConfig parseMemory(Map<String, Object> map) {
        if (map == null) {
            return MemoryConfig.autoDetect();
        }
        return new MemoryConfig(getLong(map, "limit-mb", 0));
    }

    private static ProcessorConfig parseProcessor(Map<String, Object> map, ProcessorConfig defaults) {
        if (map == null) {
            return defaults;
        }
        String strategyStr = getString(map, "strategy", defaults.strategy().name());
        ProcessingStrategy strategy;
        try {
            strategy = ProcessingStrategy.valueOf(strategyStr.toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown processing strategy: " + strategyStr, e);
        }
        return new ProcessorConfig(
                getInt(map, "max-concurrent", defaults.maxConcurrent()),
                strategy,
                Duration.ofMillis(getLong(map, "chunk-pause-ms", defaults.chunkPause().toMillis())),
                getInt(map, "progress-buffer", defaults.progressBufferSize()),
                getString(map, "thread-name-prefix", defaults.threadNamePrefix())
        );
    }

    private static OptimizerConfig parseOptimizer(Map<String, Object> map, OptimizerConfig defaults) {
        if (map == null) {
            return defaults;
        }
        return new OptimizerConfig(
                getBoolean(map, "enabled", defaults.enabled()),
                Duration.ofSeconds(getLong(map, "interval-seconds", defaults.interval().toSeconds())),
                getLong(map, "pressure-threshold", defaults.pressureThreshold()),
                getDouble(map, "throughput-threshold", defaults.throughputThreshold()),
                getInt(map, "max-concurrent-cap", defaults.maxConcurrentCap()),
                getDouble(map, "reduced-memory-target", defaults.reducedMemoryTarget())
        );
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for '" + key + "': " + value, e);
        }
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number for '" + key + "': " + value, e);
        }
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid decimal for '" + key + "': " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
