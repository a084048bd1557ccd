package com.umitunal.tenantq.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Application settings read from {@code tenantq.properties} on the classpath,
 * overridden by environment variables.
 */
public class AppConfig {
    public static final String RESOURCE = "tenantq.properties";

    static final String DATA_DIR = "TENANTQ_DATA_DIR";
    static final String MAX_ATTEMPTS = "MAX_ATTEMPTS";
    static final String DEQUEUE_TIMEOUT_MS = "DEQUEUE_TIMEOUT_MS";
    static final String WORKER_POOL_SIZE = "WORKER_POOL_SIZE";
    static final String BUS_BUFFER_SIZE = "BUS_BUFFER_SIZE";
    static final String DURABLE_WRITES = "DURABLE_WRITES";

    private final StorageConfig storageConfig;
    private final WorkerConfig workerConfig;
    private final int busBufferSize;

    private AppConfig(StorageConfig storageConfig, WorkerConfig workerConfig, int busBufferSize) {
        this.storageConfig = storageConfig;
        this.workerConfig = workerConfig;
        this.busBufferSize = busBufferSize;
    }

    public StorageConfig getStorageConfig() { return storageConfig; }
    public WorkerConfig getWorkerConfig() { return workerConfig; }
    public int getBusBufferSize() { return busBufferSize; }

    /**
     * Load from the classpath resource and the process environment.
     */
    public static AppConfig load() {
        return load(readResource(), System.getenv());
    }

    /**
     * Resolve settings from explicit sources. Environment entries win.
     */
    public static AppConfig load(Properties defaults, Map<String, String> env) {
        Properties merged = new Properties();
        merged.putAll(defaults);
        for (String key : new String[]{DATA_DIR, MAX_ATTEMPTS, DEQUEUE_TIMEOUT_MS,
                WORKER_POOL_SIZE, BUS_BUFFER_SIZE, DURABLE_WRITES}) {
            String value = env.get(key);
            if (value != null && !value.isBlank()) {
                merged.setProperty(key, value.trim());
            }
        }

        StorageConfig storage = StorageConfig.newBuilder(merged.getProperty(DATA_DIR, "./data"))
                .withDurableWrites(Boolean.parseBoolean(merged.getProperty(DURABLE_WRITES, "true")))
                .build();

        WorkerConfig worker = WorkerConfig.newBuilder()
                .withMaxAttempts(intValue(merged, MAX_ATTEMPTS, 3))
                .withDequeueTimeout(Duration.ofMillis(intValue(merged, DEQUEUE_TIMEOUT_MS, 5000)))
                .withPoolSize(intValue(merged, WORKER_POOL_SIZE, 1))
                .build();

        return new AppConfig(storage, worker, intValue(merged, BUS_BUFFER_SIZE, 1024));
    }

    private static int intValue(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static Properties readResource() {
        Properties props = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return props;
    }
}
