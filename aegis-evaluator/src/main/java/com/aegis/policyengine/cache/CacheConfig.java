package com.aegis.policyengine.cache;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Configuration for {@link CompiledEvaluatorCache}.
 *
 * <p><b>Environment Variable Override:</b>
 * <pre>
 * AEGIS_CACHE_CAPACITY=256
 * AEGIS_CACHE_RECORD_METRICS=false
 * </pre>
 *
 * <p><b>Example aegis.properties:</b>
 * <pre>
 * cache.capacity=256
 * cache.record.metrics=true
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * CacheConfig config = CacheConfig.builder()
 *     .capacity(512)
 *     .recordMetrics(true)
 *     .build();
 * }</pre>
 */
public final class CacheConfig {

    private static final Logger logger = Logger.getLogger(CacheConfig.class.getName());

    public static final int DEFAULT_CAPACITY = 128;
    public static final String DEFAULT_PROPERTIES = "aegis.properties";

    private static final String ENV_CAPACITY = "AEGIS_CACHE_CAPACITY";
    private static final String ENV_RECORD_METRICS = "AEGIS_CACHE_RECORD_METRICS";

    private final int capacity;
    private final boolean recordMetrics;

    private CacheConfig(Builder builder) {
        this.capacity = builder.capacity;
        this.recordMetrics = builder.recordMetrics;
    }

    public static CacheConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by any {@code AEGIS_CACHE_*} environment variables that are set.
     */
    public static CacheConfig fromEnvironment() {
        return builder()
                .capacity(getEnvInt(ENV_CAPACITY, DEFAULT_CAPACITY))
                .recordMetrics(getEnvBoolean(ENV_RECORD_METRICS, true))
                .build();
    }

    /**
     * Loads configuration from {@code aegis.properties} on the classpath, falling back to
     * {@link #fromEnvironment()} when the file is absent.
     */
    public static CacheConfig load() {
        try {
            return loadFromProperties(DEFAULT_PROPERTIES);
        } catch (IOException e) {
            logger.fine("No " + DEFAULT_PROPERTIES + " found, using environment: " + e.getMessage());
            return fromEnvironment();
        }
    }

    /**
     * Loads configuration from a properties file on the classpath, then the filesystem.
     * Environment variables take precedence over file values.
     */
    public static CacheConfig loadFromProperties(String resource) throws IOException {
        Properties props = new Properties();
        try (InputStream in = CacheConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                props.load(in);
            } else {
                Path file = Paths.get(resource);
                if (!Files.exists(file)) {
                    throw new IOException("Configuration not found: " + resource);
                }
                try (InputStream fileIn = Files.newInputStream(file)) {
                    props.load(fileIn);
                }
            }
        }
        int capacity = parseInt("cache.capacity", props.getProperty("cache.capacity"), DEFAULT_CAPACITY);
        boolean recordMetrics = Boolean.parseBoolean(props.getProperty("cache.record.metrics", "true").trim());
        CacheConfig config = builder()
                .capacity(getEnvInt(ENV_CAPACITY, capacity))
                .recordMetrics(getEnvBoolean(ENV_RECORD_METRICS, recordMetrics))
                .build();
        logger.info("Loaded cache configuration from " + resource + ": " + config);
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int capacity() {
        return capacity;
    }

    public boolean recordMetrics() {
        return recordMetrics;
    }

    @Override
    public String toString() {
        return String.format("CacheConfig{capacity=%d, recordMetrics=%s}", capacity, recordMetrics);
    }

    private static int getEnvInt(String key, int defaultValue) {
        return parseInt(key, System.getenv(key), defaultValue);
    }

    private static boolean getEnvBoolean(String key, boolean defaultValue) {
        String value = System.getenv(key);
        return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    private static int parseInt(String key, String value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.log(Level.WARNING, "Invalid " + key + "='" + value + "', using " + defaultValue, e);
            return defaultValue;
        }
    }

    public static final class Builder {
        private int capacity = DEFAULT_CAPACITY;
        private boolean recordMetrics = true;

        private Builder() {
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder recordMetrics(boolean recordMetrics) {
            this.recordMetrics = recordMetrics;
            return this;
        }

        public CacheConfig build() {
            if (capacity <= 0) {
                throw new IllegalArgumentException("capacity must be positive: " + capacity);
            }
            return new CacheConfig(this);
        }
    }
}
