package com.aegis.policyengine.compiler;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Configuration for {@link PolicyCompiler}.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>AEGIS_COMPILER_QUANTIFIERS - compile forall/exists clauses (default: false)</li>
 *   <li>AEGIS_COMPILER_PATTERN_CACHE_SIZE - compiled regex patterns shared across policies (default: 1024)</li>
 * </ul>
 *
 * <h2>Properties</h2>
 * {@code compiler.quantifiers}, {@code compiler.pattern.cache.size}
 */
public final class CompilerConfig {

    private static final Logger logger = Logger.getLogger(CompilerConfig.class.getName());

    private final boolean quantifierCompilation;
    private final int patternCacheSize;

    private CompilerConfig(Builder builder) {
        this.quantifierCompilation = builder.quantifierCompilation;
        this.patternCacheSize = builder.patternCacheSize;
    }

    public static CompilerConfig defaults() {
        return builder().build();
    }

    public static CompilerConfig fromEnvironment() {
        return builder()
                .quantifierCompilation(getEnvBoolean("AEGIS_COMPILER_QUANTIFIERS", false))
                .patternCacheSize(getEnvInt("AEGIS_COMPILER_PATTERN_CACHE_SIZE", 1024))
                .build();
    }

    /**
     * Loads configuration from a properties file on the classpath, then the filesystem.
     * Missing keys keep their defaults.
     */
    public static CompilerConfig loadFromProperties(String resource) throws IOException {
        Properties props = new Properties();
        try (InputStream in = CompilerConfig.class.getClassLoader().getResourceAsStream(resource)) {
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
        return builder()
                .quantifierCompilation(Boolean.parseBoolean(props.getProperty("compiler.quantifiers", "false")))
                .patternCacheSize(Integer.parseInt(props.getProperty("compiler.pattern.cache.size", "1024").trim()))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean quantifierCompilation() {
        return quantifierCompilation;
    }

    public int patternCacheSize() {
        return patternCacheSize;
    }

    @Override
    public String toString() {
        return String.format("CompilerConfig{quantifiers=%s, patternCacheSize=%d}",
                quantifierCompilation, patternCacheSize);
    }

    private static boolean getEnvBoolean(String key, boolean defaultValue) {
        String value = System.getenv(key);
        return value != null ? Boolean.parseBoolean(value) : defaultValue;
    }

    private static int getEnvInt(String key, int defaultValue) {
        String value = System.getenv(key);
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
        private boolean quantifierCompilation = false;
        private int patternCacheSize = 1024;

        private Builder() {
        }

        public Builder quantifierCompilation(boolean enabled) {
            this.quantifierCompilation = enabled;
            return this;
        }

        public Builder patternCacheSize(int size) {
            this.patternCacheSize = size;
            return this;
        }

        public CompilerConfig build() {
            if (patternCacheSize <= 0) {
                throw new IllegalArgumentException("patternCacheSize must be positive: " + patternCacheSize);
            }
            return new CompilerConfig(this);
        }
    }
}
