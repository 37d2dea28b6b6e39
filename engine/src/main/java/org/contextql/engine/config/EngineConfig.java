package org.contextql.engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Engine tunables.
 *
 * Values come from {@code contextql.properties} on the classpath and can be
 * overridden per JVM with system properties of the same name.
 *
 * @param cacheTtl         Result lifetime when a context does not set its own
 * @param cacheMaxEntries  Cache size bound; oldest entries go first
 * @param executionTimeout Default bound on a single store query
 * @param historySize      Execution records kept in memory
 */
public record EngineConfig(Duration cacheTtl, int cacheMaxEntries, Duration executionTimeout, int historySize) {

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfig.class);

    public static final String RESOURCE = "contextql.properties";

    public static final String CACHE_TTL_SECONDS = "contextql.cache.ttl-seconds";
    public static final String CACHE_MAX_ENTRIES = "contextql.cache.max-entries";
    public static final String EXECUTION_TIMEOUT_SECONDS = "contextql.execution.timeout-seconds";
    public static final String HISTORY_SIZE = "contextql.history.size";

    public static final EngineConfig DEFAULTS = new EngineConfig(Duration.ofSeconds(3600), 1000,
            Duration.ofSeconds(30), 500);

    public EngineConfig {
        if (cacheTtl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL cannot be negative: " + cacheTtl);
        }
        if (cacheMaxEntries <= 0) {
            throw new IllegalArgumentException("Cache max entries must be positive: " + cacheMaxEntries);
        }
        if (executionTimeout.isNegative() || executionTimeout.isZero()) {
            throw new IllegalArgumentException("Execution timeout must be positive: " + executionTimeout);
        }
        if (historySize < 0) {
            throw new IllegalArgumentException("History size cannot be negative: " + historySize);
        }
    }

    /**
     * Loads the classpath resource, then applies system property overrides.
     */
    public static EngineConfig load() {
        Properties properties = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                LOGGER.debug("No {} on classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE, e);
        }
        for (String name : new String[] {CACHE_TTL_SECONDS, CACHE_MAX_ENTRIES, EXECUTION_TIMEOUT_SECONDS,
                HISTORY_SIZE}) {
            String override = System.getProperty(name);
            if (override != null) {
                properties.setProperty(name, override);
            }
        }
        return from(properties);
    }

    public static EngineConfig from(Properties properties) {
        return new EngineConfig(
                Duration.ofSeconds(longValue(properties, CACHE_TTL_SECONDS, DEFAULTS.cacheTtl.getSeconds())),
                (int) longValue(properties, CACHE_MAX_ENTRIES, DEFAULTS.cacheMaxEntries),
                Duration.ofSeconds(longValue(properties, EXECUTION_TIMEOUT_SECONDS,
                        DEFAULTS.executionTimeout.getSeconds())),
                (int) longValue(properties, HISTORY_SIZE, DEFAULTS.historySize));
    }

    private static long longValue(Properties properties, String name, long fallback) {
        String value = properties.getProperty(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + name + " must be an integer, got '" + value + "'", e);
        }
    }
}
