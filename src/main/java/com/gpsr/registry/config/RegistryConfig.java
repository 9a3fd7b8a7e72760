package com.gpsr.registry.config;

import com.gpsr.registry.source.SourceCacheConfig;
import com.gpsr.registry.store.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Top-level configuration of the registry core.
 *
 * @param retry                 retry-on-conflict strategy for version numbering and find-or-create
 * @param sourceCache           source lookup cache settings
 * @param duplicateSuffixLength number of trailing identifier characters compared by the duplicate heuristic
 * @param defaultConfidence     confidence assigned to claims and responsibilities submitted without one
 * @param defaultPageLimit      page size used when a listing does not ask for one
 * @param maxPageLimit          upper bound on any requested page size
 */
public record RegistryConfig(
        RetryConfig retry,
        SourceCacheConfig sourceCache,
        int duplicateSuffixLength,
        int defaultConfidence,
        int defaultPageLimit,
        int maxPageLimit
) {
    private static final Logger log = LoggerFactory.getLogger(RegistryConfig.class);

    public static final String RESOURCE_NAME = "gpsr-registry.properties";

    public RegistryConfig {
        Objects.requireNonNull(retry, "retry is required");
        Objects.requireNonNull(sourceCache, "sourceCache is required");
        if (duplicateSuffixLength <= 0) {
            throw new IllegalArgumentException("duplicateSuffixLength must be > 0");
        }
        if (defaultConfidence < 0 || defaultConfidence > 100) {
            throw new IllegalArgumentException("defaultConfidence must be between 0 and 100");
        }
        if (defaultPageLimit <= 0) {
            throw new IllegalArgumentException("defaultPageLimit must be > 0");
        }
        if (maxPageLimit < defaultPageLimit) {
            throw new IllegalArgumentException("maxPageLimit must be >= defaultPageLimit");
        }
    }

    public static RegistryConfig defaults() {
        return new RegistryConfig(RetryConfig.defaults(), SourceCacheConfig.defaults(), 8, 50, 20, 100);
    }

    /**
     * Reads the configuration from properties. Missing keys keep their defaults.
     */
    public static RegistryConfig fromProperties(Properties props) {
        RegistryConfig d = defaults();
        RetryConfig retry = new RetryConfig(
                intValue(props, "gpsr.retry.max-attempts", d.retry().maxAttempts()),
                longValue(props, "gpsr.retry.initial-backoff-ms", d.retry().initialBackoffMs()),
                doubleValue(props, "gpsr.retry.multiplier", d.retry().multiplier()));
        SourceCacheConfig cache = new SourceCacheConfig(
                intValue(props, "gpsr.sources.cache-size", d.sourceCache().maxSize()),
                intValue(props, "gpsr.sources.cache-ttl-seconds", d.sourceCache().ttlSeconds()),
                Boolean.parseBoolean(props.getProperty("gpsr.sources.cache-enabled",
                        String.valueOf(d.sourceCache().enabled()))));
        return new RegistryConfig(
                retry,
                cache,
                intValue(props, "gpsr.duplicates.suffix-length", d.duplicateSuffixLength()),
                intValue(props, "gpsr.claims.default-confidence", d.defaultConfidence()),
                intValue(props, "gpsr.pagination.default-limit", d.defaultPageLimit()),
                intValue(props, "gpsr.pagination.max-limit", d.maxPageLimit()));
    }

    /**
     * Loads {@value #RESOURCE_NAME} from the classpath, or returns the defaults when
     * the resource is absent.
     */
    public static RegistryConfig load() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = RegistryConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                log.info("No {} on classpath, using default registry configuration", RESOURCE_NAME);
                return defaults();
            }
            Properties props = new Properties();
            props.load(in);
            RegistryConfig config = fromProperties(props);
            log.info("Registry configuration loaded: retry.maxAttempts={}, duplicates.suffixLength={}",
                    config.retry().maxAttempts(), config.duplicateSuffixLength());
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
    }

    private static int intValue(Properties props, String key, int fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static long longValue(Properties props, String key, long fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static double doubleValue(Properties props, String key, double fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }
}
