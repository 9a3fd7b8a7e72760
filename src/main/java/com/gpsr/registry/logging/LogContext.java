package com.gpsr.registry.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging of registry operations.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forAggregate("Entity", entityId, "update")) {
 *     log.info("version.created versionNumber={}", number);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for an operation on one aggregate.
     */
    public static LogContext forAggregate(String aggregateType, String aggregateId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("aggregateType", aggregateType);
        ctx.put("aggregateId", aggregateId != null ? aggregateId : "new");
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Creates a log context for a responsibility resolution.
     */
    public static LogContext forResolution(String productId, String countryCode) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("productId", productId);
        ctx.put("countryCode", countryCode);
        ctx.put("operation", "resolve");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
