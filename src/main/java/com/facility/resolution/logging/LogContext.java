package com.facility.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMatch(correlationId, facilityId)) {
 *     log.info("Found {} candidates", candidates.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for duplicate detection of a single query record.
     */
    public static LogContext forMatch(String correlationId, String facilityId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("facilityId", facilityId);
        ctx.put("operation", "match");
        return ctx;
    }

    /**
     * Context for a pass over a batch of records (grouping, deduplication, slug assignment).
     */
    public static LogContext forBatch(String batchId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Context for folding one duplicate group into its survivor.
     */
    public static LogContext forMerge(String correlationId, String survivorId, int groupSize) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("survivorId", survivorId);
        ctx.put("groupSize", Integer.toString(groupSize));
        ctx.put("operation", "merge");
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
