package com.content.reconciliation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forFold(correlationId, records.size())) {
 *     log.info("fold.completed recordsFolded={}", folded);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for folding a batch of raw records.
     */
    public static LogContext forFold(String correlationId, int recordCount) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("recordCount", String.valueOf(recordCount));
        ctx.put("operation", "fold");
        return ctx;
    }

    /**
     * Creates a log context for a candidate matching run.
     */
    public static LogContext forMatch(String correlationId, int videoCount, int counterpartCount) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("videoCount", String.valueOf(videoCount));
        ctx.put("counterpartCount", String.valueOf(counterpartCount));
        ctx.put("operation", "match");
        return ctx;
    }

    /**
     * Creates a log context for a workflow commit.
     */
    public static LogContext forCommit(String correlationId, String stage) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("stage", stage);
        ctx.put("operation", "commit");
        return ctx;
    }

    /**
     * Creates a log context for consolidating two entities.
     */
    public static LogContext forConsolidation(String correlationId, String keepId, String discardId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("keepEntityId", keepId);
        ctx.put("discardEntityId", discardId);
        ctx.put("operation", "consolidate");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
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
