package com.spending.fraud.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRule(runId, "contract_splitting")) {
 *     log.info("rule.finished alerts={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a whole detection run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "detect");
        return ctx;
    }

    /**
     * Context for a single rule execution inside a run.
     */
    public static LogContext forRule(String runId, String ruleName) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("rule", ruleName);
        ctx.put("operation", "rule");
        return ctx;
    }

    /**
     * Context for a matching batch.
     */
    public static LogContext forBatch(String matchId, int batchIndex) {
        LogContext ctx = new LogContext();
        ctx.put("matchId", matchId);
        ctx.put("batchIndex", Integer.toString(batchIndex));
        ctx.put("operation", "match");
        return ctx;
    }

    /**
     * Generates a unique run or match id.
     */
    public static String generateId() {
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
