package com.profile.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forMatch(correlationId, personId)) {
 *     log.info("match.completed results={}", results.size());
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one matching request.
     */
    public static LogContext forMatch(String correlationId, String personId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("personId", personId);
        ctx.put("operation", "match");
        return ctx;
    }

    /**
     * Creates a log context for work on one candidate, typically on a worker thread.
     */
    public static LogContext forCandidate(String candidateId) {
        LogContext ctx = new LogContext();
        ctx.put("candidateId", candidateId);
        return ctx;
    }

    /**
     * Restores a captured MDC map (see {@link MDC#getCopyOfContextMap()}) on the current thread.
     * Keys already present are left untouched.
     */
    public static LogContext restore(Map<String, String> captured) {
        LogContext ctx = new LogContext();
        if (captured != null) {
            for (Map.Entry<String, String> entry : captured.entrySet()) {
                if (MDC.get(entry.getKey()) == null) {
                    ctx.put(entry.getKey(), entry.getValue());
                }
            }
        }
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
