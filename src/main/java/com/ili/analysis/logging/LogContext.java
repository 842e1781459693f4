package com.ili.analysis.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forAnalysis(analysisId, "RUN_2015", "RUN_2022")) {
 *     log.info("matching.completed matched={} missing={}", matched, missing);
 * } // MDC entries are cleared here
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a two-survey analysis.
     */
    public static LogContext forAnalysis(String analysisId, String runA, String runB) {
        LogContext ctx = new LogContext();
        ctx.put("analysisId", analysisId);
        ctx.put("runA", runA);
        ctx.put("runB", runB);
        ctx.put("operation", "analyze");
        return ctx;
    }

    /**
     * Creates a log context for a multi-survey tracking run.
     */
    public static LogContext forMultiRun(String analysisId, List<String> runIds) {
        LogContext ctx = new LogContext();
        ctx.put("analysisId", analysisId);
        ctx.put("runs", String.join(",", runIds));
        ctx.put("operation", "multirun");
        return ctx;
    }

    /**
     * Generates a unique analysis ID.
     */
    public static String generateAnalysisId() {
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
