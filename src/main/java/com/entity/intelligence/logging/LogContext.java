package com.entity.intelligence.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBuild(buildId)) {
 *     log.info("graph.build.completed entities={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a full artifact build.
     */
    public static LogContext forBuild(String buildId) {
        LogContext ctx = new LogContext();
        ctx.put("buildId", buildId);
        ctx.put("operation", "build");
        return ctx;
    }

    /**
     * Creates a log context for one analyzer pass over the corpus.
     */
    public static LogContext forAnalyzer(String analyzer) {
        LogContext ctx = new LogContext();
        ctx.put("analyzer", analyzer);
        ctx.put("operation", "analyze");
        return ctx;
    }

    public static String generateBuildId() {
        return UUID.randomUUID().toString();
    }

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
