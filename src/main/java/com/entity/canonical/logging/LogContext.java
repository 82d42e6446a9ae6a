package com.entity.canonical.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC entries scoped to a try-with-resources block.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forDocument(runId, documentId)) {
 *     log.info("document.ingested created={} merged={}", created, merged);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "ingest-run");
        return ctx;
    }

    public static LogContext forDocument(String runId, String documentId) {
        LogContext ctx = new LogContext();
        if (runId != null) {
            ctx.put("runId", runId);
        }
        ctx.put("documentId", documentId);
        ctx.put("operation", "ingest-document");
        return ctx;
    }

    public static LogContext forReview(String linkId, String reviewerId) {
        LogContext ctx = new LogContext();
        ctx.put("candidateLinkId", linkId);
        ctx.put("reviewerId", reviewerId);
        ctx.put("operation", "review");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value != null && value.equals(MDC.get(key))) {
            // owned by an enclosing context
            return;
        }
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
