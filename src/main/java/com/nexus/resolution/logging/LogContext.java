package com.nexus.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for one resolution, merge or review decision.
 * Entries are removed when the context is closed.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(correlationId, ingestionId, "PERSON")) {
 *     log.info("resolution.decided decision={}", decision);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String INGESTION_ID = "ingestionId";
    public static final String ENTITY_TYPE = "entityType";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forResolution(String correlationId, String ingestionId, String entityType) {
        return new LogContext()
                .with(CORRELATION_ID, correlationId)
                .with(INGESTION_ID, ingestionId)
                .with(ENTITY_TYPE, entityType)
                .with(OPERATION, "resolve");
    }

    public static LogContext forMerge(String correlationId, String sourceId, String targetId) {
        return new LogContext()
                .with(CORRELATION_ID, correlationId)
                .with("sourceId", sourceId)
                .with("targetId", targetId)
                .with(OPERATION, "merge");
    }

    public static LogContext forReview(String reviewItemId, String actorId) {
        return new LogContext()
                .with(CORRELATION_ID, generateCorrelationId())
                .with("reviewItemId", reviewItemId)
                .with("actorId", actorId)
                .with(OPERATION, "review");
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an entry; null values are skipped.
     */
    public LogContext with(String key, String value) {
        if (value != null) {
            keys.add(key);
            MDC.put(key, value);
        }
        return this;
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
