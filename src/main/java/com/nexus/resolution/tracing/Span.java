package com.nexus.resolution.tracing;

/**
 * A traced unit of work, ended on {@link #close()}.
 *
 * <pre>
 * try (Span span = tracing.startSpan(TracingService.MERGE, Map.of("targetId", targetId))) {
 *     span.setAttribute("attempts", 1L);
 *     span.setStatus(Span.SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
