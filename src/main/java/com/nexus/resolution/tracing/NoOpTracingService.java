package com.nexus.resolution.tracing;

import java.util.Map;

/**
 * Default when no tracer is configured. Every call returns the same inert span.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return InertSpan.INSTANCE;
    }

    private enum InertSpan implements Span {
        INSTANCE;

        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setAttribute(String key, double value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    }
}
