package com.nexus.resolution.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.Objects;

/**
 * {@link TracingService} over the OpenTelemetry API. Resolution spans are internal spans,
 * started as children of the current OpenTelemetry context.
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        builder.setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            attributes.forEach((key, value) -> {
                if (value != null) {
                    builder.setAttribute(key, value);
                }
            });
        }
        return new ResolutionSpan(builder.startSpan());
    }

    private record ResolutionSpan(io.opentelemetry.api.trace.Span delegate) implements Span {

        @Override
        public void setAttribute(String key, String value) {
            if (value != null) {
                delegate.setAttribute(key, value);
            }
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, double value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
