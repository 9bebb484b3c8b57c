package com.nexus.resolution.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan(TracingService.RESOLVE, Map.of("ingestionId", "ing-1"))) {
                    span.setAttribute("outcome", "MERGED");
                    span.setAttribute("attempts", 2L);
                    span.setAttribute("topScore", 0.91);
                    span.setStatus(Span.SpanStatus.OK);
                    span.recordException(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan(TracingService.MERGE, Map.of()), noOp.startSpan(TracingService.ADJUDICATE, null));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.setAttribute(anyString(), anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Should create span with the operation name and initial attributes")
        void createSpan() {
            Span span = service.startSpan(TracingService.RESOLVE, Map.of("entityType", "PERSON"));

            assertNotNull(span);
            verify(tracer).spanBuilder("resolution.resolve");
            verify(builder).setAttribute("entityType", "PERSON");
            verify(builder).startSpan();
        }

        @Test
        @DisplayName("Should start internal spans and drop null initial attributes")
        void internalSpanWithoutNullAttributes() {
            Map<String, String> attributes = new HashMap<>();
            attributes.put("targetId", "c-1");
            attributes.put("sourceId", null);

            service.startSpan(TracingService.MERGE, attributes);

            verify(builder).setSpanKind(SpanKind.INTERNAL);
            verify(builder).setAttribute("targetId", "c-1");
            verify(builder, never()).setAttribute(eq("sourceId"), nullable(String.class));
        }

        @Test
        @DisplayName("Should forward attributes and skip null strings")
        void setAttributes() {
            Span span = service.startSpan(TracingService.MERGE, Map.of());
            span.setAttribute("survivorId", "c-1");
            span.setAttribute("attempts", 3L);
            span.setAttribute("topScore", 0.75);
            span.setAttribute("missing", (String) null);

            verify(otelSpan).setAttribute("survivorId", "c-1");
            verify(otelSpan).setAttribute("attempts", 3L);
            verify(otelSpan).setAttribute("topScore", 0.75);
            verify(otelSpan, never()).setAttribute(eq("missing"), anyString());
        }

        @Test
        @DisplayName("Should map statuses and record exceptions")
        void statusAndException() {
            Span span = service.startSpan(TracingService.ADJUDICATE, Map.of());
            RuntimeException error = new RuntimeException("adjudicator down");

            span.recordException(error);
            span.setStatus(Span.SpanStatus.ERROR);

            verify(otelSpan).recordException(error);
            verify(otelSpan).setStatus(StatusCode.ERROR);
        }

        @Test
        @DisplayName("Should end span on close")
        void endSpanOnClose() {
            try (Span span = service.startSpan(TracingService.RESOLVE, Map.of())) {
                span.setStatus(Span.SpanStatus.OK);
            }

            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).end();
        }
    }
}
