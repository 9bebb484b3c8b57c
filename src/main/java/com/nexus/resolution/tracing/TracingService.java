package com.nexus.resolution.tracing;

import java.util.Map;

/**
 * Tracing seam for resolution, adjudication and merge spans.
 * {@link NoOpTracingService} is used unless a tracer is supplied.
 */
public interface TracingService {

    String RESOLVE = "resolution.resolve";
    String ADJUDICATE = "adjudication.adjudicate";
    String MERGE = "merge.apply";

    /**
     * @param attributes initial span attributes; null values are dropped
     */
    Span startSpan(String operationName, Map<String, String> attributes);
}
