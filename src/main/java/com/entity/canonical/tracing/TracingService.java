package com.entity.canonical.tracing;

import java.util.Map;

/**
 * Creates trace spans. {@link NoOpTracingService} is the default.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
