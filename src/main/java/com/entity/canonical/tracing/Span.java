package com.entity.canonical.tracing;

/**
 * A unit of work in a trace, ended on {@link #close()}.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("canonical.ingest")) {
 *     span.setAttribute("documentId", documentId);
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Records {@code t} and marks the span as failed.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
