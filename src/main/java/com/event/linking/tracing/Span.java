package com.event.linking.tracing;

/**
 * A unit of work in a trace, ended when closed.
 *
 * <pre>
 * try (Span span = tracing.startSpan("event.ingest")) {
 *     span.setAttribute(TracingService.ARTICLE_ID, articleId);
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    /**
     * Marks a point in time inside the span, such as a retry.
     */
    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
