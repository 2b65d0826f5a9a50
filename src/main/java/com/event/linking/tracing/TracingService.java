package com.event.linking.tracing;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Tracing integration. The default {@link NoOpTracingService} does nothing, so the library
 * works without a tracer.
 */
public interface TracingService {

    String ARTICLE_ID = "article.id";
    String EVENT_ID = "event.id";
    String SHARD = "event.shard";
    String OUTCOME = "assignment.outcome";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Runs the work inside a span, marking the span OK or recording the failure.
     */
    default <T> T inSpan(String operationName, Map<String, String> attributes, Supplier<T> work) {
        try (Span span = startSpan(operationName, attributes)) {
            try {
                T result = work.get();
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }
}
