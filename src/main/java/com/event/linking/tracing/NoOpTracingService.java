package com.event.linking.tracing;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Default when no tracer is configured: every span is the same inert instance and
 * {@link #inSpan} runs the work directly.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName) {
        return InertSpan.INSTANCE;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return InertSpan.INSTANCE;
    }

    @Override
    public <T> T inSpan(String operationName, Map<String, String> attributes, Supplier<T> work) {
        return work.get();
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
        public void addEvent(String name) {
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
