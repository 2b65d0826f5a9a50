package com.event.linking.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan("event.ingest", Map.of(TracingService.ARTICLE_ID, "a-1"))) {
                    span.setAttribute(TracingService.EVENT_ID, "ev-1");
                    span.setAttribute("members", 3L);
                    span.setAttribute("score", 0.8);
                    span.addEvent("retry");
                    span.setStatus(Span.SpanStatus.OK);
                    span.recordException(new IllegalStateException("stale"));
                }
            });
        }

        @Test
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("a"), noOp.startSpan("b"));
        }

        @Test
        void inSpanReturnsWorkResult() {
            assertEquals("done", new NoOpTracingService().inSpan("op", Map.of(), () -> "done"));
        }

        @Test
        void inSpanPropagatesFailures() {
            IllegalStateException failure = new IllegalStateException("stale");

            IllegalStateException thrown = assertThrows(IllegalStateException.class,
                    () -> new NoOpTracingService().inSpan("op", Map.of(), () -> {
                        throw failure;
                    }));
            assertSame(failure, thrown);
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
        void startsSpanWithInitialAttributes() {
            Span span = service.startSpan("event.ingest", Map.of(TracingService.SHARD, "maritime|piraeus"));

            assertNotNull(span);
            verify(tracer).spanBuilder("event.ingest");
            verify(builder).setAttribute(TracingService.SHARD, "maritime|piraeus");
            verify(builder).startSpan();
        }

        @Test
        void delegatesAttributesAndEvents() {
            Span span = service.startSpan("event.merge");
            span.setAttribute("survivor", "ev-1");
            span.setAttribute("members", 4L);
            span.setAttribute("score", 0.75);
            span.addEvent("retry");

            verify(otelSpan).setAttribute("survivor", "ev-1");
            verify(otelSpan).setAttribute("members", 4L);
            verify(otelSpan).setAttribute("score", 0.75);
            verify(otelSpan).addEvent("retry");
        }

        @Test
        void mapsStatusAndEndsOnClose() {
            Span span = service.startSpan("event.ingest");
            span.setStatus(Span.SpanStatus.OK);
            span.setStatus(Span.SpanStatus.ERROR);
            span.close();

            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan).end();
        }

        @Test
        @DisplayName("inSpan marks failures and rethrows")
        void inSpanRecordsFailure() {
            IllegalStateException failure = new IllegalStateException("boom");

            IllegalStateException thrown = assertThrows(IllegalStateException.class,
                    () -> service.inSpan("event.reconcile", Map.of(), () -> {
                        throw failure;
                    }));

            assertSame(failure, thrown);
            verify(otelSpan).recordException(failure);
            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan).end();
        }

        @Test
        void inSpanMarksSuccess() {
            int result = service.inSpan("event.reconcile", Map.of(), () -> 42);

            assertEquals(42, result);
            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).end();
        }
    }
}
