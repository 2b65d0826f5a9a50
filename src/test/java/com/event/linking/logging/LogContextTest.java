package com.event.linking.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    void forIngestSetsArticleAndShard() {
        try (LogContext ctx = LogContext.forIngest("corr-1", "art-1", "maritime|piraeus")) {
            assertEquals("corr-1", MDC.get(LogContext.CORRELATION_ID));
            assertEquals("art-1", MDC.get(LogContext.ARTICLE_ID));
            assertEquals("maritime|piraeus", MDC.get(LogContext.SHARD));
            assertEquals("ingest", MDC.get(LogContext.OPERATION));
        }
        assertNull(MDC.get(LogContext.ARTICLE_ID));
        assertNull(MDC.get(LogContext.SHARD));
    }

    @Test
    void forMergeSetsBothEvents() {
        try (LogContext ctx = LogContext.forMerge("corr-2", "ev-1", "ev-2")) {
            assertEquals("ev-1", MDC.get("survivorEventId"));
            assertEquals("ev-2", MDC.get("absorbedEventId"));
            assertEquals("merge", MDC.get(LogContext.OPERATION));
        }
    }

    @Test
    void forReconciliationAndLifecycle() {
        try (LogContext ctx = LogContext.forReconciliation("pass-1")) {
            assertEquals("pass-1", MDC.get("passId"));
            assertEquals("reconcile", MDC.get(LogContext.OPERATION));
        }
        try (LogContext ctx = LogContext.forLifecycle("ev-3", "reopen")) {
            assertEquals("ev-3", MDC.get(LogContext.EVENT_ID));
            assertEquals("reopen", MDC.get(LogContext.OPERATION));
        }
        assertNull(MDC.get(LogContext.OPERATION));
    }

    @Test
    @DisplayName("with() adds keys that are removed on close")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forBatch("batch-1").with("source", "902.gr")) {
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("902.gr", MDC.get("source"));
        }
        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("source"));
    }

    @Test
    @DisplayName("Nested context restores the values it shadowed")
    void nestedContextRestoresShadowedValues() {
        try (LogContext outer = LogContext.forIngest("outer", "art-1", "shard-a")) {
            try (LogContext inner = LogContext.forMerge("inner", "ev-1", "ev-2")) {
                assertEquals("inner", MDC.get(LogContext.CORRELATION_ID));
                assertEquals("merge", MDC.get(LogContext.OPERATION));
                assertEquals("art-1", MDC.get(LogContext.ARTICLE_ID));
            }
            assertEquals("outer", MDC.get(LogContext.CORRELATION_ID));
            assertEquals("ingest", MDC.get(LogContext.OPERATION));
            assertNull(MDC.get("survivorEventId"));
        }
        assertNull(MDC.get(LogContext.CORRELATION_ID));
    }

    @Test
    void nullValueRemovesKey() {
        MDC.put(LogContext.EVENT_ID, "stale");
        try (LogContext ctx = LogContext.forLifecycle(null, "sweep")) {
            assertNull(MDC.get(LogContext.EVENT_ID));
        }
        assertEquals("stale", MDC.get(LogContext.EVENT_ID));
    }

    @Test
    void correlationIdsAreUniqueUuids() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            String id = LogContext.generateCorrelationId();
            assertTrue(id.matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"), id);
            ids.add(id);
        }
        assertEquals(100, ids.size());
    }
}
