package com.event.linking.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * AutoCloseable SLF4J MDC wrapper for structured logging.
 * Entries are removed on close, and values shadowed by a nested context are restored.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forIngest(correlationId, articleId, shardKey)) {
 *     log.info("ingest.completed outcome={} eventId={}", outcome, eventId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String ARTICLE_ID = "articleId";
    public static final String EVENT_ID = "eventId";
    public static final String SHARD = "shard";
    public static final String OPERATION = "operation";

    private final Deque<Previous> previous = new ArrayDeque<>();

    private LogContext() {
    }

    public static LogContext forIngest(String correlationId, String articleId, String shardKey) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(ARTICLE_ID, articleId);
        ctx.put(SHARD, shardKey);
        ctx.put(OPERATION, "ingest");
        return ctx;
    }

    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put(OPERATION, "batch");
        return ctx;
    }

    public static LogContext forMerge(String correlationId, String survivorId, String absorbedId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put("survivorEventId", survivorId);
        ctx.put("absorbedEventId", absorbedId);
        ctx.put(OPERATION, "merge");
        return ctx;
    }

    public static LogContext forReconciliation(String passId) {
        LogContext ctx = new LogContext();
        ctx.put("passId", passId);
        ctx.put(OPERATION, "reconcile");
        return ctx;
    }

    public static LogContext forLifecycle(String eventId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put(EVENT_ID, eventId);
        ctx.put(OPERATION, operation);
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        previous.push(new Previous(key, MDC.get(key)));
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    @Override
    public void close() {
        while (!previous.isEmpty()) {
            Previous entry = previous.pop();
            if (entry.value() != null) {
                MDC.put(entry.key(), entry.value());
            } else {
                MDC.remove(entry.key());
            }
        }
    }

    private record Previous(String key, String value) {
    }
}
