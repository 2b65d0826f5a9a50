package com.event.linking.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Compensating transaction spanning the stores touched by one article or one merge.
 * Compensations run in reverse order if a step fails or the transaction closes
 * without {@link #markSuccess()}.
 *
 * <pre>
 * try (StoreTransaction tx = new StoreTransaction("ingest " + id)) {
 *     tx.execute("register article", () -> articles.register(a), () -> articles.unregister(id));
 *     Event e = tx.execute("insert event", () -> store.insert(seed), stored -> store.delete(stored.getId()));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class StoreTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreTransaction.class);

    private final String name;
    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    public StoreTransaction(String name) {
        this.name = name;
    }

    /**
     * Executes a step and registers its compensation.
     *
     * @throws RuntimeException the step's failure, after all registered compensations ran
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        execute(description, () -> {
            operation.run();
            return null;
        }, ignored -> compensation.run());
    }

    /**
     * Executes a step producing a value; the compensation receives that value.
     */
    public <T> T execute(String description, Supplier<T> operation, Consumer<T> compensation) {
        ensureOpen();
        T result;
        try {
            log.debug("tx.step tx={} step={}", name, description);
            result = operation.get();
        } catch (RuntimeException e) {
            log.warn("tx.step.failed tx={} step={} error={}", name, description, e.getMessage());
            rollback(e);
            throw e;
        }
        compensationStack.push(new CompensatingAction(description, () -> compensation.accept(result)));
        return result;
    }

    /**
     * Executes an append-only step (audit, ledger, metrics) that is not undone.
     */
    public void executeNoCompensation(String description, Runnable operation) {
        ensureOpen();
        try {
            log.debug("tx.step tx={} step={} compensation=none", name, description);
            operation.run();
        } catch (RuntimeException e) {
            log.warn("tx.step.failed tx={} step={} error={}", name, description, e.getMessage());
            rollback(e);
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("tx.rollback tx={} reason=closed-without-success", name);
            rollback(null);
        }
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed: " + name);
        }
    }

    /**
     * Runs every compensation. A failing compensation does not stop the others; its exception
     * is attached to the primary failure when there is one.
     */
    private void rollback(RuntimeException cause) {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("tx.compensate tx={} step={}", name, action.description());
                action.compensation().run();
            } catch (RuntimeException e) {
                log.error("tx.compensation.failed tx={} step={}", name, action.description(), e);
                if (cause != null) {
                    cause.addSuppressed(e);
                }
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {
    }
}
