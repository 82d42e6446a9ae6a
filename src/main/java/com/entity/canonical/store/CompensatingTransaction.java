package com.entity.canonical.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ordered log of undo actions for a store transaction.
 * Each applied step registers its compensation; rolling back runs them in reverse order.
 * A failed step registers nothing and leaves earlier steps in place until the owner
 * decides to roll back.
 *
 * <pre>
 * try (CompensatingTransaction tx = new CompensatingTransaction("doc-1")) {
 *     tx.execute("insert alias", () -&gt; insertAlias(...), () -&gt; deleteAlias(...));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class CompensatingTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CompensatingTransaction.class);

    private final String label;
    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    public CompensatingTransaction(String label) {
        this.label = label;
    }

    /**
     * Runs a step and registers its compensation once the step has succeeded.
     *
     * @throws IllegalStateException if the transaction is closed
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        ensureOpen();
        log.trace("tx.step label={} step={}", label, description);
        operation.run();
        compensationStack.push(new CompensatingAction(description, compensation));
    }

    /**
     * Registers a compensation for a step the caller already performed.
     */
    public void registerCompensation(String description, Runnable compensation) {
        ensureOpen();
        compensationStack.push(new CompensatingAction(description, compensation));
    }

    public void markSuccess() {
        ensureOpen();
        this.success = true;
        compensationStack.clear();
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isClosed() {
        return closed;
    }

    public int pendingCompensations() {
        return compensationStack.size();
    }

    /**
     * Runs every registered compensation in reverse order and closes the transaction.
     */
    public void rollback() {
        if (closed) {
            return;
        }
        if (!compensationStack.isEmpty()) {
            log.warn("tx.rollback label={} steps={}", label, compensationStack.size());
        }
        runCompensations();
        closed = true;
    }

    @Override
    public void close() {
        if (!closed && !success) {
            rollback();
        }
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed: " + label);
        }
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("tx.compensate label={} step={}", label, action.description);
                action.compensation.run();
            } catch (RuntimeException e) {
                // best-effort: keep undoing the remaining steps
                log.error("tx.compensation.failed label={} step={} error={}",
                        label, action.description, e.getMessage(), e);
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}
