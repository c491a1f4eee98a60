package com.marginledger.ledger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Unit of work for one state-changing ledger call.
 *
 * <p>Books record a compensation for every mutation they apply ({@link #onRollback}).
 * If any later step throws, {@link LedgerTransactionManager} runs the compensations in
 * reverse order, which restores the exact pre-call state. Events staged with
 * {@link #publish} are delivered only after the transaction commits, so listeners never
 * observe a transition that was later undone.
 */
public class LedgerTransaction {

    private final String operation;
    private final Deque<Runnable> compensations = new ArrayDeque<>();
    private final List<ApplicationEvent> pendingEvents = new ArrayList<>();

    LedgerTransaction(String operation) {
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    public void onRollback(Runnable compensation) {
        compensations.push(compensation);
    }

    public void publish(ApplicationEvent event) {
        pendingEvents.add(event);
    }

    List<ApplicationEvent> getPendingEvents() {
        return Collections.unmodifiableList(pendingEvents);
    }

    int getCompensationCount() {
        return compensations.size();
    }

    /**
     * Runs compensations newest-first. Every compensation is attempted even if one fails;
     * the first failure is returned so the caller can attach it to the original error.
     */
    RuntimeException rollback() {
        RuntimeException firstFailure = null;
        while (!compensations.isEmpty()) {
            Runnable compensation = compensations.pop();
            try {
                compensation.run();
            } catch (RuntimeException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                } else {
                    firstFailure.addSuppressed(e);
                }
            }
        }
        pendingEvents.clear();
        return firstFailure;
    }
}
