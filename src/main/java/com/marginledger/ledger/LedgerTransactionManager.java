package com.marginledger.ledger;

import com.marginledger.exception.BaseException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Serializes every ledger transaction behind a single fair writer lock.
 *
 * <p>Protocol for {@link #execute}:
 * <ol>
 *   <li>Reject the call if this thread already holds the write lock (no re-entry from a
 *       transfer callback or from inside another transaction)</li>
 *   <li>Acquire the write lock and run the work against a fresh {@link LedgerTransaction}</li>
 *   <li>On any exception, run the recorded compensations and rethrow the original error</li>
 *   <li>On success, append the staged events to the outbox while still holding the lock,
 *       release it, and then drain the outbox</li>
 * </ol>
 *
 * <p>The outbox is filled in commit order and drained by one thread at a time, so listeners
 * see events of different transactions in the order those transactions committed. A
 * transaction started by a listener leaves its events in the outbox; the drain already
 * running on that thread delivers them after the current event.
 *
 * <p>Read-only queries use {@link #read}, which shares the read lock and therefore always
 * sees a committed state.
 */
@Component
public class LedgerTransactionManager {

    private static final Logger log = LoggerFactory.getLogger(LedgerTransactionManager.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final ReentrantLock deliveryLock = new ReentrantLock();
    private final Queue<ApplicationEvent> outbox = new ConcurrentLinkedQueue<>();
    private final ApplicationEventPublisher applicationEventPublisher;

    public LedgerTransactionManager(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public <T> T execute(String operation, Function<LedgerTransaction, T> work) {
        if (lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("Re-entrant ledger call rejected: " + operation);
        }

        LedgerTransaction transaction = new LedgerTransaction(operation);
        T result;

        lock.writeLock().lock();
        try {
            result = work.apply(transaction);
            outbox.addAll(transaction.getPendingEvents());
        } catch (RuntimeException e) {
            rollback(transaction, e);
            throw e;
        } finally {
            lock.writeLock().unlock();
        }

        deliverCommitted();
        return result;
    }

    public void executeVoid(String operation, Consumer<LedgerTransaction> work) {
        execute(operation, transaction -> {
            work.accept(transaction);
            return null;
        });
    }

    public <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isInTransaction() {
        return lock.isWriteLockedByCurrentThread();
    }

    private void rollback(LedgerTransaction transaction, RuntimeException cause) {
        int steps = transaction.getCompensationCount();
        RuntimeException compensationFailure = transaction.rollback();
        if (compensationFailure != null) {
            log.error(
                    "Rollback of {} incomplete after {}: {}",
                    transaction.getOperation(),
                    cause.getMessage(),
                    compensationFailure.getMessage(),
                    compensationFailure);
            cause.addSuppressed(compensationFailure);
        } else if (cause instanceof BaseException) {
            log.debug("Rolled back {} ({} steps): {}", transaction.getOperation(), steps, cause.getMessage());
        } else {
            log.warn("Rolled back {} ({} steps) after unexpected error", transaction.getOperation(), steps, cause);
        }
    }

    private void deliverCommitted() {
        if (deliveryLock.isHeldByCurrentThread()) {
            return;
        }
        deliveryLock.lock();
        try {
            ApplicationEvent event;
            while ((event = outbox.poll()) != null) {
                publishQuietly(event);
            }
        } finally {
            deliveryLock.unlock();
        }
    }

    private void publishQuietly(ApplicationEvent event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (Exception e) {
            log.error("Failed to publish ledger event {}: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }
}
