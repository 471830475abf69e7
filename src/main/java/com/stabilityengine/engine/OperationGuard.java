package com.stabilityengine.engine;

import com.stabilityengine.common.exception.ReentrantOperationException;
import com.stabilityengine.ledger.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs engine operations one at a time and refuses re-entry.
 *
 * The lock is held for the whole operation, including its commit, so an
 * operation never observes another one half-applied. A thread that is already
 * inside an operation (for instance a refund recipient's receive hook) cannot
 * start a second one.
 */
@Component
@Slf4j
public class OperationGuard {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final ThreadLocal<TransactionType> running = new ThreadLocal<>();

    public <T> T execute(TransactionType operation, Supplier<T> body) {
        TransactionType current = running.get();
        if (current != null) {
            log.warn("Rejected re-entrant {} during {}", operation, current);
            throw new ReentrantOperationException(operation.name(), current.name());
        }

        lock.lock();
        running.set(operation);
        try {
            return body.get();
        } finally {
            running.remove();
            lock.unlock();
        }
    }

    public boolean isOperationInProgress() {
        return running.get() != null;
    }
}
