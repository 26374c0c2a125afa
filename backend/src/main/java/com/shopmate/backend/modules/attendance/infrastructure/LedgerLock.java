package com.shopmate.backend.modules.attendance.infrastructure;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

/**
 * The single mutual-exclusion point for ledger read-modify-write cycles and for the live
 * presence set derived from it. Reentrant, so a locked operation may call another one.
 */
@Component
public class LedgerLock {

    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Runnable action) {
        withLock(() -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
