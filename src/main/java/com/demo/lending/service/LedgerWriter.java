package com.demo.lending.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single writer for the ledger. Every mutation runs under one global lock and in its
 * own transaction, which gives one totally ordered log of writes; an exception rolls
 * the whole write back.
 */
@Component
@RequiredArgsConstructor
public class LedgerWriter {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    public <T> T write(Supplier<T> body) {
        lock.lock();
        try {
            return transactionTemplate.execute(status -> body.get());
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable body) {
        write(() -> {
            body.run();
            return null;
        });
    }

    /**
     * Holds the writer lock across several writes without joining them into one
     * transaction; each nested {@link #write} still commits or rolls back on its own.
     */
    public <T> T exclusive(Supplier<T> body) {
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }
}
