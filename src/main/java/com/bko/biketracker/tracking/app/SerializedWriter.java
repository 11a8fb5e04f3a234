package com.bko.biketracker.tracking.app;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs tracking writes one at a time, each in its own transaction committed before the next starts.
 * Segmentation reads the latest activity and then mutates it, which is only safe for a single writer.
 */
@Component
public class SerializedWriter {
    private final ReentrantLock lock = new ReentrantLock();
    private final TransactionOperations transactions;

    public SerializedWriter(TransactionOperations transactions) {
        this.transactions = transactions;
    }

    public <T> T write(Supplier<T> work) {
        lock.lock();
        try {
            return transactions.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }
}
