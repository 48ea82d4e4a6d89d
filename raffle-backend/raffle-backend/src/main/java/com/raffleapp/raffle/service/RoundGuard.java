package com.raffleapp.raffle.service;

import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-writer guard over the round, its entrants and the treasury.
 * <p>
 * Every operation that reads or changes that state runs while holding one fair
 * lock. {@link #write} and {@link #read} also open a transaction, so a body's
 * changes to phase, entrants and balance commit together or not at all.
 * {@link #exclusive} holds the lock across several transactions plus an
 * outbound call (oracle request, prize transfer); the lock is reentrant so the
 * steps can nest.
 */
@Component
public class RoundGuard {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;

    public RoundGuard(PlatformTransactionManager transactionManager) {
        this.writeTx = new TransactionTemplate(transactionManager);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
    }

    public <T> T write(Supplier<T> body) {
        return exclusive(() -> writeTx.execute(status -> body.get()));
    }

    public <T> T read(Supplier<T> body) {
        return exclusive(() -> readTx.execute(status -> body.get()));
    }

    public <T> T exclusive(Supplier<T> body) {
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }
}
