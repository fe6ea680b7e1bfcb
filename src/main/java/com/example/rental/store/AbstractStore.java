package com.example.rental.store;

import com.example.rental.service.exception.StorageException;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.function.Supplier;

/**
 * Shared plumbing of the stores: explicit transactions and translation of data access
 * failures into {@link StorageException}. Domain exceptions thrown inside a transaction
 * roll it back and propagate unchanged.
 */
abstract class AbstractStore {

    protected final TransactionTemplate tx;
    protected final TransactionTemplate readTx;
    protected final Clock clock;

    protected AbstractStore(PlatformTransactionManager txManager, Clock clock) {
        this.tx = new TransactionTemplate(txManager);
        this.readTx = new TransactionTemplate(txManager);
        this.readTx.setReadOnly(true);
        this.clock = clock;
    }

    protected LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    protected <T> T write(String operation, Supplier<T> work) {
        try {
            return tx.execute(status -> work.get());
        } catch (DataAccessException e) {
            throw new StorageException(operation + " failed", e);
        }
    }

    protected void writeVoid(String operation, Runnable work) {
        write(operation, () -> {
            work.run();
            return null;
        });
    }

    protected <T> T read(String operation, Supplier<T> work) {
        try {
            return readTx.execute(status -> work.get());
        } catch (DataAccessException e) {
            throw new StorageException(operation + " failed", e);
        }
    }
}
