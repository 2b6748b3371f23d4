package com.proxycare.pool.store;

import com.proxycare.common.exception.PoolFailureException;
import com.proxycare.common.exception.PoolFailureReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;

/**
 * Runs a unit of store work in a transaction and turns connectivity, timeout and lock
 * failures into {@link PoolFailureReason#UNAVAILABLE}. Joins an already running transaction.
 */
@Component
public class StoreGuard {

    private static final Logger log = LoggerFactory.getLogger(StoreGuard.class);

    private final TransactionTemplate tx;

    public StoreGuard(PlatformTransactionManager transactionManager) {
        this.tx = new TransactionTemplate(transactionManager);
    }

    public <T> T execute(String operation, TransactionCallback<T> work) {
        try {
            return tx.execute(work);
        } catch (CannotCreateTransactionException
                 | DataAccessResourceFailureException
                 | TransientDataAccessException
                 | RecoverableDataAccessException ex) {
            log.warn("Proxy store unavailable during {}: {}", operation, ex.getMessage());
            throw new PoolFailureException(
                    "Proxy store unavailable",
                    PoolFailureReason.UNAVAILABLE,
                    Map.of("operation", operation),
                    ex
            );
        }
    }

    public void run(String operation, Runnable work) {
        execute(operation, status -> {
            work.run();
            return null;
        });
    }
}
