package com.flagship.roster_ledger.common.jdbc;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.function.Supplier;

/**
 * Runs a unit of JDBC work inside a savepoint of the current transaction.
 *
 * If the work throws, the connection is rolled back to the savepoint and the
 * exception is rethrown; the enclosing transaction stays usable. This is the
 * only way to recover from a failed statement inside a PostgreSQL
 * transaction without losing the work done before it.
 *
 * Only JDBC work may run inside: the JPA persistence context is not rolled
 * back with the savepoint.
 */
@Component
@Slf4j
public class SavepointTemplate {

    private final DataSource dataSource;

    public SavepointTemplate(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public <T> T execute(String name, Supplier<T> work) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalTransactionStateException("Savepoint '" + name + "' requires an active transaction");
        }
        Connection connection = DataSourceUtils.getConnection(dataSource);
        Savepoint savepoint = createSavepoint(connection, name);
        T result;
        try {
            result = work.get();
        } catch (RuntimeException e) {
            rollbackTo(connection, savepoint, name, e);
            throw e;
        }
        release(connection, savepoint, name);
        return result;
    }

    public void run(String name, Runnable work) {
        execute(name, () -> {
            work.run();
            return null;
        });
    }

    private Savepoint createSavepoint(Connection connection, String name) {
        try {
            return connection.setSavepoint(name);
        } catch (SQLException e) {
            throw new CannotCreateTransactionException("Could not create savepoint " + name, e);
        }
    }

    private void rollbackTo(Connection connection, Savepoint savepoint, String name, RuntimeException cause) {
        try {
            connection.rollback(savepoint);
            log.debug("Rolled back to savepoint {} after {}", name, cause.getClass().getSimpleName());
        } catch (SQLException e) {
            TransactionSystemException failure =
                    new TransactionSystemException("Could not roll back to savepoint " + name, e);
            failure.initApplicationException(cause);
            throw failure;
        }
    }

    private void release(Connection connection, Savepoint savepoint, String name) {
        try {
            connection.releaseSavepoint(savepoint);
        } catch (SQLException e) {
            throw new TransactionSystemException("Could not release savepoint " + name, e);
        }
    }
}
