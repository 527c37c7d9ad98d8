package com.versionrace.engine.persistence.jdbc;

import com.versionrace.core.exception.ConnectionException;
import com.versionrace.core.model.Deadline;
import com.versionrace.core.model.IsolationLevel;
import com.versionrace.core.repository.StorageTransaction;
import com.versionrace.core.repository.TransactionalStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.support.SQLErrorCodeSQLExceptionTranslator;
import org.springframework.jdbc.support.SQLExceptionTranslator;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * DataSource-backed storage collaborator.
 * Every transaction takes its own connection from the pool, so two racing
 * writers never share a physical session.
 */
@Repository("jdbcTransactionalStorage")
public class JdbcTransactionalStorage implements TransactionalStorage {

    private static final Logger log = LoggerFactory.getLogger(JdbcTransactionalStorage.class);

    private final DataSource dataSource;
    private final SQLExceptionTranslator sqlExceptionTranslator;
    private final StorageExceptionTranslator translator = new StorageExceptionTranslator();

    public JdbcTransactionalStorage(DataSource dataSource) {
        this.dataSource = dataSource;
        this.sqlExceptionTranslator = new SQLErrorCodeSQLExceptionTranslator(dataSource);
    }

    @Override
    public StorageTransaction begin(IsolationLevel isolationLevel, Deadline deadline) {
        deadline.check("begin transaction");

        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new ConnectionException("Failed to obtain connection: " + e.getMessage(), e);
        }

        try {
            int originalIsolation = connection.getTransactionIsolation();
            connection.setTransactionIsolation(isolationLevel.jdbcLevel());
            connection.setAutoCommit(false);
            JdbcStorageTransaction transaction = new JdbcStorageTransaction(
                connection, originalIsolation, isolationLevel, deadline, sqlExceptionTranslator, translator);
            log.debug("Began transaction {} at {}", transaction.transactionId(), isolationLevel);
            return transaction;
        } catch (SQLException e) {
            ConnectionException failure = new ConnectionException(
                "Failed to begin transaction at " + isolationLevel + ": " + e.getMessage(), e);
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                failure.addSuppressed(closeFailure);
            }
            throw failure;
        }
    }
}
