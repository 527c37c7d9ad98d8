package com.versionrace.engine.persistence.jdbc;

import com.versionrace.core.exception.OperationTimeoutException;
import com.versionrace.core.exception.StatementException;
import com.versionrace.core.exception.VersionRaceException;
import com.versionrace.core.model.Deadline;
import com.versionrace.core.model.IsolationLevel;
import com.versionrace.core.repository.RowReader;
import com.versionrace.core.repository.StorageTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.support.SQLExceptionTranslator;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One JDBC transaction pinned to its own connection.
 * Statements run through a JdbcTemplate bound to that single connection, so
 * row mapping and exception translation stay the same as elsewhere while the
 * transaction boundary is driven explicitly by the owner.
 * 
 * Not thread-safe: a handle belongs to the task that opened it.
 */
final class JdbcStorageTransaction implements StorageTransaction {

    private static final Logger log = LoggerFactory.getLogger(JdbcStorageTransaction.class);

    private final UUID transactionId = UUID.randomUUID();
    private final Connection connection;
    private final int originalIsolation;
    private final IsolationLevel isolationLevel;
    private final Deadline deadline;
    private final JdbcTemplate jdbcTemplate;
    private final StorageExceptionTranslator translator;
    private boolean active = true;

    JdbcStorageTransaction(
            Connection connection,
            int originalIsolation,
            IsolationLevel isolationLevel,
            Deadline deadline,
            SQLExceptionTranslator sqlExceptionTranslator,
            StorageExceptionTranslator translator) {
        this.connection = connection;
        this.originalIsolation = originalIsolation;
        this.isolationLevel = isolationLevel;
        this.deadline = deadline;
        this.translator = translator;
        this.jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        this.jdbcTemplate.setExceptionTranslator(sqlExceptionTranslator);
    }

    @Override
    public UUID transactionId() {
        return transactionId;
    }

    @Override
    public IsolationLevel isolationLevel() {
        return isolationLevel;
    }

    @Override
    public Deadline deadline() {
        return deadline;
    }

    @Override
    public int execute(String sql, Object... args) {
        prepareStatement("execute");
        try {
            int rows = jdbcTemplate.update(sql, args);
            log.debug("Transaction {} affected {} row(s)", transactionId, rows);
            return rows;
        } catch (DataAccessException e) {
            throw rollbackAfter(translator.translate("execute", e, deadline));
        }
    }

    @Override
    public <T> Optional<T> querySingle(String sql, RowReader<T> reader, Object... args) {
        prepareStatement("query");
        List<T> results;
        try {
            results = jdbcTemplate.query(sql, (rs, rowNum) -> reader.read(rs), args);
        } catch (DataAccessException e) {
            throw rollbackAfter(translator.translate("query", e, deadline));
        }
        if (results.size() > 1) {
            throw rollbackAfter(new StatementException(
                "Expected at most one row but query returned " + results.size()));
        }
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public void commit() {
        ensureActive("commit");
        active = false;
        try {
            connection.commit();
            log.debug("Committed transaction {}", transactionId);
        } catch (SQLException e) {
            StatementException failure = new StatementException("Commit failed: " + e.getMessage(), e);
            rollbackConnection(failure);
            throw failure;
        } finally {
            release();
        }
    }

    @Override
    public void rollback() {
        if (!active) {
            return;
        }
        active = false;
        try {
            connection.rollback();
            log.debug("Rolled back transaction {}", transactionId);
        } catch (SQLException e) {
            throw new StatementException("Rollback failed: " + e.getMessage(), e);
        } finally {
            release();
        }
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void close() {
        rollback();
    }

    // ========== Helper Methods ==========

    private void prepareStatement(String operation) {
        ensureActive(operation);
        if (deadline.isExpired()) {
            throw rollbackAfter(new OperationTimeoutException(operation));
        }
        jdbcTemplate.setQueryTimeout(deadline.remainingSeconds());
    }

    private void ensureActive(String operation) {
        if (!active) {
            throw new IllegalStateException(
                "Cannot " + operation + ": transaction " + transactionId + " is no longer active");
        }
    }

    private VersionRaceException rollbackAfter(VersionRaceException failure) {
        try {
            rollback();
        } catch (StatementException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
        return failure;
    }

    private void rollbackConnection(Exception failure) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private void release() {
        try {
            connection.setAutoCommit(true);
            connection.setTransactionIsolation(originalIsolation);
        } catch (SQLException e) {
            log.warn("Failed to reset connection state for transaction {}: {}", transactionId, e.getMessage());
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection for transaction {}: {}", transactionId, e.getMessage());
        }
    }
}
