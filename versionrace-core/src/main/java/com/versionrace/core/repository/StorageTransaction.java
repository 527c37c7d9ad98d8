package com.versionrace.core.repository;

import com.versionrace.core.model.Deadline;
import com.versionrace.core.model.IsolationLevel;

import java.util.Optional;
import java.util.UUID;

/**
 * An open database transaction owned by exactly one caller.
 * 
 * A handle is terminated by the first call to {@link #commit()} or
 * {@link #rollback()}. After that, rollback is a no-op while commit and
 * statement execution fail with {@link IllegalStateException}.
 * {@link #close()} rolls back a handle that is still active.
 */
public interface StorageTransaction extends AutoCloseable {

    /**
     * Identifier used in logs.
     */
    UUID transactionId();

    IsolationLevel isolationLevel();

    Deadline deadline();

    /**
     * Execute a data-changing statement.
     * 
     * @param sql Statement with {@code ?} placeholders
     * @param args Positional arguments
     * @return Number of affected rows
     * @throws com.versionrace.core.exception.StatementException if the statement fails
     * @throws com.versionrace.core.exception.OperationTimeoutException if the deadline expires
     */
    int execute(String sql, Object... args);

    /**
     * Run a query expected to return zero or one row.
     * 
     * @param sql Query with {@code ?} placeholders
     * @param reader Maps the row
     * @param args Positional arguments
     * @return The mapped row if present
     * @throws com.versionrace.core.exception.StatementException if the query fails or returns several rows
     * @throws com.versionrace.core.exception.OperationTimeoutException if the deadline expires
     */
    <T> Optional<T> querySingle(String sql, RowReader<T> reader, Object... args);

    /**
     * Commit and terminate the handle.
     */
    void commit();

    /**
     * Roll back and terminate the handle. Safe to call on a terminated handle.
     */
    void rollback();

    boolean isActive();

    @Override
    void close();
}
