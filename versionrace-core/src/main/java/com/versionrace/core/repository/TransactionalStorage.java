package com.versionrace.core.repository;

import com.versionrace.core.model.Deadline;
import com.versionrace.core.model.IsolationLevel;

/**
 * Minimal storage collaborator: hands out independent transactions,
 * each on its own connection.
 */
public interface TransactionalStorage {

    /**
     * Open a new transaction.
     * 
     * @param isolationLevel Isolation level for the transaction
     * @param deadline Bounds every statement run on the returned handle
     * @return An active transaction
     * @throws com.versionrace.core.exception.ConnectionException if no connection can be obtained
     * @throws com.versionrace.core.exception.OperationTimeoutException if the deadline already expired
     */
    StorageTransaction begin(IsolationLevel isolationLevel, Deadline deadline);
}
