package com.versionrace.engine.persistence.jdbc;

import com.versionrace.core.exception.OperationTimeoutException;
import com.versionrace.core.exception.StatementException;
import com.versionrace.core.exception.VersionRaceException;
import com.versionrace.core.model.Deadline;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;

import java.sql.SQLTimeoutException;

/**
 * Maps Spring's DataAccessException hierarchy onto the version race taxonomy.
 * Timeouts (driver or deadline) become {@link OperationTimeoutException},
 * everything else becomes {@link StatementException} with the Spring
 * exception kept as cause so callers can still inspect it.
 */
final class StorageExceptionTranslator {

    VersionRaceException translate(String operation, DataAccessException e, Deadline deadline) {
        if (isTimeout(e) || deadline.isExpired()) {
            return new OperationTimeoutException(operation, e);
        }
        return new StatementException(
            String.format("%s failed: %s", operation, e.getMostSpecificCause().getMessage()), e);
    }

    /**
     * True when the failure was a unique-key violation.
     */
    static boolean isDuplicateKey(StatementException e) {
        return e.getCause() instanceof org.springframework.dao.DuplicateKeyException;
    }

    private boolean isTimeout(DataAccessException e) {
        if (e instanceof QueryTimeoutException) {
            return true;
        }
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof SQLTimeoutException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
