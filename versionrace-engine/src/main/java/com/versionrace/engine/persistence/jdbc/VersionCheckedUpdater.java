package com.versionrace.engine.persistence.jdbc;

import com.versionrace.core.exception.StatementException;
import com.versionrace.core.repository.StorageTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * The compare-and-increment primitive optimistic locking rests on.
 * 
 * Match and increment happen in one UPDATE statement, so the database's
 * row lock decides between concurrent callers holding the same expected
 * version: at most one of them can see a matching row.
 * 
 * The caller owns the transaction boundary; nothing here commits or rolls back.
 */
@Component
public class VersionCheckedUpdater {

    private static final Logger log = LoggerFactory.getLogger(VersionCheckedUpdater.class);

    static final String ADVANCE_SQL = """
        UPDATE versioned_entity
        SET version = version + 1
        WHERE entity_key = ? AND version = ?
        """;

    /**
     * Advance the version by one if it still equals {@code expectedVersion}.
     * 
     * @param transaction Open transaction owned by the caller
     * @param key The entity key
     * @param expectedVersion Version the row must currently have
     * @return 1 if the row was advanced, 0 if the version was stale or the key missing
     */
    public int tryAdvance(StorageTransaction transaction, UUID key, long expectedVersion) {
        int rows = transaction.execute(ADVANCE_SQL, key, expectedVersion);
        if (rows > 1) {
            throw new StatementException(String.format(
                "Conditional update on %s touched %d rows; key is not unique", key, rows));
        }
        log.debug("Conditional advance of {} from version {} affected {} row(s) in transaction {}",
            key, expectedVersion, rows, transaction.transactionId());
        return rows;
    }
}
