package com.versionrace.engine.persistence.jdbc;

import com.versionrace.core.exception.DuplicateKeyException;
import com.versionrace.core.exception.NotFoundException;
import com.versionrace.core.exception.StatementException;
import com.versionrace.core.model.Deadline;
import com.versionrace.core.model.IsolationLevel;
import com.versionrace.core.model.VersionedEntity;
import com.versionrace.core.repository.EntityStore;
import com.versionrace.core.repository.RowReader;
import com.versionrace.core.repository.StorageTransaction;
import com.versionrace.core.repository.TransactionalStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;

/**
 * Relational implementation of EntityStore.
 * Each operation opens, finishes and releases its own transaction.
 */
@Repository("jdbcEntityStore")
public class JdbcEntityStore implements EntityStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEntityStore.class);

    private static final String INSERT_SQL =
        "INSERT INTO versioned_entity (entity_key, version) VALUES (?, ?)";
    private static final String SELECT_SQL =
        "SELECT entity_key, version FROM versioned_entity WHERE entity_key = ?";
    private static final String DELETE_SQL =
        "DELETE FROM versioned_entity WHERE entity_key = ?";

    private final TransactionalStorage storage;
    private final VersionCheckedUpdater updater;
    private final VersionedEntityRowReader rowReader = new VersionedEntityRowReader();

    public JdbcEntityStore(TransactionalStorage storage, VersionCheckedUpdater updater) {
        this.storage = storage;
        this.updater = updater;
    }

    @Override
    public VersionedEntity create(UUID key, IsolationLevel isolationLevel, Deadline deadline) {
        try (StorageTransaction tx = storage.begin(isolationLevel, deadline)) {
            try {
                tx.execute(INSERT_SQL, key, VersionedEntity.INITIAL_VERSION);
            } catch (StatementException e) {
                if (StorageExceptionTranslator.isDuplicateKey(e)) {
                    throw new DuplicateKeyException(key, e);
                }
                throw e;
            }
            tx.commit();
        }
        log.info("Created entity {} at version {}", key, VersionedEntity.INITIAL_VERSION);
        return VersionedEntity.create(key);
    }

    @Override
    public VersionedEntity read(UUID key, IsolationLevel isolationLevel, Deadline deadline) {
        return find(key, isolationLevel, deadline)
            .orElseThrow(() -> new NotFoundException(key));
    }

    @Override
    public Optional<VersionedEntity> find(UUID key, IsolationLevel isolationLevel, Deadline deadline) {
        try (StorageTransaction tx = storage.begin(isolationLevel, deadline)) {
            Optional<VersionedEntity> entity = tx.querySingle(SELECT_SQL, rowReader, key);
            // Reads never commit
            tx.rollback();
            return entity;
        }
    }

    @Override
    public int advance(UUID key, long expectedVersion, IsolationLevel isolationLevel, Deadline deadline) {
        try (StorageTransaction tx = storage.begin(isolationLevel, deadline)) {
            int rows = updater.tryAdvance(tx, key, expectedVersion);
            tx.commit();
            if (rows == 0) {
                log.debug("Entity {} not advanced: version {} is stale or key missing", key, expectedVersion);
            } else {
                log.info("Advanced entity {} from version {}", key, expectedVersion);
            }
            return rows;
        }
    }

    @Override
    public int delete(UUID key, IsolationLevel isolationLevel, Deadline deadline) {
        try (StorageTransaction tx = storage.begin(isolationLevel, deadline)) {
            int rows = tx.execute(DELETE_SQL, key);
            tx.commit();
            log.info("Deleted entity {} ({} row(s))", key, rows);
            return rows;
        }
    }

    private static class VersionedEntityRowReader implements RowReader<VersionedEntity> {
        @Override
        public VersionedEntity read(ResultSet rs) throws SQLException {
            return new VersionedEntity(
                UUID.fromString(rs.getString("entity_key")),
                rs.getLong("version")
            );
        }
    }
}
