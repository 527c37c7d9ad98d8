package com.versionrace.core.repository;

import com.versionrace.core.model.Deadline;
import com.versionrace.core.model.IsolationLevel;
import com.versionrace.core.model.VersionedEntity;

import java.util.Optional;
import java.util.UUID;

/**
 * Record store for versioned entities.
 * Every call runs in its own transaction at the given isolation level.
 */
public interface EntityStore {

    /**
     * Insert a new entity at the initial version and commit.
     * 
     * @param key The entity key
     * @return The created entity
     * @throws com.versionrace.core.exception.DuplicateKeyException if the key already exists
     */
    VersionedEntity create(UUID key, IsolationLevel isolationLevel, Deadline deadline);

    /**
     * Read an entity. The read transaction is always rolled back.
     * 
     * @param key The entity key
     * @return The current committed entity
     * @throws com.versionrace.core.exception.NotFoundException if the key does not exist
     */
    VersionedEntity read(UUID key, IsolationLevel isolationLevel, Deadline deadline);

    /**
     * Read an entity if present. The read transaction is always rolled back.
     * 
     * @param key The entity key
     * @return The entity if found
     */
    Optional<VersionedEntity> find(UUID key, IsolationLevel isolationLevel, Deadline deadline);

    /**
     * Apply one conditional update in its own transaction and commit.
     * 
     * @param key The entity key
     * @param expectedVersion Version the row must currently have
     * @return 1 if the version advanced, 0 if the version was stale or the key missing
     */
    int advance(UUID key, long expectedVersion, IsolationLevel isolationLevel, Deadline deadline);

    /**
     * Delete an entity unconditionally and commit.
     * 
     * @param key The entity key
     * @return Number of deleted rows (0 or 1)
     */
    int delete(UUID key, IsolationLevel isolationLevel, Deadline deadline);
}
