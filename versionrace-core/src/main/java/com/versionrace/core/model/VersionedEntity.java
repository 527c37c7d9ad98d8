package com.versionrace.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A single row guarded by an optimistic version counter.
 * 
 * Primary Key: key
 * 
 * Invariants:
 * - Exactly one row per key between creation and deletion
 * - version starts at 1 and only grows by 1 per successful conditional update
 * - version is never assigned directly
 */
public record VersionedEntity(
    UUID key,
    long version
) {
    /**
     * Version every entity is created with.
     */
    public static final long INITIAL_VERSION = 1L;

    public VersionedEntity {
        Objects.requireNonNull(key, "key");
        if (version < INITIAL_VERSION) {
            throw new IllegalArgumentException("version must be >= " + INITIAL_VERSION + ": " + version);
        }
    }

    /**
     * Create a freshly inserted entity.
     */
    public static VersionedEntity create(UUID key) {
        return new VersionedEntity(key, INITIAL_VERSION);
    }

    /**
     * The entity as it looks after one successful conditional update.
     */
    public VersionedEntity advanced() {
        return new VersionedEntity(key, version + 1);
    }

    /**
     * Number of successful conditional updates applied since creation.
     */
    public long advancesSinceCreation() {
        return version - INITIAL_VERSION;
    }
}
