package com.versionrace.core.exception;

import java.util.UUID;

/**
 * Thrown when an entity is created with a key that already exists.
 */
public class DuplicateKeyException extends VersionRaceException {
    
    public static final String ERROR_CODE = "DUPLICATE_KEY";
    
    private final UUID key;
    
    public DuplicateKeyException(UUID key, Throwable cause) {
        super(ERROR_CODE, String.format("Entity already exists: %s", key), cause);
        this.key = key;
    }
    
    public UUID getKey() {
        return key;
    }
}
