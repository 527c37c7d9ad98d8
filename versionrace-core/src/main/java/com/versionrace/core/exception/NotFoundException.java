package com.versionrace.core.exception;

import java.util.UUID;

/**
 * Thrown when a versioned entity does not exist.
 */
public class NotFoundException extends VersionRaceException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    private final UUID key;
    
    public NotFoundException(UUID key) {
        super(ERROR_CODE, String.format("Entity not found: %s", key));
        this.key = key;
    }
    
    public UUID getKey() {
        return key;
    }
}
