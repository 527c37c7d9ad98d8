package com.versionrace.core.exception;

/**
 * Infrastructure failure reported by the storage layer.
 * Propagated unchanged, never retried.
 */
public abstract class StorageException extends VersionRaceException {
    
    protected StorageException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
