package com.versionrace.core.exception;

/**
 * Thrown when a connection or transaction cannot be opened.
 */
public class ConnectionException extends StorageException {
    
    public static final String ERROR_CODE = "CONNECTION_FAILED";
    
    public ConnectionException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
