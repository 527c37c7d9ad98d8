package com.versionrace.core.exception;

/**
 * Thrown when an operation's deadline expires or the calling thread is interrupted.
 */
public class OperationTimeoutException extends VersionRaceException {
    
    public static final String ERROR_CODE = "TIMEOUT";
    
    public OperationTimeoutException(String operation) {
        super(ERROR_CODE, String.format("Deadline expired during %s", operation));
    }
    
    public OperationTimeoutException(String operation, Throwable cause) {
        super(ERROR_CODE, String.format("Deadline expired during %s", operation), cause);
    }
}
