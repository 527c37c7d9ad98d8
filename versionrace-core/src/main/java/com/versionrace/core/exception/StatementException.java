package com.versionrace.core.exception;

/**
 * Thrown when a statement fails inside an open transaction,
 * including constraint violations and serialization failures.
 */
public class StatementException extends StorageException {
    
    public static final String ERROR_CODE = "STATEMENT_FAILED";
    
    public StatementException(String message) {
        super(ERROR_CODE, message, null);
    }
    
    public StatementException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
