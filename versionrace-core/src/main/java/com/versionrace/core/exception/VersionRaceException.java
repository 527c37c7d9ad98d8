package com.versionrace.core.exception;

/**
 * Base exception for all version race errors.
 */
public class VersionRaceException extends RuntimeException {
    
    private final String errorCode;
    
    public VersionRaceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public VersionRaceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
