package com.wpanther.multisigcoordinator.exception;

/**
 * Base type for failures reported to callers of the coordinator.
 * The error code is the machine-readable kind rendered in error responses.
 */
public abstract class MultisigException extends RuntimeException {

    private final String errorCode;

    protected MultisigException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected MultisigException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
