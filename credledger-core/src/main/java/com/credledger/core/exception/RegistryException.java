package com.credledger.core.exception;

import java.util.Objects;

/**
 * Base class for every rejected registry operation.
 * A thrown {@code RegistryException} always means the transaction was rolled back.
 */
public abstract class RegistryException extends RuntimeException {

    private final ErrorCode errorCode;

    protected RegistryException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
