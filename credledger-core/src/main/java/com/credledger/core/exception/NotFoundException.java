package com.credledger.core.exception;

/**
 * Thrown when an operation references an identity or credential that does not exist.
 */
public class NotFoundException extends RegistryException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
