package com.credledger.core.exception;

/**
 * Thrown when a principal tries to register a second identity.
 */
public class IdentityAlreadyExistsException extends RegistryException {

    public IdentityAlreadyExistsException(String message) {
        super(ErrorCode.ALREADY_EXISTS, message);
    }
}
