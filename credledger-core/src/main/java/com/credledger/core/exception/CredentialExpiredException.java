package com.credledger.core.exception;

/**
 * Thrown when a credential is presented after its expiration timestamp.
 */
public class CredentialExpiredException extends RegistryException {

    public CredentialExpiredException(String message) {
        super(ErrorCode.EXPIRED, message);
    }
}
