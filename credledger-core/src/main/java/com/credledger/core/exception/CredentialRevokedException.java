package com.credledger.core.exception;

/**
 * Thrown when a revoked credential is presented for verification.
 */
public class CredentialRevokedException extends RegistryException {

    public CredentialRevokedException(String message) {
        super(ErrorCode.INVALID, message);
    }
}
