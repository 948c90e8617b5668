package com.credledger.core.exception;

/**
 * Thrown when a credential is checked against a subject it was not issued to.
 */
public class CredentialMismatchException extends RegistryException {

    public CredentialMismatchException(String message) {
        super(ErrorCode.MISMATCH, message);
    }
}
