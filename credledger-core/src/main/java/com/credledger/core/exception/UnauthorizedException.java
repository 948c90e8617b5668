package com.credledger.core.exception;

/**
 * Thrown when the caller is not the admin, not an authorized verifier, or not the issuer.
 */
public class UnauthorizedException extends RegistryException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
