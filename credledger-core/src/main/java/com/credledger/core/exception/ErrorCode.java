package com.credledger.core.exception;

/**
 * Failure categories reported by registry operations.
 */
public enum ErrorCode {
    /** Caller lacks the role the operation requires. */
    UNAUTHORIZED,
    /** Caller already registered an identity. */
    ALREADY_EXISTS,
    /** Referenced identity or credential is absent. */
    NOT_FOUND,
    /** A required field is empty or out of range. */
    INVALID_INPUT,
    /** Credential does not belong to the subject it was checked against. */
    MISMATCH,
    /** Credential was revoked by its issuer. */
    INVALID,
    /** Credential is past its expiration timestamp. */
    EXPIRED
}
