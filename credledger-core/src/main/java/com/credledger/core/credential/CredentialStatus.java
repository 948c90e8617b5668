package com.credledger.core.credential;

/**
 * Derived usability of a credential at a point in time.
 * Only {@code REVOKED} is stored; {@code EXPIRED} is computed from the clock.
 */
public enum CredentialStatus {
    ACTIVE,
    EXPIRED,
    REVOKED
}
