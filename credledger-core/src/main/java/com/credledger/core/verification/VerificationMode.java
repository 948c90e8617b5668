package com.credledger.core.verification;

/**
 * Selected by the credential id passed to a verification: {@code 0} means general.
 */
public enum VerificationMode {
    /** One-way trust attestation on the identity as a whole. Mutates state. */
    GENERAL,
    /** Read-only validity check of one credential against its subject. */
    CREDENTIAL
}
