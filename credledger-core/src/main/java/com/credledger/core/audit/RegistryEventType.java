package com.credledger.core.audit;

/**
 * State transitions recorded in the audit log, one per successful mutating operation.
 */
public enum RegistryEventType {
    IDENTITY_CREATED,
    IDENTITY_VERIFIED,
    CREDENTIAL_ISSUED,
    CREDENTIAL_REVOKED,
    VERIFIER_AUTHORIZED
}
