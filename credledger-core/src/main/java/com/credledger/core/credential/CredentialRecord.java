package com.credledger.core.credential;

import com.credledger.core.domain.Principal;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of an issued credential.
 *
 * @param data opaque reference into external content-addressed storage, never dereferenced here
 */
public record CredentialRecord(
        long id,
        Principal issuer,
        Principal subject,
        String credentialType,
        String data,
        Instant issuedAt,
        Instant expiresAt,
        boolean valid
) {
    public CredentialRecord {
        Objects.requireNonNull(issuer, "Issuer cannot be null");
        Objects.requireNonNull(subject, "Subject cannot be null");
        Objects.requireNonNull(credentialType, "Credential type cannot be null");
        Objects.requireNonNull(data, "Data cannot be null");
        Objects.requireNonNull(issuedAt, "Issued at cannot be null");
        Objects.requireNonNull(expiresAt, "Expires at cannot be null");
    }

    /**
     * True while the credential is unrevoked and {@code at} is not after {@code expiresAt}.
     */
    public boolean isUsableAt(Instant at) {
        return statusAt(at) == CredentialStatus.ACTIVE;
    }

    /**
     * Revocation takes precedence over expiry.
     */
    public CredentialStatus statusAt(Instant at) {
        if (!valid) {
            return CredentialStatus.REVOKED;
        }
        return at.isAfter(expiresAt) ? CredentialStatus.EXPIRED : CredentialStatus.ACTIVE;
    }
}
