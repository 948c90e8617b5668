package com.credledger.core.credential;

import com.credledger.core.domain.Principal;

import java.time.Instant;

/**
 * Mutable credential state, owned by {@link CredentialStore}.
 */
final class Credential {

    private final long id;
    private final Principal issuer;
    private final Principal subject;
    private final String credentialType;
    private final String data;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private boolean valid;

    Credential(long id, Principal issuer, Principal subject, String credentialType,
               String data, Instant issuedAt, Instant expiresAt) {
        this.id = id;
        this.issuer = issuer;
        this.subject = subject;
        this.credentialType = credentialType;
        this.data = data;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        this.valid = true;
    }

    Principal issuer() {
        return issuer;
    }

    Principal subject() {
        return subject;
    }

    boolean isValid() {
        return valid;
    }

    void setValid(boolean valid) {
        this.valid = valid;
    }

    CredentialRecord toRecord() {
        return new CredentialRecord(id, issuer, subject, credentialType, data, issuedAt, expiresAt, valid);
    }
}
