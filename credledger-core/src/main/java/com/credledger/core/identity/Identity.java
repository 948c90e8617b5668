package com.credledger.core.identity;

import com.credledger.core.domain.Principal;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable identity state, owned by {@link IdentityStore}.
 * Callers outside the store only ever see {@link IdentityRecord} snapshots.
 */
final class Identity {

    private final Principal owner;
    private final String name;
    private final String email;
    private final Instant createdAt;
    private boolean verified;
    // reserved extension point, no operation populates it yet
    private final Map<String, String> attributes;
    private final Set<Principal> verifiers;

    Identity(Principal owner, String name, String email, Instant createdAt) {
        this.owner = owner;
        this.name = name;
        this.email = email;
        this.createdAt = createdAt;
        this.verified = false;
        this.attributes = new LinkedHashMap<>();
        this.verifiers = new LinkedHashSet<>();
    }

    Principal owner() {
        return owner;
    }

    boolean isVerified() {
        return verified;
    }

    void setVerified(boolean verified) {
        this.verified = verified;
    }

    boolean addVerifier(Principal verifier) {
        return verifiers.add(verifier);
    }

    void removeVerifier(Principal verifier) {
        verifiers.remove(verifier);
    }

    IdentityRecord toRecord() {
        return new IdentityRecord(owner, name, email, createdAt, verified, attributes, verifiers);
    }
}
