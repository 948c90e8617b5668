package com.credledger.core.identity;

import com.credledger.core.audit.RegistryEvent;
import com.credledger.core.domain.Principal;
import com.credledger.core.exception.IdentityAlreadyExistsException;
import com.credledger.core.exception.InvalidInputException;
import com.credledger.core.exception.NotFoundException;
import com.credledger.core.ledger.LedgerTransaction;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps each principal to at most one identity.
 *
 * Identities are created once, never deleted, and their name and email are
 * write-once. The only later mutation is the one-way verification flag plus
 * the verifier set, applied through {@link #recordVerification}.
 */
public class IdentityStore {

    private final Map<Principal, Identity> identities = new HashMap<>();

    /**
     * Registers the transaction caller's identity.
     *
     * @throws IdentityAlreadyExistsException if the caller already has one
     * @throws InvalidInputException          if name or email is blank
     */
    public IdentityRecord create(LedgerTransaction tx, String name, String email) {
        Principal owner = tx.caller();
        if (identities.containsKey(owner)) {
            throw new IdentityAlreadyExistsException("Identity already exists for " + owner);
        }
        requireText(name, "Name");
        requireText(email, "Email");

        Identity identity = new Identity(owner, name, email, tx.timestamp());
        identities.put(owner, identity);
        tx.onRollback(() -> identities.remove(owner));
        tx.emit(RegistryEvent.identityCreated(owner, name, tx.timestamp()));
        return identity.toRecord();
    }

    /**
     * Marks the identity verified and records the verifier.
     * Re-verification leaves the flag as is but still adds a new verifier.
     */
    public IdentityRecord recordVerification(LedgerTransaction tx, Principal subject, Principal verifier) {
        Identity identity = require(subject);

        if (!identity.isVerified()) {
            identity.setVerified(true);
            tx.onRollback(() -> identity.setVerified(false));
        }
        if (identity.addVerifier(verifier)) {
            tx.onRollback(() -> identity.removeVerifier(verifier));
        }
        return identity.toRecord();
    }

    public Optional<IdentityRecord> find(Principal owner) {
        return Optional.ofNullable(identities.get(owner)).map(Identity::toRecord);
    }

    public boolean exists(Principal owner) {
        return owner != null && identities.containsKey(owner);
    }

    /**
     * @throws NotFoundException if the principal has no identity
     */
    public void requireExisting(Principal owner) {
        require(owner);
    }

    public Set<Principal> verifiersOf(Principal owner) {
        return find(owner).map(IdentityRecord::verifiers).orElse(Set.of());
    }

    public int size() {
        return identities.size();
    }

    private Identity require(Principal owner) {
        Objects.requireNonNull(owner, "Principal cannot be null");
        Identity identity = identities.get(owner);
        if (identity == null) {
            throw new NotFoundException("No identity registered for " + owner);
        }
        return identity;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field + " is required");
        }
    }
}
