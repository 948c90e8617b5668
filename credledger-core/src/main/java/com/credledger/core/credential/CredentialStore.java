package com.credledger.core.credential;

import com.credledger.core.audit.RegistryEvent;
import com.credledger.core.domain.Principal;
import com.credledger.core.exception.InvalidInputException;
import com.credledger.core.exception.NotFoundException;
import com.credledger.core.exception.UnauthorizedException;
import com.credledger.core.identity.IdentityStore;
import com.credledger.core.ledger.LedgerTransaction;
import com.credledger.core.role.RoleRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Credentials keyed by a sequential id starting at 1.
 *
 * Ids are never reused. A rejected or rolled-back issuance leaves the counter
 * untouched, so successful issuances form a gapless sequence.
 */
public class CredentialStore {

    private final RoleRegistry roleRegistry;
    private final IdentityStore identityStore;
    private final Map<Long, Credential> credentials = new HashMap<>();
    private final Map<Principal, List<Long>> bySubject = new HashMap<>();
    private long totalCredentials;

    public CredentialStore(RoleRegistry roleRegistry, IdentityStore identityStore) {
        this.roleRegistry = Objects.requireNonNull(roleRegistry, "Role registry cannot be null");
        this.identityStore = Objects.requireNonNull(identityStore, "Identity store cannot be null");
    }

    /**
     * Issues a credential from the transaction caller to {@code subject}.
     *
     * @param expirationSeconds seconds from issuance until expiry; zero expires immediately after the issuing second
     * @return the new credential
     * @throws UnauthorizedException if the caller is not an authorized verifier
     * @throws NotFoundException     if the subject has no identity
     * @throws InvalidInputException if type or data is blank, or the duration is negative or unrepresentable
     */
    public CredentialRecord issue(LedgerTransaction tx, Principal subject, String credentialType,
                                  String data, long expirationSeconds) {
        Objects.requireNonNull(subject, "Subject cannot be null");
        Principal issuer = tx.caller();
        roleRegistry.requireVerifier(issuer);
        identityStore.requireExisting(subject);
        requireText(credentialType, "Credential type");
        requireText(data, "Credential data");

        Instant issuedAt = tx.timestamp();
        if (expirationSeconds < 0) {
            throw new InvalidInputException("Expiration duration cannot be negative: " + expirationSeconds);
        }
        if (expirationSeconds > Instant.MAX.getEpochSecond() - issuedAt.getEpochSecond()) {
            throw new InvalidInputException("Expiration duration too large: " + expirationSeconds);
        }

        long id = ++totalCredentials;
        tx.onRollback(() -> totalCredentials--);

        Credential credential = new Credential(id, issuer, subject, credentialType, data,
                issuedAt, issuedAt.plusSeconds(expirationSeconds));
        credentials.put(id, credential);
        tx.onRollback(() -> credentials.remove(id));

        List<Long> subjectIds = bySubject.computeIfAbsent(subject, k -> new ArrayList<>());
        subjectIds.add(id);
        tx.onRollback(() -> subjectIds.remove(Long.valueOf(id)));

        tx.emit(RegistryEvent.credentialIssued(id, issuer, subject, credentialType, issuedAt));
        return credential.toRecord();
    }

    /**
     * Revokes a credential. Only its issuer may do so; revoking twice succeeds.
     *
     * @throws UnauthorizedException if the caller did not issue this credential, or it does not exist
     */
    public CredentialRecord revoke(LedgerTransaction tx, long credentialId) {
        Credential credential = credentials.get(credentialId);
        Principal caller = tx.caller();
        if (credential == null || !credential.issuer().equals(caller)) {
            throw new UnauthorizedException("Caller " + caller + " is not the issuer of credential " + credentialId);
        }

        if (credential.isValid()) {
            credential.setValid(false);
            tx.onRollback(() -> credential.setValid(true));
        }
        tx.emit(RegistryEvent.credentialRevoked(credentialId, caller, tx.timestamp()));
        return credential.toRecord();
    }

    public Optional<CredentialRecord> find(long credentialId) {
        return Optional.ofNullable(credentials.get(credentialId)).map(Credential::toRecord);
    }

    /**
     * @throws NotFoundException if no credential has this id
     */
    public CredentialRecord require(long credentialId) {
        return find(credentialId)
                .orElseThrow(() -> new NotFoundException("Credential not found: " + credentialId));
    }

    /**
     * Ids issued to the subject, in issuance order.
     */
    public List<Long> idsIssuedTo(Principal subject) {
        return List.copyOf(bySubject.getOrDefault(subject, List.of()));
    }

    public long getTotalCredentials() {
        return totalCredentials;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field + " is required");
        }
    }
}
