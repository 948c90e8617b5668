package com.credledger.core.verification;

import com.credledger.core.audit.RegistryEvent;
import com.credledger.core.credential.CredentialRecord;
import com.credledger.core.credential.CredentialStore;
import com.credledger.core.domain.Principal;
import com.credledger.core.exception.CredentialExpiredException;
import com.credledger.core.exception.CredentialMismatchException;
import com.credledger.core.exception.CredentialRevokedException;
import com.credledger.core.exception.NotFoundException;
import com.credledger.core.exception.UnauthorizedException;
import com.credledger.core.identity.IdentityStore;
import com.credledger.core.ledger.LedgerTransaction;
import com.credledger.core.role.RoleRegistry;

import java.time.Instant;
import java.util.Objects;

/**
 * Answers "is this identity or credential currently valid".
 *
 * Holds no state of its own. General verification escalates trust on an identity
 * through {@link IdentityStore}; credential verification only reads.
 * A single authorized verifier's attestation is sufficient to mark an identity verified.
 */
public class VerificationEngine {

    public static final long GENERAL_VERIFICATION = 0L;

    private final RoleRegistry roleRegistry;
    private final IdentityStore identityStore;
    private final CredentialStore credentialStore;

    public VerificationEngine(RoleRegistry roleRegistry, IdentityStore identityStore,
                              CredentialStore credentialStore) {
        this.roleRegistry = Objects.requireNonNull(roleRegistry, "Role registry cannot be null");
        this.identityStore = Objects.requireNonNull(identityStore, "Identity store cannot be null");
        this.credentialStore = Objects.requireNonNull(credentialStore, "Credential store cannot be null");
    }

    /**
     * Verifies {@code subject} on behalf of the transaction caller.
     *
     * @param credentialId {@link #GENERAL_VERIFICATION} for a general verification, else the credential to check
     * @throws UnauthorizedException       if the caller is not an authorized verifier
     * @throws NotFoundException           if the subject has no identity, or the credential does not exist
     * @throws CredentialMismatchException if the credential was issued to someone else
     * @throws CredentialRevokedException  if the credential was revoked
     * @throws CredentialExpiredException  if the transaction time is past the credential's expiry
     */
    public VerificationOutcome verify(LedgerTransaction tx, Principal subject, long credentialId) {
        Objects.requireNonNull(subject, "Subject cannot be null");
        Principal verifier = tx.caller();
        roleRegistry.requireVerifier(verifier);
        identityStore.requireExisting(subject);

        if (credentialId == GENERAL_VERIFICATION) {
            return verifyIdentity(tx, subject, verifier);
        }
        return checkCredential(tx.timestamp(), subject, verifier, credentialId);
    }

    private VerificationOutcome verifyIdentity(LedgerTransaction tx, Principal subject, Principal verifier) {
        identityStore.recordVerification(tx, subject, verifier);
        tx.emit(RegistryEvent.identityVerified(subject, verifier, tx.timestamp()));
        return new VerificationOutcome(VerificationMode.GENERAL, subject, verifier,
                GENERAL_VERIFICATION, tx.timestamp());
    }

    private VerificationOutcome checkCredential(Instant now, Principal subject, Principal verifier,
                                                long credentialId) {
        CredentialRecord credential = credentialStore.require(credentialId);
        if (!credential.subject().equals(subject)) {
            throw new CredentialMismatchException(
                    "Credential " + credentialId + " was not issued to " + subject);
        }
        if (!credential.valid()) {
            throw new CredentialRevokedException("Credential " + credentialId + " has been revoked");
        }
        if (now.isAfter(credential.expiresAt())) {
            throw new CredentialExpiredException(
                    "Credential " + credentialId + " expired at " + credential.expiresAt());
        }
        return new VerificationOutcome(VerificationMode.CREDENTIAL, subject, verifier, credentialId, now);
    }
}
