package com.credledger.core;

import com.credledger.core.audit.RegistryAuditLog;
import com.credledger.core.credential.CredentialRecord;
import com.credledger.core.credential.CredentialStore;
import com.credledger.core.domain.Principal;
import com.credledger.core.identity.IdentityRecord;
import com.credledger.core.identity.IdentityStore;
import com.credledger.core.ledger.LedgerTransactionExecutor;
import com.credledger.core.role.RoleRegistry;
import com.credledger.core.verification.VerificationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ledger-backed registry of self-issued identities and verifier-issued credentials.
 *
 * Every operation runs as one serialized transaction: it either commits all of
 * its effects together with its audit event, or throws a
 * {@link com.credledger.core.exception.RegistryException} and changes nothing.
 * Reads never fail on missing records; they return empty results.
 */
public class IdentityRegistry {

    private static final Logger log = LoggerFactory.getLogger(IdentityRegistry.class);

    private final LedgerTransactionExecutor executor;
    private final RoleRegistry roleRegistry;
    private final IdentityStore identityStore;
    private final CredentialStore credentialStore;
    private final VerificationEngine verificationEngine;

    /**
     * Brings the registry up with {@code admin} as administrator and first verifier.
     */
    public IdentityRegistry(Principal admin, Clock clock, RegistryAuditLog auditLog) {
        this.executor = new LedgerTransactionExecutor(clock, auditLog);
        this.roleRegistry = new RoleRegistry(admin);
        this.identityStore = new IdentityStore();
        this.credentialStore = new CredentialStore(roleRegistry, identityStore);
        this.verificationEngine = new VerificationEngine(roleRegistry, identityStore, credentialStore);
    }

    public static IdentityRegistry initialize(Principal admin, Clock clock, String nodeId) {
        return new IdentityRegistry(admin, clock, new RegistryAuditLog(nodeId));
    }

    // ==================== Mutating operations ====================

    /**
     * Registers the caller's identity. Name and email can never be changed afterwards.
     */
    public IdentityRecord createIdentity(Principal caller, String name, String email) {
        return executor.execute("createIdentity", caller,
                tx -> identityStore.create(tx, name, email));
    }

    /**
     * Admin only. Granting an existing verifier again succeeds and is logged again.
     */
    public void addVerifier(Principal caller, Principal target) {
        executor.run("addVerifier", caller, tx -> roleRegistry.authorizeVerifier(tx, target));
    }

    /**
     * Authorized verifiers only.
     *
     * @return the new credential id
     */
    public long issueCredential(Principal caller, Principal subject, String credentialType,
                                String data, long durationSeconds) {
        CredentialRecord issued = executor.execute("issueCredential", caller,
                tx -> credentialStore.issue(tx, subject, credentialType, data, durationSeconds));
        log.info("Credential {} ({}) issued by {} to {}, expires {}",
                issued.id(), issued.credentialType(), caller.shortForm(), subject.shortForm(), issued.expiresAt());
        return issued.id();
    }

    /**
     * General verification of {@code user}.
     */
    public boolean verifyIdentity(Principal caller, Principal user) {
        return verifyIdentity(caller, user, VerificationEngine.GENERAL_VERIFICATION);
    }

    /**
     * Verifies {@code user}; with a non-zero {@code credentialId} checks that credential without mutating anything.
     *
     * @return always {@code true}; every failure is an exception
     */
    public boolean verifyIdentity(Principal caller, Principal user, long credentialId) {
        executor.execute("verifyIdentity", caller,
                tx -> verificationEngine.verify(tx, user, credentialId));
        return true;
    }

    /**
     * Issuer only. Revoking an already revoked credential succeeds.
     */
    public void revokeCredential(Principal caller, long credentialId) {
        executor.run("revokeCredential", caller, tx -> credentialStore.revoke(tx, credentialId));
    }

    // ==================== Reads ====================

    public Optional<IdentityRecord> getIdentity(Principal user) {
        return executor.read(() -> identityStore.find(user));
    }

    public Optional<CredentialRecord> getCredential(long credentialId) {
        return executor.read(() -> credentialStore.find(credentialId));
    }

    public boolean isAuthorizedVerifier(Principal principal) {
        return executor.read(() -> roleRegistry.isAuthorizedVerifier(principal));
    }

    public long getTotalCredentials() {
        return executor.read(credentialStore::getTotalCredentials);
    }

    /**
     * Principals that performed a general verification of {@code user}; empty if none or no identity.
     */
    public Set<Principal> getIdentityVerifiers(Principal user) {
        return executor.read(() -> identityStore.verifiersOf(user));
    }

    public List<Long> getCredentialsOf(Principal subject) {
        Objects.requireNonNull(subject, "Subject cannot be null");
        return executor.read(() -> credentialStore.idsIssuedTo(subject));
    }

    /**
     * Whether the credential is unrevoked and unexpired right now. False for unknown ids.
     */
    public boolean isCredentialUsable(long credentialId) {
        return executor.read(() -> credentialStore.find(credentialId)
                .map(c -> c.isUsableAt(executor.now()))
                .orElse(false));
    }

    public Principal getAdmin() {
        return roleRegistry.getAdmin();
    }

    public RegistryAuditLog getAuditLog() {
        return executor.getAuditLog();
    }
}
