package com.credledger.core.credential;

import com.credledger.core.audit.RegistryAuditLog;
import com.credledger.core.audit.RegistryEventType;
import com.credledger.core.domain.Principal;
import com.credledger.core.exception.InvalidInputException;
import com.credledger.core.exception.NotFoundException;
import com.credledger.core.exception.RegistryException;
import com.credledger.core.exception.UnauthorizedException;
import com.credledger.core.identity.IdentityStore;
import com.credledger.core.ledger.LedgerTransactionExecutor;
import com.credledger.core.role.RoleRegistry;
import com.credledger.core.support.MutableClock;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import net.jqwik.api.lifecycle.BeforeTry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.credledger.core.support.TestPrincipals.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for credential issuance and revocation.
 */
class CredentialStorePropertyTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private RegistryAuditLog auditLog;
    private LedgerTransactionExecutor executor;
    private RoleRegistry roles;
    private IdentityStore identities;
    private CredentialStore store;

    @BeforeEach
    @BeforeTry
    void setUp() {
        clock = new MutableClock(T0);
        auditLog = new RegistryAuditLog("test-ledger");
        executor = new LedgerTransactionExecutor(clock, auditLog);
        roles = new RoleRegistry(ADMIN);
        identities = new IdentityStore();
        store = new CredentialStore(roles, identities);
        executor.run("addVerifier", ADMIN, tx -> roles.authorizeVerifier(tx, VERIFIER));
        executor.execute("createIdentity", USER, tx -> identities.create(tx, "Ada", "ada@example.org"));
        executor.execute("createIdentity", OTHER_USER, tx -> identities.create(tx, "Grace", "grace@example.org"));
    }

    private CredentialRecord issue(Principal issuer, Principal subject, String type, String data, long seconds) {
        return executor.execute("issueCredential", issuer, tx -> store.issue(tx, subject, type, data, seconds));
    }

    // ==================== Issuance ====================

    @Test
    void issue_assignsFirstIdAndExpiry() {
        CredentialRecord credential = issue(VERIFIER, USER, "education", "ipfs://hash1", 3600);

        assertThat(credential.id()).isEqualTo(1L);
        assertThat(credential.issuer()).isEqualTo(VERIFIER);
        assertThat(credential.subject()).isEqualTo(USER);
        assertThat(credential.issuedAt()).isEqualTo(T0);
        assertThat(credential.expiresAt()).isEqualTo(T0.plusSeconds(3600));
        assertThat(credential.valid()).isTrue();
        assertThat(store.getTotalCredentials()).isEqualTo(1);
        assertThat(auditLog.getEntries(RegistryEventType.CREDENTIAL_ISSUED)).singleElement()
                .satisfies(e -> assertThat(e.event().attribute("credentialType")).isEqualTo("education"));
    }

    @Test
    void issue_zeroDurationExpiresAtIssuance() {
        CredentialRecord credential = issue(ADMIN, USER, "session", "ipfs://s", 0);

        assertThat(credential.expiresAt()).isEqualTo(credential.issuedAt());
        assertThat(credential.isUsableAt(T0)).isTrue();
        assertThat(credential.isUsableAt(T0.plusSeconds(1))).isFalse();
    }

    @Test
    void issue_checksAuthorizationBeforeSubjectAndInput() {
        assertThatThrownBy(() -> issue(OUTSIDER, OUTSIDER, "", "", -1))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> issue(VERIFIER, OUTSIDER, "", "", -1))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> issue(VERIFIER, USER, "", "ipfs://x", 10))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> issue(VERIFIER, USER, "kyc", " ", 10))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> issue(VERIFIER, USER, "kyc", "ipfs://x", -1))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> issue(VERIFIER, USER, "kyc", "ipfs://x", Long.MAX_VALUE))
                .isInstanceOf(InvalidInputException.class);

        assertThat(store.getTotalCredentials()).isZero();
        assertThat(auditLog.getEntries(RegistryEventType.CREDENTIAL_ISSUED)).isEmpty();
    }

    @Test
    void issue_rolledBackIssuanceDoesNotConsumeId() {
        assertThatThrownBy(() -> executor.execute("issueCredential", VERIFIER, tx -> {
            store.issue(tx, USER, "kyc", "ipfs://x", 60);
            throw new IllegalStateException("fail after issue");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(store.getTotalCredentials()).isZero();
        assertThat(store.find(1)).isEmpty();
        assertThat(store.idsIssuedTo(USER)).isEmpty();
        assertThat(issue(VERIFIER, USER, "kyc", "ipfs://x", 60).id()).isEqualTo(1L);
    }

    /**
     * Property: ids of successful issuances are 1..n with no gaps, whatever fails in between.
     */
    @Property(tries = 50)
    void idsAreGaplessAcrossFailedAttempts(@ForAll @Size(min = 1, max = 30) List<@From("attempts") Attempt> attempts) {
        List<Long> issued = new ArrayList<>();
        for (Attempt attempt : attempts) {
            try {
                issued.add(issue(attempt.issuer(), attempt.subject(), attempt.type(), "ipfs://data", attempt.seconds()).id());
            } catch (RegistryException expected) {
                assertThat(attempt.shouldSucceed()).isFalse();
            }
        }

        long successes = attempts.stream().filter(Attempt::shouldSucceed).count();
        assertThat(issued).hasSize((int) successes);
        for (int i = 0; i < issued.size(); i++) {
            assertThat(issued.get(i)).isEqualTo(i + 1L);
        }
        assertThat(store.getTotalCredentials()).isEqualTo(successes);
        assertThat(auditLog.getEntries(RegistryEventType.CREDENTIAL_ISSUED)).hasSize((int) successes);
    }

    @Provide
    Arbitrary<Attempt> attempts() {
        Arbitrary<Principal> issuers = Arbitraries.of(ADMIN, VERIFIER, OUTSIDER);
        Arbitrary<Principal> subjects = Arbitraries.of(USER, OTHER_USER, OUTSIDER);
        Arbitrary<String> types = Arbitraries.of("education", "kyc", "");
        Arbitrary<Long> seconds = Arbitraries.longs().between(-5, 100_000);
        return Combinators.combine(issuers, subjects, types, seconds).as(Attempt::new);
    }

    record Attempt(Principal issuer, Principal subject, String type, long seconds) {
        boolean shouldSucceed() {
            return !issuer.equals(OUTSIDER) && !subject.equals(OUTSIDER) && !type.isEmpty() && seconds >= 0;
        }
    }

    // ==================== Revocation ====================

    @Test
    void revoke_byIssuerIsIdempotent() {
        long id = issue(VERIFIER, USER, "education", "ipfs://hash1", 3600).id();

        executor.execute("revokeCredential", VERIFIER, tx -> store.revoke(tx, id));
        CredentialRecord again = executor.execute("revokeCredential", VERIFIER, tx -> store.revoke(tx, id));

        assertThat(again.valid()).isFalse();
        assertThat(store.find(id).orElseThrow().statusAt(T0)).isEqualTo(CredentialStatus.REVOKED);
        assertThat(auditLog.getEntries(RegistryEventType.CREDENTIAL_REVOKED)).hasSize(2);
    }

    @Test
    void revoke_byAdminOfAnotherIssuersCredentialIsRejected() {
        long id = issue(VERIFIER, USER, "education", "ipfs://hash1", 3600).id();

        assertThatThrownBy(() -> executor.execute("revokeCredential", ADMIN, tx -> store.revoke(tx, id)))
                .isInstanceOf(UnauthorizedException.class);

        assertThat(store.find(id).orElseThrow().valid()).isTrue();
    }

    @Test
    void revoke_unknownCredentialIsUnauthorized() {
        assertThatThrownBy(() -> executor.execute("revokeCredential", VERIFIER, tx -> store.revoke(tx, 42)))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessageContaining("credential 42");
    }

    /**
     * Property: once revoked, no sequence of further revocations or time passing makes a credential valid again.
     */
    @Property(tries = 30)
    void revocationIsPermanent(@ForAll @IntRange(min = 1, max = 5) int revocations,
                               @ForAll @LongRange(min = 0, max = 1_000_000) long elapsed) {
        long id = issue(ADMIN, OTHER_USER, "kyc", "ipfs://k", 10_000).id();
        for (int i = 0; i < revocations; i++) {
            executor.execute("revokeCredential", ADMIN, tx -> store.revoke(tx, id));
            clock.advanceSeconds(elapsed / revocations);
        }

        CredentialRecord credential = store.find(id).orElseThrow();
        assertThat(credential.valid()).isFalse();
        assertThat(credential.isUsableAt(clock.instant())).isFalse();
    }

    // ==================== Reads ====================

    @Test
    void find_unknownIdsAreEmpty() {
        assertThat(store.find(0)).isEmpty();
        assertThat(store.find(-1)).isEmpty();
        assertThat(store.find(1)).isEmpty();
        assertThatThrownBy(() -> store.require(1)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void idsIssuedTo_tracksSubjectInIssuanceOrder() {
        issue(VERIFIER, USER, "a", "ipfs://1", 1);
        issue(VERIFIER, OTHER_USER, "b", "ipfs://2", 1);
        issue(ADMIN, USER, "c", "ipfs://3", 1);

        assertThat(store.idsIssuedTo(USER)).containsExactly(1L, 3L);
        assertThat(store.idsIssuedTo(OTHER_USER)).containsExactly(2L);
        assertThat(store.idsIssuedTo(OUTSIDER)).isEmpty();
    }

    @Test
    void statusAt_expiryBoundaryIsInclusive() {
        CredentialRecord credential = issue(VERIFIER, USER, "education", "ipfs://hash1", 3600);

        assertThat(credential.statusAt(T0.plusSeconds(3600))).isEqualTo(CredentialStatus.ACTIVE);
        assertThat(credential.statusAt(T0.plusSeconds(3601))).isEqualTo(CredentialStatus.EXPIRED);
    }
}
