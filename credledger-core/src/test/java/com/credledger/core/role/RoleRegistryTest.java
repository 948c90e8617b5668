package com.credledger.core.role;

import com.credledger.core.audit.RegistryAuditLog;
import com.credledger.core.audit.RegistryEventType;
import com.credledger.core.exception.ErrorCode;
import com.credledger.core.exception.UnauthorizedException;
import com.credledger.core.ledger.LedgerTransactionExecutor;
import com.credledger.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.credledger.core.support.TestPrincipals.*;
import static org.assertj.core.api.Assertions.*;

class RoleRegistryTest {

    private RegistryAuditLog auditLog;
    private LedgerTransactionExecutor executor;
    private RoleRegistry roles;

    @BeforeEach
    void setUp() {
        auditLog = new RegistryAuditLog("test-ledger");
        executor = new LedgerTransactionExecutor(MutableClock.startingAt("2026-01-01T00:00:00Z"), auditLog);
        roles = new RoleRegistry(ADMIN);
    }

    @Test
    void constructor_makesInitiatorAdminAndVerifier() {
        assertThat(roles.getAdmin()).isEqualTo(ADMIN);
        assertThat(roles.isAuthorizedVerifier(ADMIN)).isTrue();
        assertThat(roles.getAuthorizedVerifiers()).containsExactly(ADMIN);
    }

    @Test
    void authorizeVerifier_byAdminGrantsRoleAndEmitsEvent() {
        executor.run("addVerifier", ADMIN, tx -> roles.authorizeVerifier(tx, VERIFIER));

        assertThat(roles.isAuthorizedVerifier(VERIFIER)).isTrue();
        assertThat(auditLog.getEntries(RegistryEventType.VERIFIER_AUTHORIZED)).singleElement()
                .satisfies(e -> {
                    assertThat(e.event().attribute("verifier")).isEqualTo(VERIFIER.address());
                    assertThat(e.event().attribute("authorizedBy")).isEqualTo(ADMIN.address());
                });
    }

    @Test
    void authorizeVerifier_isIdempotentButStillLogged() {
        executor.run("addVerifier", ADMIN, tx -> roles.authorizeVerifier(tx, VERIFIER));
        executor.run("addVerifier", ADMIN, tx -> roles.authorizeVerifier(tx, VERIFIER));

        assertThat(roles.getAuthorizedVerifiers()).containsExactlyInAnyOrder(ADMIN, VERIFIER);
        assertThat(auditLog.size()).isEqualTo(2);
    }

    @Test
    void authorizeVerifier_byNonAdminIsRejected() {
        // even an authorized verifier cannot grant the role
        executor.run("addVerifier", ADMIN, tx -> roles.authorizeVerifier(tx, VERIFIER));

        assertThatThrownBy(() -> executor.run("addVerifier", VERIFIER, tx -> roles.authorizeVerifier(tx, OUTSIDER)))
                .isInstanceOf(UnauthorizedException.class)
                .satisfies(e -> assertThat(((UnauthorizedException) e).getErrorCode()).isEqualTo(ErrorCode.UNAUTHORIZED));

        assertThat(roles.isAuthorizedVerifier(OUTSIDER)).isFalse();
        assertThat(auditLog.size()).isEqualTo(1);
    }

    @Test
    void authorizeVerifier_byNonAdminWithNullTargetIsUnauthorized() {
        assertThatThrownBy(() -> executor.run("addVerifier", OUTSIDER, tx -> roles.authorizeVerifier(tx, null)))
                .isInstanceOf(UnauthorizedException.class);

        assertThat(auditLog.size()).isZero();
    }

    @Test
    void authorizeVerifier_grantIsUndoneWhenTransactionFails() {
        assertThatThrownBy(() -> executor.run("addVerifier", ADMIN, tx -> {
            roles.authorizeVerifier(tx, VERIFIER);
            throw new IllegalStateException("fail after grant");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(roles.isAuthorizedVerifier(VERIFIER)).isFalse();
        assertThat(auditLog.size()).isZero();
    }

    @Test
    void isAuthorizedVerifier_handlesNull() {
        assertThat(roles.isAuthorizedVerifier(null)).isFalse();
    }
}
