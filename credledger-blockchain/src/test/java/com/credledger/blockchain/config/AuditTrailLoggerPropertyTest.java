package com.credledger.blockchain.config;

import com.credledger.core.IdentityRegistry;
import com.credledger.core.domain.Principal;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.time.Clock;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for audit trail delivery.
 */
class AuditTrailLoggerPropertyTest {

    private static final Principal ADMIN = Principal.of("0x00000000000000000000000000000000000a11ce");

    /**
     * Property: every committed event reaches the logger once; rejected operations deliver nothing.
     */
    @Property(tries = 50)
    void everyCommittedEventIsDeliveredOnce(
            @ForAll @IntRange(min = 0, max = 20) int identities,
            @ForAll @IntRange(min = 0, max = 5) int duplicateAttempts) {
        // Given
        IdentityRegistry registry = IdentityRegistry.initialize(ADMIN, Clock.systemUTC(), "prop-ledger");
        AuditTrailLogger logger = new AuditTrailLogger(registry.getAuditLog());

        // When
        for (int i = 1; i <= identities; i++) {
            registry.createIdentity(principal(i), "user-" + i, "user" + i + "@example.org");
        }
        for (int i = 0; i < duplicateAttempts && identities > 0; i++) {
            assertThatThrownBy(() -> registry.createIdentity(principal(1), "again", "again@example.org"))
                    .isNotNull();
        }

        // Then
        assertThat(logger.getDelivered()).isEqualTo(identities);
        assertThat(registry.getAuditLog().size()).isEqualTo(identities);

        logger.close();
        assertThat(registry.getAuditLog().getSubscriberCount()).isZero();
    }

    private static Principal principal(int n) {
        return Principal.of(String.format("0x%040x", n));
    }
}
