package com.credledger.core.verification;

import com.credledger.core.domain.Principal;

import java.time.Instant;

/**
 * Successful verification. Failures are reported as exceptions instead.
 *
 * @param credentialId the checked credential, or {@code 0} for a general verification
 */
public record VerificationOutcome(
        VerificationMode mode,
        Principal subject,
        Principal verifier,
        long credentialId,
        Instant verifiedAt
) {}
