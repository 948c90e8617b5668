package com.credledger.core.identity;

import com.credledger.core.domain.Principal;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a registered identity.
 *
 * @param owner      principal the identity belongs to, also its key
 * @param name       self-declared name, write-once
 * @param email      self-declared email, write-once
 * @param createdAt  ledger time of registration
 * @param verified   true once any authorized verifier performed a general verification
 * @param attributes extension attributes; currently always empty
 * @param verifiers  principals that performed a general verification, in first-seen order
 */
public record IdentityRecord(
        Principal owner,
        String name,
        String email,
        Instant createdAt,
        boolean verified,
        Map<String, String> attributes,
        Set<Principal> verifiers
) {
    public IdentityRecord {
        Objects.requireNonNull(owner, "Owner cannot be null");
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(email, "Email cannot be null");
        Objects.requireNonNull(createdAt, "Created at cannot be null");
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
        verifiers = verifiers != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(verifiers))
                : Set.of();
    }
}
