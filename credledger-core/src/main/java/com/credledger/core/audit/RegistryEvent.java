package com.credledger.core.audit;

import com.credledger.core.domain.Principal;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An externally observable registry event.
 * Attribute values are strings so that entries hash and export identically.
 */
public record RegistryEvent(
        RegistryEventType type,
        Map<String, String> attributes,
        Instant timestamp
) {
    public static final String OWNER = "owner";
    public static final String NAME = "name";
    public static final String SUBJECT = "subject";
    public static final String VERIFIER = "verifier";
    public static final String CREDENTIAL_ID = "credentialId";
    public static final String ISSUER = "issuer";
    public static final String CREDENTIAL_TYPE = "credentialType";
    public static final String REVOKED_BY = "revokedBy";
    public static final String AUTHORIZED_BY = "authorizedBy";

    private static final Set<String> PRINCIPAL_KEYS =
            Set.of(OWNER, SUBJECT, VERIFIER, ISSUER, REVOKED_BY, AUTHORIZED_BY);

    public RegistryEvent {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        // insertion order is part of the entry hash
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    public static RegistryEvent identityCreated(Principal owner, String name, Instant timestamp) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(OWNER, owner.address());
        attributes.put(NAME, name);
        return new RegistryEvent(RegistryEventType.IDENTITY_CREATED, attributes, timestamp);
    }

    public static RegistryEvent identityVerified(Principal subject, Principal verifier, Instant timestamp) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(SUBJECT, subject.address());
        attributes.put(VERIFIER, verifier.address());
        return new RegistryEvent(RegistryEventType.IDENTITY_VERIFIED, attributes, timestamp);
    }

    public static RegistryEvent credentialIssued(long credentialId, Principal issuer, Principal subject,
                                                 String credentialType, Instant timestamp) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(CREDENTIAL_ID, Long.toString(credentialId));
        attributes.put(ISSUER, issuer.address());
        attributes.put(SUBJECT, subject.address());
        attributes.put(CREDENTIAL_TYPE, credentialType);
        return new RegistryEvent(RegistryEventType.CREDENTIAL_ISSUED, attributes, timestamp);
    }

    public static RegistryEvent credentialRevoked(long credentialId, Principal revokedBy, Instant timestamp) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(CREDENTIAL_ID, Long.toString(credentialId));
        attributes.put(REVOKED_BY, revokedBy.address());
        return new RegistryEvent(RegistryEventType.CREDENTIAL_REVOKED, attributes, timestamp);
    }

    public static RegistryEvent verifierAuthorized(Principal verifier, Principal authorizedBy, Instant timestamp) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(VERIFIER, verifier.address());
        attributes.put(AUTHORIZED_BY, authorizedBy.address());
        return new RegistryEvent(RegistryEventType.VERIFIER_AUTHORIZED, attributes, timestamp);
    }

    /**
     * True if the principal appears in any principal-valued attribute.
     */
    public boolean involves(Principal principal) {
        return attributes.entrySet().stream()
                .anyMatch(e -> PRINCIPAL_KEYS.contains(e.getKey())
                        && e.getValue().equals(principal.address()));
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
