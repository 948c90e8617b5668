package com.credledger.core.audit;

import com.credledger.core.domain.Principal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only registry audit log with hash-chaining for tamper detection.
 *
 * Entries are appended only by the transaction executor, after a transaction
 * commits. Subscribers are notified synchronously, in sequence order, once the
 * executor has released the ledger lock.
 */
public class RegistryAuditLog {

    private static final Logger log = LoggerFactory.getLogger(RegistryAuditLog.class);

    public static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final List<AuditEntry> entries;
    private final String nodeId;
    private final ObjectMapper objectMapper;
    private final Map<String, Subscription> subscriptions;
    private volatile String lastHash;

    public RegistryAuditLog(String nodeId) {
        this.nodeId = Objects.requireNonNull(nodeId, "Node ID cannot be null");
        this.entries = new CopyOnWriteArrayList<>();
        this.subscriptions = new ConcurrentHashMap<>();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.lastHash = GENESIS_HASH;
    }

    /**
     * Appends the events of one committed transaction to the chain.
     * Subscribers are not notified until {@link #publish(List)} is called.
     */
    public synchronized List<AuditEntry> appendCommitted(String transactionId, List<RegistryEvent> events) {
        Objects.requireNonNull(transactionId, "Transaction ID cannot be null");
        Objects.requireNonNull(events, "Events cannot be null");

        List<AuditEntry> appended = new ArrayList<>(events.size());
        for (RegistryEvent event : events) {
            appended.add(append(transactionId, event));
        }
        return appended;
    }

    /**
     * Delivers already-appended entries to subscribers, in order.
     */
    public void publish(List<AuditEntry> committed) {
        committed.forEach(this::notifySubscribers);
    }

    private AuditEntry append(String transactionId, RegistryEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");

        String entryId = UUID.randomUUID().toString();
        String previousHash = lastHash;
        long sequenceNumber = entries.size();
        String entryHash = computeEntryHash(entryId, sequenceNumber, transactionId, nodeId, previousHash, event);

        AuditEntry entry = new AuditEntry(
                entryId,
                sequenceNumber,
                transactionId,
                event,
                previousHash,
                entryHash,
                nodeId
        );

        entries.add(entry);
        lastHash = entryHash;
        return entry;
    }

    // ==================== Subscriptions ====================

    /**
     * Subscribes to one event type.
     *
     * @return subscription id, accepted by {@link #unsubscribe(String)}
     */
    public String subscribe(RegistryEventType type, RegistryEventListener listener) {
        Objects.requireNonNull(type, "Type cannot be null");
        return register(type, listener);
    }

    /**
     * Subscribes to every event type.
     */
    public String subscribe(RegistryEventListener listener) {
        return register(null, listener);
    }

    public boolean unsubscribe(String subscriptionId) {
        return subscriptions.remove(subscriptionId) != null;
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

    private String register(RegistryEventType type, RegistryEventListener listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");
        String subscriptionId = UUID.randomUUID().toString();
        subscriptions.put(subscriptionId, new Subscription(subscriptionId, type, listener));
        return subscriptionId;
    }

    private void notifySubscribers(AuditEntry entry) {
        for (Subscription sub : subscriptions.values()) {
            if (sub.type() != null && sub.type() != entry.event().type()) {
                continue;
            }
            try {
                sub.listener().onEvent(entry);
            } catch (RuntimeException e) {
                // committed state stands regardless of listener failures
                log.warn("Audit subscriber {} failed on entry {}", sub.id(), entry.sequenceNumber(), e);
            }
        }
    }

    // ==================== Queries ====================

    public List<AuditEntry> getEntries() {
        return new ArrayList<>(entries);
    }

    public List<AuditEntry> getEntries(RegistryEventType type) {
        return entries.stream()
                .filter(e -> e.event().type() == type)
                .toList();
    }

    /**
     * Entries naming the principal as owner, subject, issuer, verifier or actor.
     */
    public List<AuditEntry> getEntriesInvolving(Principal principal) {
        return entries.stream()
                .filter(e -> e.event().involves(principal))
                .toList();
    }

    public List<AuditEntry> getEntries(Instant from, Instant to) {
        return entries.stream()
                .filter(e -> !e.event().timestamp().isBefore(from) && !e.event().timestamp().isAfter(to))
                .toList();
    }

    public List<AuditEntry> getLatestEntries(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count cannot be negative: " + count);
        }
        List<AuditEntry> snapshot = getEntries();
        int start = Math.max(0, snapshot.size() - count);
        return new ArrayList<>(snapshot.subList(start, snapshot.size()));
    }

    public int size() {
        return entries.size();
    }

    public String getLastHash() {
        return lastHash;
    }

    public String getNodeId() {
        return nodeId;
    }

    // ==================== Integrity ====================

    /**
     * Recomputes the hash chain and reports every break.
     */
    public VerificationResult verifyIntegrity() {
        return verifyChain(getEntries());
    }

    /**
     * Verifies a chain held outside this log, such as a copy taken by an auditor.
     */
    public static VerificationResult verifyChain(List<AuditEntry> chain) {
        List<String> errors = new ArrayList<>();
        String expectedPrevHash = GENESIS_HASH;

        for (int i = 0; i < chain.size(); i++) {
            AuditEntry entry = chain.get(i);

            if (entry.sequenceNumber() != i) {
                errors.add("Sequence number mismatch at index " + i);
            }
            if (!entry.previousHash().equals(expectedPrevHash)) {
                errors.add("Previous hash mismatch at index " + i);
            }
            String computedHash = computeEntryHash(entry.id(), entry.sequenceNumber(), entry.transactionId(),
                    entry.nodeId(), entry.previousHash(), entry.event());
            if (!entry.entryHash().equals(computedHash)) {
                errors.add("Entry hash mismatch at index " + i + " - possible tampering");
            }
            expectedPrevHash = entry.entryHash();
        }

        return new VerificationResult(errors.isEmpty(), errors, chain.size());
    }

    // ==================== Export ====================

    /**
     * Exports the log as a JSON document.
     */
    public String export() {
        List<AuditEntry> snapshot = getEntries();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("nodeId", nodeId);
        root.put("entryCount", snapshot.size());
        root.put("lastHash", lastHash);
        ArrayNode array = root.putArray("entries");
        for (AuditEntry entry : snapshot) {
            ObjectNode node = array.addObject();
            node.put("id", entry.id());
            node.put("seq", entry.sequenceNumber());
            node.put("transactionId", entry.transactionId());
            node.put("type", entry.event().type().name());
            node.put("timestamp", entry.event().timestamp().toString());
            ObjectNode attributes = node.putObject("attributes");
            entry.event().attributes().forEach(attributes::put);
            node.put("prevHash", entry.previousHash());
            node.put("hash", entry.entryHash());
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to export audit log", e);
        }
    }

    /**
     * Plain-language rendering of an entry.
     */
    public String describe(AuditEntry entry) {
        RegistryEvent event = entry.event();
        return switch (event.type()) {
            case IDENTITY_CREATED -> String.format("%s registered an identity as \"%s\"",
                    event.attribute(RegistryEvent.OWNER), event.attribute(RegistryEvent.NAME));
            case IDENTITY_VERIFIED -> String.format("%s verified the identity of %s",
                    event.attribute(RegistryEvent.VERIFIER), event.attribute(RegistryEvent.SUBJECT));
            case CREDENTIAL_ISSUED -> String.format("%s issued %s credential #%s to %s",
                    event.attribute(RegistryEvent.ISSUER), event.attribute(RegistryEvent.CREDENTIAL_TYPE),
                    event.attribute(RegistryEvent.CREDENTIAL_ID), event.attribute(RegistryEvent.SUBJECT));
            case CREDENTIAL_REVOKED -> String.format("%s revoked credential #%s",
                    event.attribute(RegistryEvent.REVOKED_BY), event.attribute(RegistryEvent.CREDENTIAL_ID));
            case VERIFIER_AUTHORIZED -> String.format("%s authorized %s as a verifier",
                    event.attribute(RegistryEvent.AUTHORIZED_BY), event.attribute(RegistryEvent.VERIFIER));
        };
    }

    // ==================== Private Methods ====================

    /**
     * Hashes every field of the entry except the hash itself. The input is canonical
     * JSON with sorted keys, so free-text attribute values cannot alias other fields.
     */
    private static String computeEntryHash(String entryId, long sequenceNumber, String transactionId,
                                           String nodeId, String previousHash, RegistryEvent event) {
        Map<String, Object> content = new TreeMap<>();
        content.put("id", entryId);
        content.put("seq", sequenceNumber);
        content.put("transactionId", transactionId);
        content.put("nodeId", nodeId);
        content.put("prevHash", previousHash);
        content.put("type", event.type().name());
        content.put("timestamp", event.timestamp().getEpochSecond());
        content.put("attributes", new TreeMap<>(event.attributes()));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(CANONICAL_MAPPER.writeValueAsBytes(content));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode audit entry " + entryId, e);
        }
    }

    // ==================== Inner Types ====================

    /**
     * An entry in the audit log.
     */
    public record AuditEntry(
            String id,
            long sequenceNumber,
            String transactionId,
            RegistryEvent event,
            String previousHash,
            String entryHash,
            String nodeId
    ) {
        public AuditEntry {
            Objects.requireNonNull(id, "ID cannot be null");
            Objects.requireNonNull(transactionId, "Transaction ID cannot be null");
            Objects.requireNonNull(event, "Event cannot be null");
            Objects.requireNonNull(previousHash, "Previous hash cannot be null");
            Objects.requireNonNull(entryHash, "Entry hash cannot be null");
            Objects.requireNonNull(nodeId, "Node ID cannot be null");
        }
    }

    /**
     * Result of integrity verification.
     */
    public record VerificationResult(
            boolean valid,
            List<String> errors,
            int entriesVerified
    ) {
        public VerificationResult {
            errors = errors != null ? List.copyOf(errors) : List.of();
        }
    }

    private record Subscription(
            String id,
            RegistryEventType type,
            RegistryEventListener listener
    ) {}
}
