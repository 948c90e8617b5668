package com.credledger.core.ledger;

import com.credledger.core.audit.RegistryEvent;
import com.credledger.core.domain.Principal;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * One atomic registry operation in flight.
 *
 * Stores record an undo action for every mutation they make and queue the
 * audit events the operation produces. The executor either commits both or
 * replays the undo journal and drops the events.
 */
public final class LedgerTransaction {

    private final String id;
    private final String operation;
    private final Principal caller;
    private final Instant timestamp;
    private final Deque<Runnable> undoJournal;
    private final List<RegistryEvent> pendingEvents;
    private boolean open;

    LedgerTransaction(String id, String operation, Principal caller, Instant timestamp) {
        this.id = Objects.requireNonNull(id, "Transaction ID cannot be null");
        this.operation = Objects.requireNonNull(operation, "Operation cannot be null");
        this.caller = Objects.requireNonNull(caller, "Caller cannot be null");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.undoJournal = new ArrayDeque<>();
        this.pendingEvents = new ArrayList<>();
        this.open = true;
    }

    public String id() {
        return id;
    }

    public String operation() {
        return operation;
    }

    public Principal caller() {
        return caller;
    }

    /**
     * Ledger time of this transaction. Every effect of the transaction shares it.
     */
    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Registers the inverse of a mutation that has just been applied.
     */
    public void onRollback(Runnable undo) {
        ensureOpen();
        undoJournal.push(Objects.requireNonNull(undo, "Undo action cannot be null"));
    }

    /**
     * Queues an audit event; it reaches the log only if the transaction commits.
     */
    public void emit(RegistryEvent event) {
        ensureOpen();
        pendingEvents.add(Objects.requireNonNull(event, "Event cannot be null"));
    }

    List<RegistryEvent> pendingEvents() {
        return List.copyOf(pendingEvents);
    }

    void rollback() {
        while (!undoJournal.isEmpty()) {
            undoJournal.pop().run();
        }
        pendingEvents.clear();
    }

    void close() {
        open = false;
        undoJournal.clear();
    }

    private void ensureOpen() {
        if (!open) {
            throw new IllegalStateException("Transaction " + id + " is already closed");
        }
    }
}
