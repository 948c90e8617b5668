package com.credledger.core.ledger;

import com.credledger.core.audit.RegistryAuditLog;
import com.credledger.core.audit.RegistryAuditLog.AuditEntry;
import com.credledger.core.domain.Principal;
import com.credledger.core.exception.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Serialises registry operations and gives each one all-or-nothing semantics.
 *
 * This is the in-process stand-in for the hosting ledger: a single fair lock
 * provides global ordering, the clock provides block timestamps (whole seconds),
 * and the undo journal of {@link LedgerTransaction} provides revert-on-failure.
 */
public class LedgerTransactionExecutor {

    private static final Logger log = LoggerFactory.getLogger(LedgerTransactionExecutor.class);

    private final Clock clock;
    private final RegistryAuditLog auditLog;
    private final ReentrantLock lock;
    private final AtomicLong transactionCounter;

    public LedgerTransactionExecutor(Clock clock, RegistryAuditLog auditLog) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.auditLog = Objects.requireNonNull(auditLog, "Audit log cannot be null");
        this.lock = new ReentrantLock(true);
        this.transactionCounter = new AtomicLong();
    }

    /**
     * Runs a mutating operation as one transaction.
     *
     * @throws RegistryException if the operation was rejected; nothing was changed
     */
    public <T> T execute(String operation, Principal caller, Function<LedgerTransaction, T> body) {
        Objects.requireNonNull(body, "Body cannot be null");

        T result;
        List<AuditEntry> committed;
        lock.lock();
        try {
            if (lock.getHoldCount() > 1) {
                throw new IllegalStateException("Nested transaction attempted by " + operation);
            }
            LedgerTransaction tx = new LedgerTransaction(
                    "tx-" + transactionCounter.incrementAndGet(), operation, caller, now());
            try {
                result = body.apply(tx);
                committed = auditLog.appendCommitted(tx.id(), tx.pendingEvents());
            } catch (RegistryException e) {
                tx.rollback();
                log.info("Rejected {} {} from {}: {} ({})",
                        tx.id(), operation, caller.shortForm(), e.getErrorCode(), e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                tx.rollback();
                log.error("Reverted {} {} from {} after unexpected failure", tx.id(), operation, caller.shortForm(), e);
                throw e;
            } catch (Error e) {
                tx.rollback();
                log.error("Reverted {} {} from {} after fatal error", tx.id(), operation, caller.shortForm(), e);
                throw e;
            } finally {
                tx.close();
            }
            log.debug("Committed {} {} from {} with {} event(s)",
                    tx.id(), operation, caller.shortForm(), committed.size());
        } finally {
            lock.unlock();
        }

        auditLog.publish(committed);
        return result;
    }

    /**
     * Runs a mutating operation that has no result.
     */
    public void run(String operation, Principal caller, Consumer<LedgerTransaction> body) {
        Objects.requireNonNull(body, "Body cannot be null");
        execute(operation, caller, tx -> {
            body.accept(tx);
            return null;
        });
    }

    /**
     * Runs a read against committed state.
     */
    public <T> T read(Supplier<T> query) {
        Objects.requireNonNull(query, "Query cannot be null");
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current ledger time, truncated to the ledger's one-second granularity.
     */
    public Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }

    public RegistryAuditLog getAuditLog() {
        return auditLog;
    }
}
