package com.credledger.blockchain.config;

import com.credledger.core.audit.RegistryAuditLog;
import com.credledger.core.audit.RegistryAuditLog.AuditEntry;
import com.credledger.core.audit.RegistryEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every committed registry event to the application log in plain language.
 */
public class AuditTrailLogger implements RegistryEventListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailLogger.class);

    private final RegistryAuditLog auditLog;
    private final String subscriptionId;
    private long delivered;

    public AuditTrailLogger(RegistryAuditLog auditLog) {
        this.auditLog = auditLog;
        this.subscriptionId = auditLog.subscribe(this);
    }

    @Override
    public void onEvent(AuditEntry entry) {
        synchronized (this) {
            delivered++;
        }
        log.info("[audit #{} {}] {}", entry.sequenceNumber(), entry.transactionId(), auditLog.describe(entry));
    }

    public synchronized long getDelivered() {
        return delivered;
    }

    @Override
    public void close() {
        auditLog.unsubscribe(subscriptionId);
    }
}
