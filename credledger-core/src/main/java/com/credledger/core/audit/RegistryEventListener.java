package com.credledger.core.audit;

/**
 * Receives audit entries after the transaction that produced them has committed.
 */
@FunctionalInterface
public interface RegistryEventListener {

    void onEvent(RegistryAuditLog.AuditEntry entry);
}
