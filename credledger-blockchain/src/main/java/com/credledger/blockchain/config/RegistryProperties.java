package com.credledger.blockchain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the in-process identity registry.
 */
@ConfigurationProperties(prefix = "credledger.registry")
public class RegistryProperties {

    private String admin;
    private String auditNodeId = "local-ledger";

    public String getAdmin() { return admin; }
    public void setAdmin(String admin) { this.admin = admin; }
    public String getAuditNodeId() { return auditNodeId; }
    public void setAuditNodeId(String auditNodeId) { this.auditNodeId = auditNodeId; }
}
