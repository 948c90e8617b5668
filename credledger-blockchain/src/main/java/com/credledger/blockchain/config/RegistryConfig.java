package com.credledger.blockchain.config;

import com.credledger.core.IdentityRegistry;
import com.credledger.core.audit.RegistryAuditLog;
import com.credledger.core.domain.Principal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the in-process identity registry used for local and simulated ledgers.
 *
 * The administrator is fixed when the bean is created and cannot change afterwards.
 */
@Configuration
@EnableConfigurationProperties(RegistryProperties.class)
public class RegistryConfig {

    private static final Logger log = LoggerFactory.getLogger(RegistryConfig.class);

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RegistryAuditLog registryAuditLog(RegistryProperties properties) {
        return new RegistryAuditLog(properties.getAuditNodeId());
    }

    @Bean
    public IdentityRegistry identityRegistry(RegistryProperties properties, Clock ledgerClock,
                                             RegistryAuditLog registryAuditLog) {
        String admin = properties.getAdmin();
        if (admin == null || admin.isBlank()) {
            throw new IllegalStateException("credledger.registry.admin must be set to bring up the registry");
        }
        Principal adminPrincipal;
        try {
            adminPrincipal = Principal.of(admin);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("credledger.registry.admin is not a valid address: " + admin, e);
        }
        log.info("Identity registry initialized on node {} with admin {}",
                registryAuditLog.getNodeId(), adminPrincipal);
        return new IdentityRegistry(adminPrincipal, ledgerClock, registryAuditLog);
    }

    @Bean
    public AuditTrailLogger auditTrailLogger(IdentityRegistry identityRegistry) {
        return new AuditTrailLogger(identityRegistry.getAuditLog());
    }
}
