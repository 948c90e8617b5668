package com.credledger.core.role;

import com.credledger.core.audit.RegistryEvent;
import com.credledger.core.domain.Principal;
import com.credledger.core.exception.UnauthorizedException;
import com.credledger.core.ledger.LedgerTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tracks the administrator and the set of authorized verifiers.
 *
 * The admin is fixed at construction and is always a verifier. Membership only
 * grows: there is no removal or admin transfer.
 */
public class RoleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoleRegistry.class);

    private final Principal admin;
    private final Set<Principal> authorizedVerifiers;

    public RoleRegistry(Principal initiator) {
        this.admin = Objects.requireNonNull(initiator, "Initiator cannot be null");
        this.authorizedVerifiers = new TreeSet<>();
        this.authorizedVerifiers.add(initiator);
        log.info("Role registry initialized with admin {}", initiator);
    }

    /**
     * Grants the verifier role. Idempotent; an event is emitted on every successful call.
     *
     * @throws UnauthorizedException if the transaction caller is not the admin
     */
    public void authorizeVerifier(LedgerTransaction tx, Principal target) {
        requireAdmin(tx.caller());
        Objects.requireNonNull(target, "Target cannot be null");

        if (authorizedVerifiers.add(target)) {
            tx.onRollback(() -> authorizedVerifiers.remove(target));
        }
        tx.emit(RegistryEvent.verifierAuthorized(target, tx.caller(), tx.timestamp()));
    }

    public boolean isAuthorizedVerifier(Principal principal) {
        return principal != null && authorizedVerifiers.contains(principal);
    }

    public void requireAdmin(Principal caller) {
        if (!admin.equals(caller)) {
            throw new UnauthorizedException("Only the admin may perform this operation, caller " + caller);
        }
    }

    public void requireVerifier(Principal caller) {
        if (!isAuthorizedVerifier(caller)) {
            throw new UnauthorizedException("Caller " + caller + " is not an authorized verifier");
        }
    }

    public Principal getAdmin() {
        return admin;
    }

    public Set<Principal> getAuthorizedVerifiers() {
        return Collections.unmodifiableSet(new TreeSet<>(authorizedVerifiers));
    }
}
