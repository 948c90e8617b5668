package com.credledger.blockchain.service;

import com.credledger.blockchain.contract.IdentityRegistryContract;
import com.credledger.blockchain.contract.IdentityRegistryContract.CredentialView;
import com.credledger.blockchain.contract.IdentityRegistryContract.IdentityView;
import com.credledger.core.credential.CredentialRecord;
import com.credledger.core.domain.Principal;
import com.credledger.core.identity.IdentityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Service for interacting with a deployed Identity Registry smart contract.
 *
 * Transactions are signed with the configured key, so the caller of every
 * operation is the account behind {@code credledger.blockchain.private-key}.
 * Nothing here throws: a disabled bridge, a reverted call or an unreachable
 * node all yield {@link Optional#empty()}.
 */
@Service
public class BlockchainIdentityRegistryService {

    private static final Logger log = LoggerFactory.getLogger(BlockchainIdentityRegistryService.class);
    private final BlockchainConfig config;
    private IdentityRegistryContract contract;
    private Web3j web3j;

    public BlockchainIdentityRegistryService(BlockchainConfig config) {
        this.config = config;
        if (config.isEnabled()) {
            initializeContract();
        }
    }

    private void initializeContract() {
        try {
            this.web3j = Web3j.build(new HttpService(config.getNodeUrl()));
            Credentials credentials = Credentials.create(config.getPrivateKey());
            StaticGasProvider gasProvider = new StaticGasProvider(
                    BigInteger.valueOf(config.getGasPrice()),
                    BigInteger.valueOf(config.getGasLimit()));
            this.contract = IdentityRegistryContract.load(
                    config.getRegistryAddress(), web3j, credentials, gasProvider);
            log.info("Identity Registry contract initialized at {} (operator {})",
                    config.getRegistryAddress(), credentials.getAddress());
        } catch (Exception e) {
            log.error("Failed to initialize identity registry contract", e);
        }
    }

    // ==================== Transactions ====================

    /**
     * Registers the operator account's identity.
     */
    public Optional<BlockchainTxResult> createIdentity(String name, String email) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = contract.createIdentity(name, email).send();
            return Optional.of(BlockchainTxResult.from(receipt));
        } catch (Exception e) {
            log.error("Failed to create identity \"{}\" on blockchain", name, e);
            return Optional.empty();
        }
    }

    public Optional<BlockchainTxResult> addVerifier(Principal verifier) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = contract.addVerifier(verifier.address()).send();
            return Optional.of(BlockchainTxResult.from(receipt));
        } catch (Exception e) {
            log.error("Failed to authorize verifier {} on blockchain", verifier, e);
            return Optional.empty();
        }
    }

    /**
     * Issues a credential and reads the assigned id back from the CredentialIssued event.
     */
    public Optional<CredentialIssuance> issueCredential(
            Principal subject, String credentialType, String data, long durationSeconds) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        if (durationSeconds < 0) {
            log.warn("Refusing to issue {} credential to {} with negative duration {}",
                    credentialType, subject, durationSeconds);
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = contract.issueCredential(
                    subject.address(), credentialType, data, BigInteger.valueOf(durationSeconds)
            ).send();
            BlockchainTxResult tx = BlockchainTxResult.from(receipt);
            if (!tx.success()) {
                log.warn("Credential issuance to {} reverted in tx {}", subject, tx.txHash());
                return Optional.of(new CredentialIssuance(0L, tx));
            }
            long credentialId = contract.getIssuedCredentialId(receipt)
                    .map(BigInteger::longValueExact)
                    .orElseThrow(() -> new IllegalStateException(
                            "No CredentialIssued event in receipt " + receipt.getTransactionHash()));
            return Optional.of(new CredentialIssuance(credentialId, tx));
        } catch (Exception e) {
            log.error("Failed to issue {} credential to {} on blockchain", credentialType, subject, e);
            return Optional.empty();
        }
    }

    public Optional<BlockchainTxResult> verifyIdentity(Principal user) {
        return verifyIdentity(user, 0L);
    }

    public Optional<BlockchainTxResult> verifyIdentity(Principal user, long credentialId) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = contract.verifyIdentity(
                    user.address(), BigInteger.valueOf(credentialId)).send();
            return Optional.of(BlockchainTxResult.from(receipt));
        } catch (Exception e) {
            log.error("Failed to verify identity {} (credential {}) on blockchain", user, credentialId, e);
            return Optional.empty();
        }
    }

    public Optional<BlockchainTxResult> revokeCredential(long credentialId) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = contract.revokeCredential(BigInteger.valueOf(credentialId)).send();
            return Optional.of(BlockchainTxResult.from(receipt));
        } catch (Exception e) {
            log.error("Failed to revoke credential {} on blockchain", credentialId, e);
            return Optional.empty();
        }
    }

    // ==================== Reads ====================

    /**
     * Reads an identity. The contract does not expose attributes or the verifier set,
     * so both come back empty.
     */
    public Optional<IdentityRecord> getIdentity(Principal user) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            IdentityView view = contract.getIdentity(user.address()).send();
            if (!view.exists()) {
                return Optional.empty();
            }
            return Optional.of(new IdentityRecord(
                    user,
                    view.name,
                    view.email,
                    Instant.ofEpochSecond(view.createdAt.longValueExact()),
                    view.isVerified,
                    Map.of(),
                    Set.of()));
        } catch (Exception e) {
            log.error("Failed to read identity {} from blockchain", user, e);
            return Optional.empty();
        }
    }

    public Optional<CredentialRecord> getCredential(long credentialId) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            CredentialView view = contract.getCredential(BigInteger.valueOf(credentialId)).send();
            if (!view.exists()) {
                return Optional.empty();
            }
            return Optional.of(new CredentialRecord(
                    view.id.longValueExact(),
                    Principal.of(view.issuer),
                    Principal.of(view.subject),
                    view.credentialType,
                    view.data,
                    toInstant(view.issuedAt),
                    toInstant(view.expiresAt),
                    view.isValid));
        } catch (Exception e) {
            log.error("Failed to read credential {} from blockchain", credentialId, e);
            return Optional.empty();
        }
    }

    public Optional<Boolean> isAuthorizedVerifier(Principal principal) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return Optional.of(contract.isAuthorizedVerifier(principal.address()).send());
        } catch (Exception e) {
            log.error("Failed to check verifier status of {} on blockchain", principal, e);
            return Optional.empty();
        }
    }

    public Optional<Long> getTotalCredentials() {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return Optional.of(contract.getTotalCredentials().send().longValueExact());
        } catch (Exception e) {
            log.error("Failed to read credential count from blockchain", e);
            return Optional.empty();
        }
    }

    public boolean isEnabled() {
        return config.isEnabled() && contract != null;
    }

    private static Instant toInstant(BigInteger epochSeconds) {
        // uint256 expiry can exceed what Instant holds
        if (epochSeconds.compareTo(BigInteger.valueOf(Instant.MAX.getEpochSecond())) > 0) {
            return Instant.MAX;
        }
        return Instant.ofEpochSecond(epochSeconds.longValueExact());
    }

    public record BlockchainTxResult(String txHash, BigInteger blockNumber, boolean success) {
        static BlockchainTxResult from(TransactionReceipt receipt) {
            return new BlockchainTxResult(
                    receipt.getTransactionHash(),
                    receipt.getBlockNumber(),
                    receipt.isStatusOK());
        }
    }

    /**
     * Outcome of issueCredential. {@code credentialId} is zero when the transaction reverted.
     */
    public record CredentialIssuance(long credentialId, BlockchainTxResult tx) {}
}
