package com.credledger.blockchain.contract;

import org.web3j.abi.EventValues;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.*;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Identity Registry Smart Contract - Web3j wrapper.
 *
 * Registers self-issued identities, lets authorized verifiers issue and check
 * credentials, and lets issuers revoke them. Every mutating call emits one event.
 *
 * Solidity equivalent:
 * contract IdentityRegistry {
 *     struct Identity {
 *         address owner;
 *         string name;
 *         string email;
 *         uint256 createdAt;
 *         bool isVerified;
 *         mapping(string => string) attributes;
 *         mapping(address => bool) verifiers;
 *     }
 *
 *     struct Credential {
 *         uint256 id;
 *         address issuer;
 *         address subject;
 *         string credentialType;
 *         string data;              // content-addressed reference, e.g. ipfs://...
 *         uint256 issuedAt;
 *         uint256 expiresAt;
 *         bool isValid;
 *     }
 *
 *     address public admin;
 *     mapping(address => bool) public authorizedVerifiers;
 *     mapping(address => Identity) public identities;
 *     mapping(uint256 => Credential) public credentials;
 *     uint256 private credentialCounter;
 *
 *     event IdentityCreated(address indexed user, string name, uint256 timestamp);
 *     event IdentityVerified(address indexed user, address indexed verifier, uint256 timestamp);
 *     event CredentialIssued(uint256 indexed credentialId, address indexed issuer, address indexed subject, string credentialType);
 *     event CredentialRevoked(uint256 indexed credentialId, address indexed revoker);
 *     event VerifierAdded(address indexed verifier, address indexed addedBy);
 * }
 */
public class IdentityRegistryContract extends Contract {

    /**
     * Compiled Solidity bytecode.
     *
     * Left empty: the registry is deployed separately and attached with
     * {@link #load(String, Web3j, Credentials, ContractGasProvider)}.
     */
    public static final String BINARY = "";

    public static final String FUNC_CREATEIDENTITY = "createIdentity";
    public static final String FUNC_ADDVERIFIER = "addVerifier";
    public static final String FUNC_ISSUECREDENTIAL = "issueCredential";
    public static final String FUNC_VERIFYIDENTITY = "verifyIdentity";
    public static final String FUNC_REVOKECREDENTIAL = "revokeCredential";
    public static final String FUNC_GETIDENTITY = "getIdentity";
    public static final String FUNC_GETCREDENTIAL = "getCredential";
    public static final String FUNC_ISAUTHORIZEDVERIFIER = "isAuthorizedVerifier";
    public static final String FUNC_GETTOTALCREDENTIALS = "getTotalCredentials";

    // Events
    public static final Event IDENTITY_CREATED_EVENT = new Event("IdentityCreated",
            Arrays.asList(
                    new TypeReference<Address>(true) {},  // user
                    new TypeReference<Utf8String>() {},   // name
                    new TypeReference<Uint256>() {}       // timestamp
            ));

    public static final Event IDENTITY_VERIFIED_EVENT = new Event("IdentityVerified",
            Arrays.asList(
                    new TypeReference<Address>(true) {},  // user
                    new TypeReference<Address>(true) {},  // verifier
                    new TypeReference<Uint256>() {}       // timestamp
            ));

    public static final Event CREDENTIAL_ISSUED_EVENT = new Event("CredentialIssued",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // credentialId
                    new TypeReference<Address>(true) {},  // issuer
                    new TypeReference<Address>(true) {},  // subject
                    new TypeReference<Utf8String>() {}    // credentialType
            ));

    public static final Event CREDENTIAL_REVOKED_EVENT = new Event("CredentialRevoked",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // credentialId
                    new TypeReference<Address>(true) {}   // revoker
            ));

    public static final Event VERIFIER_ADDED_EVENT = new Event("VerifierAdded",
            Arrays.asList(
                    new TypeReference<Address>(true) {},  // verifier
                    new TypeReference<Address>(true) {}   // addedBy
            ));

    protected IdentityRegistryContract(String contractAddress, Web3j web3j,
                                       Credentials credentials, ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    /**
     * Registers the sender's identity.
     */
    public RemoteFunctionCall<TransactionReceipt> createIdentity(String name, String email) {
        final Function function = new Function(
                FUNC_CREATEIDENTITY,
                Arrays.asList(new Utf8String(name), new Utf8String(email)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    /**
     * Grants the verifier role. Admin only.
     */
    public RemoteFunctionCall<TransactionReceipt> addVerifier(String verifier) {
        final Function function = new Function(
                FUNC_ADDVERIFIER,
                Arrays.asList(new Address(verifier)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    /**
     * Issues a credential; the new id is carried by the CredentialIssued event in the receipt.
     */
    public RemoteFunctionCall<TransactionReceipt> issueCredential(
            String subject,
            String credentialType,
            String data,
            BigInteger expirationDuration) {
        final Function function = new Function(
                FUNC_ISSUECREDENTIAL,
                Arrays.asList(
                        new Address(subject),
                        new Utf8String(credentialType),
                        new Utf8String(data),
                        new Uint256(expirationDuration)
                ),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    /**
     * General verification when {@code credentialId} is zero, credential check otherwise.
     */
    public RemoteFunctionCall<TransactionReceipt> verifyIdentity(String user, BigInteger credentialId) {
        final Function function = new Function(
                FUNC_VERIFYIDENTITY,
                Arrays.asList(new Address(user), new Uint256(credentialId)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    public RemoteFunctionCall<TransactionReceipt> revokeCredential(BigInteger credentialId) {
        final Function function = new Function(
                FUNC_REVOKECREDENTIAL,
                Arrays.asList(new Uint256(credentialId)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    /**
     * Reads an identity. Unknown users come back zero-valued.
     */
    @SuppressWarnings("rawtypes")
    public RemoteFunctionCall<IdentityView> getIdentity(String user) {
        final Function function = new Function(
                FUNC_GETIDENTITY,
                Arrays.asList(new Address(user)),
                Arrays.asList(
                        new TypeReference<Utf8String>() {},  // name
                        new TypeReference<Utf8String>() {},  // email
                        new TypeReference<Uint256>() {},     // createdAt
                        new TypeReference<Bool>() {}         // isVerified
                ));
        return new RemoteFunctionCall<>(function, () -> {
            List<Type> results = executeCallMultipleValueReturn(function);
            return new IdentityView(
                    (String) results.get(0).getValue(),
                    (String) results.get(1).getValue(),
                    (BigInteger) results.get(2).getValue(),
                    (Boolean) results.get(3).getValue());
        });
    }

    /**
     * Reads a credential. Unknown ids come back zero-valued.
     */
    @SuppressWarnings("rawtypes")
    public RemoteFunctionCall<CredentialView> getCredential(BigInteger credentialId) {
        final Function function = new Function(
                FUNC_GETCREDENTIAL,
                Arrays.asList(new Uint256(credentialId)),
                Arrays.asList(
                        new TypeReference<Uint256>() {},     // id
                        new TypeReference<Address>() {},     // issuer
                        new TypeReference<Address>() {},     // subject
                        new TypeReference<Utf8String>() {},  // credentialType
                        new TypeReference<Utf8String>() {},  // data
                        new TypeReference<Uint256>() {},     // issuedAt
                        new TypeReference<Uint256>() {},     // expiresAt
                        new TypeReference<Bool>() {}         // isValid
                ));
        return new RemoteFunctionCall<>(function, () -> {
            List<Type> results = executeCallMultipleValueReturn(function);
            return new CredentialView(
                    (BigInteger) results.get(0).getValue(),
                    (String) results.get(1).getValue(),
                    (String) results.get(2).getValue(),
                    (String) results.get(3).getValue(),
                    (String) results.get(4).getValue(),
                    (BigInteger) results.get(5).getValue(),
                    (BigInteger) results.get(6).getValue(),
                    (Boolean) results.get(7).getValue());
        });
    }

    public RemoteFunctionCall<Boolean> isAuthorizedVerifier(String principal) {
        final Function function = new Function(
                FUNC_ISAUTHORIZEDVERIFIER,
                Arrays.asList(new Address(principal)),
                Arrays.asList(new TypeReference<Bool>() {}));
        return executeRemoteCallSingleValueReturn(function, Boolean.class);
    }

    public RemoteFunctionCall<BigInteger> getTotalCredentials() {
        final Function function = new Function(
                FUNC_GETTOTALCREDENTIALS,
                Collections.emptyList(),
                Arrays.asList(new TypeReference<Uint256>() {}));
        return executeRemoteCallSingleValueReturn(function, BigInteger.class);
    }

    /**
     * Extracts the id assigned by an issueCredential transaction.
     */
    public Optional<BigInteger> getIssuedCredentialId(TransactionReceipt receipt) {
        List<EventValuesWithLog> values = extractEventParametersWithLog(CREDENTIAL_ISSUED_EVENT, receipt);
        return values.stream()
                .map(EventValuesWithLog::getIndexedValues)
                .filter(indexed -> !indexed.isEmpty())
                .map(indexed -> (BigInteger) indexed.get(0).getValue())
                .findFirst();
    }

    /**
     * Decodes a raw CredentialIssued log entry.
     */
    public static Optional<EventValues> decodeCredentialIssued(Log log) {
        return Optional.ofNullable(staticExtractEventParameters(CREDENTIAL_ISSUED_EVENT, log));
    }

    /**
     * Loads an existing contract at the given address.
     */
    public static IdentityRegistryContract load(String contractAddress, Web3j web3j,
                                                Credentials credentials, ContractGasProvider gasProvider) {
        return new IdentityRegistryContract(contractAddress, web3j, credentials, gasProvider);
    }

    /**
     * Identity tuple as returned by the contract.
     */
    public static class IdentityView {
        public final String name;
        public final String email;
        public final BigInteger createdAt;
        public final boolean isVerified;

        public IdentityView(String name, String email, BigInteger createdAt, boolean isVerified) {
            this.name = name;
            this.email = email;
            this.createdAt = createdAt;
            this.isVerified = isVerified;
        }

        /**
         * The contract never stores an identity with a zero creation time.
         */
        public boolean exists() {
            return createdAt != null && createdAt.signum() > 0;
        }
    }

    /**
     * Credential tuple as returned by the contract.
     */
    public static class CredentialView {
        public final BigInteger id;
        public final String issuer;
        public final String subject;
        public final String credentialType;
        public final String data;
        public final BigInteger issuedAt;
        public final BigInteger expiresAt;
        public final boolean isValid;

        public CredentialView(BigInteger id, String issuer, String subject, String credentialType,
                              String data, BigInteger issuedAt, BigInteger expiresAt, boolean isValid) {
            this.id = id;
            this.issuer = issuer;
            this.subject = subject;
            this.credentialType = credentialType;
            this.data = data;
            this.issuedAt = issuedAt;
            this.expiresAt = expiresAt;
            this.isValid = isValid;
        }

        /**
         * Ids start at 1, so a zero id means the slot was never written.
         */
        public boolean exists() {
            return id != null && id.signum() > 0;
        }
    }
}
