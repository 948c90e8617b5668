package com.credledger.blockchain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CredLedger node: in-process identity registry plus the bridge to a deployed registry contract.
 */
@SpringBootApplication(scanBasePackages = "com.credledger")
public class CredLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CredLedgerApplication.class, args);
    }
}
