package com.credledger.core.domain;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An actor on the ledger, identified by its 20-byte account address.
 *
 * Addresses are normalised to lower-case {@code 0x}-prefixed hex. The zero
 * address is not a principal: absence is always expressed with {@code Optional}.
 */
public record Principal(String address) implements Comparable<Principal> {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");
    private static final String ZERO_ADDRESS = "0x" + "0".repeat(40);

    public Principal {
        Objects.requireNonNull(address, "Address cannot be null");
        address = address.trim().toLowerCase(Locale.ROOT);
        if (!address.startsWith("0x")) {
            address = "0x" + address;
        }
        if (!ADDRESS.matcher(address).matches()) {
            throw new IllegalArgumentException("Not a 20-byte hex address: " + address);
        }
        if (ZERO_ADDRESS.equals(address)) {
            throw new IllegalArgumentException("The zero address cannot act as a principal");
        }
    }

    public static Principal of(String address) {
        return new Principal(address);
    }

    /**
     * Short form used in log lines, e.g. {@code 0x1a2b..9f0e}.
     */
    public String shortForm() {
        return address.substring(0, 6) + ".." + address.substring(address.length() - 4);
    }

    @Override
    public int compareTo(Principal other) {
        return address.compareTo(other.address);
    }

    @Override
    public String toString() {
        return address;
    }
}
