package com.flagship.wager_engine.ledger;

/**
 * Normalization of public player addresses.
 *
 * Addresses are fixed-length (55 characters). Wallet connectors sometimes hand over a
 * longer, prefixed form; the address is then the trailing 55 characters.
 */
public final class PlayerAddress {

    public static final int LENGTH = 55;

    private PlayerAddress() {
        // Utility class
    }

    /**
     * Trims the value and keeps its trailing {@value #LENGTH} characters when longer.
     *
     * @throws IllegalArgumentException if the address is null or blank
     */
    public static String normalize(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Player address is required");
        }
        String trimmed = address.trim();
        if (trimmed.length() > LENGTH) {
            return trimmed.substring(trimmed.length() - LENGTH);
        }
        return trimmed;
    }
}
