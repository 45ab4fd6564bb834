package com.tokenexchange.engine.domain;

import java.util.HexFormat;
import java.util.Locale;

/**
 * Value object for a 20-byte account or instrument identifier.
 * Canonical form is lower-case hex with a {@code 0x} prefix, e.g.
 * {@code 0x1234567890123456789012345678901234567890}.
 */
public record Address(String hex) {

    public static final int LENGTH = 20;

    public Address {
        if (hex == null) {
            throw new IllegalArgumentException("Address must not be null");
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() != LENGTH * 2 || !digits.chars().allMatch(HexFormat::isHexDigit)) {
            throw new IllegalArgumentException("Invalid address: " + hex);
        }
        hex = "0x" + digits.toLowerCase(Locale.ROOT);
    }

    public static Address of(String hex) {
        return new Address(hex);
    }

    public static Address fromBytes(byte[] bytes) {
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Address must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new Address(HexFormat.of().formatHex(bytes));
    }

    public byte[] toBytes() {
        return HexFormat.of().parseHex(hex, 2, hex.length());
    }

    @Override
    public String toString() {
        return hex;
    }
}
