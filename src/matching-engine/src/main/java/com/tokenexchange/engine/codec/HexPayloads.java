package com.tokenexchange.engine.codec;

import java.util.HexFormat;

/**
 * {@code 0x}-prefixed hex form of payloads as exchanged over JSON.
 */
public final class HexPayloads {

    private static final HexFormat HEX = HexFormat.of();

    private HexPayloads() {
    }

    public static String toHex(byte[] bytes) {
        return "0x" + HEX.formatHex(bytes);
    }

    /**
     * Parse hex with or without a {@code 0x} prefix.
     *
     * @throws IllegalArgumentException on odd length or non-hex characters
     */
    public static byte[] fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Hex string is null");
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() % 2 != 0) {
            throw new IllegalArgumentException("Hex string has an odd number of digits: " + digits.length());
        }
        try {
            return HEX.parseHex(digits);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex payload: " + e.getMessage(), e);
        }
    }
}
