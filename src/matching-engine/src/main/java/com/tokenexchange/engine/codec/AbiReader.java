package com.tokenexchange.engine.codec;

import com.tokenexchange.engine.domain.Address;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Bounds-checked reads of 32-byte big-endian ABI words from a payload.
 * Offsets are byte offsets from the start of the payload.
 */
final class AbiReader {

    static final int WORD = 32;

    private static final int LONG_PADDING = WORD - Long.BYTES;
    private static final int ADDRESS_PADDING = WORD - Address.LENGTH;

    private final byte[] data;

    AbiReader(byte[] data) {
        this.data = data;
    }

    int length() {
        return data.length;
    }

    BigInteger uint256(int offset, String field) throws AbiFormatException {
        checkWord(offset, field);
        return new BigInteger(1, Arrays.copyOfRange(data, offset, offset + WORD));
    }

    /**
     * Read a uint256 word that must fit a non-negative {@code long}. Used for offsets,
     * lengths and flags, where anything larger cannot address the payload.
     */
    long uint63(int offset, String field) throws AbiFormatException {
        checkWord(offset, field);
        for (int i = 0; i < LONG_PADDING; i++) {
            if (data[offset + i] != 0) {
                throw new AbiFormatException(field + " exceeds the supported 63-bit range at byte " + offset);
            }
        }
        long value = 0;
        for (int i = LONG_PADDING; i < WORD; i++) {
            value = (value << 8) | (data[offset + i] & 0xFF);
        }
        if (value < 0) {
            throw new AbiFormatException(field + " exceeds the supported 63-bit range at byte " + offset);
        }
        return value;
    }

    Address address(int offset, String field) throws AbiFormatException {
        checkWord(offset, field);
        for (int i = 0; i < ADDRESS_PADDING; i++) {
            if (data[offset + i] != 0) {
                throw new AbiFormatException(field + " is not a left-padded address at byte " + offset);
            }
        }
        return Address.fromBytes(Arrays.copyOfRange(data, offset + ADDRESS_PADDING, offset + WORD));
    }

    boolean bool(int offset, String field) throws AbiFormatException {
        long value;
        try {
            value = uint63(offset, field);
        } catch (AbiFormatException e) {
            throw new AbiFormatException(field + " is not a valid bool at byte " + offset);
        }
        if (value == 0) {
            return false;
        }
        if (value == 1) {
            return true;
        }
        throw new AbiFormatException(field + " is not a valid bool at byte " + offset + ": " + value);
    }

    private void checkWord(int offset, String field) throws AbiFormatException {
        if (offset < 0 || offset > data.length - WORD) {
            throw new AbiFormatException(
                field + " at byte " + offset + " lies outside the " + data.length + "-byte payload");
        }
    }
}
