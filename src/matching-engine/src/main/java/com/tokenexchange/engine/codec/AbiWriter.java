package com.tokenexchange.engine.codec;

import com.tokenexchange.engine.domain.Address;

import java.math.BigInteger;
import java.nio.ByteBuffer;

/**
 * Sequential writer of 32-byte big-endian ABI words into a pre-sized buffer.
 */
final class AbiWriter {

    private final ByteBuffer buffer;

    AbiWriter(int words) {
        this.buffer = ByteBuffer.allocate(words * AbiReader.WORD);
    }

    AbiWriter uint(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Unsigned value expected: " + value);
        }
        int start = buffer.position();
        buffer.position(start + AbiReader.WORD - Long.BYTES);
        buffer.putLong(value);
        return this;
    }

    AbiWriter uint(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > AbiReader.WORD * 8) {
            throw new IllegalArgumentException("Value does not fit uint256: " + value);
        }
        byte[] raw = value.toByteArray();
        // toByteArray may carry a leading sign byte
        int skip = raw.length > AbiReader.WORD ? raw.length - AbiReader.WORD : 0;
        int start = buffer.position();
        buffer.position(start + AbiReader.WORD - (raw.length - skip));
        buffer.put(raw, skip, raw.length - skip);
        return this;
    }

    AbiWriter address(Address address) {
        int start = buffer.position();
        buffer.position(start + AbiReader.WORD - Address.LENGTH);
        buffer.put(address.toBytes());
        return this;
    }

    AbiWriter bool(boolean value) {
        return uint(value ? 1L : 0L);
    }

    byte[] toByteArray() {
        if (buffer.hasRemaining()) {
            throw new IllegalStateException(
                "ABI buffer not fully written: " + buffer.remaining() + " bytes left");
        }
        return buffer.array();
    }
}
