package com.tokenexchange.engine.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HexPayloadsTest {

    @Test
    void shouldFormatWithPrefix() {
        assertEquals("0x00ff10", HexPayloads.toHex(new byte[] {0, (byte) 0xff, 0x10}));
        assertEquals("0x", HexPayloads.toHex(new byte[0]));
    }

    @Test
    void shouldParseWithOrWithoutPrefix() {
        assertArrayEquals(new byte[] {(byte) 0xab, 0x01}, HexPayloads.fromHex("0xAB01"));
        assertArrayEquals(new byte[] {(byte) 0xab, 0x01}, HexPayloads.fromHex("ab01"));
        assertArrayEquals(new byte[0], HexPayloads.fromHex("0x"));
    }

    @Test
    void shouldRejectMalformedHex() {
        assertThrows(IllegalArgumentException.class, () -> HexPayloads.fromHex("0xabc"));
        assertThrows(IllegalArgumentException.class, () -> HexPayloads.fromHex("0xzz"));
        assertThrows(IllegalArgumentException.class, () -> HexPayloads.fromHex(null));
    }
}
