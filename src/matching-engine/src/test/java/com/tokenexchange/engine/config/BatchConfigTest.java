package com.tokenexchange.engine.config;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.tokenexchange.engine.Fixtures.uint;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchConfigTest {

    private final EngineDefaults defaults =
        new EngineDefaults(100, 5, 10, 20, true, MatchingMode.STRICT);

    @Test
    void shouldUseDefaultsWithoutRuntimeConfig() {
        BatchConfig config = BatchConfig.resolve(defaults, null);

        assertEquals(100, config.getMaxTradesPerBatch());
        assertEquals(uint(5), config.getMinTradeAmount());
        assertEquals(10, config.getMakerFeeBps());
        assertEquals(20, config.getTakerFeeBps());
        assertEquals(20, config.getEffectiveFeeBps());
        assertEquals(uint(0), config.getTimestamp());
        assertEquals(MatchingMode.STRICT, config.getMatchingMode());
        assertFalse(config.hasRuntimeOverride());
    }

    @Test
    void shouldApplyRuntimeOverrides() {
        BatchConfig config = BatchConfig.resolve(defaults, new RuntimeConfig(1_700_000_000L, 35, 8));

        assertEquals(uint(8), config.getMinTradeAmount());
        assertEquals(35, config.getEffectiveFeeBps());
        assertEquals(uint(1_700_000_000L), config.getTimestamp());
        assertTrue(config.hasRuntimeOverride());
    }

    @Test
    void shouldKeepDefaultMinimumWhenRuntimeMinimumIsZero() {
        BatchConfig config = BatchConfig.resolve(defaults, new RuntimeConfig(1, 35, 0));

        assertEquals(uint(5), config.getMinTradeAmount());
    }

    @Test
    void shouldKeepBuildTimeMakerTakerRatesWhenSplitEnabled() {
        BatchConfig config = BatchConfig.resolve(defaults, new RuntimeConfig(1, 35, 0));

        assertEquals(10, config.getMakerFeeBps());
        assertEquals(20, config.getTakerFeeBps());
    }

    @Test
    void shouldChargeTakerOnlyWhenSplitDisabled() {
        EngineDefaults flat = new EngineDefaults(100, 1, 10, 20, false, MatchingMode.STRICT);

        BatchConfig withOverride = BatchConfig.resolve(flat, new RuntimeConfig(1, 35, 0));
        BatchConfig withoutOverride = BatchConfig.resolve(flat, null);

        assertEquals(0, withOverride.getMakerFeeBps());
        assertEquals(35, withOverride.getTakerFeeBps());
        assertEquals(0, withoutOverride.getMakerFeeBps());
        assertEquals(20, withoutOverride.getTakerFeeBps());
    }

    @Test
    void shouldRejectFeeRateAboveTenThousand() {
        assertThrows(IllegalArgumentException.class,
            () -> RuntimeConfig.fromWords(BigInteger.ONE, BigInteger.valueOf(10_001), BigInteger.ONE));
        assertThrows(IllegalArgumentException.class,
            () -> RuntimeConfig.fromWords(BigInteger.ONE, BigInteger.ONE.shiftLeft(200), BigInteger.ONE));
    }

    @Test
    void shouldAcceptFullWidthTimestampAndMinimum() {
        BigInteger wide = BigInteger.ONE.shiftLeft(255);

        BatchConfig config = BatchConfig.resolve(defaults,
            RuntimeConfig.fromWords(wide, BigInteger.TEN, wide));

        assertEquals(wide, config.getTimestamp());
        assertEquals(wide, config.getMinTradeAmount());
        assertEquals(10, config.getEffectiveFeeBps());
    }
}
