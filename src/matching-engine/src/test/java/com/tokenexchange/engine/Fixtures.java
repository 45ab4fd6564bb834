package com.tokenexchange.engine;

import com.tokenexchange.engine.config.EngineDefaults;
import com.tokenexchange.engine.config.MatchingMode;
import com.tokenexchange.engine.domain.Address;
import com.tokenexchange.engine.domain.Order;
import com.tokenexchange.engine.domain.Side;

import java.math.BigInteger;

/**
 * Shared addresses and order factories for engine tests.
 */
public final class Fixtures {

    public static final Address ALICE = Address.of("0x" + "a1".repeat(20));
    public static final Address BOB = Address.of("0x" + "b2".repeat(20));
    public static final Address CAROL = Address.of("0x" + "c3".repeat(20));

    public static final Address TOKEN_A = Address.of("0x" + "0a".repeat(20));
    public static final Address TOKEN_B = Address.of("0x" + "0b".repeat(20));
    public static final Address TOKEN_C = Address.of("0x" + "0c".repeat(20));

    private Fixtures() {
    }

    public static BigInteger uint(long value) {
        return BigInteger.valueOf(value);
    }

    public static Order buy(long id, Address instrument, long quantity, long price) {
        return new Order(id, ALICE, instrument, quantity, price, Side.BUY);
    }

    public static Order sell(long id, Address instrument, long quantity, long price) {
        return new Order(id, BOB, instrument, quantity, price, Side.SELL);
    }

    /**
     * Defaults as shipped: cap 100, min 1, maker 10 bps, taker 20 bps, split on, strict.
     */
    public static EngineDefaults defaults() {
        return new EngineDefaults(100, 1, 10, 20, true, MatchingMode.STRICT);
    }

    public static EngineDefaults defaults(int maxTrades, long minTrade, MatchingMode mode) {
        return new EngineDefaults(maxTrades, minTrade, 10, 20, true, mode);
    }
}
