package com.tokenexchange.engine.matching;

import java.math.BigInteger;

/**
 * Exact fee arithmetic: {@code fee = floor(quantity * price * bps / 10000)}.
 * No floating point anywhere in the value or fee path.
 */
public final class FeeCalculator {

    public static final int BASIS_POINTS_DENOMINATOR = 10_000;

    /** Largest value a trade tuple word can hold. */
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private static final BigInteger DENOMINATOR = BigInteger.valueOf(BASIS_POINTS_DENOMINATOR);

    private FeeCalculator() {
    }

    public static BigInteger tradeValue(BigInteger quantity, BigInteger price) {
        if (quantity.signum() < 0 || price.signum() < 0) {
            throw new IllegalArgumentException(
                "Quantity and price must be unsigned: quantity=" + quantity + ", price=" + price);
        }
        return quantity.multiply(price);
    }

    public static BigInteger fee(BigInteger quantity, BigInteger price, int bps) {
        return feeOnValue(tradeValue(quantity, price), bps);
    }

    public static BigInteger feeOnValue(BigInteger value, int bps) {
        if (bps < 0 || bps > BASIS_POINTS_DENOMINATOR) {
            throw new IllegalArgumentException(
                "Fee basis points out of range 0.." + BASIS_POINTS_DENOMINATOR + ": " + bps);
        }
        // value is non-negative, so integer division floors
        return value.multiply(BigInteger.valueOf(bps)).divide(DENOMINATOR);
    }
}
