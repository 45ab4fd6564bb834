package com.tokenexchange.engine.config;

import java.math.BigInteger;

/**
 * Optional per-batch overrides carried in the payload's config tuple.
 *
 * @param timestamp       logical batch time supplied by the caller
 * @param feeBasisPoints  fee rate override, parts per 10000
 * @param minTradeAmount  minimum tradable quantity override, 0 means "use default"
 */
public record RuntimeConfig(BigInteger timestamp, int feeBasisPoints, BigInteger minTradeAmount) {

    public static final int MAX_BASIS_POINTS = 10_000;

    public RuntimeConfig {
        if (timestamp.signum() < 0 || minTradeAmount.signum() < 0) {
            throw new IllegalArgumentException(
                "Runtime config values must be unsigned: timestamp=" + timestamp
                    + ", minTradeAmount=" + minTradeAmount);
        }
        if (feeBasisPoints < 0 || feeBasisPoints > MAX_BASIS_POINTS) {
            throw new IllegalArgumentException(
                "Fee basis points out of range 0.." + MAX_BASIS_POINTS + ": " + feeBasisPoints);
        }
    }

    public RuntimeConfig(long timestamp, int feeBasisPoints, long minTradeAmount) {
        this(BigInteger.valueOf(timestamp), feeBasisPoints, BigInteger.valueOf(minTradeAmount));
    }

    /**
     * Build from raw uint256 words as decoded from the wire.
     *
     * @throws IllegalArgumentException if the fee rate is above 10000
     */
    public static RuntimeConfig fromWords(BigInteger timestamp, BigInteger feeBasisPoints,
                                          BigInteger minTradeAmount) {
        if (feeBasisPoints.compareTo(BigInteger.valueOf(MAX_BASIS_POINTS)) > 0) {
            throw new IllegalArgumentException(
                "Fee basis points out of range 0.." + MAX_BASIS_POINTS + ": " + feeBasisPoints);
        }
        return new RuntimeConfig(timestamp, feeBasisPoints.intValueExact(), minTradeAmount);
    }
}
