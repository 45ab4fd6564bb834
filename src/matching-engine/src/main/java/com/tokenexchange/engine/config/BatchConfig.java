package com.tokenexchange.engine.config;

import java.math.BigInteger;

/**
 * Immutable configuration of one batch, resolved from the build-time defaults and
 * the optional runtime tuple of that batch. Passed explicitly to every stage.
 */
public final class BatchConfig {

    private final int maxTradesPerBatch;
    private final BigInteger minTradeAmount;
    private final int makerFeeBps;
    private final int takerFeeBps;
    private final int effectiveFeeBps;
    private final BigInteger timestamp;
    private final MatchingMode matchingMode;
    private final boolean runtimeOverride;

    private BatchConfig(int maxTradesPerBatch, BigInteger minTradeAmount, int makerFeeBps,
                        int takerFeeBps, int effectiveFeeBps, BigInteger timestamp,
                        MatchingMode matchingMode, boolean runtimeOverride) {
        this.maxTradesPerBatch = maxTradesPerBatch;
        this.minTradeAmount = minTradeAmount;
        this.makerFeeBps = makerFeeBps;
        this.takerFeeBps = takerFeeBps;
        this.effectiveFeeBps = effectiveFeeBps;
        this.timestamp = timestamp;
        this.matchingMode = matchingMode;
        this.runtimeOverride = runtimeOverride;
    }

    /**
     * Resolve the effective values for a batch.
     *
     * <ul>
     *   <li>minimum trade: runtime value if present and non-zero, else the default</li>
     *   <li>effective fee rate: runtime value if present, else the default taker rate</li>
     *   <li>maker and taker rates: always the build-time rates; with the maker/taker
     *       split disabled the maker pays nothing and the taker pays the effective rate</li>
     *   <li>timestamp: runtime value, else 0</li>
     * </ul>
     *
     * @param runtimeConfig decoded runtime tuple, or {@code null} when absent
     */
    public static BatchConfig resolve(EngineDefaults defaults, RuntimeConfig runtimeConfig) {
        BigInteger minTrade = BigInteger.valueOf(defaults.getMinTradeAmount());
        int effectiveFee = defaults.getTakerFeeBps();
        BigInteger timestamp = BigInteger.ZERO;

        if (runtimeConfig != null) {
            if (runtimeConfig.minTradeAmount().signum() != 0) {
                minTrade = runtimeConfig.minTradeAmount();
            }
            effectiveFee = runtimeConfig.feeBasisPoints();
            timestamp = runtimeConfig.timestamp();
        }

        int makerFee;
        int takerFee;
        if (defaults.isMakerTakerFees()) {
            makerFee = defaults.getMakerFeeBps();
            takerFee = defaults.getTakerFeeBps();
        } else {
            makerFee = 0;
            takerFee = effectiveFee;
        }

        return new BatchConfig(defaults.getMaxTradesPerBatch(), minTrade, makerFee, takerFee,
                effectiveFee, timestamp, defaults.getMatchingMode(), runtimeConfig != null);
    }

    public int getMaxTradesPerBatch() {
        return maxTradesPerBatch;
    }

    public BigInteger getMinTradeAmount() {
        return minTradeAmount;
    }

    public int getMakerFeeBps() {
        return makerFeeBps;
    }

    public int getTakerFeeBps() {
        return takerFeeBps;
    }

    public int getEffectiveFeeBps() {
        return effectiveFeeBps;
    }

    public BigInteger getTimestamp() {
        return timestamp;
    }

    public MatchingMode getMatchingMode() {
        return matchingMode;
    }

    public boolean hasRuntimeOverride() {
        return runtimeOverride;
    }

    @Override
    public String toString() {
        return "BatchConfig{" +
                "maxTradesPerBatch=" + maxTradesPerBatch +
                ", minTradeAmount=" + minTradeAmount +
                ", makerFeeBps=" + makerFeeBps +
                ", takerFeeBps=" + takerFeeBps +
                ", effectiveFeeBps=" + effectiveFeeBps +
                ", timestamp=" + timestamp +
                ", matchingMode=" + matchingMode +
                ", runtimeOverride=" + runtimeOverride +
                '}';
    }
}
