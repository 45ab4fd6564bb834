package com.tokenexchange.engine.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Build-time defaults of the matching engine.
 *
 * <p>Values come from the classpath resource {@code engine.properties} and may be
 * overridden by environment variables. The environment name of a key is the key
 * upper-cased with dots replaced by underscores:
 * <ul>
 *   <li>{@code max.trades.per.batch} / {@code MAX_TRADES_PER_BATCH} (default 100)</li>
 *   <li>{@code min.trade.amount} / {@code MIN_TRADE_AMOUNT} (default 1)</li>
 *   <li>{@code maker.fee.bps} / {@code MAKER_FEE_BPS} (default 10)</li>
 *   <li>{@code taker.fee.bps} / {@code TAKER_FEE_BPS} (default 20)</li>
 *   <li>{@code maker.taker.fees} / {@code MAKER_TAKER_FEES} (default true)</li>
 *   <li>{@code matching.mode} / {@code MATCHING_MODE} (default STRICT)</li>
 * </ul>
 *
 * <p>Loaded once at process start. Nothing here is read during a batch.
 */
public final class EngineDefaults {

    public static final String RESOURCE = "engine.properties";

    static final String MAX_TRADES_PER_BATCH = "max.trades.per.batch";
    static final String MIN_TRADE_AMOUNT = "min.trade.amount";
    static final String MAKER_FEE_BPS = "maker.fee.bps";
    static final String TAKER_FEE_BPS = "taker.fee.bps";
    static final String MAKER_TAKER_FEES = "maker.taker.fees";
    static final String MATCHING_MODE = "matching.mode";

    private final int maxTradesPerBatch;
    private final long minTradeAmount;
    private final int makerFeeBps;
    private final int takerFeeBps;
    private final boolean makerTakerFees;
    private final MatchingMode matchingMode;

    public EngineDefaults(int maxTradesPerBatch, long minTradeAmount, int makerFeeBps,
                          int takerFeeBps, boolean makerTakerFees, MatchingMode matchingMode) {
        if (maxTradesPerBatch < 0) {
            throw new IllegalArgumentException("maxTradesPerBatch must not be negative: " + maxTradesPerBatch);
        }
        if (minTradeAmount < 1) {
            throw new IllegalArgumentException("minTradeAmount must be at least 1: " + minTradeAmount);
        }
        checkBasisPoints("makerFeeBps", makerFeeBps);
        checkBasisPoints("takerFeeBps", takerFeeBps);
        if (matchingMode == null) {
            throw new IllegalArgumentException("matchingMode must not be null");
        }
        this.maxTradesPerBatch = maxTradesPerBatch;
        this.minTradeAmount = minTradeAmount;
        this.makerFeeBps = makerFeeBps;
        this.takerFeeBps = takerFeeBps;
        this.makerTakerFees = makerTakerFees;
        this.matchingMode = matchingMode;
    }

    /**
     * Load from {@code engine.properties} on the classpath, then apply environment overrides.
     */
    public static EngineDefaults load() {
        return load(loadResource(RESOURCE), System.getenv());
    }

    static EngineDefaults load(Properties properties, Map<String, String> env) {
        int maxTrades = getInt(properties, env, MAX_TRADES_PER_BATCH, 100);
        long minTrade = getLong(properties, env, MIN_TRADE_AMOUNT, 1L);
        int makerBps = getInt(properties, env, MAKER_FEE_BPS, 10);
        int takerBps = getInt(properties, env, TAKER_FEE_BPS, 20);
        boolean split = getBoolean(properties, env, MAKER_TAKER_FEES, true);
        MatchingMode mode = getMode(properties, env, MATCHING_MODE, MatchingMode.STRICT);
        return new EngineDefaults(maxTrades, minTrade, makerBps, takerBps, split, mode);
    }

    static Properties loadResource(String name) {
        Properties properties = new Properties();
        try (InputStream in = EngineDefaults.class.getClassLoader().getResourceAsStream(name)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + name, e);
        }
        return properties;
    }

    static String envName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    private static String getValue(Properties properties, Map<String, String> env, String key) {
        String value = env.get(envName(key));
        if (value == null || value.isBlank()) {
            value = properties.getProperty(key);
        }
        return (value != null && !value.isBlank()) ? value.trim() : null;
    }

    private static int getInt(Properties properties, Map<String, String> env, String key, int defaultValue) {
        String value = getValue(properties, env, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static long getLong(Properties properties, Map<String, String> env, String key, long defaultValue) {
        String value = getValue(properties, env, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static boolean getBoolean(Properties properties, Map<String, String> env, String key,
                                      boolean defaultValue) {
        String value = getValue(properties, env, key);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
    }

    private static MatchingMode getMode(Properties properties, Map<String, String> env, String key,
                                        MatchingMode defaultValue) {
        String value = getValue(properties, env, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return MatchingMode.valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid matching mode for " + key + ": " + value, e);
        }
    }

    private static void checkBasisPoints(String name, int bps) {
        if (bps < 0 || bps > RuntimeConfig.MAX_BASIS_POINTS) {
            throw new IllegalArgumentException(
                name + " out of range 0.." + RuntimeConfig.MAX_BASIS_POINTS + ": " + bps);
        }
    }

    public int getMaxTradesPerBatch() {
        return maxTradesPerBatch;
    }

    public long getMinTradeAmount() {
        return minTradeAmount;
    }

    public int getMakerFeeBps() {
        return makerFeeBps;
    }

    public int getTakerFeeBps() {
        return takerFeeBps;
    }

    public boolean isMakerTakerFees() {
        return makerTakerFees;
    }

    public MatchingMode getMatchingMode() {
        return matchingMode;
    }

    @Override
    public String toString() {
        return "EngineDefaults{" +
                "maxTradesPerBatch=" + maxTradesPerBatch +
                ", minTradeAmount=" + minTradeAmount +
                ", makerFeeBps=" + makerFeeBps +
                ", takerFeeBps=" + takerFeeBps +
                ", makerTakerFees=" + makerTakerFees +
                ", matchingMode=" + matchingMode +
                '}';
    }
}
