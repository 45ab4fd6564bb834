package com.tokenexchange.rollup.config;

import java.util.Map;

/**
 * Configuration for the rollup adapter, parsed from environment variables.
 *
 * <p>Environment variables:
 * <ul>
 *   <li>{@code HTTP_PORT} - HTTP endpoint port (default 5000)</li>
 *   <li>{@code METRICS_PORT} - Prometheus metrics port (default 9091)</li>
 *   <li>{@code ROLLUP_HTTP_SERVER_URL} - rollup server base URL; the polling loop only
 *       runs when this is set</li>
 *   <li>{@code JOURNAL_PATH} - directory of the input journal (default /tmp/journal)</li>
 *   <li>{@code JOURNAL_SIZE_MB} - journal capacity (default 64)</li>
 *   <li>{@code RING_BUFFER_SIZE} - Disruptor ring size, a power of two (default 1024)</li>
 *   <li>{@code KAFKA_BOOTSTRAP} - Kafka bootstrap servers; publication is off when unset</li>
 *   <li>{@code STATS_INTERVAL_SECONDS} - periodic summary interval (default 10)</li>
 *   <li>{@code EXECUTE_TIMEOUT_MS} - how long a request waits for the engine (default 5000)</li>
 *   <li>{@code POLL_BACKOFF_MS} - delay after a failed rollup call (default 1000)</li>
 * </ul>
 */
public class AdapterConfig {

    private final int httpPort;
    private final int metricsPort;
    private final String rollupServerUrl;
    private final String journalPath;
    private final int journalSizeMb;
    private final int ringBufferSize;
    private final String kafkaBootstrap;
    private final int statsIntervalSeconds;
    private final long executeTimeoutMs;
    private final long pollBackoffMs;

    public AdapterConfig(int httpPort, int metricsPort, String rollupServerUrl, String journalPath,
                         int journalSizeMb, int ringBufferSize, String kafkaBootstrap,
                         int statsIntervalSeconds, long executeTimeoutMs, long pollBackoffMs) {
        if (Integer.bitCount(ringBufferSize) != 1) {
            throw new IllegalArgumentException("RING_BUFFER_SIZE must be a power of two: " + ringBufferSize);
        }
        if (journalSizeMb <= 0) {
            throw new IllegalArgumentException("JOURNAL_SIZE_MB must be positive: " + journalSizeMb);
        }
        if (statsIntervalSeconds <= 0) {
            throw new IllegalArgumentException(
                "STATS_INTERVAL_SECONDS must be positive: " + statsIntervalSeconds);
        }
        this.httpPort = httpPort;
        this.metricsPort = metricsPort;
        this.rollupServerUrl = stripTrailingSlash(rollupServerUrl);
        this.journalPath = journalPath;
        this.journalSizeMb = journalSizeMb;
        this.ringBufferSize = ringBufferSize;
        this.kafkaBootstrap = kafkaBootstrap;
        this.statsIntervalSeconds = statsIntervalSeconds;
        this.executeTimeoutMs = executeTimeoutMs;
        this.pollBackoffMs = pollBackoffMs;
    }

    /**
     * Parse configuration from environment variables.
     */
    public static AdapterConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static AdapterConfig fromEnv(Map<String, String> env) {
        int httpPort = getEnvInt(env, "HTTP_PORT", 5000);
        int metricsPort = getEnvInt(env, "METRICS_PORT", 9091);
        String rollupServerUrl = getEnvString(env, "ROLLUP_HTTP_SERVER_URL", null);
        String journalPath = getEnvString(env, "JOURNAL_PATH", "/tmp/journal");
        int journalSizeMb = getEnvInt(env, "JOURNAL_SIZE_MB", 64);
        int ringBufferSize = getEnvInt(env, "RING_BUFFER_SIZE", 1024);
        String kafkaBootstrap = getEnvString(env, "KAFKA_BOOTSTRAP", null);
        int statsInterval = getEnvInt(env, "STATS_INTERVAL_SECONDS", 10);
        long executeTimeoutMs = getEnvInt(env, "EXECUTE_TIMEOUT_MS", 5000);
        long pollBackoffMs = getEnvInt(env, "POLL_BACKOFF_MS", 1000);

        return new AdapterConfig(httpPort, metricsPort, rollupServerUrl, journalPath,
                journalSizeMb, ringBufferSize, kafkaBootstrap, statsInterval,
                executeTimeoutMs, pollBackoffMs);
    }

    private static int getEnvInt(Map<String, String> env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid integer for environment variable " + name + ": " + value, e);
        }
    }

    private static String getEnvString(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    private static String stripTrailingSlash(String url) {
        if (url != null && url.endsWith("/")) {
            return url.substring(0, url.length() - 1);
        }
        return url;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public int getMetricsPort() {
        return metricsPort;
    }

    public String getRollupServerUrl() {
        return rollupServerUrl;
    }

    public boolean isRollupEnabled() {
        return rollupServerUrl != null;
    }

    public String getJournalPath() {
        return journalPath;
    }

    public int getJournalSizeMb() {
        return journalSizeMb;
    }

    public int getRingBufferSize() {
        return ringBufferSize;
    }

    public String getKafkaBootstrap() {
        return kafkaBootstrap;
    }

    public boolean isKafkaEnabled() {
        return kafkaBootstrap != null;
    }

    public int getStatsIntervalSeconds() {
        return statsIntervalSeconds;
    }

    public long getExecuteTimeoutMs() {
        return executeTimeoutMs;
    }

    public long getPollBackoffMs() {
        return pollBackoffMs;
    }

    @Override
    public String toString() {
        return "AdapterConfig{" +
                "httpPort=" + httpPort +
                ", metricsPort=" + metricsPort +
                ", rollupServerUrl='" + rollupServerUrl + '\'' +
                ", journalPath='" + journalPath + '\'' +
                ", journalSizeMb=" + journalSizeMb +
                ", ringBufferSize=" + ringBufferSize +
                ", kafkaBootstrap='" + kafkaBootstrap + '\'' +
                ", statsIntervalSeconds=" + statsIntervalSeconds +
                ", executeTimeoutMs=" + executeTimeoutMs +
                ", pollBackoffMs=" + pollBackoffMs +
                '}';
    }
}
