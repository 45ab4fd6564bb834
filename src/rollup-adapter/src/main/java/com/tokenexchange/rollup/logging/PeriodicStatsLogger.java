package com.tokenexchange.rollup.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Logs aggregate batch statistics every N seconds on a separate daemon thread.
 * Never blocks the sequencer thread.
 */
public class PeriodicStatsLogger {

    private static final Logger logger = LoggerFactory.getLogger(PeriodicStatsLogger.class);

    private final BatchStats stats;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler;

    private long lastBatches;
    private long lastNotices;
    private long lastReports;
    private long lastTrades;
    private long lastTruncated;

    public PeriodicStatsLogger(BatchStats stats, int intervalSeconds) {
        this.stats = stats;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "periodic-stats-logger");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::logSummary, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        logger.info("Periodic stats logger started",
                keyValue("event", "STATS_LOGGER_STARTED"),
                keyValue("intervalSeconds", intervalSeconds));
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Log a final lifetime summary on shutdown.
     */
    public void logShutdownSummary() {
        long batches = stats.batchesProcessed.get();
        long notices = stats.notices.get();
        double acceptRate = batches > 0 ? (double) notices / batches : 0.0;

        logger.info("Shutdown summary",
                keyValue("event", "SHUTDOWN_SUMMARY"),
                keyValue("totalBatches", batches),
                keyValue("totalNotices", notices),
                keyValue("totalReports", stats.reports.get()),
                keyValue("totalDecodeErrors", stats.decodeErrors.get()),
                keyValue("totalOrders", stats.ordersDecoded.get()),
                keyValue("totalTrades", stats.tradesEmitted.get()),
                keyValue("totalTruncated", stats.tradesTruncated.get()),
                keyValue("totalInstrumentFailures", stats.instrumentFailures.get()),
                keyValue("totalInspects", stats.inspects.get()),
                keyValue("overallAcceptRate", String.format("%.4f", acceptRate)));
    }

    void logSummary() {
        try {
            long currentBatches = stats.batchesProcessed.get();
            long currentNotices = stats.notices.get();
            long currentReports = stats.reports.get();
            long currentTrades = stats.tradesEmitted.get();
            long currentTruncated = stats.tradesTruncated.get();

            long deltaBatches = currentBatches - lastBatches;
            long deltaNotices = currentNotices - lastNotices;
            double acceptRate = deltaBatches > 0 ? (double) deltaNotices / deltaBatches : 0.0;

            logger.info("Periodic summary",
                    keyValue("event", "PERIODIC_SUMMARY"),
                    keyValue("intervalSeconds", intervalSeconds),
                    keyValue("batches", deltaBatches),
                    keyValue("notices", deltaNotices),
                    keyValue("reports", currentReports - lastReports),
                    keyValue("trades", currentTrades - lastTrades),
                    keyValue("truncated", currentTruncated - lastTruncated),
                    keyValue("acceptRate", String.format("%.4f", acceptRate)));

            lastBatches = currentBatches;
            lastNotices = currentNotices;
            lastReports = currentReports;
            lastTrades = currentTrades;
            lastTruncated = currentTruncated;
        } catch (Exception e) {
            logger.error("Error in periodic stats logging", e);
        }
    }
}
