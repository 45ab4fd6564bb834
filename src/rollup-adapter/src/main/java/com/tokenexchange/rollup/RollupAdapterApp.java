package com.tokenexchange.rollup;

import com.tokenexchange.engine.BatchProcessor;
import com.tokenexchange.engine.config.EngineDefaults;
import com.tokenexchange.rollup.config.AdapterConfig;
import com.tokenexchange.rollup.disruptor.BatchEventHandler;
import com.tokenexchange.rollup.disruptor.BatchSequencer;
import com.tokenexchange.rollup.http.ExecuteHttpHandler;
import com.tokenexchange.rollup.http.ExecuteRawHttpHandler;
import com.tokenexchange.rollup.http.HealthHttpHandler;
import com.tokenexchange.rollup.http.InspectHttpHandler;
import com.tokenexchange.rollup.journal.InputJournal;
import com.tokenexchange.rollup.logging.BatchStats;
import com.tokenexchange.rollup.logging.PeriodicStatsLogger;
import com.tokenexchange.rollup.metrics.AdapterMetrics;
import com.tokenexchange.rollup.publishing.OutcomePublisher;
import com.tokenexchange.rollup.rollup.RollupHttpClient;
import com.tokenexchange.rollup.rollup.RollupPollingLoop;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.Executors;

/**
 * Main entry point for the rollup adapter.
 *
 * Startup sequence:
 * 1. Load engine defaults (classpath engine.properties + environment)
 * 2. Parse AdapterConfig from environment variables
 * 3. Initialize AdapterMetrics + Prometheus HTTP server
 * 4. Open the InputJournal (memory-mapped file)
 * 5. Initialize OutcomePublisher when Kafka is configured
 * 6. Create the BatchProcessor and start the BatchSequencer
 * 7. Start the periodic stats logger
 * 8. Start HttpServer with /execute, /execute-raw, /inspect, /health handlers
 * 9. Start the rollup polling loop when a rollup server is configured
 * 10. Register JVM shutdown hook
 */
public class RollupAdapterApp {

    private static final Logger logger = LoggerFactory.getLogger(RollupAdapterApp.class);

    public static void main(String[] args) {
        logger.info("Starting token exchange rollup adapter...");

        // 1. Engine defaults
        EngineDefaults defaults = null;
        try {
            defaults = EngineDefaults.load();
            logger.info("Engine defaults: {}", defaults);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid engine configuration: {}", e.getMessage());
            System.exit(1);
        }

        // 2. Adapter configuration
        AdapterConfig config = null;
        try {
            config = AdapterConfig.fromEnv();
            logger.info("Configuration: {}", config);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid adapter configuration: {}", e.getMessage());
            System.exit(1);
        }

        // 3. Metrics and Prometheus HTTP server
        AdapterMetrics metrics = new AdapterMetrics(PrometheusRegistry.defaultRegistry);
        metrics.registerJvmMetrics();
        try {
            metrics.startHttpServer(config.getMetricsPort());
            logger.info("Prometheus metrics HTTP server started on port {}",
                    config.getMetricsPort());
        } catch (IOException e) {
            logger.error("Failed to start Prometheus HTTP server on port {}: {}",
                    config.getMetricsPort(), e.getMessage());
            System.exit(1);
        }

        // 4. Input journal
        InputJournal journal = null;
        try {
            journal = new InputJournal(config.getJournalPath(), config.getJournalSizeMb());
            logger.info("Input journal initialized at {} ({} MB, {} records on disk)",
                    config.getJournalPath(), config.getJournalSizeMb(), journal.getRecordCount());
        } catch (IOException e) {
            logger.error("Failed to initialize input journal: {}. Continuing without journal.",
                    e.getMessage());
        }

        // 5. Kafka publisher
        OutcomePublisher publisher = null;
        if (config.isKafkaEnabled()) {
            publisher = new OutcomePublisher(config.getKafkaBootstrap());
        } else {
            logger.info("KAFKA_BOOTSTRAP not set. Outcome publication disabled.");
        }

        // 6. Engine and sequencer
        BatchStats stats = new BatchStats();
        BatchProcessor processor = new BatchProcessor(defaults);
        BatchEventHandler handler = new BatchEventHandler(
                processor, journal, publisher, metrics, stats);
        BatchSequencer sequencer = new BatchSequencer(config.getRingBufferSize(), handler);
        sequencer.start();

        // 7. Periodic stats logger
        PeriodicStatsLogger statsLogger = new PeriodicStatsLogger(
                stats, config.getStatsIntervalSeconds());
        statsLogger.start();

        // 8. HTTP server
        HttpServer httpServer = null;
        try {
            httpServer = HttpServer.create(
                    new InetSocketAddress(config.getHttpPort()), 0);
            httpServer.createContext("/execute",
                    new ExecuteHttpHandler(sequencer, metrics, config.getExecuteTimeoutMs()));
            httpServer.createContext("/execute-raw",
                    new ExecuteRawHttpHandler(sequencer, metrics, config.getExecuteTimeoutMs()));
            httpServer.createContext("/inspect",
                    new InspectHttpHandler(sequencer, stats, metrics, config.getExecuteTimeoutMs()));
            httpServer.createContext("/health", new HealthHttpHandler());
            httpServer.setExecutor(Executors.newFixedThreadPool(
                    Runtime.getRuntime().availableProcessors()));
            httpServer.start();
            logger.info("HTTP server started on port {}", config.getHttpPort());
        } catch (IOException e) {
            logger.error("Failed to start HTTP server on port {}: {}",
                    config.getHttpPort(), e.getMessage());
            System.exit(1);
        }

        // 9. Rollup polling loop
        RollupPollingLoop pollingLoop = null;
        if (config.isRollupEnabled()) {
            HttpClient httpClient = HttpClient.newBuilder()
                    .version(HttpClient.Version.HTTP_1_1)
                    .connectTimeout(Duration.ofSeconds(2))
                    .build();
            RollupHttpClient rollupClient = new RollupHttpClient(
                    config.getRollupServerUrl(), httpClient,
                    Duration.ofMillis(config.getExecuteTimeoutMs()));
            pollingLoop = new RollupPollingLoop(rollupClient, sequencer, stats, metrics,
                    config.getExecuteTimeoutMs(), config.getPollBackoffMs());
            pollingLoop.start();
        } else {
            logger.info("ROLLUP_HTTP_SERVER_URL not set. Serving HTTP endpoints only.");
        }

        // 10. Shutdown hook
        final InputJournal journalRef = journal;
        final OutcomePublisher publisherRef = publisher;
        final RollupPollingLoop pollingLoopRef = pollingLoop;
        final HttpServer httpServerRef = httpServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down rollup adapter...");
            if (pollingLoopRef != null) {
                pollingLoopRef.stop();
            }
            httpServerRef.stop(1);
            sequencer.shutdown();
            if (journalRef != null) {
                journalRef.close();
            }
            if (publisherRef != null) {
                publisherRef.close();
            }

            statsLogger.logShutdownSummary();
            statsLogger.stop();

            metrics.close();
            logger.info("Rollup adapter shut down complete.");
        }));

        logger.info("Rollup adapter is ready. HTTP: {}, Metrics: {}, Rollup server: {}",
                config.getHttpPort(), config.getMetricsPort(),
                config.isRollupEnabled() ? config.getRollupServerUrl() : "disabled");
    }
}
