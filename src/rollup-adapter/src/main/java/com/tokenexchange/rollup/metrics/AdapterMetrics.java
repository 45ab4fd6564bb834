package com.tokenexchange.rollup.metrics;

import com.tokenexchange.engine.BatchOutcome;
import io.prometheus.metrics.core.metrics.Counter;
import io.prometheus.metrics.core.metrics.Gauge;
import io.prometheus.metrics.core.metrics.Histogram;
import io.prometheus.metrics.exporter.httpserver.HTTPServer;
import io.prometheus.metrics.instrumentation.jvm.JvmMetrics;
import io.prometheus.metrics.model.registry.PrometheusRegistry;

import java.io.IOException;
import java.util.Locale;

/**
 * All Prometheus metrics for the rollup adapter, defined in one place.
 */
public class AdapterMetrics {

    public final Histogram batchDuration;
    // name: rollup_batch_duration_seconds

    public final Counter batchesTotal;
    // name: rollup_batches_total

    public final Counter tradesTotal;
    // name: rollup_trades_total

    public final Counter tradesTruncatedTotal;
    // name: rollup_trades_truncated_total

    public final Counter instrumentFailuresTotal;
    // name: rollup_instrument_failures_total

    public final Counter httpRequestsTotal;
    // name: rollup_http_requests_total

    public final Counter rollupErrorsTotal;
    // name: rollup_server_errors_total

    public final Gauge ringbufferUtilization;
    // name: rollup_ringbuffer_utilization_ratio

    private final PrometheusRegistry registry;
    private HTTPServer httpServer;

    public AdapterMetrics(PrometheusRegistry registry) {
        this.registry = registry;

        // End-to-end engine latency, from submission to outcome
        batchDuration = Histogram.builder()
                .name("rollup_batch_duration_seconds")
                .help("Time from batch submission to outcome")
                .labelNames("source")
                .classicOnly()
                .classicUpperBounds(0.0005, 0.001, 0.005, 0.01, 0.025, 0.05, 0.1, 0.5, 1.0)
                .register(registry);

        batchesTotal = Counter.builder()
                .name("rollup_batches_total")
                .help("Batches processed by outcome")
                .labelNames("source", "outcome")
                .register(registry);

        tradesTotal = Counter.builder()
                .name("rollup_trades_total")
                .help("Trades emitted")
                .register(registry);

        tradesTruncatedTotal = Counter.builder()
                .name("rollup_trades_truncated_total")
                .help("Trades cut by the per-batch trade cap")
                .register(registry);

        instrumentFailuresTotal = Counter.builder()
                .name("rollup_instrument_failures_total")
                .help("Instruments whose matching failed in best-effort mode")
                .register(registry);

        httpRequestsTotal = Counter.builder()
                .name("rollup_http_requests_total")
                .help("HTTP requests by endpoint and status class")
                .labelNames("endpoint", "status")
                .register(registry);

        rollupErrorsTotal = Counter.builder()
                .name("rollup_server_errors_total")
                .help("Failed calls to the rollup server")
                .labelNames("call")
                .register(registry);

        ringbufferUtilization = Gauge.builder()
                .name("rollup_ringbuffer_utilization_ratio")
                .help("Ring buffer fill level 0.0 to 1.0")
                .register(registry);
    }

    public void recordOutcome(String source, BatchOutcome outcome, double durationSeconds) {
        batchDuration.labelValues(source).observe(durationSeconds);
        batchesTotal.labelValues(source, outcome.getType().name().toLowerCase(Locale.ROOT)).inc();
        tradesTotal.inc(outcome.getStatistics().tradesEmitted());
        tradesTruncatedTotal.inc(outcome.getStatistics().tradesTruncated());
        instrumentFailuresTotal.inc(outcome.getFailures().size());
    }

    public void recordHttpRequest(String endpoint, int statusCode) {
        httpRequestsTotal.labelValues(endpoint, categorizeStatus(statusCode)).inc();
    }

    /**
     * Register JVM metrics (GC, memory, threads) with this registry.
     */
    public void registerJvmMetrics() {
        JvmMetrics.builder().register(registry);
    }

    /**
     * Start the Prometheus HTTP server on the given port.
     * Exposes /metrics endpoint for Prometheus scraping.
     */
    public void startHttpServer(int port) throws IOException {
        httpServer = HTTPServer.builder()
                .port(port)
                .registry(registry)
                .buildAndStart();
    }

    public void close() {
        if (httpServer != null) {
            httpServer.close();
        }
    }

    private static String categorizeStatus(int statusCode) {
        if (statusCode >= 200 && statusCode < 300) return "2xx";
        if (statusCode >= 400 && statusCode < 500) return "4xx";
        return "5xx";
    }
}
