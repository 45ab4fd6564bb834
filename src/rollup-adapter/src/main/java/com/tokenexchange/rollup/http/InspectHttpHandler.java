package com.tokenexchange.rollup.http;

import com.google.gson.Gson;
import com.tokenexchange.engine.EngineStatus;
import com.tokenexchange.rollup.disruptor.BatchSequencer;
import com.tokenexchange.rollup.logging.BatchStats;
import com.tokenexchange.rollup.metrics.AdapterMetrics;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * HTTP handler for GET /inspect. Returns the effective engine configuration and
 * lifetime counters without touching any batch state.
 */
public class InspectHttpHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(InspectHttpHandler.class);
    private static final String ENDPOINT = "/inspect";

    private final BatchSequencer sequencer;
    private final BatchStats stats;
    private final AdapterMetrics metrics;
    private final long timeoutMs;
    private final Gson gson;

    public InspectHttpHandler(BatchSequencer sequencer, BatchStats stats, AdapterMetrics metrics,
                              long timeoutMs) {
        this.sequencer = sequencer;
        this.stats = stats;
        this.metrics = metrics;
        this.timeoutMs = timeoutMs;
        this.gson = new Gson();
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "{\"error\":\"Method not allowed\"}");
            return;
        }

        try {
            EngineStatus status = sequencer.inspect("http").get(timeoutMs, TimeUnit.MILLISECONDS);
            sendResponse(exchange, 200, gson.toJson(StatusDocument.build(status, stats)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sendResponse(exchange, 503, "{\"error\":\"Interrupted\"}");
        } catch (Exception e) {
            logger.error("Error handling inspect request: {}", e.getMessage(), e);
            sendResponse(exchange, 500, "{\"error\":\"Inspect failed\"}");
        }
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String body)
            throws IOException {
        metrics.recordHttpRequest(ENDPOINT, statusCode);
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
