package com.tokenexchange.rollup.http;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.tokenexchange.engine.BatchOutcome;
import com.tokenexchange.rollup.disruptor.BatchSequencer;
import com.tokenexchange.rollup.metrics.AdapterMetrics;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP handler for POST /execute-raw. The request body is the ABI payload itself and
 * a notice answers with the raw trade array.
 */
public class ExecuteRawHttpHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(ExecuteRawHttpHandler.class);
    private static final String ENDPOINT = "/execute-raw";

    private final BatchSequencer sequencer;
    private final AdapterMetrics metrics;
    private final long timeoutMs;
    private final Gson gson;

    public ExecuteRawHttpHandler(BatchSequencer sequencer, AdapterMetrics metrics, long timeoutMs) {
        this.sequencer = sequencer;
        this.metrics = metrics;
        this.timeoutMs = timeoutMs;
        this.gson = new Gson();
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendErrorResponse(exchange, 405, "Method not allowed");
            return;
        }

        byte[] payload;
        try (InputStream is = exchange.getRequestBody()) {
            payload = is.readAllBytes();
        }
        if (payload.length == 0) {
            sendErrorResponse(exchange, 400, "No input data provided");
            return;
        }

        BatchOutcome outcome;
        try {
            outcome = sequencer.submit(payload, "http-raw").get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RejectedExecutionException) {
                sendErrorResponse(exchange, 503, "Ring buffer full");
            } else {
                logger.error("Engine failed on raw execute request: {}", e.getCause().getMessage(), e);
                sendErrorResponse(exchange, 500, "Engine failure: " + e.getCause().getMessage());
            }
            return;
        } catch (TimeoutException e) {
            logger.warn("Raw execute request timed out after {} ms", timeoutMs);
            sendErrorResponse(exchange, 500, "Engine timed out after " + timeoutMs + " ms");
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sendErrorResponse(exchange, 503, "Interrupted");
            return;
        }

        if (!outcome.isNotice()) {
            sendErrorResponse(exchange, 500, outcome.getReportMessage());
            return;
        }

        byte[] trades = outcome.getTradePayload();
        metrics.recordHttpRequest(ENDPOINT, 200);
        exchange.getResponseHeaders().set("Content-Type", "application/octet-stream");
        exchange.sendResponseHeaders(200, trades.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(trades);
        }
    }

    private void sendErrorResponse(HttpExchange exchange, int statusCode, String message)
            throws IOException {
        metrics.recordHttpRequest(ENDPOINT, statusCode);
        JsonObject response = new JsonObject();
        response.addProperty("error", message);
        byte[] responseBytes = gson.toJson(response).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
