package com.tokenexchange.rollup.http;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.tokenexchange.engine.BatchOutcome;
import com.tokenexchange.engine.InstrumentFailure;
import com.tokenexchange.engine.codec.HexPayloads;
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
 * HTTP handler for POST /execute.
 *
 * Accepts {"input_payload_hex":"0x..."}, runs the batch through the sequencer and
 * waits for the outcome. A notice answers 200 with the hex trade array; a report
 * answers 500 with the error kind and message.
 */
public class ExecuteHttpHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(ExecuteHttpHandler.class);
    private static final String ENDPOINT = "/execute";
    static final String INPUT_FIELD = "input_payload_hex";

    private final BatchSequencer sequencer;
    private final AdapterMetrics metrics;
    private final long timeoutMs;
    private final Gson gson;

    public ExecuteHttpHandler(BatchSequencer sequencer, AdapterMetrics metrics, long timeoutMs) {
        this.sequencer = sequencer;
        this.metrics = metrics;
        this.timeoutMs = timeoutMs;
        this.gson = new Gson();
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "{\"error\":\"Method not allowed\"}");
            return;
        }

        byte[] payload;
        try {
            String body;
            try (InputStream is = exchange.getRequestBody()) {
                body = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
            JsonElement parsed = JsonParser.parseString(body);
            if (!parsed.isJsonObject()) {
                sendErrorResponse(exchange, 400, "Request body must be a JSON object");
                return;
            }
            JsonObject json = parsed.getAsJsonObject();
            if (!json.has(INPUT_FIELD) || json.get(INPUT_FIELD).isJsonNull()) {
                sendErrorResponse(exchange, 400, "Missing " + INPUT_FIELD + " in request");
                return;
            }
            JsonElement input = json.get(INPUT_FIELD);
            if (!input.isJsonPrimitive() || !input.getAsJsonPrimitive().isString()) {
                sendErrorResponse(exchange, 400, INPUT_FIELD + " must be a hex string");
                return;
            }
            payload = HexPayloads.fromHex(input.getAsString());
        } catch (JsonParseException | IllegalArgumentException | IllegalStateException
                 | UnsupportedOperationException e) {
            sendErrorResponse(exchange, 400, "Invalid request: " + e.getMessage());
            return;
        }

        BatchOutcome outcome;
        try {
            outcome = sequencer.submit(payload, "http").get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RejectedExecutionException) {
                sendErrorResponse(exchange, 503, "Ring buffer full");
            } else {
                logger.error("Engine failed on execute request: {}", e.getCause().getMessage(), e);
                sendErrorResponse(exchange, 500, "Engine failure: " + e.getCause().getMessage());
            }
            return;
        } catch (TimeoutException e) {
            logger.warn("Execute request timed out after {} ms", timeoutMs);
            sendErrorResponse(exchange, 500, "Engine timed out after " + timeoutMs + " ms");
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sendErrorResponse(exchange, 503, "Interrupted");
            return;
        }

        if (outcome.isNotice()) {
            JsonObject response = new JsonObject();
            response.addProperty("output_payload_hex", HexPayloads.toHex(outcome.getTradePayload()));
            outcome.getConfigWarning().ifPresent(w -> response.addProperty("warning", w));
            if (!outcome.getFailures().isEmpty()) {
                JsonArray failures = new JsonArray();
                for (InstrumentFailure failure : outcome.getFailures()) {
                    failures.add(failure.describe());
                }
                response.add("failures", failures);
            }
            sendResponse(exchange, 200, gson.toJson(response));
        } else {
            JsonObject details = new JsonObject();
            details.addProperty("errorKind", outcome.getErrorKind().label());
            details.addProperty("message", outcome.getMessage());
            JsonObject response = new JsonObject();
            response.addProperty("error", outcome.getReportMessage());
            response.add("details", details);
            sendResponse(exchange, 500, gson.toJson(response));
        }
    }

    private void sendErrorResponse(HttpExchange exchange, int statusCode, String message)
            throws IOException {
        JsonObject response = new JsonObject();
        response.addProperty("error", message);
        sendResponse(exchange, statusCode, gson.toJson(response));
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
