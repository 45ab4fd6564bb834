package com.tokenexchange.rollup.rollup;

import com.google.gson.Gson;
import com.tokenexchange.engine.BatchOutcome;
import com.tokenexchange.engine.EngineStatus;
import com.tokenexchange.engine.InstrumentFailure;
import com.tokenexchange.rollup.disruptor.BatchSequencer;
import com.tokenexchange.rollup.http.StatusDocument;
import com.tokenexchange.rollup.logging.BatchStats;
import com.tokenexchange.rollup.metrics.AdapterMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Drives the engine from the rollup server.
 *
 * Each step reports the status of the previous request via /finish and handles the
 * request it gets back:
 * <ul>
 *   <li>advance with a notice: POST /notice, one extra /report per failed instrument,
 *       status accept</li>
 *   <li>advance with a report: POST /report with the message, status reject</li>
 *   <li>inspect: POST /report with the JSON status record, status accept</li>
 * </ul>
 *
 * Transport failures back off for a fixed delay. The engine is never retried.
 */
public class RollupPollingLoop implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(RollupPollingLoop.class);
    private static final String SOURCE = "rollup";

    private final RollupHttpClient client;
    private final BatchSequencer sequencer;
    private final BatchStats stats;
    private final AdapterMetrics metrics;
    private final long executeTimeoutMs;
    private final long backoffMs;
    private final Gson gson;

    private volatile boolean running;
    private Thread thread;

    public RollupPollingLoop(RollupHttpClient client, BatchSequencer sequencer, BatchStats stats,
                             AdapterMetrics metrics, long executeTimeoutMs, long backoffMs) {
        this.client = client;
        this.sequencer = sequencer;
        this.stats = stats;
        this.metrics = metrics;
        this.executeTimeoutMs = executeTimeoutMs;
        this.backoffMs = backoffMs;
        this.gson = new Gson();
    }

    public void start() {
        running = true;
        thread = new Thread(this, "rollup-poller");
        thread.start();
        logger.info("Rollup polling loop started");
    }

    public void stop() {
        running = false;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        logger.info("Rollup polling loop stopped");
    }

    @Override
    public void run() {
        String status = RollupHttpClient.ACCEPT;
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                status = step(status);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * One /finish round trip plus handling of the returned request.
     *
     * @return the status to report on the next /finish call
     */
    String step(String status) throws InterruptedException {
        Optional<RollupRequest> next;
        try {
            next = client.finish(status);
        } catch (IOException e) {
            transportFailure("finish", e);
            return status;
        }

        if (next.isEmpty()) {
            logger.debug("No pending rollup request, trying again");
            return status;
        }

        RollupRequest request = next.get();
        if (request.isAdvance()) {
            return handleAdvance(request.payload());
        }
        if (request.isInspect()) {
            return handleInspect();
        }
        logger.warn("Unknown rollup request type {}", keyValue("requestType", request.requestType()));
        return RollupHttpClient.REJECT;
    }

    private String handleAdvance(byte[] payload) throws InterruptedException {
        BatchOutcome outcome;
        try {
            outcome = sequencer.submit(payload, SOURCE).get(executeTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            logger.error("Engine failed on advance request: {}", e.getCause().getMessage(), e);
            sendReport("Engine failure: " + e.getCause().getMessage());
            return RollupHttpClient.REJECT;
        } catch (TimeoutException e) {
            logger.error("Engine timed out on advance request after {} ms", executeTimeoutMs);
            sendReport("Engine timed out after " + executeTimeoutMs + " ms");
            return RollupHttpClient.REJECT;
        }

        if (!outcome.isNotice()) {
            logger.info("Advance rejected {} {}",
                    keyValue("errorKind", outcome.getErrorKind().label()),
                    keyValue("message", outcome.getMessage()));
            sendReport(outcome.getResponsePayload());
            return RollupHttpClient.REJECT;
        }

        try {
            client.sendNotice(outcome.getTradePayload());
        } catch (IOException e) {
            transportFailure("notice", e);
            return RollupHttpClient.REJECT;
        }
        for (InstrumentFailure failure : outcome.getFailures()) {
            sendReport(failure.describe());
        }
        return RollupHttpClient.ACCEPT;
    }

    private String handleInspect() throws InterruptedException {
        EngineStatus status;
        try {
            status = sequencer.inspect(SOURCE).get(executeTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            logger.error("Inspect request failed: {}", e.getMessage(), e);
            sendReport("Inspect failed: " + e.getMessage());
            return RollupHttpClient.REJECT;
        }
        String json = gson.toJson(StatusDocument.build(status, stats));
        sendReport(json.getBytes(StandardCharsets.UTF_8));
        return RollupHttpClient.ACCEPT;
    }

    private void sendReport(String message) throws InterruptedException {
        sendReport(message.getBytes(StandardCharsets.UTF_8));
    }

    private void sendReport(byte[] payload) throws InterruptedException {
        try {
            client.sendReport(payload);
        } catch (IOException e) {
            transportFailure("report", e);
        }
    }

    private void transportFailure(String call, IOException e) throws InterruptedException {
        logger.warn("Rollup server call failed {} {}", keyValue("call", call),
                keyValue("reason", e.getMessage()));
        metrics.rollupErrorsTotal.labelValues(call).inc();
        Thread.sleep(backoffMs);
    }
}
