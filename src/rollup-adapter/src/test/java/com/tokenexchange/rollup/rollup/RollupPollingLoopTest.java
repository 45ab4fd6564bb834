package com.tokenexchange.rollup.rollup;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.tokenexchange.engine.BatchOutcome;
import com.tokenexchange.engine.EngineStatus;
import com.tokenexchange.rollup.AdapterFixtures;
import com.tokenexchange.rollup.disruptor.BatchSequencer;
import com.tokenexchange.rollup.logging.BatchStats;
import com.tokenexchange.rollup.metrics.AdapterMetrics;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RollupPollingLoopTest {

    @Mock
    private RollupHttpClient client;

    @Mock
    private BatchSequencer sequencer;

    private AdapterMetrics metrics;
    private RollupPollingLoop loop;

    @BeforeEach
    void setUp() {
        metrics = new AdapterMetrics(new PrometheusRegistry());
        loop = new RollupPollingLoop(client, sequencer, new BatchStats(), metrics, 1000, 0);
    }

    private static Optional<RollupRequest> advance(byte[] payload) {
        return Optional.of(new RollupRequest(RollupRequest.ADVANCE_STATE, payload));
    }

    @Test
    void shouldSendNoticeAndAcceptOnSuccessfulBatch() throws Exception {
        byte[] payload = AdapterFixtures.crossingPayload();
        BatchOutcome notice = AdapterFixtures.notice();
        when(client.finish(RollupHttpClient.ACCEPT)).thenReturn(advance(payload));
        when(sequencer.submit(payload, "rollup")).thenReturn(CompletableFuture.completedFuture(notice));

        String next = loop.step(RollupHttpClient.ACCEPT);

        assertEquals(RollupHttpClient.ACCEPT, next);
        verify(client).sendNotice(notice.getTradePayload());
        verify(client, never()).sendReport(any());
    }

    @Test
    void shouldSendReportAndRejectOnDecodeError() throws Exception {
        byte[] payload = AdapterFixtures.garbagePayload();
        BatchOutcome report = AdapterFixtures.report();
        when(client.finish(RollupHttpClient.ACCEPT)).thenReturn(advance(payload));
        when(sequencer.submit(payload, "rollup")).thenReturn(CompletableFuture.completedFuture(report));

        String next = loop.step(RollupHttpClient.ACCEPT);

        assertEquals(RollupHttpClient.REJECT, next);
        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
        verify(client).sendReport(captor.capture());
        String message = new String(captor.getValue(), StandardCharsets.UTF_8);
        assertTrue(message.startsWith("DecodeError: "));
        verify(client, never()).sendNotice(any());
    }

    @Test
    void shouldReportEachFailedInstrumentAfterTheNotice() throws Exception {
        byte[] payload = AdapterFixtures.twoInstrumentPayload();
        BatchOutcome outcome = AdapterFixtures.noticeWithFailure();
        when(client.finish(RollupHttpClient.ACCEPT)).thenReturn(advance(payload));
        when(sequencer.submit(payload, "rollup")).thenReturn(CompletableFuture.completedFuture(outcome));

        String next = loop.step(RollupHttpClient.ACCEPT);

        assertEquals(RollupHttpClient.ACCEPT, next);
        verify(client).sendNotice(outcome.getTradePayload());
        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
        verify(client).sendReport(captor.capture());
        String message = new String(captor.getValue(), StandardCharsets.UTF_8);
        assertTrue(message.startsWith("MatchingError: instrument " + AdapterFixtures.TOKEN_B.hex()));
    }

    @Test
    void shouldAnswerInspectWithStatusReport() throws Exception {
        EngineStatus status = AdapterFixtures.processor().inspect();
        when(client.finish(RollupHttpClient.REJECT))
                .thenReturn(Optional.of(new RollupRequest(RollupRequest.INSPECT_STATE, new byte[0])));
        when(sequencer.inspect("rollup")).thenReturn(CompletableFuture.completedFuture(status));

        String next = loop.step(RollupHttpClient.REJECT);

        assertEquals(RollupHttpClient.ACCEPT, next);
        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
        verify(client).sendReport(captor.capture());
        JsonObject json = JsonParser.parseString(new String(captor.getValue(), StandardCharsets.UTF_8))
                .getAsJsonObject();
        assertEquals(100, json.getAsJsonObject("config").get("maxTradesPerBatch").getAsInt());
        assertEquals("STRICT", json.getAsJsonObject("config").get("matchingMode").getAsString());
        verify(sequencer, never()).submit(any(), any());
    }

    @Test
    void shouldKeepStatusWhenNothingIsPending() throws Exception {
        when(client.finish(RollupHttpClient.REJECT)).thenReturn(Optional.empty());

        assertEquals(RollupHttpClient.REJECT, loop.step(RollupHttpClient.REJECT));
        verifyNoInteractions(sequencer);
    }

    @Test
    void shouldBackOffAndRetryFinishAfterTransportFailure() throws Exception {
        when(client.finish(RollupHttpClient.ACCEPT))
                .thenThrow(new IOException("connection refused"))
                .thenReturn(Optional.empty());

        assertEquals(RollupHttpClient.ACCEPT, loop.step(RollupHttpClient.ACCEPT));
        assertEquals(RollupHttpClient.ACCEPT, loop.step(RollupHttpClient.ACCEPT));

        verify(client, times(2)).finish(RollupHttpClient.ACCEPT);
        assertEquals(1.0, metrics.rollupErrorsTotal.labelValues("finish").get());
        verifyNoInteractions(sequencer);
    }

    @Test
    void shouldRejectWhenNoticeDeliveryFails() throws Exception {
        byte[] payload = AdapterFixtures.crossingPayload();
        BatchOutcome notice = AdapterFixtures.notice();
        when(client.finish(RollupHttpClient.ACCEPT)).thenReturn(advance(payload));
        when(sequencer.submit(payload, "rollup")).thenReturn(CompletableFuture.completedFuture(notice));
        doThrow(new IOException("reset")).when(client).sendNotice(any());

        assertEquals(RollupHttpClient.REJECT, loop.step(RollupHttpClient.ACCEPT));
        assertEquals(1.0, metrics.rollupErrorsTotal.labelValues("notice").get());
        verify(sequencer, times(1)).submit(payload, "rollup");
    }

    @Test
    void shouldReportEngineFailureWithoutRetryingTheBatch() throws Exception {
        byte[] payload = AdapterFixtures.crossingPayload();
        when(client.finish(RollupHttpClient.ACCEPT)).thenReturn(advance(payload));
        when(sequencer.submit(payload, "rollup"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        assertEquals(RollupHttpClient.REJECT, loop.step(RollupHttpClient.ACCEPT));

        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
        verify(client).sendReport(captor.capture());
        assertEquals("Engine failure: boom", new String(captor.getValue(), StandardCharsets.UTF_8));
        verify(sequencer, times(1)).submit(eq(payload), eq("rollup"));
    }

    @Test
    void shouldRejectUnknownRequestType() throws Exception {
        when(client.finish(RollupHttpClient.ACCEPT))
                .thenReturn(Optional.of(new RollupRequest("mystery_state", new byte[0])));

        assertEquals(RollupHttpClient.REJECT, loop.step(RollupHttpClient.ACCEPT));
        verifyNoInteractions(sequencer);
    }

    @Test
    void shouldClassifyRequestTypes() {
        assertTrue(new RollupRequest(RollupRequest.ADVANCE_STATE, new byte[0]).isAdvance());
        assertTrue(new RollupRequest(RollupRequest.INSPECT_STATE, new byte[0]).isInspect());
        assertArrayEquals(new byte[] {1}, new RollupRequest("x", new byte[] {1}).payload());
    }
}
