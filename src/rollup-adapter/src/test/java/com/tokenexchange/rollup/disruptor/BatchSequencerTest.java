package com.tokenexchange.rollup.disruptor;

import com.tokenexchange.engine.BatchOutcome;
import com.tokenexchange.engine.EngineStatus;
import com.tokenexchange.engine.config.MatchingMode;
import com.tokenexchange.rollup.AdapterFixtures;
import com.tokenexchange.rollup.journal.InputJournal;
import com.tokenexchange.rollup.logging.BatchStats;
import com.tokenexchange.rollup.metrics.AdapterMetrics;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchSequencerTest {

    @TempDir
    Path dir;

    private BatchSequencer sequencer;
    private InputJournal journal;

    @AfterEach
    void tearDown() {
        if (sequencer != null) {
            sequencer.shutdown();
        }
        if (journal != null) {
            journal.close();
        }
    }

    private BatchStats start(InputJournal journal) {
        BatchStats stats = new BatchStats();
        AdapterMetrics metrics = new AdapterMetrics(new PrometheusRegistry());
        BatchEventHandler handler = new BatchEventHandler(
                AdapterFixtures.processor(), journal, null, metrics, stats);
        sequencer = new BatchSequencer(64, handler);
        sequencer.start();
        return stats;
    }

    @Test
    void shouldCompleteSubmissionWithEngineOutcome() throws Exception {
        BatchStats stats = start(null);

        BatchOutcome outcome = sequencer.submit(AdapterFixtures.crossingPayload(), "test")
                .get(5, TimeUnit.SECONDS);

        assertTrue(outcome.isNotice());
        assertEquals(1, outcome.getTrades().size());
        assertEquals(1, stats.batchesProcessed.get());
    }

    @Test
    void shouldCompleteMalformedSubmissionWithReport() throws Exception {
        start(null);

        BatchOutcome outcome = sequencer.submit(AdapterFixtures.garbagePayload(), "test")
                .get(5, TimeUnit.SECONDS);

        assertFalse(outcome.isNotice());
        assertTrue(outcome.getReportMessage().startsWith("DecodeError: "));
    }

    @Test
    void shouldAnswerInspectWithoutProcessingABatch() throws Exception {
        BatchStats stats = start(null);

        EngineStatus status = sequencer.inspect("test").get(5, TimeUnit.SECONDS);

        assertEquals(100, status.maxTradesPerBatch());
        assertEquals(MatchingMode.STRICT, status.matchingMode());
        assertEquals(0, stats.batchesProcessed.get());
        assertEquals(1, stats.inspects.get());
    }

    @Test
    void shouldProcessSubmissionsInOrderAndJournalEachPayload() throws Exception {
        journal = new InputJournal(dir.toString(), 1);
        BatchStats stats = start(journal);

        List<CompletableFuture<BatchOutcome>> futures = new ArrayList<>();
        futures.add(sequencer.submit(AdapterFixtures.crossingPayload(), "test"));
        futures.add(sequencer.submit(AdapterFixtures.garbagePayload(), "test"));
        futures.add(sequencer.submit(AdapterFixtures.twoInstrumentPayload(), "test"));
        EngineStatus status = sequencer.inspect("test").get(5, TimeUnit.SECONDS);

        for (CompletableFuture<BatchOutcome> future : futures) {
            assertTrue(future.isDone());
        }
        assertEquals(100, status.maxTradesPerBatch());
        assertEquals(3, stats.batchesProcessed.get());
        assertEquals(2, futures.get(2).get().getTrades().size());

        List<byte[]> journaled = journal.replay();
        assertEquals(3, journaled.size());
        assertArrayEquals(AdapterFixtures.crossingPayload(), journaled.get(0));
        assertArrayEquals(AdapterFixtures.garbagePayload(), journaled.get(1));
        assertArrayEquals(AdapterFixtures.twoInstrumentPayload(), journaled.get(2));
    }

    @Test
    void shouldRefuseSubmissionsBeforeStart() {
        BatchEventHandler handler = new BatchEventHandler(AdapterFixtures.processor(), null, null,
                new AdapterMetrics(new PrometheusRegistry()), new BatchStats());
        BatchSequencer unstarted = new BatchSequencer(64, handler);

        assertThrows(IllegalStateException.class,
                () -> unstarted.submit(AdapterFixtures.crossingPayload(), "test"));
    }
}
