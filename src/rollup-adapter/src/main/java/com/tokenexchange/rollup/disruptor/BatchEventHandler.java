package com.tokenexchange.rollup.disruptor;

import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.tokenexchange.engine.BatchOutcome;
import com.tokenexchange.engine.BatchProcessor;
import com.tokenexchange.rollup.journal.InputJournal;
import com.tokenexchange.rollup.logging.BatchStats;
import com.tokenexchange.rollup.metrics.AdapterMetrics;
import com.tokenexchange.rollup.publishing.OutcomePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single-threaded event processor in front of the engine.
 *
 * Every engine call happens here, one event at a time, so batches are atomic and
 * totally ordered no matter how many HTTP threads or pollers publish.
 *
 * Processing pipeline per advance event:
 * 1. Append the payload to the input journal
 * 2. Run the batch through the engine
 * 3. Record stats and metrics
 * 4. Publish the outcome to Kafka (async)
 * 5. Complete the caller's future
 * 6. Flush the journal on endOfBatch
 */
public class BatchEventHandler implements EventHandler<BatchEvent> {

    private static final Logger logger = LoggerFactory.getLogger(BatchEventHandler.class);

    private final BatchProcessor processor;
    private final InputJournal journal;
    private final OutcomePublisher publisher;
    private final AdapterMetrics metrics;
    private final BatchStats stats;
    private volatile RingBuffer<BatchEvent> ringBuffer;

    /**
     * @param journal   may be {@code null} when journaling is unavailable
     * @param publisher may be {@code null} when Kafka publication is disabled
     */
    public BatchEventHandler(BatchProcessor processor, InputJournal journal,
                             OutcomePublisher publisher, AdapterMetrics metrics,
                             BatchStats stats) {
        this.processor = processor;
        this.journal = journal;
        this.publisher = publisher;
        this.metrics = metrics;
        this.stats = stats;
    }

    /**
     * Attach the started ring buffer so the fill level can be reported.
     */
    void attach(RingBuffer<BatchEvent> ringBuffer) {
        this.ringBuffer = ringBuffer;
    }

    @Override
    public void onEvent(BatchEvent event, long sequence, boolean endOfBatch) {
        if (event.reply == null) {
            // Slot was cleared or never populated
            return;
        }

        try {
            if (event.kind == BatchEvent.Kind.INSPECT) {
                stats.inspects.incrementAndGet();
                event.reply.complete(EngineReply.of(processor.inspect()));
                return;
            }

            appendToJournal(event.payload);

            BatchOutcome outcome = processor.process(event.payload);

            double duration = nanosToSeconds(System.nanoTime() - event.receivedNanos);
            stats.record(outcome);
            metrics.recordOutcome(event.source, outcome, duration);
            metrics.ringbufferUtilization.set(fillRatio());

            if (publisher != null) {
                publisher.publish(event.source, outcome);
            }
            event.reply.complete(EngineReply.of(outcome));

        } catch (Exception e) {
            logger.error("Error processing event sequence {}: {}", sequence, e.getMessage(), e);
            event.reply.completeExceptionally(e);
        } finally {
            event.clear();

            if (endOfBatch && journal != null) {
                journal.flush();
            }
        }
    }

    /**
     * Share of ring slots published but not yet released by this handler.
     */
    double fillRatio() {
        RingBuffer<BatchEvent> rb = ringBuffer;
        if (rb == null) {
            return 0.0;
        }
        long size = rb.getBufferSize();
        return (double) (size - rb.remainingCapacity()) / size;
    }

    private void appendToJournal(byte[] payload) {
        if (journal == null) {
            return;
        }
        try {
            journal.append(payload);
        } catch (Exception e) {
            logger.warn("Failed to append to journal: {}", e.getMessage());
        }
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }
}
