package com.tokenexchange.rollup.disruptor;

import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.tokenexchange.engine.BatchOutcome;
import com.tokenexchange.engine.EngineStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

/**
 * Publishes engine requests into the Disruptor ring buffer and hands back a future
 * completed by the {@link BatchEventHandler} on the sequencer thread.
 */
public class BatchSequencer {

    private static final Logger logger = LoggerFactory.getLogger(BatchSequencer.class);

    private final Disruptor<BatchEvent> disruptor;
    private final BatchEventHandler handler;
    private RingBuffer<BatchEvent> ringBuffer;

    public BatchSequencer(int ringBufferSize, BatchEventHandler handler) {
        this.disruptor = new Disruptor<>(
                new BatchEventFactory(),
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new YieldingWaitStrategy()
        );
        this.disruptor.handleEventsWith(handler);
        this.handler = handler;
    }

    public void start() {
        ringBuffer = disruptor.start();
        handler.attach(ringBuffer);
        logger.info("Disruptor started. Ring buffer size: {}", ringBuffer.getBufferSize());
    }

    /**
     * Queue a batch payload. The future fails with {@link RejectedExecutionException}
     * when the ring buffer is full.
     */
    public CompletableFuture<BatchOutcome> submit(byte[] payload, String source) {
        return publish(BatchEvent.Kind.ADVANCE, source, payload).thenApply(EngineReply::outcome);
    }

    /**
     * Queue a read-only status request behind all batches already submitted.
     */
    public CompletableFuture<EngineStatus> inspect(String source) {
        return publish(BatchEvent.Kind.INSPECT, source, null).thenApply(EngineReply::status);
    }

    public void shutdown() {
        try {
            disruptor.shutdown();
            logger.info("Disruptor shut down.");
        } catch (Exception e) {
            logger.warn("Error shutting down Disruptor: {}", e.getMessage());
        }
    }

    private CompletableFuture<EngineReply> publish(BatchEvent.Kind kind, String source, byte[] payload) {
        if (ringBuffer == null) {
            throw new IllegalStateException("Sequencer not started");
        }
        long receivedNanos = System.nanoTime();
        CompletableFuture<EngineReply> reply = new CompletableFuture<>();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            logger.warn("Ring buffer full. Rejecting {} request from {}", kind, source);
            reply.completeExceptionally(new RejectedExecutionException("Ring buffer full"));
            return reply;
        }

        try {
            BatchEvent event = ringBuffer.get(sequence);
            BatchEventTranslator.translate(event, sequence, kind, source, payload, reply, receivedNanos);
        } finally {
            ringBuffer.publish(sequence);
        }
        return reply;
    }
}
