package com.tokenexchange.rollup.disruptor;

import java.util.concurrent.CompletableFuture;

/**
 * Copies a request into a claimed BatchEvent slot.
 */
public class BatchEventTranslator {

    private BatchEventTranslator() {
    }

    public static void translate(BatchEvent event, long sequence, BatchEvent.Kind kind,
                                 String source, byte[] payload,
                                 CompletableFuture<EngineReply> reply, long receivedNanos) {
        event.receivedNanos = receivedNanos;
        event.kind = kind;
        event.source = source;
        event.payload = payload;
        event.reply = reply;
    }
}
