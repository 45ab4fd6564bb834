package com.tokenexchange.rollup.disruptor;

import java.util.concurrent.CompletableFuture;

/**
 * Pre-allocated mutable event object in the Disruptor ring buffer.
 *
 * Fields are public for direct access on the sequencer thread. The clear() method
 * resets all fields after processing so a slot never holds a stale payload or reply.
 */
public class BatchEvent {

    public enum Kind {
        ADVANCE,
        INSPECT
    }

    public long receivedNanos;     // System.nanoTime() when the request was received
    public Kind kind;
    public String source;          // "http" or "rollup"
    public byte[] payload;
    public CompletableFuture<EngineReply> reply;

    public void clear() {
        receivedNanos = 0;
        kind = null;
        source = null;
        payload = null;
        reply = null;
    }
}
