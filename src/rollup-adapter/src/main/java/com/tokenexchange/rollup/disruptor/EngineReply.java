package com.tokenexchange.rollup.disruptor;

import com.tokenexchange.engine.BatchOutcome;
import com.tokenexchange.engine.EngineStatus;

/**
 * What the sequencer thread hands back to a waiting caller: an outcome for an
 * advance request, a status for an inspect request.
 */
public record EngineReply(BatchOutcome outcome, EngineStatus status) {

    public static EngineReply of(BatchOutcome outcome) {
        return new EngineReply(outcome, null);
    }

    public static EngineReply of(EngineStatus status) {
        return new EngineReply(null, status);
    }
}
