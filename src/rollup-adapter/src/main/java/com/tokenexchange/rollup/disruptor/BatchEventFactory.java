package com.tokenexchange.rollup.disruptor;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for pre-allocating BatchEvent instances in the ring buffer.
 */
public class BatchEventFactory implements EventFactory<BatchEvent> {

    @Override
    public BatchEvent newInstance() {
        return new BatchEvent();
    }
}
