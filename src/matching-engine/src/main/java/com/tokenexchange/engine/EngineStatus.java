package com.tokenexchange.engine;

import com.tokenexchange.engine.config.MatchingMode;

/**
 * Effective configuration of the engine when no runtime override is supplied.
 */
public record EngineStatus(int maxTradesPerBatch,
                           long minTradeAmount,
                           int makerFeeBps,
                           int takerFeeBps,
                           int effectiveFeeBps,
                           boolean makerTakerFees,
                           MatchingMode matchingMode) {
}
