package com.tokenexchange.engine.matching;

import com.tokenexchange.engine.config.BatchConfig;
import com.tokenexchange.engine.domain.Trade;
import com.tokenexchange.engine.partition.InstrumentGroup;

import java.util.List;

/**
 * Interface for order matching algorithms.
 * The matching algorithm takes the orders of one instrument and the batch
 * configuration, fills the orders in place and returns the trades produced.
 */
public interface MatchingAlgorithm {
    List<Trade> match(InstrumentGroup group, BatchConfig config);
}
