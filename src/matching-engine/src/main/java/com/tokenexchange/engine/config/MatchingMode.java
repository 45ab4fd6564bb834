package com.tokenexchange.engine.config;

/**
 * How a batch reacts to a fault while matching one instrument.
 */
public enum MatchingMode {
    /** Any instrument failure turns the whole batch into a report. */
    STRICT,
    /** Failed instruments are reported separately; trades of the others are kept. */
    BEST_EFFORT
}
