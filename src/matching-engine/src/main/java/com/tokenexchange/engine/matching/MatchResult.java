package com.tokenexchange.engine.matching;

import com.tokenexchange.engine.domain.Address;
import com.tokenexchange.engine.domain.Trade;

import java.util.List;

/**
 * Result of matching one instrument: its trades, or the error that stopped it.
 *
 * @param error failure message, {@code null} on success
 */
public record MatchResult(Address instrument, List<Trade> trades, String error) {

    public MatchResult {
        trades = List.copyOf(trades);
    }

    public static MatchResult success(Address instrument, List<Trade> trades) {
        return new MatchResult(instrument, trades, null);
    }

    public static MatchResult failure(Address instrument, String error) {
        return new MatchResult(instrument, List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
