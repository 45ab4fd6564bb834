package com.tokenexchange.engine;

import com.tokenexchange.engine.domain.Address;

/**
 * An instrument whose matching failed in best-effort mode.
 */
public record InstrumentFailure(Address instrument, String message) {

    public String describe() {
        return ErrorKind.MATCHING_ERROR.label() + ": instrument " + instrument + ": " + message;
    }
}
