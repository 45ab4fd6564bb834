package com.tokenexchange.rollup.rollup;

/**
 * A pending request handed out by the rollup server's /finish endpoint.
 */
public record RollupRequest(String requestType, byte[] payload) {

    public static final String ADVANCE_STATE = "advance_state";
    public static final String INSPECT_STATE = "inspect_state";

    public boolean isAdvance() {
        return ADVANCE_STATE.equals(requestType);
    }

    public boolean isInspect() {
        return INSPECT_STATE.equals(requestType);
    }
}
