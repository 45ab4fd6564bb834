package com.tokenexchange.engine;

/**
 * Categories of batch failures surfaced to the caller.
 */
public enum ErrorKind {

    /** Payload layout violation. Fatal for the batch. */
    DECODE_ERROR("DecodeError"),

    /** Malformed runtime config tuple. Non-fatal, defaults are used. */
    CONFIG_ERROR("ConfigError"),

    /** Exception while matching one instrument. */
    MATCHING_ERROR("MatchingError");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
