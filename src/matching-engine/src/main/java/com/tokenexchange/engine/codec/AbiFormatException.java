package com.tokenexchange.engine.codec;

/**
 * Raised while walking an ABI payload that does not follow the expected layout.
 */
class AbiFormatException extends Exception {

    AbiFormatException(String message) {
        super(message);
    }
}
