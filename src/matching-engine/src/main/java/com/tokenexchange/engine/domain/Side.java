package com.tokenexchange.engine.domain;

public enum Side {
    BUY,
    SELL
}
