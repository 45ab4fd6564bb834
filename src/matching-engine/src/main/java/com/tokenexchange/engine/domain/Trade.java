package com.tokenexchange.engine.domain;

import java.math.BigInteger;

/**
 * A single execution between a buy order and a sell order of the same instrument.
 * Field order matches the on-chain settlement tuple. Every numeric field is a uint256.
 *
 * @param executionPrice limit price of the maker (the order with the smaller id)
 * @param totalFee       maker fee plus taker fee
 */
public record Trade(BigInteger buyOrderId,
                    BigInteger sellOrderId,
                    Address buyer,
                    Address seller,
                    Address instrument,
                    BigInteger executionPrice,
                    BigInteger quantity,
                    BigInteger totalFee) {
}
