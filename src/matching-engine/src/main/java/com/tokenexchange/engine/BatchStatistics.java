package com.tokenexchange.engine;

import com.tokenexchange.engine.codec.PayloadSchema;

/**
 * Per-batch counters attached to every {@link BatchOutcome}.
 *
 * @param schema payload layout, {@code null} when decoding failed
 */
public record BatchStatistics(int ordersDecoded,
                              int dustDropped,
                              int instruments,
                              int tradesEmitted,
                              int tradesTruncated,
                              PayloadSchema schema) {

    public static BatchStatistics empty() {
        return new BatchStatistics(0, 0, 0, 0, 0, null);
    }
}
