package com.tokenexchange.rollup.logging;

import com.tokenexchange.engine.BatchOutcome;
import com.tokenexchange.engine.BatchStatistics;
import com.tokenexchange.engine.ErrorKind;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lifetime counters shared between the sequencer thread (writer) and the stats
 * logger and inspect requests (readers).
 */
public class BatchStats {

    public final AtomicLong batchesProcessed = new AtomicLong();
    public final AtomicLong notices = new AtomicLong();
    public final AtomicLong reports = new AtomicLong();
    public final AtomicLong decodeErrors = new AtomicLong();
    public final AtomicLong ordersDecoded = new AtomicLong();
    public final AtomicLong tradesEmitted = new AtomicLong();
    public final AtomicLong tradesTruncated = new AtomicLong();
    public final AtomicLong instrumentFailures = new AtomicLong();
    public final AtomicLong inspects = new AtomicLong();

    public void record(BatchOutcome outcome) {
        BatchStatistics statistics = outcome.getStatistics();
        batchesProcessed.incrementAndGet();
        if (outcome.isNotice()) {
            notices.incrementAndGet();
        } else {
            reports.incrementAndGet();
            if (outcome.getErrorKind() == ErrorKind.DECODE_ERROR) {
                decodeErrors.incrementAndGet();
            }
        }
        ordersDecoded.addAndGet(statistics.ordersDecoded());
        tradesEmitted.addAndGet(statistics.tradesEmitted());
        tradesTruncated.addAndGet(statistics.tradesTruncated());
        instrumentFailures.addAndGet(outcome.getFailures().size());
    }
}
