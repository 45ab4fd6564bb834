package com.tokenexchange.engine;

import com.tokenexchange.engine.batch.TradeBudget;
import com.tokenexchange.engine.codec.DecodeResult;
import com.tokenexchange.engine.codec.OrderPayloadDecoder;
import com.tokenexchange.engine.codec.TradeCodec;
import com.tokenexchange.engine.config.BatchConfig;
import com.tokenexchange.engine.config.EngineDefaults;
import com.tokenexchange.engine.config.MatchingMode;
import com.tokenexchange.engine.domain.Trade;
import com.tokenexchange.engine.matching.MatchResult;
import com.tokenexchange.engine.matching.MatchingAlgorithm;
import com.tokenexchange.engine.matching.PriceTimePriorityMatcher;
import com.tokenexchange.engine.partition.InstrumentGroup;
import com.tokenexchange.engine.partition.InstrumentPartitioner;
import com.tokenexchange.engine.partition.PartitionedBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Runs one batch end to end: decode, resolve config, partition, match each instrument
 * under the trade budget, encode.
 *
 * Synchronous and single-threaded. Callers must serialize invocations; the processor
 * keeps no state between batches.
 */
public class BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    private final EngineDefaults defaults;
    private final OrderPayloadDecoder decoder = new OrderPayloadDecoder();
    private final InstrumentPartitioner partitioner = new InstrumentPartitioner();
    private final MatchingAlgorithm matcher;

    public BatchProcessor(EngineDefaults defaults) {
        this(defaults, new PriceTimePriorityMatcher());
    }

    public BatchProcessor(EngineDefaults defaults, MatchingAlgorithm matcher) {
        this.defaults = defaults;
        this.matcher = matcher;
    }

    public BatchOutcome process(byte[] payload) {
        DecodeResult decoded = decoder.decode(payload);
        if (!decoded.isSuccess()) {
            log.warn("Batch rejected",
                keyValue("errorKind", ErrorKind.DECODE_ERROR.label()),
                keyValue("reason", decoded.getError()));
            return BatchOutcome.report(ErrorKind.DECODE_ERROR, decoded.getError(),
                BatchStatistics.empty());
        }

        BatchConfig config = BatchConfig.resolve(defaults, decoded.getRuntimeConfig().orElse(null));
        String configWarning = decoded.getConfigWarning().orElse(null);
        if (configWarning != null) {
            log.warn("Batch running on defaults",
                keyValue("errorKind", ErrorKind.CONFIG_ERROR.label()),
                keyValue("reason", configWarning));
        }

        PartitionedBatch partitioned = partitioner.partition(
            decoded.getBuyOrders(), decoded.getSellOrders(), config);
        TradeBudget budget = new TradeBudget(config.getMaxTradesPerBatch());
        List<Trade> trades = new ArrayList<>();
        List<InstrumentFailure> failures = new ArrayList<>();

        for (InstrumentGroup group : partitioned.groups()) {
            MatchResult result = matchGroup(group, config);
            if (!result.isSuccess()) {
                if (config.getMatchingMode() == MatchingMode.STRICT) {
                    String message = "instrument " + group.getInstrument() + ": " + result.error();
                    log.warn("Batch aborted",
                        keyValue("errorKind", ErrorKind.MATCHING_ERROR.label()),
                        keyValue("instrument", group.getInstrument().hex()),
                        keyValue("reason", result.error()));
                    return BatchOutcome.report(ErrorKind.MATCHING_ERROR, message,
                        statistics(decoded, partitioned, 0, budget.getTruncated()));
                }
                failures.add(new InstrumentFailure(group.getInstrument(), result.error()));
                continue;
            }
            trades.addAll(budget.admit(result.trades()));
        }

        byte[] encoded = TradeCodec.encodeTrades(trades);
        BatchStatistics stats = statistics(decoded, partitioned, trades.size(), budget.getTruncated());
        log.info("Batch processed",
            keyValue("schema", decoded.getSchema()),
            keyValue("orders", stats.ordersDecoded()),
            keyValue("dustDropped", stats.dustDropped()),
            keyValue("instruments", stats.instruments()),
            keyValue("trades", stats.tradesEmitted()),
            keyValue("truncated", stats.tradesTruncated()),
            keyValue("failedInstruments", failures.size()),
            keyValue("timestamp", config.getTimestamp()));
        return BatchOutcome.notice(encoded, trades, configWarning, failures, stats);
    }

    /**
     * Effective configuration with no runtime override. Does not touch any batch state.
     */
    public EngineStatus inspect() {
        BatchConfig config = BatchConfig.resolve(defaults, null);
        return new EngineStatus(config.getMaxTradesPerBatch(), defaults.getMinTradeAmount(),
            config.getMakerFeeBps(), config.getTakerFeeBps(), config.getEffectiveFeeBps(),
            defaults.isMakerTakerFees(), config.getMatchingMode());
    }

    private MatchResult matchGroup(InstrumentGroup group, BatchConfig config) {
        try {
            return MatchResult.success(group.getInstrument(), matcher.match(group, config));
        } catch (RuntimeException e) {
            log.error("Matching failed for instrument {}", group.getInstrument(), e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return MatchResult.failure(group.getInstrument(), reason);
        }
    }

    private BatchStatistics statistics(DecodeResult decoded, PartitionedBatch partitioned,
                                       int tradesEmitted, int truncated) {
        return new BatchStatistics(decoded.getOrderCount(), partitioned.dustDropped(),
            partitioned.instrumentCount(), tradesEmitted, truncated, decoded.getSchema());
    }
}
