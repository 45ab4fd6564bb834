package com.tokenexchange.rollup.http;

import com.google.gson.JsonObject;
import com.tokenexchange.engine.EngineStatus;
import com.tokenexchange.rollup.logging.BatchStats;

/**
 * JSON status record served by GET /inspect and by rollup inspect requests.
 */
public final class StatusDocument {

    public static final String SERVICE_NAME = "token-exchange-rollup";

    private StatusDocument() {
    }

    public static JsonObject build(EngineStatus status, BatchStats stats) {
        JsonObject config = new JsonObject();
        config.addProperty("maxTradesPerBatch", status.maxTradesPerBatch());
        config.addProperty("minTradeAmount", status.minTradeAmount());
        config.addProperty("makerFeeBps", status.makerFeeBps());
        config.addProperty("takerFeeBps", status.takerFeeBps());
        config.addProperty("effectiveFeeBps", status.effectiveFeeBps());
        config.addProperty("makerTakerFees", status.makerTakerFees());
        config.addProperty("matchingMode", status.matchingMode().name());

        JsonObject counters = new JsonObject();
        counters.addProperty("batchesProcessed", stats.batchesProcessed.get());
        counters.addProperty("notices", stats.notices.get());
        counters.addProperty("reports", stats.reports.get());
        counters.addProperty("decodeErrors", stats.decodeErrors.get());
        counters.addProperty("ordersDecoded", stats.ordersDecoded.get());
        counters.addProperty("tradesEmitted", stats.tradesEmitted.get());
        counters.addProperty("tradesTruncated", stats.tradesTruncated.get());
        counters.addProperty("instrumentFailures", stats.instrumentFailures.get());

        JsonObject json = new JsonObject();
        json.addProperty("service", SERVICE_NAME);
        json.add("config", config);
        json.add("counters", counters);
        return json;
    }
}
