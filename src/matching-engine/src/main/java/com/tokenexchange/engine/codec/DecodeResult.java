package com.tokenexchange.engine.codec;

import com.tokenexchange.engine.config.RuntimeConfig;
import com.tokenexchange.engine.domain.Order;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of decoding an order payload: either the decoded orders (with an optional
 * runtime config and config warning) or the reason the payload was rejected.
 */
public final class DecodeResult {

    private final boolean success;
    private final PayloadSchema schema;
    private final List<Order> buyOrders;
    private final List<Order> sellOrders;
    private final RuntimeConfig runtimeConfig;
    private final String configWarning;
    private final String error;

    private DecodeResult(boolean success, PayloadSchema schema, List<Order> buyOrders,
                         List<Order> sellOrders, RuntimeConfig runtimeConfig,
                         String configWarning, String error) {
        this.success = success;
        this.schema = schema;
        this.buyOrders = buyOrders;
        this.sellOrders = sellOrders;
        this.runtimeConfig = runtimeConfig;
        this.configWarning = configWarning;
        this.error = error;
    }

    public static DecodeResult success(PayloadSchema schema, List<Order> buyOrders,
                                       List<Order> sellOrders, RuntimeConfig runtimeConfig,
                                       String configWarning) {
        return new DecodeResult(true, schema,
            Collections.unmodifiableList(buyOrders), Collections.unmodifiableList(sellOrders),
            runtimeConfig, configWarning, null);
    }

    public static DecodeResult failure(String error) {
        return new DecodeResult(false, null, List.of(), List.of(), null, null, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public PayloadSchema getSchema() {
        return schema;
    }

    public List<Order> getBuyOrders() {
        return buyOrders;
    }

    public List<Order> getSellOrders() {
        return sellOrders;
    }

    public int getOrderCount() {
        return buyOrders.size() + sellOrders.size();
    }

    public Optional<RuntimeConfig> getRuntimeConfig() {
        return Optional.ofNullable(runtimeConfig);
    }

    public Optional<String> getConfigWarning() {
        return Optional.ofNullable(configWarning);
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        if (!success) {
            return "DecodeResult{error='" + error + "'}";
        }
        return "DecodeResult{" +
                "schema=" + schema +
                ", buys=" + buyOrders.size() +
                ", sells=" + sellOrders.size() +
                ", runtimeConfig=" + runtimeConfig +
                ", configWarning=" + configWarning +
                '}';
    }
}
