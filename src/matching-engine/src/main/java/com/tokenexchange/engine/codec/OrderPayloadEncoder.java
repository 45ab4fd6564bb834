package com.tokenexchange.engine.codec;

import com.tokenexchange.engine.config.RuntimeConfig;
import com.tokenexchange.engine.domain.Order;
import com.tokenexchange.engine.domain.Side;

import java.util.List;

/**
 * Client-side encoder for order batches. Writes each order's own side as its
 * {@code isBuy} flag, whichever array it is placed in.
 */
public final class OrderPayloadEncoder {

    private OrderPayloadEncoder() {
    }

    /**
     * Encode a V1 payload.
     */
    public static byte[] encode(List<Order> buys, List<Order> sells) {
        return encode(buys, sells, null);
    }

    /**
     * Encode a V2 payload when {@code runtimeConfig} is present, V1 otherwise.
     */
    public static byte[] encode(List<Order> buys, List<Order> sells, RuntimeConfig runtimeConfig) {
        PayloadSchema schema = runtimeConfig == null
            ? PayloadSchema.LEGACY_V1 : PayloadSchema.CONFIGURED_V2;
        int headWords = schema.headBytes() / AbiReader.WORD;
        int buyWords = 1 + buys.size() * OrderPayloadDecoder.ORDER_WORDS;
        int sellWords = 1 + sells.size() * OrderPayloadDecoder.ORDER_WORDS;

        AbiWriter writer = new AbiWriter(headWords + buyWords + sellWords);
        long buysOffset = schema.headBytes();
        writer.uint(buysOffset);
        writer.uint(buysOffset + (long) buyWords * AbiReader.WORD);
        if (runtimeConfig != null) {
            writer.uint(runtimeConfig.timestamp())
                .uint(runtimeConfig.feeBasisPoints())
                .uint(runtimeConfig.minTradeAmount());
        }
        writeOrders(writer, buys);
        writeOrders(writer, sells);
        return writer.toByteArray();
    }

    private static void writeOrders(AbiWriter writer, List<Order> orders) {
        writer.uint(orders.size());
        for (Order order : orders) {
            writer.uint(order.getId())
                .address(order.getTrader())
                .address(order.getInstrument())
                .uint(order.getQuantity())
                .uint(order.getLimitPrice())
                .bool(order.getSide() == Side.BUY);
        }
    }
}
