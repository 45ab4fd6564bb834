package com.tokenexchange.engine.codec;

import com.tokenexchange.engine.config.RuntimeConfig;
import com.tokenexchange.engine.domain.Address;
import com.tokenexchange.engine.domain.Order;
import com.tokenexchange.engine.domain.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Decodes V1 and V2 order batch payloads (see {@link PayloadSchema}).
 *
 * <p>Layout violations produce a failed {@link DecodeResult}. A malformed runtime config
 * tuple in an otherwise valid V2 payload is not fatal: the result carries no runtime
 * config and a warning instead.
 */
public class OrderPayloadDecoder {

    private static final Logger log = LoggerFactory.getLogger(OrderPayloadDecoder.class);

    static final int ORDER_WORDS = 6;
    static final int ORDER_BYTES = ORDER_WORDS * AbiReader.WORD;

    private static final int BUYS_OFFSET_POS = 0;
    private static final int SELLS_OFFSET_POS = AbiReader.WORD;
    private static final int CONFIG_POS = 2 * AbiReader.WORD;

    public DecodeResult decode(byte[] payload) {
        if (payload == null || payload.length < PayloadSchema.LEGACY_V1.headBytes()) {
            int length = payload == null ? 0 : payload.length;
            return DecodeResult.failure("Payload of " + length + " bytes is shorter than the "
                + PayloadSchema.LEGACY_V1.headBytes() + "-byte minimum head");
        }
        AbiReader reader = new AbiReader(payload);
        try {
            long buysOffset = reader.uint63(BUYS_OFFSET_POS, "buy array offset");
            PayloadSchema schema = PayloadSchema.forBuyArrayOffset(buysOffset);
            if (schema == null) {
                throw new AbiFormatException("Unknown payload layout: buy array offset 0x"
                    + Long.toHexString(buysOffset));
            }
            if (payload.length < schema.headBytes()) {
                throw new AbiFormatException("Payload of " + payload.length
                    + " bytes is shorter than the " + schema + " head");
            }
            long sellsOffset = reader.uint63(SELLS_OFFSET_POS, "sell array offset");
            checkArrayOffset(reader, sellsOffset, schema, "sell array offset");

            List<Order> buys = readOrders(reader, (int) buysOffset, Side.BUY);
            List<Order> sells = readOrders(reader, (int) sellsOffset, Side.SELL);
            checkUniqueIds(buys, sells);

            RuntimeConfig runtimeConfig = null;
            String configWarning = null;
            if (schema.carriesRuntimeConfig()) {
                try {
                    runtimeConfig = readRuntimeConfig(reader);
                } catch (IllegalArgumentException e) {
                    configWarning = "Malformed runtime config, using defaults: " + e.getMessage();
                    log.warn("Runtime config rejected",
                        keyValue("reason", e.getMessage()));
                }
            }
            return DecodeResult.success(schema, buys, sells, runtimeConfig, configWarning);
        } catch (AbiFormatException e) {
            log.debug("Payload rejected: {}", e.getMessage());
            return DecodeResult.failure(e.getMessage());
        }
    }

    private void checkArrayOffset(AbiReader reader, long offset, PayloadSchema schema,
                                  String field) throws AbiFormatException {
        if (offset % AbiReader.WORD != 0) {
            throw new AbiFormatException(field + " 0x" + Long.toHexString(offset)
                + " is not word-aligned");
        }
        if (offset < schema.headBytes() || offset > reader.length() - AbiReader.WORD) {
            throw new AbiFormatException(field + " 0x" + Long.toHexString(offset)
                + " lies outside the " + reader.length() + "-byte payload");
        }
    }

    private List<Order> readOrders(AbiReader reader, int offset, Side side)
            throws AbiFormatException {
        String array = side == Side.BUY ? "buy array" : "sell array";
        long count = reader.uint63(offset, array + " length");
        int start = offset + AbiReader.WORD;
        long available = (reader.length() - start) / ORDER_BYTES;
        if (count > available) {
            throw new AbiFormatException(array + " declares " + count
                + " orders but the payload holds at most " + available);
        }

        List<Order> orders = new ArrayList<>((int) count);
        for (int i = 0; i < count; i++) {
            int base = start + i * ORDER_BYTES;
            String field = array + "[" + i + "]";
            BigInteger id = reader.uint256(base, field + ".id");
            Address trader = reader.address(base + AbiReader.WORD, field + ".trader");
            Address instrument = reader.address(base + 2 * AbiReader.WORD, field + ".instrument");
            BigInteger quantity = reader.uint256(base + 3 * AbiReader.WORD, field + ".quantity");
            BigInteger price = reader.uint256(base + 4 * AbiReader.WORD, field + ".price");
            boolean isBuy = reader.bool(base + 5 * AbiReader.WORD, field + ".isBuy");
            if (isBuy != (side == Side.BUY)) {
                throw new AbiFormatException(field + " (order " + id + ") is flagged isBuy="
                    + isBuy + " inside the " + array);
            }
            orders.add(new Order(id, trader, instrument, quantity, price, side));
        }
        return orders;
    }

    private void checkUniqueIds(List<Order> buys, List<Order> sells) throws AbiFormatException {
        Set<BigInteger> seen = new HashSet<>();
        for (Order order : buys) {
            if (!seen.add(order.getId())) {
                throw new AbiFormatException("Duplicate order id " + order.getId());
            }
        }
        for (Order order : sells) {
            if (!seen.add(order.getId())) {
                throw new AbiFormatException("Duplicate order id " + order.getId());
            }
        }
    }

    private RuntimeConfig readRuntimeConfig(AbiReader reader) throws AbiFormatException {
        BigInteger timestamp = reader.uint256(CONFIG_POS, "config.timestamp");
        BigInteger feeBps = reader.uint256(CONFIG_POS + AbiReader.WORD, "config.feeBps");
        BigInteger minTrade = reader.uint256(CONFIG_POS + 2 * AbiReader.WORD, "config.minTradeAmount");
        return RuntimeConfig.fromWords(timestamp, feeBps, minTrade);
    }
}
