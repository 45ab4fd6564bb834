package com.tokenexchange.engine.codec;

import com.tokenexchange.engine.domain.Address;
import com.tokenexchange.engine.domain.Trade;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * ABI codec for the trade list returned to the chain.
 *
 * <pre>
 * [0x20][length][Trade x length]
 * Trade = (uint256 buyOrderId, uint256 sellOrderId, address buyer, address seller,
 *          address instrument, uint256 executionPrice, uint256 quantity, uint256 totalFee)
 * </pre>
 */
public final class TradeCodec {

    static final int TRADE_WORDS = 8;
    static final int TRADE_BYTES = TRADE_WORDS * AbiReader.WORD;

    private static final int ARRAY_OFFSET = AbiReader.WORD;

    private TradeCodec() {
    }

    /**
     * Encode trades in the given order.
     */
    public static byte[] encodeTrades(List<Trade> trades) {
        AbiWriter writer = new AbiWriter(2 + trades.size() * TRADE_WORDS);
        writer.uint(ARRAY_OFFSET).uint(trades.size());
        for (Trade trade : trades) {
            writer.uint(trade.buyOrderId())
                .uint(trade.sellOrderId())
                .address(trade.buyer())
                .address(trade.seller())
                .address(trade.instrument())
                .uint(trade.executionPrice())
                .uint(trade.quantity())
                .uint(trade.totalFee());
        }
        return writer.toByteArray();
    }

    /**
     * Decode an encoded trade list, as the on-chain consumer would read it.
     *
     * @throws IllegalArgumentException if the bytes are not a well-formed trade array
     */
    public static List<Trade> decodeTrades(byte[] encoded) {
        AbiReader reader = new AbiReader(encoded);
        try {
            long offset = reader.uint63(0, "trade array offset");
            if (offset != ARRAY_OFFSET) {
                throw new AbiFormatException("Unexpected trade array offset 0x" + Long.toHexString(offset));
            }
            long count = reader.uint63(ARRAY_OFFSET, "trade array length");
            int start = ARRAY_OFFSET + AbiReader.WORD;
            if (count != (encoded.length - start) / TRADE_BYTES
                    || (encoded.length - start) % TRADE_BYTES != 0) {
                throw new AbiFormatException("Trade array declares " + count
                    + " trades in " + encoded.length + " bytes");
            }
            List<Trade> trades = new ArrayList<>((int) count);
            for (int i = 0; i < count; i++) {
                int base = start + i * TRADE_BYTES;
                String field = "trade[" + i + "]";
                BigInteger buyOrderId = reader.uint256(base, field + ".buyOrderId");
                BigInteger sellOrderId = reader.uint256(base + AbiReader.WORD, field + ".sellOrderId");
                Address buyer = reader.address(base + 2 * AbiReader.WORD, field + ".buyer");
                Address seller = reader.address(base + 3 * AbiReader.WORD, field + ".seller");
                Address instrument = reader.address(base + 4 * AbiReader.WORD, field + ".instrument");
                BigInteger price = reader.uint256(base + 5 * AbiReader.WORD, field + ".executionPrice");
                BigInteger quantity = reader.uint256(base + 6 * AbiReader.WORD, field + ".quantity");
                BigInteger totalFee = reader.uint256(base + 7 * AbiReader.WORD, field + ".totalFee");
                trades.add(new Trade(buyOrderId, sellOrderId, buyer, seller, instrument,
                    price, quantity, totalFee));
            }
            return trades;
        } catch (AbiFormatException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }
}
