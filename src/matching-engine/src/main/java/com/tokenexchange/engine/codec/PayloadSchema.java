package com.tokenexchange.engine.codec;

/**
 * Versioned layouts of the order batch payload.
 *
 * <pre>
 * V1  abi.encode(Order[] buys, Order[] sells)
 *     head: [buysOffset=0x40][sellsOffset]
 *
 * V2  abi.encode(Order[] buys, Order[] sells, (uint256,uint256,uint256) config)
 *     head: [buysOffset=0xa0][sellsOffset][timestamp][feeBps][minTradeAmount]
 *
 * Order = (uint256 id, address trader, address instrument,
 *          uint256 quantity, uint256 price, bool isBuy)      6 words, inline
 * array = [length][length x Order]
 * </pre>
 *
 * <p>The buy array always starts right after the head, so its offset identifies the
 * version without trial decoding.
 */
public enum PayloadSchema {

    LEGACY_V1(2, false),
    CONFIGURED_V2(5, true);

    private final int headWords;
    private final boolean carriesRuntimeConfig;

    PayloadSchema(int headWords, boolean carriesRuntimeConfig) {
        this.headWords = headWords;
        this.carriesRuntimeConfig = carriesRuntimeConfig;
    }

    public int headBytes() {
        return headWords * AbiReader.WORD;
    }

    public boolean carriesRuntimeConfig() {
        return carriesRuntimeConfig;
    }

    /**
     * @return the schema whose head ends at the given buy array offset, or {@code null}
     */
    public static PayloadSchema forBuyArrayOffset(long offset) {
        for (PayloadSchema schema : values()) {
            if (schema.headBytes() == offset) {
                return schema;
            }
        }
        return null;
    }
}
