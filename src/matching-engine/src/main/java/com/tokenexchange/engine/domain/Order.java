package com.tokenexchange.engine.domain;

import java.math.BigInteger;

/**
 * Order entity with fill tracking. All input fields are immutable; only
 * {@code filled} changes, and only upwards, while a batch is being matched.
 * Orders are never carried from one batch to the next.
 *
 * Id, quantity and limit price are uint256 on the wire and carried as
 * non-negative {@link BigInteger}.
 */
public class Order {

    private final BigInteger id;
    private final Address trader;
    private final Address instrument;
    private final BigInteger quantity;
    private final BigInteger limitPrice;
    private final Side side;
    private BigInteger filled;

    public Order(BigInteger id, Address trader, Address instrument, BigInteger quantity,
                 BigInteger limitPrice, Side side) {
        if (id.signum() < 0 || quantity.signum() < 0 || limitPrice.signum() < 0) {
            throw new IllegalArgumentException(
                "Order fields must be unsigned: id=" + id + ", quantity=" + quantity
                    + ", limitPrice=" + limitPrice);
        }
        this.id = id;
        this.trader = trader;
        this.instrument = instrument;
        this.quantity = quantity;
        this.limitPrice = limitPrice;
        this.side = side;
        this.filled = BigInteger.ZERO;
    }

    public Order(long id, Address trader, Address instrument, long quantity,
                 long limitPrice, Side side) {
        this(BigInteger.valueOf(id), trader, instrument, BigInteger.valueOf(quantity),
            BigInteger.valueOf(limitPrice), side);
    }

    /**
     * Fill this order by the given quantity.
     */
    public void fill(BigInteger qty) {
        if (qty.signum() <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive: " + qty);
        }
        if (qty.compareTo(getRemainingQuantity()) > 0) {
            throw new IllegalStateException(
                "Fill quantity " + qty + " exceeds remaining " + getRemainingQuantity()
                    + " on order " + id);
        }
        filled = filled.add(qty);
    }

    public boolean isFilled() {
        return filled.compareTo(quantity) >= 0;
    }

    public BigInteger getRemainingQuantity() {
        return quantity.subtract(filled);
    }

    public BigInteger getId() {
        return id;
    }

    public Address getTrader() {
        return trader;
    }

    public Address getInstrument() {
        return instrument;
    }

    public BigInteger getQuantity() {
        return quantity;
    }

    public BigInteger getLimitPrice() {
        return limitPrice;
    }

    public Side getSide() {
        return side;
    }

    public BigInteger getFilled() {
        return filled;
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + id +
                ", side=" + side +
                ", instrument=" + instrument +
                ", quantity=" + quantity +
                ", limitPrice=" + limitPrice +
                ", filled=" + filled +
                '}';
    }
}
