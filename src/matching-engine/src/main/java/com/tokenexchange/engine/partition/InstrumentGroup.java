package com.tokenexchange.engine.partition;

import com.tokenexchange.engine.domain.Address;
import com.tokenexchange.engine.domain.Order;
import com.tokenexchange.engine.domain.Side;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The orders of one instrument within a batch, in payload order.
 */
public class InstrumentGroup {

    private final Address instrument;
    private final List<Order> orders = new ArrayList<>();

    public InstrumentGroup(Address instrument) {
        this.instrument = instrument;
    }

    void add(Order order) {
        if (!instrument.equals(order.getInstrument())) {
            throw new IllegalArgumentException(
                "Order " + order.getId() + " belongs to " + order.getInstrument()
                    + ", not " + instrument);
        }
        orders.add(order);
    }

    public Address getInstrument() {
        return instrument;
    }

    public List<Order> getOrders() {
        return Collections.unmodifiableList(orders);
    }

    public List<Order> buys() {
        return ofSide(Side.BUY);
    }

    public List<Order> sells() {
        return ofSide(Side.SELL);
    }

    public int size() {
        return orders.size();
    }

    private List<Order> ofSide(Side side) {
        List<Order> result = new ArrayList<>();
        for (Order order : orders) {
            if (order.getSide() == side) {
                result.add(order);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "InstrumentGroup{" +
                "instrument=" + instrument +
                ", orders=" + orders.size() +
                '}';
    }
}
