package com.tokenexchange.engine.matching;

import com.tokenexchange.engine.config.BatchConfig;
import com.tokenexchange.engine.domain.Order;
import com.tokenexchange.engine.domain.Trade;
import com.tokenexchange.engine.partition.InstrumentGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Price-time priority matching algorithm.
 *
 * Price priority: buys are walked from the highest limit price down, sells from the
 * lowest up.
 *
 * Time priority: at equal prices the smaller order id (earlier arrival) goes first.
 *
 * The order with the smaller id in each crossing pair is the maker and sets the
 * execution price. When a crossing pair cannot trade at least the minimum amount,
 * the side(s) whose remainder equals the tradable amount are skipped, since that
 * remainder can never clear the minimum again. This bounds the loop by the number
 * of orders.
 *
 * Time complexity: O(N log N) for the sort plus O(N) crossing steps.
 */
public class PriceTimePriorityMatcher implements MatchingAlgorithm {

    private static final Logger log = LoggerFactory.getLogger(PriceTimePriorityMatcher.class);

    static final Comparator<Order> BUY_PRIORITY =
        Comparator.<Order, BigInteger>comparing(Order::getLimitPrice).reversed()
            .thenComparing(Order::getId);

    static final Comparator<Order> SELL_PRIORITY =
        Comparator.<Order, BigInteger>comparing(Order::getLimitPrice)
            .thenComparing(Order::getId);

    @Override
    public List<Trade> match(InstrumentGroup group, BatchConfig config) {
        List<Order> buys = group.buys();
        List<Order> sells = group.sells();
        buys.sort(BUY_PRIORITY);
        sells.sort(SELL_PRIORITY);

        List<Trade> trades = new ArrayList<>();
        BigInteger minTrade = config.getMinTradeAmount();
        int b = 0;
        int s = 0;

        while (b < buys.size() && s < sells.size()) {
            Order buy = buys.get(b);
            Order sell = sells.get(s);
            if (buy.getLimitPrice().compareTo(sell.getLimitPrice()) < 0) {
                break;
            }

            BigInteger tradable = buy.getRemainingQuantity().min(sell.getRemainingQuantity());
            if (tradable.compareTo(minTrade) >= 0) {
                trades.add(execute(buy, sell, tradable, config));
            } else {
                // Forward progress: a remainder below the minimum never trades again
                boolean skipBuy = buy.getRemainingQuantity().equals(tradable);
                boolean skipSell = sell.getRemainingQuantity().equals(tradable);
                if (skipBuy) {
                    b++;
                }
                if (skipSell) {
                    s++;
                }
                continue;
            }

            if (buy.isFilled()) {
                b++;
            }
            if (sell.isFilled()) {
                s++;
            }
        }
        return trades;
    }

    private Trade execute(Order buy, Order sell, BigInteger quantity, BatchConfig config) {
        Order maker = buy.getId().compareTo(sell.getId()) < 0 ? buy : sell;
        BigInteger price = maker.getLimitPrice();

        BigInteger value = FeeCalculator.tradeValue(quantity, price);
        BigInteger makerFee = FeeCalculator.feeOnValue(value, config.getMakerFeeBps());
        BigInteger takerFee = FeeCalculator.feeOnValue(value, config.getTakerFeeBps());
        BigInteger totalFee = makerFee.add(takerFee);
        if (totalFee.compareTo(FeeCalculator.MAX_UINT256) > 0) {
            throw new ArithmeticException("Total fee of buy " + buy.getId() + " against sell "
                + sell.getId() + " does not fit uint256");
        }

        buy.fill(quantity);
        sell.fill(quantity);

        log.debug("Matched buy={} sell={} instrument={} quantity={} price={} maker={} makerFee={} takerFee={}",
            buy.getId(), sell.getId(), buy.getInstrument(), quantity, price, maker.getId(),
            makerFee, takerFee);

        return new Trade(buy.getId(), sell.getId(), buy.getTrader(), sell.getTrader(),
            buy.getInstrument(), price, quantity, totalFee);
    }
}
