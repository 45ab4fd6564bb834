package com.tokenexchange.engine.batch;

import com.tokenexchange.engine.domain.Trade;

import java.util.List;

/**
 * Global cap on the number of trades a batch may emit.
 *
 * Groups are admitted in partitioner order; the trades of a group that do not fit the
 * remaining budget are cut, so later instruments may get nothing.
 */
public class TradeBudget {

    private final int limit;
    private int used;
    private int truncated;

    public TradeBudget(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Trade budget must not be negative: " + limit);
        }
        this.limit = limit;
    }

    /**
     * @return the leading trades that fit the remaining budget
     */
    public List<Trade> admit(List<Trade> trades) {
        int room = getRemaining();
        if (trades.size() <= room) {
            used += trades.size();
            return trades;
        }
        truncated += trades.size() - room;
        used += room;
        return trades.subList(0, room);
    }

    public int getLimit() {
        return limit;
    }

    public int getUsed() {
        return used;
    }

    public int getTruncated() {
        return truncated;
    }

    public int getRemaining() {
        return limit - used;
    }

    public boolean isExhausted() {
        return used >= limit;
    }
}
