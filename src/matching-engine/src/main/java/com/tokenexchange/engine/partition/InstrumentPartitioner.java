package com.tokenexchange.engine.partition;

import com.tokenexchange.engine.config.BatchConfig;
import com.tokenexchange.engine.domain.Address;
import com.tokenexchange.engine.domain.Order;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a batch into per-instrument groups.
 *
 * Orders below the batch's minimum trade amount are dropped first. Instruments are
 * listed in the order they first appear, scanning the buy array and then the sell
 * array. That order only matters when the trade budget runs out.
 */
public class InstrumentPartitioner {

    private static final Logger log = LoggerFactory.getLogger(InstrumentPartitioner.class);

    public PartitionedBatch partition(List<Order> buys, List<Order> sells, BatchConfig config) {
        List<InstrumentGroup> groups = new ArrayList<>();
        // lookup only, iteration goes through the list
        Map<Address, InstrumentGroup> index = new HashMap<>();
        int dust = 0;

        List<Order> all = new ArrayList<>(buys.size() + sells.size());
        all.addAll(buys);
        all.addAll(sells);

        for (Order order : all) {
            if (order.getQuantity().compareTo(config.getMinTradeAmount()) < 0) {
                log.debug("Dropping dust order id={} quantity={} minTradeAmount={}",
                    order.getId(), order.getQuantity(), config.getMinTradeAmount());
                dust++;
                continue;
            }
            InstrumentGroup group = index.get(order.getInstrument());
            if (group == null) {
                group = new InstrumentGroup(order.getInstrument());
                index.put(order.getInstrument(), group);
                groups.add(group);
            }
            group.add(order);
        }
        return new PartitionedBatch(groups, dust);
    }
}
