package com.tokenexchange.engine.partition;

import java.util.List;

/**
 * Instrument groups in first-occurrence order, plus the number of dust orders dropped.
 */
public record PartitionedBatch(List<InstrumentGroup> groups, int dustDropped) {

    public PartitionedBatch {
        groups = List.copyOf(groups);
    }

    public int instrumentCount() {
        return groups.size();
    }
}
