package org.transitmatters.stopevents.application;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import org.transitmatters.stopevents.models.Event;
import org.transitmatters.stopevents.models.SourceKind;
import org.transitmatters.stopevents.output.PartitionKey;

import java.util.List;
import java.util.Map;

/**
 * Output of one pipeline run: the enriched partitions as written, and the fault summary.
 */
public class ProcessingResult {
    private final SourceKind sourceKind;
    private final ImmutableSortedMap<PartitionKey, ImmutableList<Event>> partitions;
    private final ProcessingStats stats;

    public ProcessingResult(SourceKind sourceKind, Map<PartitionKey, ? extends List<Event>> partitions, ProcessingStats stats) {
        this.sourceKind = sourceKind;
        ImmutableSortedMap.Builder<PartitionKey, ImmutableList<Event>> builder = ImmutableSortedMap.naturalOrder();
        partitions.forEach((key, events) -> builder.put(key, ImmutableList.copyOf(events)));
        this.partitions = builder.build();
        this.stats = stats;
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    public ImmutableSortedMap<PartitionKey, ImmutableList<Event>> getPartitions() {
        return partitions;
    }

    /**
     * @return all events, partition by partition
     */
    public List<Event> getEvents() {
        ImmutableList.Builder<Event> events = ImmutableList.builder();
        partitions.values().forEach(events::addAll);
        return events.build();
    }

    public ProcessingStats getStats() {
        return stats;
    }

    public long getFaultCount(FaultKind kind) {
        return stats.getCount(kind);
    }
}
