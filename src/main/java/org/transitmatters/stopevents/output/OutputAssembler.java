package org.transitmatters.stopevents.output;

import org.transitmatters.stopevents.models.Event;
import org.transitmatters.stopevents.models.SourceKind;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Groups events into output partitions, each in stable row order.
 */
public class OutputAssembler {

    public SortedMap<PartitionKey, List<Event>> partition(List<Event> events, SourceKind sourceKind) {
        SortedMap<PartitionKey, List<Event>> partitions = new TreeMap<>();
        for (Event event : events) {
            partitions.computeIfAbsent(PartitionKey.of(event, sourceKind), key -> new ArrayList<>()).add(event);
        }
        partitions.values().forEach(OutputAssembler::sortRows);
        return partitions;
    }

    public static void sortRows(List<Event> rows) {
        rows.sort(Event.TIMELINE_ORDER);
    }
}
