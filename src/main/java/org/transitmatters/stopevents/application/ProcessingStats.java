package org.transitmatters.stopevents.application;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

/**
 * Counters for one pipeline run. Safe to update from the worker threads.
 */
public class ProcessingStats {
    private volatile long startTime = System.nanoTime();

    private final AtomicLong recordsRead = new AtomicLong();
    private final AtomicLong eventsWritten = new AtomicLong();
    private final AtomicLong partitionsWritten = new AtomicLong();

    private final Map<FaultKind, LongAdder> faults = new EnumMap<>(FaultKind.class);
    private final Map<String, LongAdder> faultReasons = new ConcurrentHashMap<>();

    public ProcessingStats() {
        for (FaultKind kind : FaultKind.values()) {
            faults.put(kind, new LongAdder());
        }
    }

    public long getRecordsRead() {
        return recordsRead.get();
    }

    public void addRecordsRead(long count) {
        recordsRead.addAndGet(count);
    }

    public long getEventsWritten() {
        return eventsWritten.get();
    }

    public void addEventsWritten(long count) {
        eventsWritten.addAndGet(count);
    }

    public long getPartitionsWritten() {
        return partitionsWritten.get();
    }

    public void incrementPartitionsWritten() {
        partitionsWritten.incrementAndGet();
    }

    public void increment(FaultKind kind) {
        increment(kind, null);
    }

    /**
     * @param reason Short machine-friendly tag for what caused the fault, e.g. the validator name
     */
    public void increment(FaultKind kind, String reason) {
        faults.get(kind).increment();
        if (reason != null) {
            faultReasons.computeIfAbsent(kind.name() + "/" + reason, key -> new LongAdder()).increment();
        }
    }

    public long getCount(FaultKind kind) {
        return faults.get(kind).sum();
    }

    public Map<FaultKind, Long> getFaultCounts() {
        Map<FaultKind, Long> counts = new EnumMap<>(FaultKind.class);
        faults.forEach((kind, adder) -> counts.put(kind, adder.sum()));
        return ImmutableMap.copyOf(counts);
    }

    public Map<String, Long> getFaultReasons() {
        Map<String, Long> reasons = new TreeMap<>();
        faultReasons.forEach((reason, adder) -> reasons.put(reason, adder.sum()));
        return ImmutableMap.copyOf(reasons);
    }

    public long getDurationSecs() {
        return (System.nanoTime() - startTime) / 1_000_000_000;
    }

    public void reset() {
        startTime = System.nanoTime();

        recordsRead.set(0);
        eventsWritten.set(0);
        partitionsWritten.set(0);

        faults.values().forEach(LongAdder::reset);
        faultReasons.clear();
    }

    public void logAndReset(Logger logger) {
        logger.info(toString());
        reset();
    }

    @Override
    public String toString() {
        final String faultsText = getFaultCounts().entrySet().stream()
                .filter(entry -> entry.getValue() > 0)
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining(", "));
        final String reasonsText = getFaultReasons().entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining(", "));

        return "Processing stats:\n" +
                "\tStarted: " + getDurationSecs() + " seconds ago\n" +
                "\tRecords read: " + recordsRead + "\n" +
                "\tEvents written: " + eventsWritten + "\n" +
                "\tPartitions written: " + partitionsWritten + "\n" +
                "\tFaults: " + faultsText + " (" + reasonsText + ")";
    }
}
