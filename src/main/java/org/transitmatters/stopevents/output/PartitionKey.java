package org.transitmatters.stopevents.output;

import org.transitmatters.stopevents.models.Event;
import org.transitmatters.stopevents.models.SourceKind;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one output file. A re-run writes the same keys and replaces their files.
 */
public final class PartitionKey implements Comparable<PartitionKey> {
    private static final Comparator<PartitionKey> ORDER = Comparator.comparing(PartitionKey::getSourceKind)
            .thenComparing(PartitionKey::getPath);

    private final SourceKind sourceKind;
    private final String path;

    PartitionKey(SourceKind sourceKind, String path) {
        this.sourceKind = Objects.requireNonNull(sourceKind);
        this.path = Objects.requireNonNull(path);
    }

    public static PartitionKey of(Event event, SourceKind sourceKind) {
        final LocalDate date = event.getServiceDate();
        switch (sourceKind) {
            case REALTIME_FEED:
                return new PartitionKey(sourceKind, String.format("%s/Year=%d/Month=%d/Day=%d",
                        event.getStopId(), date.getYear(), date.getMonthValue(), date.getDayOfMonth()));
            case HISTORIC_RAIL:
                return new PartitionKey(sourceKind, String.format("%s/Year=%d/Month=%d",
                        event.getStopId(), date.getYear(), date.getMonthValue()));
            case HISTORIC_BUS:
                return new PartitionKey(sourceKind, String.format("%s-%d-%s/Year=%d/Month=%d",
                        event.getRouteId(), event.getDirectionId(), event.getStopId(), date.getYear(), date.getMonthValue()));
            case HISTORIC_FERRY:
                return new PartitionKey(sourceKind, String.format("%s|%d|%s/Year=%d/Month=%d",
                        event.getRouteId(), event.getDirectionId(), event.getStopId(), date.getYear(), date.getMonthValue()));
            default:
                throw new IllegalArgumentException("Unknown source kind " + sourceKind);
        }
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    /**
     * Partition path below the output prefix, e.g. {@code 70061/Year=2024/Month=2/Day=7}
     */
    public String getPath() {
        return path;
    }

    /**
     * Daily real-time output is plain CSV, monthly historic output is gzip compressed.
     */
    public boolean isCompressed() {
        return sourceKind != SourceKind.REALTIME_FEED;
    }

    public String getPrefix() {
        switch (sourceKind) {
            case REALTIME_FEED:
                return "Events-lamp/daily-data";
            case HISTORIC_RAIL:
                return "Events/monthly-data";
            case HISTORIC_BUS:
                return "Events/monthly-bus-data";
            case HISTORIC_FERRY:
                return "Events/monthly-ferry-data";
            default:
                throw new IllegalStateException("Unknown source kind " + sourceKind);
        }
    }

    public String getFileName() {
        return isCompressed() ? "events.csv.gz" : "events.csv";
    }

    /**
     * Full relative location of the partition file, e.g. {@code Events-lamp/daily-data/70061/Year=2024/Month=2/Day=7/events.csv}
     */
    public String getObjectKey() {
        return getPrefix() + "/" + path + "/" + getFileName();
    }

    @Override
    public int compareTo(PartitionKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PartitionKey that = (PartitionKey) o;
        return sourceKind == that.sourceKind && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceKind, path);
    }

    @Override
    public String toString() {
        return getObjectKey();
    }
}
