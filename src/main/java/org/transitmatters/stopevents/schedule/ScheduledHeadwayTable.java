package org.transitmatters.stopevents.schedule;

import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Smoothed scheduled headways: for every trunk, direction and stop, the mean scheduled headway of the trips
 * arriving within each 30 minute window of the service day, rounded to the nearest 10 seconds.
 */
public class ScheduledHeadwayTable {
    public static final int BUCKET_SECONDS = 30 * 60;

    private final ImmutableMap<BucketKey, Long> buckets;

    private ScheduledHeadwayTable(Map<BucketKey, Long> buckets) {
        this.buckets = ImmutableMap.copyOf(buckets);
    }

    public static ScheduledHeadwayTable empty() {
        return new ScheduledHeadwayTable(ImmutableMap.of());
    }

    /**
     * @param trips trips operating on the service date, by trip id
     * @param stopTimes stop times of those trips
     */
    public static ScheduledHeadwayTable build(Map<String, ScheduledTrip> trips, Collection<ScheduledStopTime> stopTimes) {
        Map<StopKey, List<ScheduledStopTime>> byStop = new HashMap<>();
        for (ScheduledStopTime stopTime : stopTimes) {
            ScheduledTrip trip = trips.get(stopTime.getTripId());
            if (trip == null) {
                continue;
            }
            StopKey key = new StopKey(trip.getTrunkRouteId(), trip.getDirectionId(), stopTime.getStopId());
            byStop.computeIfAbsent(key, k -> new ArrayList<>()).add(stopTime);
        }

        // TreeMap so that iteration order and thus the resulting map is independent of input order
        Map<BucketKey, long[]> sums = new TreeMap<>();
        byStop.forEach((stop, times) -> {
            times.sort(Comparator.comparingInt(ScheduledStopTime::getArrivalSeconds)
                    .thenComparing(ScheduledStopTime::getTripId));
            for (int i = 1; i < times.size(); i++) {
                int arrival = times.get(i).getArrivalSeconds();
                long headway = arrival - times.get(i - 1).getArrivalSeconds();
                BucketKey key = new BucketKey(stop.trunkRouteId, stop.directionId, stop.stopId, bucketOf(arrival));
                long[] sumAndCount = sums.computeIfAbsent(key, k -> new long[2]);
                sumAndCount[0] += headway;
                sumAndCount[1]++;
            }
        });

        Map<BucketKey, Long> buckets = new TreeMap<>();
        sums.forEach((key, sumAndCount) -> buckets.put(key, roundedMean(sumAndCount[0], sumAndCount[1])));
        return new ScheduledHeadwayTable(buckets);
    }

    public static int bucketOf(int secondsAfterMidnight) {
        return Math.floorDiv(secondsAfterMidnight, BUCKET_SECONDS);
    }

    /**
     * Mean rounded half up to a multiple of 10, computed without floating point.
     */
    static long roundedMean(long sum, long count) {
        return Math.floorDiv(2 * sum + 10 * count, 20 * count) * 10;
    }

    public Optional<Long> get(String trunkRouteId, int directionId, String stopId, int scheduledSeconds) {
        return Optional.ofNullable(buckets.get(new BucketKey(trunkRouteId, directionId, stopId, bucketOf(scheduledSeconds))));
    }

    /**
     * Buckets hold arrival headways, so arrivals and departures of a stop visit are both looked up
     * by the scheduled arrival.
     */
    public Optional<Long> get(ScheduleReference reference) {
        ScheduledTrip trip = reference.getTrip();
        return get(trip.getTrunkRouteId(), trip.getDirectionId(), reference.getStopTime().getStopId(),
                reference.getStopTime().getArrivalSeconds());
    }

    public ImmutableMap<BucketKey, Long> asMap() {
        return buckets;
    }

    public int size() {
        return buckets.size();
    }

    private static final class StopKey {
        final String trunkRouteId;
        final int directionId;
        final String stopId;

        StopKey(String trunkRouteId, int directionId, String stopId) {
            this.trunkRouteId = trunkRouteId;
            this.directionId = directionId;
            this.stopId = stopId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            StopKey that = (StopKey) o;
            return directionId == that.directionId &&
                    trunkRouteId.equals(that.trunkRouteId) &&
                    stopId.equals(that.stopId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(trunkRouteId, directionId, stopId);
        }
    }

    public static final class BucketKey implements Comparable<BucketKey> {
        private static final Comparator<BucketKey> ORDER = Comparator.comparing((BucketKey k) -> k.trunkRouteId)
                .thenComparingInt(k -> k.directionId)
                .thenComparing(k -> k.stopId)
                .thenComparingInt(k -> k.bucket);

        private final String trunkRouteId;
        private final int directionId;
        private final String stopId;
        private final int bucket;

        public BucketKey(String trunkRouteId, int directionId, String stopId, int bucket) {
            this.trunkRouteId = Objects.requireNonNull(trunkRouteId);
            this.directionId = directionId;
            this.stopId = Objects.requireNonNull(stopId);
            this.bucket = bucket;
        }

        public String getTrunkRouteId() {
            return trunkRouteId;
        }

        public int getDirectionId() {
            return directionId;
        }

        public String getStopId() {
            return stopId;
        }

        public int getBucket() {
            return bucket;
        }

        @Override
        public int compareTo(BucketKey other) {
            return ORDER.compare(this, other);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            BucketKey that = (BucketKey) o;
            return directionId == that.directionId &&
                    bucket == that.bucket &&
                    trunkRouteId.equals(that.trunkRouteId) &&
                    stopId.equals(that.stopId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(trunkRouteId, directionId, stopId, bucket);
        }

        @Override
        public String toString() {
            return trunkRouteId + "/" + directionId + "/" + stopId + "@" + bucket;
        }
    }
}
