package org.transitmatters.stopevents.schedule;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Ordering;
import com.google.common.collect.Table;
import org.transitmatters.stopevents.models.EventType;
import org.transitmatters.stopevents.processing.ProcessorUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Immutable view of the schedule in effect on one service date.
 * <p>
 * Built once per date from the tightest feed version containing the date. Safe to share between threads.
 */
public class ScheduleIndex {
    private static final Logger log = LoggerFactory.getLogger(ScheduleIndex.class);

    /**
     * Shortest validity range first, then the later start, then the greater feed id.
     */
    static final Comparator<FeedVersion> TIGHTEST_FIRST = (a, b) -> ComparisonChain.start()
            .compare(a.getValidityDays(), b.getValidityDays())
            .compare(b.getActiveDate(), a.getActiveDate())
            .compare(b.getFeedId(), a.getFeedId())
            .result();

    private final LocalDate serviceDate;
    private final FeedVersion feed;
    private final ImmutableMap<String, ScheduledTrip> trips;
    private final ImmutableMap<String, ImmutableList<ScheduledStopTime>> stopTimesByTrip;
    private final ScheduledHeadwayTable headwayTable;
    // trip id, stop sequence -> unsmoothed headway to the previous trip of the same branch
    private final ImmutableTable<String, Integer, Long> branchArrivalHeadways;
    private final ImmutableTable<String, Integer, Long> branchDepartureHeadways;

    private ScheduleIndex(LocalDate serviceDate, FeedVersion feed) {
        this.serviceDate = serviceDate;
        this.feed = feed;

        if (feed == null) {
            this.trips = ImmutableMap.of();
            this.stopTimesByTrip = ImmutableMap.of();
            this.headwayTable = ScheduledHeadwayTable.empty();
            this.branchArrivalHeadways = ImmutableTable.of();
            this.branchDepartureHeadways = ImmutableTable.of();
            return;
        }

        Map<String, ScheduledRoute> routes = new HashMap<>();
        for (ScheduledRoute route : feed.getRoutes()) {
            routes.put(route.getRouteId(), route);
        }
        Map<String, ScheduledTrip> tripsById = new HashMap<>();
        for (ScheduledTrip trip : feed.getTrips()) {
            tripsById.put(trip.getTripId(), withBranchIdentity(trip, routes.get(trip.getRouteId())));
        }
        this.trips = ImmutableMap.copyOf(tripsById);

        Map<String, List<ScheduledStopTime>> grouped = new HashMap<>();
        for (ScheduledStopTime stopTime : feed.getStopTimes()) {
            if (trips.containsKey(stopTime.getTripId())) {
                grouped.computeIfAbsent(stopTime.getTripId(), k -> new ArrayList<>()).add(stopTime);
            }
        }
        ImmutableMap.Builder<String, ImmutableList<ScheduledStopTime>> byTrip = ImmutableMap.builder();
        grouped.forEach((tripId, times) -> byTrip.put(tripId,
                ImmutableList.sortedCopyOf(Comparator.comparingInt(ScheduledStopTime::getStopSequence), times)));
        this.stopTimesByTrip = byTrip.build();

        this.headwayTable = ScheduledHeadwayTable.build(trips, feed.getStopTimes());
        this.branchArrivalHeadways = buildBranchHeadways(ScheduledStopTime::getArrivalSeconds);
        this.branchDepartureHeadways = buildBranchHeadways(ScheduledStopTime::getDepartureSeconds);
    }

    public static ScheduleIndex empty(LocalDate serviceDate) {
        return new ScheduleIndex(serviceDate, null);
    }

    /**
     * Builds the index from the tightest of the given feed versions that contains the date.
     */
    public static ScheduleIndex build(LocalDate serviceDate, List<FeedVersion> feeds) {
        Optional<FeedVersion> feed = selectFeed(serviceDate, feeds);
        if (!feed.isPresent()) {
            log.info("No schedule feed covers {}", serviceDate);
            return empty(serviceDate);
        }
        log.info("Using schedule feed {} for {}", feed.get(), serviceDate);
        return new ScheduleIndex(serviceDate, feed.get());
    }

    static Optional<FeedVersion> selectFeed(LocalDate serviceDate, List<FeedVersion> feeds) {
        return feeds.stream()
                .filter(feed -> feed.contains(serviceDate))
                .min(TIGHTEST_FIRST);
    }

    /**
     * Trips carry their own trunk and branch when the feed has them, otherwise the route's trunk is used,
     * and otherwise the branch is derived from the route id.
     */
    private static ScheduledTrip withBranchIdentity(ScheduledTrip trip, ScheduledRoute route) {
        if (trip.getBranchRouteId().isPresent()) {
            return trip;
        }
        Optional<String> routeTrunk = route != null ? route.getTrunkRouteId() : Optional.empty();
        if (routeTrunk.isPresent() && !routeTrunk.get().equals(trip.getRouteId())) {
            return new ScheduledTrip(trip.getTripId(), trip.getRouteId(), trip.getDirectionId(),
                    routeTrunk.get(), trip.getRouteId());
        }
        if (!ProcessorUtils.isBranchRoute(trip.getRouteId())) {
            return trip;
        }
        return new ScheduledTrip(trip.getTripId(), trip.getRouteId(), trip.getDirectionId(),
                ProcessorUtils.trunkRouteId(trip.getRouteId()),
                ProcessorUtils.branchRouteId(trip.getRouteId()).orElse(null));
    }

    private ImmutableTable<String, Integer, Long> buildBranchHeadways(ToIntFunction<ScheduledStopTime> time) {
        Map<List<Object>, List<ScheduledStopTime>> byBranchStop = new HashMap<>();
        stopTimesByTrip.forEach((tripId, stopTimes) -> {
            ScheduledTrip trip = trips.get(tripId);
            trip.getBranchRouteId().ifPresent(branch -> {
                for (ScheduledStopTime stopTime : stopTimes) {
                    List<Object> key = ImmutableList.of(branch, trip.getDirectionId(), stopTime.getStopId());
                    byBranchStop.computeIfAbsent(key, k -> new ArrayList<>()).add(stopTime);
                }
            });
        });

        Table<String, Integer, Long> headways = HashBasedTable.create();
        Ordering<ScheduledStopTime> order = Ordering.from(Comparator.comparingInt(time)
                .thenComparing(ScheduledStopTime::getTripId));
        for (List<ScheduledStopTime> times : byBranchStop.values()) {
            List<ScheduledStopTime> sorted = order.sortedCopy(times);
            for (int i = 1; i < sorted.size(); i++) {
                ScheduledStopTime current = sorted.get(i);
                long headway = time.applyAsInt(current) - time.applyAsInt(sorted.get(i - 1));
                headways.put(current.getTripId(), current.getStopSequence(), headway);
            }
        }
        return ImmutableTable.copyOf(headways);
    }

    public LocalDate getServiceDate() {
        return serviceDate;
    }

    public Optional<FeedVersion> getFeed() {
        return Optional.ofNullable(feed);
    }

    public boolean isEmpty() {
        return feed == null;
    }

    public Optional<ScheduledTrip> getTrip(String tripId) {
        return tripId == null ? Optional.empty() : Optional.ofNullable(trips.get(tripId));
    }

    /**
     * @return stop times of the trip ordered by stop sequence, empty if the trip is not scheduled
     */
    public List<ScheduledStopTime> getStopTimes(String tripId) {
        if (tripId == null) {
            return ImmutableList.of();
        }
        return stopTimesByTrip.getOrDefault(tripId, ImmutableList.of());
    }

    /**
     * Finds the scheduled stop time of a trip at a stop. If the trip serves the stop more than once,
     * the visit with the given stop sequence is preferred, otherwise the first visit.
     * <p>
     * Trip ids are only unique per feed, so a trip scheduled on another route than the one observed does not match.
     */
    public Optional<ScheduleReference> getReference(String routeId, String tripId, String stopId, Integer stopSequence) {
        List<ScheduledStopTime> stopTimes = getStopTimes(tripId);
        if (stopTimes.isEmpty() || stopId == null) {
            return Optional.empty();
        }
        ScheduledTrip trip = trips.get(tripId);
        if (trip == null || (routeId != null && !routeId.equals(trip.getRouteId()))) {
            return Optional.empty();
        }

        int match = -1;
        for (int i = 0; i < stopTimes.size(); i++) {
            ScheduledStopTime candidate = stopTimes.get(i);
            if (!candidate.getStopId().equals(stopId)) {
                continue;
            }
            if (match < 0) {
                match = i;
            }
            if (stopSequence != null && candidate.getStopSequence() == stopSequence) {
                match = i;
                break;
            }
        }
        if (match < 0) {
            return Optional.empty();
        }

        ScheduledStopTime first = stopTimes.get(0);
        Integer previousDeparture = match > 0 ? stopTimes.get(match - 1).getDepartureSeconds() : null;
        return Optional.of(new ScheduleReference(feed, trip, stopTimes.get(match),
                first.getDepartureSeconds(), previousDeparture));
    }

    public ScheduledHeadwayTable getHeadwayTable() {
        return headwayTable;
    }

    /**
     * @return scheduled headway to the previous trip of the same branch at this stop, without smoothing
     */
    public Optional<Long> getScheduledBranchHeadway(ScheduleReference reference, EventType eventType) {
        ImmutableTable<String, Integer, Long> table = eventType == EventType.DEP ? branchDepartureHeadways : branchArrivalHeadways;
        return Optional.ofNullable(table.get(reference.getTrip().getTripId(), reference.getStopTime().getStopSequence()));
    }
}
