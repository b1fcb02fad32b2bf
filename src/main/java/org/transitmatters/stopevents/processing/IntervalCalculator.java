package org.transitmatters.stopevents.processing;

import com.google.common.collect.ImmutableList;
import org.transitmatters.stopevents.application.FaultKind;
import org.transitmatters.stopevents.application.ProcessingStats;
import org.transitmatters.stopevents.models.Event;
import org.transitmatters.stopevents.models.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes observed travel, dwell and headway intervals.
 * <p>
 * Travel and dwell time are per trip, headways compare consecutive trips at the same stop.
 * Negative intervals come from out of order timestamps, they are dropped and counted.
 */
public class IntervalCalculator {
    private static final Logger log = LoggerFactory.getLogger(IntervalCalculator.class);

    private final ProcessingStats stats;

    public IntervalCalculator(ProcessingStats stats) {
        this.stats = stats;
    }

    /**
     * @return the events in the same order, with intervals filled in
     */
    public List<Event> computeIntervals(List<Event> events) {
        final int n = events.size();
        Long[] travel = new Long[n];
        Long[] dwell = new Long[n];
        Long[] headway = new Long[n];
        Long[] branchHeadway = new Long[n];

        computeTripIntervals(events, travel, dwell);
        computeHeadways(events, false, headway);
        computeHeadways(events, true, branchHeadway);

        List<Event> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            result.add(events.get(i).toBuilder()
                    .setTravelTimeSeconds(travel[i])
                    .setDwellTimeSeconds(dwell[i])
                    .setHeadwaySeconds(headway[i])
                    .setHeadwayBranchSeconds(branchHeadway[i])
                    .build());
        }
        return result;
    }

    private void computeTripIntervals(List<Event> events, Long[] travel, Long[] dwell) {
        // service date + trip -> stop sequence -> visit
        Map<List<Object>, TreeMap<Integer, StopVisit>> trips = new HashMap<>();
        for (int i = 0; i < events.size(); i++) {
            Event event = events.get(i);
            List<Object> tripKey = ImmutableList.of(event.getServiceDate(), event.getTripId());
            StopVisit visit = trips.computeIfAbsent(tripKey, k -> new TreeMap<>())
                    .computeIfAbsent(event.getStopSequence(), k -> new StopVisit());
            if (event.getEventType() == EventType.ARR) {
                visit.arrival = i;
            } else {
                visit.departure = i;
            }
        }

        for (TreeMap<Integer, StopVisit> visits : trips.values()) {
            StopVisit previous = null;
            for (StopVisit visit : visits.values()) {
                if (visit.arrival != null && visit.departure != null) {
                    Long value = checked(seconds(events, visit.arrival, visit.departure), "dwell");
                    dwell[visit.arrival] = value;
                    dwell[visit.departure] = value;
                }
                if (previous != null) {
                    int from = previous.departure != null ? previous.departure : previous.arrival;
                    int to = visit.arrival != null ? visit.arrival : visit.departure;
                    Long value = checked(seconds(events, from, to), "travel");
                    if (visit.arrival != null) {
                        travel[visit.arrival] = value;
                    }
                    if (visit.departure != null) {
                        travel[visit.departure] = value;
                    }
                }
                previous = visit;
            }
        }
    }

    private void computeHeadways(List<Event> events, boolean byBranch, Long[] headway) {
        // service date + trunk or branch + direction + stop + event type -> event indexes
        Map<List<Object>, List<Integer>> stops = new HashMap<>();
        for (int i = 0; i < events.size(); i++) {
            Event event = events.get(i);
            String route;
            if (byBranch) {
                if (!event.getBranchRouteId().isPresent()) {
                    continue;
                }
                route = event.getBranchRouteId().get();
            } else {
                route = event.getTrunkRouteId();
            }
            if (route == null) {
                continue;
            }
            List<Object> key = ImmutableList.of(event.getServiceDate(), route, event.getDirectionId(),
                    event.getStopId(), event.getEventType());
            stops.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }

        Comparator<Integer> byTime = Comparator.comparing((Integer i) -> events.get(i).getEventTime().toInstant())
                .thenComparing(i -> events.get(i).getTripId());
        for (List<Integer> indexes : stops.values()) {
            indexes.sort(byTime);
            for (int k = 1; k < indexes.size(); k++) {
                headway[indexes.get(k)] = checked(seconds(events, indexes.get(k - 1), indexes.get(k)), byBranch ? "branch-headway" : "headway");
            }
        }
    }

    private static long seconds(List<Event> events, int from, int to) {
        return Duration.between(events.get(from).getEventTime(), events.get(to).getEventTime()).getSeconds();
    }

    private Long checked(long seconds, String interval) {
        if (seconds < 0) {
            log.debug("Negative {} of {} seconds", interval, seconds);
            stats.increment(FaultKind.ORDERING_ANOMALY, interval);
            return null;
        }
        return seconds;
    }

    private static final class StopVisit {
        Integer arrival;
        Integer departure;
    }
}
