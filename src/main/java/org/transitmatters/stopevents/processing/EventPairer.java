package org.transitmatters.stopevents.processing;

import com.google.common.base.Strings;
import org.transitmatters.stopevents.application.FaultKind;
import org.transitmatters.stopevents.application.ProcessingStats;
import org.transitmatters.stopevents.models.Event;
import org.transitmatters.stopevents.models.EventKey;
import org.transitmatters.stopevents.models.EventType;
import org.transitmatters.stopevents.models.PointKind;
import org.transitmatters.stopevents.models.RawMovementRecord;
import org.transitmatters.stopevents.models.SourceKind;
import org.transitmatters.stopevents.schedule.ScheduleIndex;
import org.transitmatters.stopevents.schedule.ScheduledStopTime;
import org.transitmatters.stopevents.schedule.ScheduledTrip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Reconstructs one arrival and one departure event per stop visit from normalized records.
 */
public class EventPairer {
    private static final Logger log = LoggerFactory.getLogger(EventPairer.class);

    private final Function<LocalDate, ScheduleIndex> schedules;
    private final ProcessingStats stats;

    /**
     * @param schedules schedule of a service date, used for stop sequences, the stop order of trips and branch identity
     */
    public EventPairer(Function<LocalDate, ScheduleIndex> schedules, ProcessingStats stats) {
        this.schedules = schedules;
        this.stats = stats;
    }

    public List<Event> pair(List<RawMovementRecord> records) {
        Map<TripKey, List<Visit>> trips = new LinkedHashMap<>();
        for (RawMovementRecord record : records) {
            try {
                Visit visit = resolve(record);
                trips.computeIfAbsent(new TripKey(record.getServiceDate(), record.getTripId()), k -> new ArrayList<>()).add(visit);
            } catch (OrphanEventException e) {
                log.debug("Orphan record excluded: {}", e.getMessage());
                stats.increment(FaultKind.ORPHAN_EVENT, record.getSourceKind().name());
            }
        }

        List<Event> candidates = new ArrayList<>();
        trips.forEach((trip, visits) -> candidates.addAll(pairTrip(trip, visits)));

        candidates.sort(Event.TIMELINE_ORDER);
        Map<EventKey, Event> unique = new LinkedHashMap<>();
        for (Event event : candidates) {
            Event existing = unique.putIfAbsent(event.getKey(), event);
            if (existing != null) {
                log.debug("Dropping duplicate {}, already have {}", event, existing);
                stats.increment(FaultKind.DUPLICATE_EVENT, event.getEventType().name());
            }
        }
        log.info("Paired {} records into {} events for {} trips", records.size(), unique.size(), trips.size());
        return new ArrayList<>(unique.values());
    }

    /**
     * Attaches the stop sequence, taken from the schedule when the source lacks it.
     */
    Visit resolve(RawMovementRecord record) throws OrphanEventException {
        if (record.getTripId() == null || record.getTripId().isEmpty()) {
            throw new OrphanEventException("No trip id", record);
        }
        Optional<Integer> stopSequence = record.getStopSequence();
        if (Strings.isNullOrEmpty(record.getStopId())) {
            // A real-time departure names its stop only through the visit before it
            if (isRealtimeDeparture(record) && stopSequence.isPresent()) {
                return new Visit(record, stopSequence.get());
            }
            throw new OrphanEventException("No stop id", record);
        }
        if (stopSequence.isPresent()) {
            return new Visit(record, stopSequence.get());
        }

        List<ScheduledStopTime> matches = new ArrayList<>();
        for (ScheduledStopTime stopTime : schedules.apply(record.getServiceDate()).getStopTimes(record.getTripId())) {
            if (stopTime.getStopId().equals(record.getStopId())) {
                matches.add(stopTime);
            }
        }
        if (matches.size() != 1) {
            throw new OrphanEventException("Unresolvable stop sequence", record);
        }
        return new Visit(record, matches.get(0).getStopSequence());
    }

    private List<Event> pairTrip(TripKey trip, List<Visit> visits) {
        final ScheduleIndex schedule = schedules.apply(trip.serviceDate);
        final BranchIdentity branch = BranchIdentity.resolve(schedule.getTrip(trip.tripId), visits.get(0).record);

        // Order by position in the trip. Within a stop arrivals are handled first.
        visits.sort(Comparator.comparingInt((Visit v) -> v.stopSequence)
                .thenComparing(v -> v.record.getPointKind() == PointKind.DEPARTURE)
                .thenComparing(v -> v.record.getTimestamp().toInstant()));

        List<Event> events = new ArrayList<>();
        if (visits.get(0).record.getSourceKind() == SourceKind.REALTIME_FEED) {
            reassignDepartures(visits, scheduledStops(schedule, trip.tripId), branch, events);
        } else {
            for (Visit visit : visits) {
                expand(visit, visit.stopSequence, visit.record.getStopId(), branch, events);
            }
        }
        return events;
    }

    static boolean isRealtimeDeparture(RawMovementRecord record) {
        return record.getSourceKind() == SourceKind.REALTIME_FEED && record.getPointKind() == PointKind.DEPARTURE;
    }

    private static TreeMap<Integer, String> scheduledStops(ScheduleIndex schedule, String tripId) {
        TreeMap<Integer, String> order = new TreeMap<>();
        for (ScheduledStopTime stopTime : schedule.getStopTimes(tripId)) {
            order.putIfAbsent(stopTime.getStopSequence(), stopTime.getStopId());
        }
        return order;
    }

    /**
     * Stops each vehicle of the trip was observed arriving at, by stop sequence.
     */
    private static Map<String, TreeMap<Integer, String>> observedArrivals(List<Visit> visits) {
        Map<String, TreeMap<Integer, String>> arrivals = new HashMap<>();
        for (Visit visit : visits) {
            if (visit.record.getPointKind() == PointKind.ARRIVAL) {
                arrivals.computeIfAbsent(vehicleOf(visit), k -> new TreeMap<>())
                        .putIfAbsent(visit.stopSequence, visit.record.getStopId());
            }
        }
        return arrivals;
    }

    private static String vehicleOf(Visit visit) {
        return Objects.toString(visit.record.getVehicleId(), "");
    }

    /**
     * A real-time departure is reported with the stop the vehicle is heading to. Walks the trip in stop order
     * and moves each departure to the last stop the same vehicle was seen arriving at before it. Without such
     * an arrival the previous stop of the schedule is used. A departure with neither stays where it was
     * reported, or is dropped when it carries no stop of its own.
     */
    private void reassignDepartures(List<Visit> visits, TreeMap<Integer, String> scheduledStops, BranchIdentity branch, List<Event> events) {
        final Map<String, TreeMap<Integer, String>> arrivals = observedArrivals(visits);
        for (Visit visit : visits) {
            if (visit.record.getPointKind() != PointKind.DEPARTURE) {
                expand(visit, visit.stopSequence, visit.record.getStopId(), branch, events);
                continue;
            }
            Map.Entry<Integer, String> previousStop = null;
            TreeMap<Integer, String> vehicleArrivals = arrivals.get(vehicleOf(visit));
            if (vehicleArrivals != null) {
                previousStop = vehicleArrivals.lowerEntry(visit.stopSequence);
            }
            if (previousStop == null) {
                previousStop = scheduledStops.lowerEntry(visit.stopSequence);
            }

            if (previousStop != null) {
                expand(visit, previousStop.getKey(), previousStop.getValue(), branch, events);
            } else if (!Strings.isNullOrEmpty(visit.record.getStopId())) {
                expand(visit, visit.stopSequence, visit.record.getStopId(), branch, events);
            } else {
                log.debug("No stop before departure {}", visit.record);
                stats.increment(FaultKind.INVALID_RECORD, "departure-without-stop");
            }
        }
    }

    private static void expand(Visit visit, int stopSequence, String stopId, BranchIdentity branch, List<Event> events) {
        final RawMovementRecord record = visit.record;
        Event.Builder builder = Event.newBuilder()
                .setServiceDate(record.getServiceDate())
                .setRouteId(record.getRouteId())
                .setTripId(record.getTripId())
                .setDirectionId(record.getDirectionId())
                .setStopId(stopId)
                .setStopSequence(stopSequence)
                .setVehicleId(record.getVehicleId())
                .setVehicleLabel(record.getVehicleLabel())
                .setEventTime(record.getTimestamp())
                .setVehicleConsist(record.getVehicleConsist().orElse(null))
                .setTrunkRouteId(branch.trunkRouteId)
                .setBranchRouteId(branch.branchRouteId);

        switch (record.getPointKind()) {
            case ARRIVAL:
            case ENDPOINT:
                events.add(builder.setEventType(EventType.ARR).build());
                break;
            case DEPARTURE:
            case STARTPOINT:
                events.add(builder.setEventType(EventType.DEP).build());
                break;
            case MIDPOINT:
                events.add(builder.setEventType(EventType.ARR).build());
                events.add(builder.setEventType(EventType.DEP).build());
                break;
            default:
                throw new IllegalStateException("Unhandled point kind " + record.getPointKind());
        }
    }

    static final class Visit {
        final RawMovementRecord record;
        final int stopSequence;

        Visit(RawMovementRecord record, int stopSequence) {
            this.record = record;
            this.stopSequence = stopSequence;
        }
    }

    static final class BranchIdentity {
        final String trunkRouteId;
        final String branchRouteId;

        private BranchIdentity(String trunkRouteId, String branchRouteId) {
            this.trunkRouteId = trunkRouteId;
            this.branchRouteId = branchRouteId;
        }

        /**
         * Schedule first, then the source's own columns, then the route id.
         */
        static BranchIdentity resolve(Optional<ScheduledTrip> scheduled, RawMovementRecord record) {
            if (scheduled.isPresent()) {
                ScheduledTrip trip = scheduled.get();
                return new BranchIdentity(trip.getTrunkRouteId(), trip.getBranchRouteId().orElse(null));
            }
            if (record.getTrunkRouteId().isPresent() || record.getBranchRouteId().isPresent()) {
                return new BranchIdentity(record.getTrunkRouteId().orElse(record.getRouteId()),
                        record.getBranchRouteId().orElse(null));
            }
            return new BranchIdentity(ProcessorUtils.trunkRouteId(record.getRouteId()),
                    ProcessorUtils.branchRouteId(record.getRouteId()).orElse(null));
        }
    }

    private static final class TripKey {
        final LocalDate serviceDate;
        final String tripId;

        TripKey(LocalDate serviceDate, String tripId) {
            this.serviceDate = serviceDate;
            this.tripId = tripId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            TripKey that = (TripKey) o;
            return serviceDate.equals(that.serviceDate) && tripId.equals(that.tripId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(serviceDate, tripId);
        }
    }
}
