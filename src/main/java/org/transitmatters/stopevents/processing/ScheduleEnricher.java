package org.transitmatters.stopevents.processing;

import org.transitmatters.stopevents.application.FaultKind;
import org.transitmatters.stopevents.application.ProcessingStats;
import org.transitmatters.stopevents.models.Event;
import org.transitmatters.stopevents.schedule.ScheduleIndex;
import org.transitmatters.stopevents.schedule.ScheduleReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Attaches scheduled travel time and scheduled headways to observed events.
 */
public class ScheduleEnricher {
    private static final Logger log = LoggerFactory.getLogger(ScheduleEnricher.class);

    private final Function<LocalDate, ScheduleIndex> schedules;
    private final ProcessingStats stats;

    public ScheduleEnricher(Function<LocalDate, ScheduleIndex> schedules, ProcessingStats stats) {
        this.schedules = schedules;
        this.stats = stats;
    }

    /**
     * Enriches every event with the schedule of its own service date.
     */
    public List<Event> enrich(List<Event> events) {
        List<Event> enriched = new ArrayList<>(events.size());
        for (Event event : events) {
            enriched.add(enrich(event, schedules.apply(event.getServiceDate())));
        }
        return enriched;
    }

    public List<Event> enrich(List<Event> events, ScheduleIndex schedule) {
        List<Event> enriched = new ArrayList<>(events.size());
        for (Event event : events) {
            enriched.add(enrich(event, schedule));
        }
        return enriched;
    }

    Event enrich(Event event, ScheduleIndex schedule) {
        Optional<ScheduleReference> maybeReference = schedule.getReference(
                event.getRouteId(), event.getTripId(), event.getStopId(), event.getStopSequence());
        if (!maybeReference.isPresent()) {
            // Added and unscheduled trips never match, so this is routine
            log.trace("No scheduled stop time for {}", event);
            stats.increment(FaultKind.SCHEDULE_LOOKUP_MISS);
            return event.toBuilder()
                    .setScheduledTravelTime(null)
                    .setScheduledHeadway(null)
                    .setScheduledHeadwayBranch(null)
                    .build();
        }

        final ScheduleReference reference = maybeReference.get();
        Long branchHeadway = null;
        if (reference.getBranchId().isPresent()) {
            branchHeadway = schedule.getScheduledBranchHeadway(reference, event.getEventType()).orElse(null);
        }
        return event.toBuilder()
                .setScheduledTravelTime(reference.getScheduledTravelTime().orElse(null))
                .setScheduledHeadway(schedule.getHeadwayTable().get(reference).orElse(null))
                .setScheduledHeadwayBranch(branchHeadway)
                .build();
    }
}
