package org.transitmatters.stopevents.processing;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.transitmatters.stopevents.MockDataFactory;
import org.transitmatters.stopevents.application.FaultKind;
import org.transitmatters.stopevents.application.ProcessingStats;
import org.transitmatters.stopevents.models.Event;
import org.transitmatters.stopevents.models.EventType;
import org.transitmatters.stopevents.schedule.ScheduleIndex;
import org.transitmatters.stopevents.schedule.ScheduledStopTime;
import org.transitmatters.stopevents.schedule.ScheduledTrip;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class ScheduleEnricherTest {

    private static ScheduleIndex redLineSchedule() {
        List<ScheduledStopTime> stopTimes = new ArrayList<>();
        stopTimes.addAll(MockDataFactory.mockStopTimes("T1", 36000, 300, "A", "B", "C"));
        stopTimes.addAll(MockDataFactory.mockStopTimes("T2", 36600, 300, "A", "B", "C"));
        return MockDataFactory.mockScheduleIndex(ImmutableList.of(
                new ScheduledTrip("T1", "Red", 0, null, null),
                new ScheduledTrip("T2", "Red", 0, null, null)), stopTimes);
    }

    @Test
    public void scheduledValuesAreAttached() {
        ProcessingStats stats = new ProcessingStats();
        ScheduleEnricher enricher = new ScheduleEnricher(date -> redLineSchedule(), stats);

        List<Event> enriched = enricher.enrich(ImmutableList.of(
                MockDataFactory.mockEvent("T2", "B", 2, EventType.ARR, "10:15:30")));

        Event event = enriched.get(0);
        assertEquals(Long.valueOf(300), event.getScheduledTravelTime().get());
        assertEquals(Long.valueOf(600), event.getScheduledHeadway().get());
        assertFalse(event.getScheduledHeadwayBranch().isPresent());
        assertEquals(0, stats.getCount(FaultKind.SCHEDULE_LOOKUP_MISS));
    }

    @Test
    public void firstStopHasNoScheduledTravelTime() {
        ScheduleEnricher enricher = new ScheduleEnricher(date -> redLineSchedule(), new ProcessingStats());

        Event event = enricher.enrich(ImmutableList.of(MockDataFactory.mockEvent("T1", "A", 1, EventType.DEP, "10:00:00")), redLineSchedule()).get(0);

        assertFalse(event.getScheduledTravelTime().isPresent());
    }

    @Test
    public void unscheduledTripIsCountedAndLeftEmpty() {
        ProcessingStats stats = new ProcessingStats();
        ScheduleEnricher enricher = new ScheduleEnricher(date -> redLineSchedule(), stats);
        Event added = MockDataFactory.mockEvent("Red", "ADDED-1581518546", "A", 1, EventType.ARR, "10:00:00")
                .setScheduledHeadway(600L)
                .build();

        Event event = enricher.enrich(ImmutableList.of(added)).get(0);

        assertFalse(event.getScheduledHeadway().isPresent());
        assertFalse(event.getScheduledTravelTime().isPresent());
        assertEquals(1, stats.getCount(FaultKind.SCHEDULE_LOOKUP_MISS));
    }

    @Test
    public void branchHeadwayIsUnsmoothed() {
        List<ScheduledStopTime> stopTimes = new ArrayList<>();
        stopTimes.add(new ScheduledStopTime("G1", "70196", 1, 36000, 36000));
        stopTimes.add(new ScheduledStopTime("G3", "70196", 1, 36240, 36240));
        stopTimes.add(new ScheduledStopTime("G2", "70196", 1, 36480, 36500));
        ScheduleIndex schedule = MockDataFactory.mockScheduleIndex(ImmutableList.of(
                new ScheduledTrip("G1", "Green-B", 0, null, null),
                new ScheduledTrip("G2", "Green-B", 0, null, null),
                new ScheduledTrip("G3", "Green-C", 0, null, null)), stopTimes);
        ScheduleEnricher enricher = new ScheduleEnricher(date -> schedule, new ProcessingStats());

        List<Event> enriched = enricher.enrich(ImmutableList.of(
                MockDataFactory.mockEvent("Green-B", "G2", "70196", 1, EventType.ARR, "10:08:00").build(),
                MockDataFactory.mockEvent("Green-B", "G2", "70196", 1, EventType.DEP, "10:08:20").build()));

        assertEquals(Long.valueOf(240), enriched.get(0).getScheduledHeadway().get());
        assertEquals(Long.valueOf(480), enriched.get(0).getScheduledHeadwayBranch().get());
        assertEquals(Long.valueOf(500), enriched.get(1).getScheduledHeadwayBranch().get());
    }
}
