package org.transitmatters.stopevents.normalizer;

import org.junit.Test;
import org.transitmatters.stopevents.MockDataFactory;
import org.transitmatters.stopevents.application.FaultKind;
import org.transitmatters.stopevents.application.ProcessingStats;
import org.transitmatters.stopevents.models.PointKind;
import org.transitmatters.stopevents.models.RawMovementRecord;

import java.time.LocalDate;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class HistoricFerryNormalizerTest {
    static final String HEADER = "service_date,route_id,trip_id,travel_direction,departure_terminal,arrival_terminal,actual_departure,actual_arrival,vessel_time_slot";

    private final HistoricFerryNormalizer normalizer = new HistoricFerryNormalizer();

    @Test
    public void legYieldsDepartureAndArrival() throws Exception {
        SourceTable table = MockDataFactory.mockTable("ferry.csv", HEADER,
                "2024-02-07,F1,Boat-F1-0700-Hingham-Weekday,To Boston,Hingham,Rowes Wharf,2024-02-07 07:00:00,2024-02-07 07:35:00,Vessel 1");

        List<RawMovementRecord> records = normalizer.normalize(table, MockDataFactory.SERVICE_DATE, new ProcessingStats());

        assertEquals(2, records.size());
        RawMovementRecord departure = records.get(0);
        assertEquals(PointKind.DEPARTURE, departure.getPointKind());
        assertEquals("Boat-Hingham", departure.getStopId());
        assertEquals(Integer.valueOf(1), departure.getStopSequence().get());
        assertEquals("Boat-F1", departure.getRouteId());
        assertEquals(1, departure.getDirectionId());
        assertEquals(MockDataFactory.eastern("07:00:00"), departure.getTimestamp());

        RawMovementRecord arrival = records.get(1);
        assertEquals(PointKind.ARRIVAL, arrival.getPointKind());
        assertEquals("Boat-Rowes", arrival.getStopId());
        assertEquals(Integer.valueOf(2), arrival.getStopSequence().get());
        assertEquals(MockDataFactory.eastern("07:35:00"), arrival.getTimestamp());
        assertEquals("Boat-F1-0700-Hingham-Weekday", arrival.getTripId());
    }

    @Test
    public void missingTripIdIsReplacedWithStableId() throws Exception {
        SourceTable table = MockDataFactory.mockTable("ferry.csv", HEADER,
                "2024-02-07,F4,,From Boston,Long Wharf N,Navy Yard,2024-02-07T08:00:00-05:00,,Vessel 2");

        List<RawMovementRecord> first = normalizer.normalize(table, MockDataFactory.SERVICE_DATE, new ProcessingStats());
        List<RawMovementRecord> second = normalizer.normalize(table, MockDataFactory.SERVICE_DATE, new ProcessingStats());

        assertEquals(1, first.size());
        assertEquals(36, first.get(0).getTripId().length());
        assertEquals(first.get(0).getTripId(), second.get(0).getTripId());
        assertEquals(0, first.get(0).getDirectionId());
        assertEquals("Boat-Long", first.get(0).getStopId());
    }

    @Test
    public void syntheticIdsDifferPerLeg() {
        LocalDate date = MockDataFactory.SERVICE_DATE;
        assertNotEquals(
                HistoricFerryNormalizer.syntheticTripId(date, "F4", "Vessel 2", "2024-02-07 08:00:00", null),
                HistoricFerryNormalizer.syntheticTripId(date, "F4", "Vessel 2", "2024-02-07 08:30:00", null));
    }

    @Test
    public void unknownLabelsAreHandled() {
        assertEquals("F9", HistoricFerryNormalizer.mapRoute("F9"));
        assertEquals("Boat-EastBoston", HistoricFerryNormalizer.mapRoute("F3"));
        assertNull(HistoricFerryNormalizer.mapTerminal("Nantucket"));
    }

    @Test
    public void datesOutsideTheRangeAreFiltered() throws Exception {
        HistoricFerryNormalizer bounded = new HistoricFerryNormalizer(LocalDate.of(2024, 3, 1), null);
        SourceTable table = MockDataFactory.mockTable("ferry.csv", HEADER,
                "2024-02-07,F1,T1,To Boston,Hingham,Rowes Wharf,2024-02-07 07:00:00,2024-02-07 07:35:00,Vessel 1");
        ProcessingStats stats = new ProcessingStats();

        assertTrue(bounded.normalize(table, MockDataFactory.SERVICE_DATE, stats).isEmpty());
        assertEquals(1, stats.getCount(FaultKind.FILTERED_RECORD));
    }

    @Test
    public void legWithoutActualTimesIsInvalid() throws Exception {
        SourceTable table = MockDataFactory.mockTable("ferry.csv", HEADER,
                "2024-02-07,F1,T1,To Boston,Hingham,Rowes Wharf,,,Vessel 1");
        ProcessingStats stats = new ProcessingStats();

        assertTrue(normalizer.normalize(table, MockDataFactory.SERVICE_DATE, stats).isEmpty());
        assertEquals(1, stats.getCount(FaultKind.INVALID_RECORD));
    }
}
