package org.transitmatters.stopevents.schedule;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.transitmatters.stopevents.MockDataFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class ScheduledHeadwayTableTest {

    @Test
    public void meanIsRoundedHalfUpToTenSeconds() {
        assertEquals(300, ScheduledHeadwayTable.roundedMean(604, 2));
        assertEquals(310, ScheduledHeadwayTable.roundedMean(610, 2));
        assertEquals(300, ScheduledHeadwayTable.roundedMean(896, 3));
        assertEquals(0, ScheduledHeadwayTable.roundedMean(0, 1));
    }

    @Test
    public void bucketsAreHalfHours() {
        assertEquals(0, ScheduledHeadwayTable.bucketOf(1799));
        assertEquals(1, ScheduledHeadwayTable.bucketOf(1800));
        // past midnight of the service day
        assertEquals(50, ScheduledHeadwayTable.bucketOf(25 * 3600));
    }

    @Test
    public void headwaysAreAveragedWithinTheWindow() {
        Map<String, ScheduledTrip> trips = ImmutableMap.of(
                "T1", new ScheduledTrip("T1", "Red", 0, null, null),
                "T2", new ScheduledTrip("T2", "Red", 0, null, null),
                "T3", new ScheduledTrip("T3", "Red", 0, null, null),
                "T4", new ScheduledTrip("T4", "Red", 1, null, null));
        List<ScheduledStopTime> stopTimes = new ArrayList<>();
        stopTimes.add(new ScheduledStopTime("T1", "A", 1, 36000, 36000));
        stopTimes.add(new ScheduledStopTime("T2", "A", 1, 36420, 36420));
        stopTimes.add(new ScheduledStopTime("T3", "A", 1, 36905, 36905));
        stopTimes.add(new ScheduledStopTime("T4", "A", 1, 36100, 36100));

        ScheduledHeadwayTable table = ScheduledHeadwayTable.build(trips, stopTimes);

        // (420 + 485) / 2 = 452.5
        assertEquals(Long.valueOf(450), table.get("Red", 0, "A", 36000).get());
        assertFalse(table.get("Red", 1, "A", 36000).isPresent());
        assertFalse(table.get("Red", 0, "A", 30000).isPresent());
    }

    @Test
    public void buildIsIndependentOfInputOrder() {
        Map<String, ScheduledTrip> trips = new HashMap<>();
        List<ScheduledStopTime> stopTimes = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            String tripId = "T" + i;
            trips.put(tripId, new ScheduledTrip(tripId, i % 2 == 0 ? "Green-B" : "Green-C", 0, "Green", null));
            stopTimes.addAll(MockDataFactory.mockStopTimes(tripId, 18000 + i * 317, 120, "A", "B", "C"));
        }

        ScheduledHeadwayTable first = ScheduledHeadwayTable.build(trips, stopTimes);
        Collections.shuffle(stopTimes, new Random(7));
        ScheduledHeadwayTable second = ScheduledHeadwayTable.build(trips, stopTimes);

        assertEquals(first.asMap(), second.asMap());
        for (Long headway : first.asMap().values()) {
            assertEquals(0, headway % 10);
        }
    }
}
