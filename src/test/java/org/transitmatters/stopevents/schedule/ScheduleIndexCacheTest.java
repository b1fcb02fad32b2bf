package org.transitmatters.stopevents.schedule;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.transitmatters.stopevents.MockDataFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ScheduleIndexCacheTest {

    @Test
    public void indexIsBuiltOncePerDate() {
        AtomicInteger lookups = new AtomicInteger();
        ScheduleIndexCache cache = new ScheduleIndexCache(date -> {
            lookups.incrementAndGet();
            return ImmutableList.of(MockDataFactory.mockFeed("f", date, date,
                    ImmutableList.of(new ScheduledTrip("T1", "Red", 0, null, null)),
                    MockDataFactory.mockStopTimes("T1", 36000, 300, "A", "B")));
        }, 4);

        ScheduleIndex first = cache.get(MockDataFactory.SERVICE_DATE);
        ScheduleIndex second = cache.get(MockDataFactory.SERVICE_DATE);

        assertSame(first, second);
        assertEquals(1, lookups.get());
        assertFalse(first.isEmpty());
    }

    @Test
    public void failedLookupGivesEmptyIndex() {
        ScheduleIndexCache cache = new ScheduleIndexCache(date -> {
            throw new IOException("archive unavailable");
        }, 4);

        ScheduleIndex index = cache.get(MockDataFactory.SERVICE_DATE);

        assertTrue(index.isEmpty());
        assertEquals(MockDataFactory.SERVICE_DATE, index.getServiceDate());
    }
}
