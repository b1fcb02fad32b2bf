package org.transitmatters.stopevents.schedule;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Builds at most one {@link ScheduleIndex} per service date, even when several workers ask for it concurrently.
 */
public class ScheduleIndexCache {
    private static final Logger log = LoggerFactory.getLogger(ScheduleIndexCache.class);

    private final ScheduleLookup lookup;
    private final LoadingCache<LocalDate, ScheduleIndex> indexes;

    public ScheduleIndexCache(ScheduleLookup lookup, long maximumSize) {
        this.lookup = lookup;
        this.indexes = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build(this::load);
    }

    public ScheduleIndex get(LocalDate serviceDate) {
        return indexes.get(serviceDate);
    }

    private ScheduleIndex load(LocalDate serviceDate) {
        try {
            List<FeedVersion> feeds = lookup.lookup(serviceDate);
            return ScheduleIndex.build(serviceDate, feeds);
        } catch (IOException e) {
            // Enrichment is optional, events are still written without scheduled values
            log.error("Failed to load schedule for {}, scheduled values will be missing", serviceDate, e);
            return ScheduleIndex.empty(serviceDate);
        }
    }
}
