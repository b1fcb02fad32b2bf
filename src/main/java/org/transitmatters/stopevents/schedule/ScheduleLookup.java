package org.transitmatters.stopevents.schedule;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-only access to versioned schedule data.
 */
public interface ScheduleLookup {

    /**
     * @param serviceDate date to query
     * @return every feed version whose validity range contains the date, with the trips and stop times
     * that operate on that date. Empty if no feed applies.
     */
    List<FeedVersion> lookup(LocalDate serviceDate) throws IOException;
}
