package org.transitmatters.stopevents.schedule;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Scheduled values of one trip at one stop, from the feed version in effect on the service date.
 * Offsets are seconds from the trip's first scheduled departure.
 */
public final class ScheduleReference {
    private final String feedId;
    private final LocalDate activeDate;
    private final LocalDate endDate;
    private final ScheduledTrip trip;
    private final ScheduledStopTime stopTime;
    private final int tripStartSeconds;
    private final Integer previousDepartureSeconds;

    ScheduleReference(FeedVersion feed, ScheduledTrip trip, ScheduledStopTime stopTime,
                      int tripStartSeconds, Integer previousDepartureSeconds) {
        this.feedId = feed.getFeedId();
        this.activeDate = feed.getActiveDate();
        this.endDate = feed.getEndDate();
        this.trip = trip;
        this.stopTime = stopTime;
        this.tripStartSeconds = tripStartSeconds;
        this.previousDepartureSeconds = previousDepartureSeconds;
    }

    public String getFeedId() {
        return feedId;
    }

    public LocalDate getActiveDate() {
        return activeDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public ScheduledTrip getTrip() {
        return trip;
    }

    public ScheduledStopTime getStopTime() {
        return stopTime;
    }

    public Optional<String> getBranchId() {
        return trip.getBranchRouteId();
    }

    public long getScheduledArrivalOffset() {
        return stopTime.getArrivalSeconds() - tripStartSeconds;
    }

    public long getScheduledDepartureOffset() {
        return stopTime.getDepartureSeconds() - tripStartSeconds;
    }

    /**
     * @return scheduled time from departing the previous stop to arriving here, empty at the first stop
     */
    public Optional<Long> getScheduledTravelTime() {
        if (previousDepartureSeconds == null) {
            return Optional.empty();
        }
        return Optional.of((long) stopTime.getArrivalSeconds() - previousDepartureSeconds);
    }
}
