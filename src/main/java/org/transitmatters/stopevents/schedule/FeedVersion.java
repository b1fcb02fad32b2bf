package org.transitmatters.stopevents.schedule;

import com.google.common.collect.ImmutableList;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Objects;

/**
 * One schedule snapshot, valid from {@code activeDate} to {@code endDate} inclusive.
 */
public final class FeedVersion {
    private final String feedId;
    private final LocalDate activeDate;
    private final LocalDate endDate;
    private final ImmutableList<ScheduledRoute> routes;
    private final ImmutableList<ScheduledTrip> trips;
    private final ImmutableList<ScheduledStopTime> stopTimes;

    public FeedVersion(String feedId, LocalDate activeDate, LocalDate endDate,
                       Collection<ScheduledRoute> routes,
                       Collection<ScheduledTrip> trips,
                       Collection<ScheduledStopTime> stopTimes) {
        this.feedId = Objects.requireNonNull(feedId);
        this.activeDate = Objects.requireNonNull(activeDate);
        this.endDate = Objects.requireNonNull(endDate);
        if (endDate.isBefore(activeDate)) {
            throw new IllegalArgumentException("Feed " + feedId + " ends before it starts");
        }
        this.routes = ImmutableList.copyOf(routes);
        this.trips = ImmutableList.copyOf(trips);
        this.stopTimes = ImmutableList.copyOf(stopTimes);
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

    public ImmutableList<ScheduledRoute> getRoutes() {
        return routes;
    }

    public ImmutableList<ScheduledTrip> getTrips() {
        return trips;
    }

    public ImmutableList<ScheduledStopTime> getStopTimes() {
        return stopTimes;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(activeDate) && !date.isAfter(endDate);
    }

    public long getValidityDays() {
        return ChronoUnit.DAYS.between(activeDate, endDate);
    }

    @Override
    public String toString() {
        return feedId + " [" + activeDate + ", " + endDate + "]";
    }
}
