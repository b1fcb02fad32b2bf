package org.transitmatters.stopevents.schedule;

import java.util.Objects;

/**
 * One row of stop_times. Times are seconds after midnight of the service day and can exceed 24 hours.
 */
public final class ScheduledStopTime {
    private final String tripId;
    private final String stopId;
    private final int stopSequence;
    private final int arrivalSeconds;
    private final int departureSeconds;

    public ScheduledStopTime(String tripId, String stopId, int stopSequence, int arrivalSeconds, int departureSeconds) {
        this.tripId = Objects.requireNonNull(tripId);
        this.stopId = Objects.requireNonNull(stopId);
        this.stopSequence = stopSequence;
        this.arrivalSeconds = arrivalSeconds;
        this.departureSeconds = departureSeconds;
    }

    public String getTripId() {
        return tripId;
    }

    public String getStopId() {
        return stopId;
    }

    public int getStopSequence() {
        return stopSequence;
    }

    public int getArrivalSeconds() {
        return arrivalSeconds;
    }

    public int getDepartureSeconds() {
        return departureSeconds;
    }
}
