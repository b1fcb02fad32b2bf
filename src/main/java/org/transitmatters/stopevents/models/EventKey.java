package org.transitmatters.stopevents.models;

import java.time.LocalDate;
import java.util.Objects;

public final class EventKey {
    private final LocalDate serviceDate;
    private final String tripId;
    private final String stopId;
    private final EventType eventType;

    public EventKey(LocalDate serviceDate, String tripId, String stopId, EventType eventType) {
        this.serviceDate = serviceDate;
        this.tripId = tripId;
        this.stopId = stopId;
        this.eventType = eventType;
    }

    public LocalDate getServiceDate() {
        return serviceDate;
    }

    public String getTripId() {
        return tripId;
    }

    public String getStopId() {
        return stopId;
    }

    public EventType getEventType() {
        return eventType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventKey that = (EventKey) o;
        return Objects.equals(serviceDate, that.serviceDate) &&
                Objects.equals(tripId, that.tripId) &&
                Objects.equals(stopId, that.stopId) &&
                eventType == that.eventType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceDate, tripId, stopId, eventType);
    }

    @Override
    public String toString() {
        return serviceDate + "/" + tripId + "/" + stopId + "/" + eventType;
    }
}
