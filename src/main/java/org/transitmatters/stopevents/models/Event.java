package org.transitmatters.stopevents.models;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Event is the canonical output unit: one arrival or one departure of one trip at one stop.
 *
 * Instances are immutable. Processing stages derive new instances with {@link #toBuilder()}.
 */
public class Event {
    private Event() {}

    /**
     * Order of output rows: by event time, at the same instant lower stop sequence first and arrivals
     * before departures. Trip id makes the order total.
     */
    public static final Comparator<Event> TIMELINE_ORDER = Comparator
            .comparing(Event::getEventTime, (ZonedDateTime a, ZonedDateTime b) -> a.toInstant().compareTo(b.toInstant()))
            .thenComparingInt(Event::getStopSequence)
            .thenComparing(Event::getEventType)
            .thenComparing(Event::getTripId);

    private LocalDate serviceDate;
    private String routeId;
    private String tripId;
    private int directionId;
    private String stopId;
    private int stopSequence;
    private String vehicleId;
    private String vehicleLabel;
    private EventType eventType;
    private ZonedDateTime eventTime;
    private Long travelTimeSeconds;
    private Long dwellTimeSeconds;
    private Long headwaySeconds;
    private Long headwayBranchSeconds;
    private Long scheduledTravelTime;
    private Long scheduledHeadway;
    private Long scheduledHeadwayBranch;
    private String vehicleConsist;

    // Resolved from the schedule, not part of the output rows
    private String trunkRouteId;
    private String branchRouteId;

    public static Builder newBuilder() {
        return new Builder(new Event());
    }

    public Builder toBuilder() {
        return new Builder(copy());
    }

    public LocalDate getServiceDate() {
        return serviceDate;
    }

    public String getRouteId() {
        return routeId;
    }

    public String getTripId() {
        return tripId;
    }

    public int getDirectionId() {
        return directionId;
    }

    public String getStopId() {
        return stopId;
    }

    public int getStopSequence() {
        return stopSequence;
    }

    public String getVehicleId() {
        return vehicleId;
    }

    public String getVehicleLabel() {
        return vehicleLabel;
    }

    public EventType getEventType() {
        return eventType;
    }

    public ZonedDateTime getEventTime() {
        return eventTime;
    }

    public Optional<Long> getTravelTimeSeconds() {
        return Optional.ofNullable(travelTimeSeconds);
    }

    public Optional<Long> getDwellTimeSeconds() {
        return Optional.ofNullable(dwellTimeSeconds);
    }

    public Optional<Long> getHeadwaySeconds() {
        return Optional.ofNullable(headwaySeconds);
    }

    public Optional<Long> getHeadwayBranchSeconds() {
        return Optional.ofNullable(headwayBranchSeconds);
    }

    public Optional<Long> getScheduledTravelTime() {
        return Optional.ofNullable(scheduledTravelTime);
    }

    public Optional<Long> getScheduledHeadway() {
        return Optional.ofNullable(scheduledHeadway);
    }

    public Optional<Long> getScheduledHeadwayBranch() {
        return Optional.ofNullable(scheduledHeadwayBranch);
    }

    public Optional<String> getVehicleConsist() {
        return Optional.ofNullable(vehicleConsist);
    }

    /**
     * @return the trunk route this trip runs on, the route id itself for unbranched routes
     */
    public String getTrunkRouteId() {
        return trunkRouteId != null ? trunkRouteId : routeId;
    }

    public Optional<String> getBranchRouteId() {
        return Optional.ofNullable(branchRouteId);
    }

    /**
     * Unique key of this event within one batch.
     */
    public EventKey getKey() {
        return new EventKey(serviceDate, tripId, stopId, eventType);
    }

    private Event copy() {
        Event copy = new Event();
        copy.serviceDate = serviceDate;
        copy.routeId = routeId;
        copy.tripId = tripId;
        copy.directionId = directionId;
        copy.stopId = stopId;
        copy.stopSequence = stopSequence;
        copy.vehicleId = vehicleId;
        copy.vehicleLabel = vehicleLabel;
        copy.eventType = eventType;
        copy.eventTime = eventTime;
        copy.travelTimeSeconds = travelTimeSeconds;
        copy.dwellTimeSeconds = dwellTimeSeconds;
        copy.headwaySeconds = headwaySeconds;
        copy.headwayBranchSeconds = headwayBranchSeconds;
        copy.scheduledTravelTime = scheduledTravelTime;
        copy.scheduledHeadway = scheduledHeadway;
        copy.scheduledHeadwayBranch = scheduledHeadwayBranch;
        copy.vehicleConsist = vehicleConsist;
        copy.trunkRouteId = trunkRouteId;
        copy.branchRouteId = branchRouteId;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event that = (Event) o;
        return directionId == that.directionId &&
                stopSequence == that.stopSequence &&
                Objects.equals(serviceDate, that.serviceDate) &&
                Objects.equals(routeId, that.routeId) &&
                Objects.equals(tripId, that.tripId) &&
                Objects.equals(stopId, that.stopId) &&
                Objects.equals(vehicleId, that.vehicleId) &&
                Objects.equals(vehicleLabel, that.vehicleLabel) &&
                eventType == that.eventType &&
                Objects.equals(eventTime, that.eventTime) &&
                Objects.equals(travelTimeSeconds, that.travelTimeSeconds) &&
                Objects.equals(dwellTimeSeconds, that.dwellTimeSeconds) &&
                Objects.equals(headwaySeconds, that.headwaySeconds) &&
                Objects.equals(headwayBranchSeconds, that.headwayBranchSeconds) &&
                Objects.equals(scheduledTravelTime, that.scheduledTravelTime) &&
                Objects.equals(scheduledHeadway, that.scheduledHeadway) &&
                Objects.equals(scheduledHeadwayBranch, that.scheduledHeadwayBranch) &&
                Objects.equals(vehicleConsist, that.vehicleConsist) &&
                Objects.equals(trunkRouteId, that.trunkRouteId) &&
                Objects.equals(branchRouteId, that.branchRouteId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceDate, tripId, stopId, stopSequence, eventType, eventTime);
    }

    @Override
    public String toString() {
        return serviceDate + " " + routeId + "/" + directionId + " " + tripId + " " + stopId + "#" + stopSequence
                + " " + eventType + "@" + eventTime;
    }

    public static class Builder {
        private final Event event;

        private Builder(Event event) {
            this.event = event;
        }

        public Builder setServiceDate(LocalDate serviceDate) {
            event.serviceDate = serviceDate;
            return this;
        }

        public Builder setRouteId(String routeId) {
            event.routeId = routeId;
            return this;
        }

        public Builder setTripId(String tripId) {
            event.tripId = tripId;
            return this;
        }

        public Builder setDirectionId(int directionId) {
            event.directionId = directionId;
            return this;
        }

        public Builder setStopId(String stopId) {
            event.stopId = stopId;
            return this;
        }

        public Builder setStopSequence(int stopSequence) {
            event.stopSequence = stopSequence;
            return this;
        }

        public Builder setVehicleId(String vehicleId) {
            event.vehicleId = vehicleId;
            return this;
        }

        public Builder setVehicleLabel(String vehicleLabel) {
            event.vehicleLabel = vehicleLabel;
            return this;
        }

        public Builder setEventType(EventType eventType) {
            event.eventType = eventType;
            return this;
        }

        public Builder setEventTime(ZonedDateTime eventTime) {
            event.eventTime = eventTime;
            return this;
        }

        public Builder setTravelTimeSeconds(Long travelTimeSeconds) {
            event.travelTimeSeconds = travelTimeSeconds;
            return this;
        }

        public Builder setDwellTimeSeconds(Long dwellTimeSeconds) {
            event.dwellTimeSeconds = dwellTimeSeconds;
            return this;
        }

        public Builder setHeadwaySeconds(Long headwaySeconds) {
            event.headwaySeconds = headwaySeconds;
            return this;
        }

        public Builder setHeadwayBranchSeconds(Long headwayBranchSeconds) {
            event.headwayBranchSeconds = headwayBranchSeconds;
            return this;
        }

        public Builder setScheduledTravelTime(Long scheduledTravelTime) {
            event.scheduledTravelTime = scheduledTravelTime;
            return this;
        }

        public Builder setScheduledHeadway(Long scheduledHeadway) {
            event.scheduledHeadway = scheduledHeadway;
            return this;
        }

        public Builder setScheduledHeadwayBranch(Long scheduledHeadwayBranch) {
            event.scheduledHeadwayBranch = scheduledHeadwayBranch;
            return this;
        }

        public Builder setVehicleConsist(String vehicleConsist) {
            event.vehicleConsist = vehicleConsist;
            return this;
        }

        public Builder setTrunkRouteId(String trunkRouteId) {
            event.trunkRouteId = trunkRouteId;
            return this;
        }

        public Builder setBranchRouteId(String branchRouteId) {
            event.branchRouteId = branchRouteId;
            return this;
        }

        public Event build() {
            Objects.requireNonNull(event.serviceDate, "serviceDate");
            Objects.requireNonNull(event.tripId, "tripId");
            Objects.requireNonNull(event.stopId, "stopId");
            Objects.requireNonNull(event.eventType, "eventType");
            Objects.requireNonNull(event.eventTime, "eventTime");
            return event.copy();
        }
    }
}
