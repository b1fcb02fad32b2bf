package org.transitmatters.stopevents.models;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * RawMovementRecord is an immutable, source independent view of one observed vehicle-at-location fact.
 * Timestamps are always rendered in Eastern time, whatever the encoding of the source was.
 */
public class RawMovementRecord {
    private RawMovementRecord() {}

    private SourceKind sourceKind;
    private LocalDate serviceDate;
    private String routeId;
    private String tripId;
    private int directionId;
    private String stopId;
    private Integer stopSequence;
    private String vehicleId;
    private String vehicleLabel;
    private ZonedDateTime timestamp;
    private PointKind pointKind;
    private String vehicleConsist;
    private String trunkRouteId;
    private String branchRouteId;

    public static Builder newBuilder() {
        return new Builder();
    }

    public SourceKind getSourceKind() {
        return sourceKind;
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

    /**
     * @return empty if the source row had no usable stop sequence
     */
    public Optional<Integer> getStopSequence() {
        return Optional.ofNullable(stopSequence);
    }

    public String getVehicleId() {
        return vehicleId;
    }

    public String getVehicleLabel() {
        return vehicleLabel;
    }

    public ZonedDateTime getTimestamp() {
        return timestamp;
    }

    public PointKind getPointKind() {
        return pointKind;
    }

    public Optional<String> getVehicleConsist() {
        return Optional.ofNullable(vehicleConsist);
    }

    public Optional<String> getTrunkRouteId() {
        return Optional.ofNullable(trunkRouteId);
    }

    public Optional<String> getBranchRouteId() {
        return Optional.ofNullable(branchRouteId);
    }

    private RawMovementRecord copy() {
        RawMovementRecord copy = new RawMovementRecord();
        copy.sourceKind = sourceKind;
        copy.serviceDate = serviceDate;
        copy.routeId = routeId;
        copy.tripId = tripId;
        copy.directionId = directionId;
        copy.stopId = stopId;
        copy.stopSequence = stopSequence;
        copy.vehicleId = vehicleId;
        copy.vehicleLabel = vehicleLabel;
        copy.timestamp = timestamp;
        copy.pointKind = pointKind;
        copy.vehicleConsist = vehicleConsist;
        copy.trunkRouteId = trunkRouteId;
        copy.branchRouteId = branchRouteId;
        return copy;
    }

    @Override
    public String toString() {
        return sourceKind + " " + serviceDate + " " + routeId + " " + tripId + " " + stopId + "#" + stopSequence
                + " " + pointKind + "@" + timestamp;
    }

    public static class Builder {
        private final RawMovementRecord record = new RawMovementRecord();

        private Builder() {}

        public Builder setSourceKind(SourceKind sourceKind) {
            record.sourceKind = sourceKind;
            return this;
        }

        public Builder setServiceDate(LocalDate serviceDate) {
            record.serviceDate = serviceDate;
            return this;
        }

        public Builder setRouteId(String routeId) {
            record.routeId = routeId;
            return this;
        }

        public Builder setTripId(String tripId) {
            record.tripId = tripId;
            return this;
        }

        public Builder setDirectionId(int directionId) {
            record.directionId = directionId;
            return this;
        }

        public Builder setStopId(String stopId) {
            record.stopId = stopId;
            return this;
        }

        public Builder setStopSequence(Integer stopSequence) {
            record.stopSequence = stopSequence;
            return this;
        }

        public Builder setVehicleId(String vehicleId) {
            record.vehicleId = vehicleId;
            return this;
        }

        public Builder setVehicleLabel(String vehicleLabel) {
            record.vehicleLabel = vehicleLabel;
            return this;
        }

        public Builder setTimestamp(ZonedDateTime timestamp) {
            record.timestamp = timestamp;
            return this;
        }

        public Builder setPointKind(PointKind pointKind) {
            record.pointKind = pointKind;
            return this;
        }

        public Builder setVehicleConsist(String vehicleConsist) {
            record.vehicleConsist = vehicleConsist;
            return this;
        }

        public Builder setTrunkRouteId(String trunkRouteId) {
            record.trunkRouteId = trunkRouteId;
            return this;
        }

        public Builder setBranchRouteId(String branchRouteId) {
            record.branchRouteId = branchRouteId;
            return this;
        }

        public RawMovementRecord build() {
            Objects.requireNonNull(record.sourceKind, "sourceKind");
            Objects.requireNonNull(record.serviceDate, "serviceDate");
            Objects.requireNonNull(record.timestamp, "timestamp");
            Objects.requireNonNull(record.pointKind, "pointKind");
            return record.copy();
        }
    }
}
