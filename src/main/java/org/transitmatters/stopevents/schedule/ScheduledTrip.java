package org.transitmatters.stopevents.schedule;

import java.util.Objects;
import java.util.Optional;

public final class ScheduledTrip {
    private final String tripId;
    private final String routeId;
    private final int directionId;
    private final String trunkRouteId;
    private final String branchRouteId;

    public ScheduledTrip(String tripId, String routeId, int directionId, String trunkRouteId, String branchRouteId) {
        this.tripId = Objects.requireNonNull(tripId);
        this.routeId = Objects.requireNonNull(routeId);
        this.directionId = directionId;
        this.trunkRouteId = trunkRouteId;
        this.branchRouteId = branchRouteId;
    }

    public String getTripId() {
        return tripId;
    }

    public String getRouteId() {
        return routeId;
    }

    public int getDirectionId() {
        return directionId;
    }

    /**
     * @return trunk route, or the route id itself when the trip is not part of a branching route
     */
    public String getTrunkRouteId() {
        return trunkRouteId != null ? trunkRouteId : routeId;
    }

    public Optional<String> getBranchRouteId() {
        return Optional.ofNullable(branchRouteId);
    }
}
