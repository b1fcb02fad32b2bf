package org.transitmatters.stopevents.schedule;

import java.util.Objects;
import java.util.Optional;

public final class ScheduledRoute {
    private final String routeId;
    private final String trunkRouteId;

    public ScheduledRoute(String routeId, String trunkRouteId) {
        this.routeId = Objects.requireNonNull(routeId);
        this.trunkRouteId = trunkRouteId;
    }

    public String getRouteId() {
        return routeId;
    }

    public Optional<String> getTrunkRouteId() {
        return Optional.ofNullable(trunkRouteId);
    }
}
