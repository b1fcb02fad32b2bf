package org.transitmatters.stopevents.models;

/**
 * What a raw record says about the vehicle at its stop.
 * Timepoint sources (bus) only report STARTPOINT, MIDPOINT and ENDPOINT.
 */
public enum PointKind {
    ARRIVAL,
    DEPARTURE,
    STARTPOINT,
    MIDPOINT,
    ENDPOINT;

    public boolean isTimepoint() {
        return this == STARTPOINT || this == MIDPOINT || this == ENDPOINT;
    }
}
