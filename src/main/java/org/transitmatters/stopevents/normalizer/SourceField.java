package org.transitmatters.stopevents.normalizer;

/**
 * Logical fields a normalizer reads. Each {@link SchemaVariant} maps these to physical column names.
 */
public enum SourceField {
    SERVICE_DATE,
    ROUTE_ID,
    TRIP_ID,
    DIRECTION_ID,
    STOP_ID,
    STOP_SEQUENCE,
    VEHICLE_ID,
    VEHICLE_LABEL,
    VEHICLE_CONSIST,
    TRUNK_ROUTE_ID,
    BRANCH_ROUTE_ID,
    // real-time feed
    MOVE_TIMESTAMP,
    STOP_TIMESTAMP,
    // historic rail
    EVENT_TYPE,
    EVENT_TIME_SEC,
    // historic bus
    TIME_POINT_ID,
    POINT_TYPE,
    ACTUAL,
    // historic ferry
    DEPARTURE_TERMINAL,
    ARRIVAL_TERMINAL,
    ACTUAL_DEPARTURE,
    ACTUAL_ARRIVAL
}
