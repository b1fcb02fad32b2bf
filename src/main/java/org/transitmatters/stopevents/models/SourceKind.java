package org.transitmatters.stopevents.models;

/**
 * The upstream formats movement records can come from.
 */
public enum SourceKind {
    REALTIME_FEED,
    HISTORIC_RAIL,
    HISTORIC_BUS,
    HISTORIC_FERRY
}
