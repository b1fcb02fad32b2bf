package org.transitmatters.stopevents.application;

/**
 * Data quality faults that are recovered from and counted instead of failing the batch.
 */
public enum FaultKind {
    /** Record whose trip or stop sequence could not be resolved */
    ORPHAN_EVENT,
    /** Interval came out negative because of out-of-order timestamps */
    ORDERING_ANOMALY,
    /** Second ARR or DEP for the same trip and stop */
    DUPLICATE_EVENT,
    /** No scheduled stop time for the event. Expected for added trips. */
    SCHEDULE_LOOKUP_MISS,
    /** Row that could not be parsed or lacks a mandatory value */
    INVALID_RECORD,
    /** Row excluded on purpose, e.g. by a route or date filter */
    FILTERED_RECORD
}
