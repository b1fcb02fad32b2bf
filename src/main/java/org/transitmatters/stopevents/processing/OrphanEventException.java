package org.transitmatters.stopevents.processing;

import org.transitmatters.stopevents.models.RawMovementRecord;

/**
 * A record whose trip or position within the trip cannot be resolved, so it cannot be paired.
 */
public class OrphanEventException extends Exception {
    private final transient RawMovementRecord record;

    public OrphanEventException(String message, RawMovementRecord record) {
        super(message + ": " + record);
        this.record = record;
    }

    public RawMovementRecord getRecord() {
        return record;
    }
}
