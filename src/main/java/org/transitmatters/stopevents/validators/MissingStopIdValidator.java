package org.transitmatters.stopevents.validators;

import org.transitmatters.stopevents.models.PointKind;
import org.transitmatters.stopevents.models.RawMovementRecord;
import org.transitmatters.stopevents.models.SourceKind;

/**
 * Events are partitioned by stop, so records without one cannot be placed anywhere.
 * <p>
 * Real-time departures are let through: they belong to the stop before the one they are reported with
 * and get it when events are paired.
 */
public class MissingStopIdValidator implements IRecordValidator {

    @Override
    public boolean validate(RawMovementRecord record) {
        if (record.getSourceKind() == SourceKind.REALTIME_FEED && record.getPointKind() == PointKind.DEPARTURE) {
            return true;
        }
        return record.getStopId() != null && !record.getStopId().isEmpty();
    }
}
