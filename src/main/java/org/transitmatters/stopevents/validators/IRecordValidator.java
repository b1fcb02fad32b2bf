package org.transitmatters.stopevents.validators;

import org.transitmatters.stopevents.models.RawMovementRecord;

public interface IRecordValidator {

    boolean validate(RawMovementRecord record);
}
