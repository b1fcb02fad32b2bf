package org.transitmatters.stopevents.validators;

import org.transitmatters.stopevents.models.RawMovementRecord;
import org.transitmatters.stopevents.models.SourceKind;

import java.time.LocalDate;

/**
 * Discards real-time records of non-revenue trips published before the cutover date.
 * From the cutover on the feed marks these trips itself and they are kept.
 */
public class NonRevenueTripValidator implements IRecordValidator {

    public static final String NON_REVENUE_TRIP_PREFIX = "NONREV-";
    public static final LocalDate DEFAULT_CUTOVER = LocalDate.of(2023, 12, 1);

    private final LocalDate cutover;

    public NonRevenueTripValidator(LocalDate cutover) {
        this.cutover = cutover;
    }

    @Override
    public boolean validate(RawMovementRecord record) {
        if (record.getSourceKind() != SourceKind.REALTIME_FEED || record.getTripId() == null) {
            return true;
        }
        boolean isNonRevenue = record.getTripId().startsWith(NON_REVENUE_TRIP_PREFIX);
        return !(isNonRevenue && record.getServiceDate().isBefore(cutover));
    }
}
