package org.transitmatters.stopevents.validators;

import org.junit.Test;
import org.transitmatters.stopevents.MockDataFactory;
import org.transitmatters.stopevents.models.PointKind;
import org.transitmatters.stopevents.models.RawMovementRecord;
import org.transitmatters.stopevents.models.SourceKind;

import java.time.LocalDate;

import static org.junit.Assert.assertEquals;

public class NonRevenueTripValidatorTest {

    private final NonRevenueTripValidator validator = new NonRevenueTripValidator(NonRevenueTripValidator.DEFAULT_CUTOVER);

    private static RawMovementRecord record(SourceKind sourceKind, String tripId, LocalDate serviceDate) {
        return MockDataFactory.mockRecord(sourceKind, tripId, "70063", 1, PointKind.ARRIVAL, "10:00:00")
                .setServiceDate(serviceDate)
                .build();
    }

    @Test
    public void nonRevenueTripBeforeCutoverIsDiscarded() {
        assertEquals(false, validator.validate(record(SourceKind.REALTIME_FEED, "NONREV-1581518546", LocalDate.of(2023, 11, 30))));
    }

    @Test
    public void nonRevenueTripFromCutoverIsAccepted() {
        assertEquals(true, validator.validate(record(SourceKind.REALTIME_FEED, "NONREV-1581518546", LocalDate.of(2023, 12, 1))));
    }

    @Test
    public void revenueTripIsAccepted() {
        assertEquals(true, validator.validate(record(SourceKind.REALTIME_FEED, "59743591", LocalDate.of(2023, 11, 30))));
    }

    @Test
    public void historicSourcesAreNotFiltered() {
        assertEquals(true, validator.validate(record(SourceKind.HISTORIC_RAIL, "NONREV-1581518546", LocalDate.of(2023, 11, 30))));
    }
}
