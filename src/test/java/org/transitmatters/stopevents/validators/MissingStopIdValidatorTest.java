package org.transitmatters.stopevents.validators;

import org.junit.Test;
import org.transitmatters.stopevents.MockDataFactory;
import org.transitmatters.stopevents.models.PointKind;
import org.transitmatters.stopevents.models.SourceKind;

import static org.junit.Assert.assertEquals;

public class MissingStopIdValidatorTest {

    private final MissingStopIdValidator validator = new MissingStopIdValidator();

    @Test
    public void recordWithStopIsAccepted() {
        assertEquals(true, validator.validate(MockDataFactory.mockRealtimeRecord("T1", "70063", 1, PointKind.ARRIVAL, "10:00:00")));
    }

    @Test
    public void recordWithoutStopIsDiscarded() {
        assertEquals(false, validator.validate(MockDataFactory.mockRealtimeRecord("T1", null, 1, PointKind.ARRIVAL, "10:00:00")));
        assertEquals(false, validator.validate(MockDataFactory.mockRealtimeRecord("T1", "", 1, PointKind.ARRIVAL, "10:00:00")));
    }

    @Test
    public void realtimeDepartureWithoutStopIsKeptForPairing() {
        assertEquals(true, validator.validate(MockDataFactory.mockRealtimeRecord("T1", null, 3, PointKind.DEPARTURE, "10:07:00")));
        assertEquals(false, validator.validate(MockDataFactory.mockRecord(SourceKind.HISTORIC_RAIL, "T1", null, 3, PointKind.DEPARTURE, "10:07:00").build()));
    }
}
