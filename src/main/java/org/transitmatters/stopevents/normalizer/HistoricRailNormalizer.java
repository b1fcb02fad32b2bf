package org.transitmatters.stopevents.normalizer;

import org.transitmatters.stopevents.application.ProcessingStats;
import org.transitmatters.stopevents.models.PointKind;
import org.transitmatters.stopevents.models.RawMovementRecord;
import org.transitmatters.stopevents.models.SourceKind;
import org.transitmatters.stopevents.utils.ServiceDates;

import java.time.LocalDate;
import java.util.List;

import static org.transitmatters.stopevents.normalizer.SourceField.*;

/**
 * Normalizes the published historic rapid transit event files. Event times are given as seconds
 * after midnight of the service date, Eastern wall-clock.
 */
public class HistoricRailNormalizer extends AbstractSourceNormalizer {

    private final LocalDate formatCutover;

    /**
     * @param formatCutover first service date published with the LAMP column layout
     */
    public HistoricRailNormalizer(LocalDate formatCutover) {
        this.formatCutover = formatCutover;
    }

    @Override
    public SourceKind getSourceKind() {
        return SourceKind.HISTORIC_RAIL;
    }

    @Override
    protected SchemaVariant selectVariant(LocalDate serviceDate) {
        return SchemaVariant.select(SourceKind.HISTORIC_RAIL, serviceDate, formatCutover);
    }

    @Override
    protected void normalizeRow(ColumnBinding columns, String[] row, List<RawMovementRecord> output, ProcessingStats stats) {
        final String serviceDateValue = columns.get(row, SERVICE_DATE);
        final String eventTimeSec = columns.get(row, EVENT_TIME_SEC);
        if (serviceDateValue == null || eventTimeSec == null) {
            throw new IllegalArgumentException("Missing service date or event time");
        }

        final LocalDate serviceDate = ServiceDates.parseDate(serviceDateValue);
        final long secondsAfterMidnight = NormalizerUtils.parseEpochSeconds(eventTimeSec);

        output.add(RawMovementRecord.newBuilder()
                .setSourceKind(SourceKind.HISTORIC_RAIL)
                .setServiceDate(serviceDate)
                .setRouteId(columns.get(row, ROUTE_ID))
                .setTripId(columns.get(row, TRIP_ID))
                .setDirectionId(NormalizerUtils.parseDirectionId(columns.get(row, DIRECTION_ID)))
                .setStopId(columns.get(row, STOP_ID))
                .setStopSequence(NormalizerUtils.parseInteger(columns.get(row, STOP_SEQUENCE)))
                .setVehicleId(columns.get(row, VEHICLE_ID))
                .setVehicleLabel(columns.get(row, VEHICLE_LABEL))
                .setVehicleConsist(columns.get(row, VEHICLE_CONSIST))
                .setPointKind(parseEventType(columns.get(row, EVENT_TYPE)))
                .setTimestamp(serviceDate.atStartOfDay().plusSeconds(secondsAfterMidnight).atZone(ServiceDates.EASTERN))
                .build());
    }

    static PointKind parseEventType(String eventType) {
        if ("ARR".equalsIgnoreCase(eventType)) {
            return PointKind.ARRIVAL;
        }
        if ("DEP".equalsIgnoreCase(eventType)) {
            return PointKind.DEPARTURE;
        }
        throw new IllegalArgumentException("Unknown event type " + eventType);
    }
}
