package org.transitmatters.stopevents.normalizer;

import org.transitmatters.stopevents.application.FaultKind;
import org.transitmatters.stopevents.application.ProcessingStats;
import org.transitmatters.stopevents.models.PointKind;
import org.transitmatters.stopevents.models.RawMovementRecord;
import org.transitmatters.stopevents.models.SourceKind;
import org.transitmatters.stopevents.utils.ServiceDates;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;

import static org.transitmatters.stopevents.normalizer.SourceField.*;

/**
 * Normalizes daily real-time on-time-performance rows.
 * <p>
 * Each row describes the arrival of a trip at a stop ({@code stop_timestamp}) and the departure
 * from the stop before it ({@code move_timestamp}). Both are emitted against the row's own stop here,
 * the departure is moved to the previous stop when events are paired.
 */
public class RealtimeFeedNormalizer extends AbstractSourceNormalizer {

    @Override
    public SourceKind getSourceKind() {
        return SourceKind.REALTIME_FEED;
    }

    @Override
    protected SchemaVariant selectVariant(LocalDate serviceDate) {
        return SchemaVariant.select(SourceKind.REALTIME_FEED, serviceDate);
    }

    @Override
    protected void normalizeRow(ColumnBinding columns, String[] row, List<RawMovementRecord> output, ProcessingStats stats) {
        final String moveTimestamp = columns.get(row, MOVE_TIMESTAMP);
        final String stopTimestamp = columns.get(row, STOP_TIMESTAMP);
        if (moveTimestamp == null && stopTimestamp == null) {
            stats.increment(FaultKind.FILTERED_RECORD, "no-timestamp");
            return;
        }

        final String serviceDate = columns.get(row, SERVICE_DATE);
        if (serviceDate == null) {
            throw new IllegalArgumentException("Missing service date");
        }

        RawMovementRecord.Builder builder = RawMovementRecord.newBuilder()
                .setSourceKind(SourceKind.REALTIME_FEED)
                .setServiceDate(ServiceDates.parseDate(serviceDate))
                .setRouteId(columns.get(row, ROUTE_ID))
                .setTripId(columns.get(row, TRIP_ID))
                .setDirectionId(NormalizerUtils.parseDirectionId(columns.get(row, DIRECTION_ID)))
                .setStopId(columns.get(row, STOP_ID))
                .setStopSequence(NormalizerUtils.parseInteger(columns.get(row, STOP_SEQUENCE)))
                .setVehicleId(columns.get(row, VEHICLE_ID))
                .setVehicleLabel(columns.get(row, VEHICLE_LABEL))
                .setVehicleConsist(columns.get(row, VEHICLE_CONSIST))
                .setTrunkRouteId(columns.get(row, TRUNK_ROUTE_ID))
                .setBranchRouteId(columns.get(row, BRANCH_ROUTE_ID));

        if (stopTimestamp != null) {
            output.add(builder.setPointKind(PointKind.ARRIVAL)
                    .setTimestamp(toEastern(stopTimestamp))
                    .build());
        }
        if (moveTimestamp != null) {
            output.add(builder.setPointKind(PointKind.DEPARTURE)
                    .setTimestamp(toEastern(moveTimestamp))
                    .build());
        }
    }

    private static ZonedDateTime toEastern(String epochSeconds) {
        return Instant.ofEpochSecond(NormalizerUtils.parseEpochSeconds(epochSeconds)).atZone(ServiceDates.EASTERN);
    }
}
