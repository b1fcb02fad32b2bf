package org.transitmatters.stopevents.normalizer;

import com.google.common.collect.ImmutableMap;
import org.transitmatters.stopevents.models.SourceKind;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.transitmatters.stopevents.normalizer.SourceField.*;

/**
 * Known layouts of raw sources. Every variant is an explicit mapping from {@link SourceField} to column name,
 * split into columns that must be present and columns that are read only when present.
 */
public enum SchemaVariant {
    REALTIME_LAMP(SourceKind.REALTIME_FEED,
            ImmutableMap.<SourceField, String>builder()
                    .put(SERVICE_DATE, "service_date")
                    .put(ROUTE_ID, "route_id")
                    .put(TRIP_ID, "trip_id")
                    .put(STOP_ID, "stop_id")
                    .put(DIRECTION_ID, "direction_id")
                    .put(STOP_SEQUENCE, "stop_sequence")
                    .put(VEHICLE_ID, "vehicle_id")
                    .put(VEHICLE_LABEL, "vehicle_label")
                    .put(MOVE_TIMESTAMP, "move_timestamp")
                    .put(STOP_TIMESTAMP, "stop_timestamp")
                    .build(),
            ImmutableMap.of(
                    VEHICLE_CONSIST, "vehicle_consist",
                    TRUNK_ROUTE_ID, "trunk_route_id",
                    BRANCH_ROUTE_ID, "branch_route_id")),

    HISTORIC_RAIL_LEGACY(SourceKind.HISTORIC_RAIL,
            historicRailColumns("stop_sequence"),
            ImmutableMap.of(VEHICLE_CONSIST, "vehicle_consist")),

    HISTORIC_RAIL_LAMP(SourceKind.HISTORIC_RAIL,
            historicRailColumns("sync_stop_sequence"),
            ImmutableMap.of(VEHICLE_CONSIST, "vehicle_consist")),

    HISTORIC_BUS(SourceKind.HISTORIC_BUS,
            ImmutableMap.<SourceField, String>builder()
                    .put(SERVICE_DATE, "service_date")
                    .put(ROUTE_ID, "route_id")
                    .put(DIRECTION_ID, "direction")
                    .put(TRIP_ID, "half_trip_id")
                    .put(STOP_ID, "stop_id")
                    .put(TIME_POINT_ID, "time_point_id")
                    .put(STOP_SEQUENCE, "time_point_order")
                    .put(POINT_TYPE, "point_type")
                    .put(ACTUAL, "actual")
                    .build(),
            ImmutableMap.of()),

    HISTORIC_FERRY(SourceKind.HISTORIC_FERRY,
            ImmutableMap.<SourceField, String>builder()
                    .put(SERVICE_DATE, "service_date")
                    .put(ROUTE_ID, "route_id")
                    .put(TRIP_ID, "trip_id")
                    .put(DIRECTION_ID, "travel_direction")
                    .put(DEPARTURE_TERMINAL, "departure_terminal")
                    .put(ARRIVAL_TERMINAL, "arrival_terminal")
                    .put(ACTUAL_DEPARTURE, "actual_departure")
                    .put(ACTUAL_ARRIVAL, "actual_arrival")
                    .put(VEHICLE_ID, "vessel_time_slot")
                    .build(),
            ImmutableMap.of());

    public static final LocalDate DEFAULT_RAIL_FORMAT_CUTOVER = LocalDate.of(2024, 1, 1);

    private final SourceKind sourceKind;
    private final ImmutableMap<SourceField, String> requiredColumns;
    private final ImmutableMap<SourceField, String> optionalColumns;

    SchemaVariant(SourceKind sourceKind,
                  ImmutableMap<SourceField, String> requiredColumns,
                  ImmutableMap<SourceField, String> optionalColumns) {
        this.sourceKind = sourceKind;
        this.requiredColumns = requiredColumns;
        this.optionalColumns = optionalColumns;
    }

    private static ImmutableMap<SourceField, String> historicRailColumns(String stopSequenceColumn) {
        return ImmutableMap.<SourceField, String>builder()
                .put(SERVICE_DATE, "service_date")
                .put(ROUTE_ID, "route_id")
                .put(TRIP_ID, "trip_id")
                .put(DIRECTION_ID, "direction_id")
                .put(STOP_ID, "stop_id")
                .put(STOP_SEQUENCE, stopSequenceColumn)
                .put(VEHICLE_ID, "vehicle_id")
                .put(VEHICLE_LABEL, "vehicle_label")
                .put(EVENT_TYPE, "event_type")
                .put(EVENT_TIME_SEC, "event_time_sec")
                .build();
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    public ImmutableMap<SourceField, String> getRequiredColumns() {
        return requiredColumns;
    }

    public ImmutableMap<SourceField, String> getOptionalColumns() {
        return optionalColumns;
    }

    public static SchemaVariant select(SourceKind sourceKind, LocalDate serviceDate) {
        return select(sourceKind, serviceDate, DEFAULT_RAIL_FORMAT_CUTOVER);
    }

    /**
     * Picks the layout of a source. Depends only on its arguments.
     *
     * @param railFormatCutover first service date of historic rail files in the LAMP layout
     */
    public static SchemaVariant select(SourceKind sourceKind, LocalDate serviceDate, LocalDate railFormatCutover) {
        switch (sourceKind) {
            case REALTIME_FEED:
                return REALTIME_LAMP;
            case HISTORIC_RAIL:
                return serviceDate.isBefore(railFormatCutover) ? HISTORIC_RAIL_LEGACY : HISTORIC_RAIL_LAMP;
            case HISTORIC_BUS:
                return HISTORIC_BUS;
            case HISTORIC_FERRY:
                return HISTORIC_FERRY;
            default:
                throw new IllegalArgumentException("Unknown source kind " + sourceKind);
        }
    }

    /**
     * Resolves the column positions of this variant in a source.
     *
     * @throws SchemaMismatchException if any required column is missing
     */
    public ColumnBinding bind(SourceTable source) throws SchemaMismatchException {
        Map<SourceField, Integer> indexes = new EnumMap<>(SourceField.class);
        List<String> missing = new ArrayList<>();

        requiredColumns.forEach((field, column) -> {
            Integer index = source.getColumnIndex(column).orElse(null);
            if (index == null) {
                missing.add(column);
            } else {
                indexes.put(field, index);
            }
        });
        if (!missing.isEmpty()) {
            throw new SchemaMismatchException(source.getName(), this, missing);
        }

        optionalColumns.forEach((field, column) -> source.getColumnIndex(column).ifPresent(index -> indexes.put(field, index)));
        return new ColumnBinding(this, indexes);
    }
}
