package org.transitmatters.stopevents.normalizer;

import com.google.common.collect.ImmutableMap;
import org.transitmatters.stopevents.application.FaultKind;
import org.transitmatters.stopevents.application.ProcessingStats;
import org.transitmatters.stopevents.models.PointKind;
import org.transitmatters.stopevents.models.RawMovementRecord;
import org.transitmatters.stopevents.models.SourceKind;
import org.transitmatters.stopevents.utils.ServiceDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.transitmatters.stopevents.normalizer.SourceField.*;

/**
 * Normalizes ferry ridership data. Every row is one vessel leg, so it yields a departure
 * at the departure terminal and an arrival at the arrival terminal.
 */
public class HistoricFerryNormalizer extends AbstractSourceNormalizer {
    private static final Logger log = LoggerFactory.getLogger(HistoricFerryNormalizer.class);

    // Route labels used in the ridership data are not GTFS route ids
    static final ImmutableMap<String, String> ROUTE_LABELS = ImmutableMap.<String, String>builder()
            .put("F1", "Boat-F1")
            .put("F2H", "Boat-F1")
            .put("F3", "Boat-EastBoston")
            .put("F4", "Boat-F4")
            .put("F5", "Boat-Lynn")
            .put("F6", "Boat-F6")
            .put("F7", "Boat-F7")
            .put("F8", "Boat-F8")
            .build();

    static final ImmutableMap<String, String> TERMINAL_STOPS = ImmutableMap.<String, String>builder()
            .put("Aquarium", "Boat-Aquarium")
            .put("Boston", "Boat-Long")
            .put("Central Whf", "Boat-Aquarium")
            .put("Georges", "Boat-George")
            .put("Hingham", "Boat-Hingham")
            .put("Hull", "Boat-Hull")
            .put("HULL", "Boat-Hull")
            .put("Lewis", "Boat-Lewis")
            .put("Logan", "Boat-Logan")
            .put("LOGAN", "Boat-Logan")
            .put("Long Wharf N", "Boat-Long")
            .put("Long Wharf S", "Boat-Long-South")
            .put("Lynn", "Boat-Blossom")
            .put("Navy Yard", "Boat-Charlestown")
            .put("Quincy", "Boat-Quincy")
            .put("Rowes", "Boat-Rowes")
            .put("Rowes Wharf", "Boat-Rowes")
            .put("Seaport", "Boat-Fan")
            .put("Winthrop", "Boat-Winthrop")
            .build();

    static final int DEPARTURE_STOP_SEQUENCE = 1;
    static final int ARRIVAL_STOP_SEQUENCE = 2;

    private final LocalDate startDate;
    private final LocalDate endDate;

    public HistoricFerryNormalizer() {
        this(null, null);
    }

    /**
     * @param startDate first service date to keep, null for no lower bound
     * @param endDate last service date to keep, null for no upper bound
     */
    public HistoricFerryNormalizer(LocalDate startDate, LocalDate endDate) {
        this.startDate = startDate;
        this.endDate = endDate;
    }

    @Override
    public SourceKind getSourceKind() {
        return SourceKind.HISTORIC_FERRY;
    }

    @Override
    protected SchemaVariant selectVariant(LocalDate serviceDate) {
        return SchemaVariant.select(SourceKind.HISTORIC_FERRY, serviceDate);
    }

    @Override
    protected void normalizeRow(ColumnBinding columns, String[] row, List<RawMovementRecord> output, ProcessingStats stats) {
        final String serviceDateValue = columns.get(row, SERVICE_DATE);
        if (serviceDateValue == null) {
            throw new IllegalArgumentException("Missing service date");
        }
        final LocalDate serviceDate = ServiceDates.parseDate(serviceDateValue);
        if ((startDate != null && serviceDate.isBefore(startDate)) || (endDate != null && serviceDate.isAfter(endDate))) {
            stats.increment(FaultKind.FILTERED_RECORD, "ferry-date-range");
            return;
        }

        final String actualDeparture = columns.get(row, ACTUAL_DEPARTURE);
        final String actualArrival = columns.get(row, ACTUAL_ARRIVAL);
        if (actualDeparture == null && actualArrival == null) {
            stats.increment(FaultKind.INVALID_RECORD, "ferry-missing-actual");
            return;
        }

        final String routeLabel = columns.get(row, ROUTE_ID);
        final String routeId = mapRoute(routeLabel);
        final String vehicleId = columns.get(row, VEHICLE_ID);
        String tripId = columns.get(row, TRIP_ID);
        if (tripId == null) {
            tripId = syntheticTripId(serviceDate, routeLabel, vehicleId, actualDeparture, actualArrival);
        }

        RawMovementRecord.Builder builder = RawMovementRecord.newBuilder()
                .setSourceKind(SourceKind.HISTORIC_FERRY)
                .setServiceDate(serviceDate)
                .setRouteId(routeId)
                .setTripId(tripId)
                .setDirectionId(parseTravelDirection(columns.get(row, DIRECTION_ID)))
                .setVehicleId(vehicleId);

        if (actualDeparture != null) {
            output.add(builder.setPointKind(PointKind.DEPARTURE)
                    .setStopId(mapTerminal(columns.get(row, DEPARTURE_TERMINAL)))
                    .setStopSequence(DEPARTURE_STOP_SEQUENCE)
                    .setTimestamp(NormalizerUtils.parseDateTime(actualDeparture, ServiceDates.EASTERN))
                    .build());
        }
        if (actualArrival != null) {
            output.add(builder.setPointKind(PointKind.ARRIVAL)
                    .setStopId(mapTerminal(columns.get(row, ARRIVAL_TERMINAL)))
                    .setStopSequence(ARRIVAL_STOP_SEQUENCE)
                    .setTimestamp(NormalizerUtils.parseDateTime(actualArrival, ServiceDates.EASTERN))
                    .build());
        }
    }

    static int parseTravelDirection(String travelDirection) {
        if ("To Boston".equalsIgnoreCase(travelDirection)) {
            return 1;
        }
        if ("From Boston".equalsIgnoreCase(travelDirection)) {
            return 0;
        }
        throw new IllegalArgumentException("Unknown travel direction " + travelDirection);
    }

    static String mapRoute(String routeLabel) {
        if (routeLabel == null) {
            return null;
        }
        String routeId = ROUTE_LABELS.get(routeLabel);
        if (routeId == null) {
            log.debug("No route id known for ferry label {}, keeping it as is", routeLabel);
            return routeLabel;
        }
        return routeId;
    }

    /**
     * @return stop id of the terminal, null if the terminal is unknown
     */
    static String mapTerminal(String terminal) {
        if (terminal == null) {
            return null;
        }
        String stopId = TERMINAL_STOPS.get(terminal);
        if (stopId == null) {
            log.debug("Unknown ferry terminal {}", terminal);
        }
        return stopId;
    }

    /**
     * Trip ids are missing from part of the ferry data. The generated id depends only on the leg itself,
     * so reprocessing the same file yields the same ids.
     */
    static String syntheticTripId(LocalDate serviceDate, String route, String vehicle, String departure, String arrival) {
        String name = String.join("|", String.valueOf(serviceDate), String.valueOf(route), String.valueOf(vehicle),
                String.valueOf(departure), String.valueOf(arrival));
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
