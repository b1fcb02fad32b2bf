package org.transitmatters.stopevents.normalizer;

import com.google.common.collect.ImmutableSet;
import org.transitmatters.stopevents.application.FaultKind;
import org.transitmatters.stopevents.application.ProcessingStats;
import org.transitmatters.stopevents.models.PointKind;
import org.transitmatters.stopevents.models.RawMovementRecord;
import org.transitmatters.stopevents.models.SourceKind;
import org.transitmatters.stopevents.utils.ServiceDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.transitmatters.stopevents.normalizer.SourceField.*;

/**
 * Normalizes historic bus timepoint data.
 * <p>
 * Actual times are published on a fixed 1900-01-0N base date, where N-1 is the number of days after the
 * service date. Up to the UTC cutover the time is Eastern wall-clock even when suffixed with Z,
 * from the cutover on it is UTC.
 */
public class HistoricBusNormalizer extends AbstractSourceNormalizer {
    private static final Logger log = LoggerFactory.getLogger(HistoricBusNormalizer.class);

    public static final LocalDate DEFAULT_UTC_CUTOVER = LocalDate.of(2024, 6, 1);

    static final String BASE_DATE_TIME_REGEX = "^1900-01-(\\d{2})[ T](\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?)(Z|[+-]\\d{2}:?\\d{2})?$";
    static final Pattern BASE_DATE_TIME_PATTERN = Pattern.compile(BASE_DATE_TIME_REGEX);

    private final LocalDate utcCutover;
    private final ImmutableSet<String> routeFilter;

    public HistoricBusNormalizer() {
        this(DEFAULT_UTC_CUTOVER, ImmutableSet.of());
    }

    /**
     * @param routes routes to keep, after leading zeros are stripped. Empty keeps all routes.
     */
    public HistoricBusNormalizer(LocalDate utcCutover, Collection<String> routes) {
        this.utcCutover = utcCutover;
        this.routeFilter = ImmutableSet.copyOf(routes);
    }

    @Override
    public SourceKind getSourceKind() {
        return SourceKind.HISTORIC_BUS;
    }

    @Override
    protected SchemaVariant selectVariant(LocalDate serviceDate) {
        return SchemaVariant.select(SourceKind.HISTORIC_BUS, serviceDate);
    }

    @Override
    protected void normalizeRow(ColumnBinding columns, String[] row, List<RawMovementRecord> output, ProcessingStats stats) {
        final String routeId = NormalizerUtils.stripLeadingZeros(columns.get(row, ROUTE_ID));
        if (!routeFilter.isEmpty() && !routeFilter.contains(routeId)) {
            stats.increment(FaultKind.FILTERED_RECORD, "bus-route");
            return;
        }

        final String actual = columns.get(row, ACTUAL);
        if (actual == null) {
            stats.increment(FaultKind.INVALID_RECORD, "bus-missing-actual");
            return;
        }

        final String serviceDateValue = columns.get(row, SERVICE_DATE);
        if (serviceDateValue == null) {
            throw new IllegalArgumentException("Missing service date");
        }
        final LocalDate serviceDate = ServiceDates.parseDate(serviceDateValue);

        output.add(RawMovementRecord.newBuilder()
                .setSourceKind(SourceKind.HISTORIC_BUS)
                .setServiceDate(serviceDate)
                .setRouteId(routeId)
                .setTripId(columns.get(row, TRIP_ID))
                .setDirectionId(parseDirection(columns.get(row, DIRECTION_ID)))
                .setStopId(columns.get(row, STOP_ID))
                .setStopSequence(NormalizerUtils.parseInteger(columns.get(row, STOP_SEQUENCE)))
                .setPointKind(parsePointType(columns.get(row, POINT_TYPE)))
                .setTimestamp(parseActual(actual, serviceDate))
                .build());
    }

    static int parseDirection(String direction) {
        if ("Inbound".equalsIgnoreCase(direction)) {
            return 1;
        }
        if ("Outbound".equalsIgnoreCase(direction)) {
            return 0;
        }
        throw new IllegalArgumentException("Unknown bus direction " + direction);
    }

    static PointKind parsePointType(String pointType) {
        if ("Startpoint".equalsIgnoreCase(pointType)) {
            return PointKind.STARTPOINT;
        }
        if ("Midpoint".equalsIgnoreCase(pointType)) {
            return PointKind.MIDPOINT;
        }
        if ("Endpoint".equalsIgnoreCase(pointType)) {
            return PointKind.ENDPOINT;
        }
        throw new IllegalArgumentException("Unknown point type " + pointType);
    }

    ZonedDateTime parseActual(String actual, LocalDate serviceDate) {
        Matcher matcher = BASE_DATE_TIME_PATTERN.matcher(actual);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Unexpected timepoint time " + actual);
        }
        final int dayOffset = Integer.parseInt(matcher.group(1)) - 1;
        final LocalDateTime wallClock = serviceDate.plusDays(dayOffset).atTime(LocalTime.parse(matcher.group(2)));

        if (serviceDate.isBefore(utcCutover)) {
            if (matcher.group(3) != null) {
                log.trace("Ignoring zone designator of {} before UTC cutover", actual);
            }
            return wallClock.atZone(ServiceDates.EASTERN);
        }
        return wallClock.atOffset(ZoneOffset.UTC).atZoneSameInstant(ServiceDates.EASTERN);
    }
}
