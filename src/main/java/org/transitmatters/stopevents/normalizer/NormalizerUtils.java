package org.transitmatters.stopevents.normalizer;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

public class NormalizerUtils {
    private NormalizerUtils() {}

    // 2024-02-07 08:02:00, 2024-02-07T08:02:00.123, 2024-02-07 08:02:00+00:00, 2024-02-07T08:02:00Z
    static final DateTimeFormatter FLEXIBLE_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .toFormatter();

    /**
     * Parses integers that may have been written as floats, e.g. "10.0".
     *
     * @return null for a null value
     */
    public static Integer parseInteger(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            double d = Double.parseDouble(value);
            if (d != Math.rint(d)) {
                throw new NumberFormatException("Not an integer: " + value);
            }
            return (int) d;
        }
    }

    public static long parseEpochSeconds(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return (long) Double.parseDouble(value);
        }
    }

    /**
     * Accepts 0/1 as well as the boolean encoding false/true.
     */
    public static int parseDirectionId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Missing direction");
        }
        if ("true".equalsIgnoreCase(value)) {
            return 1;
        }
        if ("false".equalsIgnoreCase(value)) {
            return 0;
        }
        int direction = parseInteger(value);
        if (direction != 0 && direction != 1) {
            throw new IllegalArgumentException("Invalid direction " + value);
        }
        return direction;
    }

    public static String stripLeadingZeros(String routeId) {
        if (routeId == null) {
            return null;
        }
        int i = 0;
        while (i < routeId.length() - 1 && routeId.charAt(i) == '0') {
            i++;
        }
        return routeId.substring(i);
    }

    /**
     * Parses a date-time. Values carrying an offset are converted to the zone, values without one
     * are taken as wall-clock time in the zone.
     */
    public static ZonedDateTime parseDateTime(String value, ZoneId zone) {
        TemporalAccessor parsed = FLEXIBLE_DATE_TIME.parse(value);
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return OffsetDateTime.from(parsed).atZoneSameInstant(zone);
        }
        return LocalDateTime.from(parsed).atZone(zone);
    }
}
