package org.transitmatters.stopevents.utils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Helpers for working with service dates. A service day starts at 03:00 Eastern time,
 * so anything before that belongs to the previous day's service.
 */
public class ServiceDates {
    private ServiceDates() {}

    public static final ZoneId EASTERN = ZoneId.of("America/New_York");

    public static final int SERVICE_DAY_START_HOUR = 3;

    public static LocalDate serviceDate(ZonedDateTime time) {
        return serviceDate(time.withZoneSameInstant(EASTERN).toLocalDateTime());
    }

    /**
     * @param localTime wall-clock time in Eastern time
     */
    public static LocalDate serviceDate(LocalDateTime localTime) {
        if (localTime.getHour() < SERVICE_DAY_START_HOUR) {
            return localTime.toLocalDate().minusDays(1);
        }
        return localTime.toLocalDate();
    }

    public static LocalDate currentServiceDate(Clock clock) {
        return serviceDate(ZonedDateTime.now(clock));
    }

    public static int toDateInt(LocalDate date) {
        return date.getYear() * 10000 + date.getMonthValue() * 100 + date.getDayOfMonth();
    }

    public static LocalDate fromDateInt(int dateInt) {
        return LocalDate.of(dateInt / 10000, (dateInt / 100) % 100, dateInt % 100);
    }

    /**
     * Parses a dateint such as 20240207, also accepting the ISO form 2024-02-07.
     */
    public static LocalDate parseDate(String value) {
        String trimmed = value.trim();
        if (trimmed.length() == 8 && trimmed.chars().allMatch(Character::isDigit)) {
            return LocalDate.parse(trimmed, DateTimeFormatter.BASIC_ISO_DATE);
        }
        // "2024-02-07 00:00:00+00:00" style timestamps only carry the date in their first ten characters
        return LocalDate.parse(trimmed.length() > 10 ? trimmed.substring(0, 10) : trimmed);
    }

    public static String formatDateInt(int dateInt) {
        return fromDateInt(dateInt).format(DateTimeFormatter.ISO_LOCAL_DATE);
    }
}
