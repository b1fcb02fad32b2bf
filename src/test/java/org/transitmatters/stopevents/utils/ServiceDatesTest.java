package org.transitmatters.stopevents.utils;

import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.Assert.assertEquals;

public class ServiceDatesTest {

    @Test
    public void serviceDayStartsAtThreeAm() {
        assertEquals(LocalDate.of(2024, 2, 6), ServiceDates.serviceDate(LocalDateTime.of(2024, 2, 7, 2, 59)));
        assertEquals(LocalDate.of(2024, 2, 7), ServiceDates.serviceDate(LocalDateTime.of(2024, 2, 7, 3, 0)));
    }

    @Test
    public void currentServiceDateUsesEasternTime() {
        // 2024-02-07T06:30Z is 01:30 Eastern
        Clock clock = Clock.fixed(Instant.parse("2024-02-07T06:30:00Z"), ZoneOffset.UTC);
        assertEquals(LocalDate.of(2024, 2, 6), ServiceDates.currentServiceDate(clock));
    }

    @Test
    public void datesAreParsedInEitherForm() {
        assertEquals(LocalDate.of(2024, 2, 7), ServiceDates.parseDate("20240207"));
        assertEquals(LocalDate.of(2024, 2, 7), ServiceDates.parseDate("2024-02-07"));
        assertEquals(LocalDate.of(2024, 2, 7), ServiceDates.parseDate("2024-02-07 00:00:00+00:00"));
    }

    @Test
    public void dateIntsConvert() {
        assertEquals(20240207, ServiceDates.toDateInt(LocalDate.of(2024, 2, 7)));
        assertEquals(LocalDate.of(2023, 12, 31), ServiceDates.fromDateInt(20231231));
        assertEquals("2023-12-31", ServiceDates.formatDateInt(20231231));
    }
}
