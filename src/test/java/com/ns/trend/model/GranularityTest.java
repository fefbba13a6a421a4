package com.ns.trend.model;

import com.ns.trend.exception.UnsupportedGranularityException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class GranularityTest {

    // Wednesday of ISO week 3
    private static final LocalDateTime SAMPLE = LocalDateTime.of(2025, 1, 15, 9, 37, 42);

    @ParameterizedTest
    @CsvSource({
        "minute, MINUTE",
        "HOUR, HOUR",
        "' Day ', DAY",
        "week, WEEK",
        "Month, MONTH",
        "year, YEAR"
    })
    void fromNameIgnoresCaseAndPadding(String name, Granularity expected) {
        assertEquals(expected, Granularity.fromName(name));
    }

    @Test
    void fromNameRejectsUnknownUnits() {
        UnsupportedGranularityException e = assertThrows(UnsupportedGranularityException.class,
                () -> Granularity.fromName("quarter"));
        assertEquals("quarter", e.getGranularity());
        assertEquals("Interval 'quarter' is not supported.", e.getMessage());

        UnsupportedGranularityException missing = assertThrows(UnsupportedGranularityException.class,
                () -> Granularity.fromName(null));
        assertNull(missing.getGranularity());
    }

    @Test
    void truncatesToBucketStart() {
        assertEquals(LocalDateTime.of(2025, 1, 15, 9, 37), Granularity.MINUTE.truncate(SAMPLE));
        assertEquals(LocalDateTime.of(2025, 1, 15, 9, 0), Granularity.HOUR.truncate(SAMPLE));
        assertEquals(LocalDate.of(2025, 1, 15).atStartOfDay(), Granularity.DAY.truncate(SAMPLE));
        assertEquals(LocalDate.of(2025, 1, 13).atStartOfDay(), Granularity.WEEK.truncate(SAMPLE));
        assertEquals(LocalDate.of(2025, 1, 1).atStartOfDay(), Granularity.MONTH.truncate(SAMPLE));
        assertEquals(LocalDate.of(2025, 1, 1).atStartOfDay(), Granularity.YEAR.truncate(SAMPLE));
    }

    @Test
    void weekTruncationCrossesYearBoundary() {
        LocalDateTime newYearsDay = LocalDate.of(2025, 1, 1).atStartOfDay();
        assertEquals(LocalDate.of(2024, 12, 30).atStartOfDay(), Granularity.WEEK.truncate(newYearsDay));

        LocalDateTime monday = LocalDate.of(2025, 1, 6).atTime(23, 59);
        assertEquals(LocalDate.of(2025, 1, 6).atStartOfDay(), Granularity.WEEK.truncate(monday));
    }

    @Test
    void nextAdvancesOneCalendarUnit() {
        LocalDateTime jan31 = LocalDate.of(2025, 1, 31).atStartOfDay();
        assertEquals(jan31.plusMinutes(1), Granularity.MINUTE.next(jan31));
        assertEquals(jan31.plusHours(1), Granularity.HOUR.next(jan31));
        assertEquals(LocalDate.of(2025, 2, 1).atStartOfDay(), Granularity.DAY.next(jan31));
        assertEquals(LocalDate.of(2025, 2, 7).atStartOfDay(), Granularity.WEEK.next(jan31));
        assertEquals(LocalDate.of(2025, 2, 1).atStartOfDay(), Granularity.MONTH.next(LocalDate.of(2025, 1, 1).atStartOfDay()));
        assertEquals(LocalDate.of(2026, 1, 1).atStartOfDay(), Granularity.YEAR.next(LocalDate.of(2025, 1, 1).atStartOfDay()));
    }

    @Test
    void formatsCanonicalBucketText() {
        assertEquals("2025-01-15 09:37:00", Granularity.MINUTE.format(SAMPLE));
        assertEquals("2025-01-15 09:00", Granularity.HOUR.format(SAMPLE));
        assertEquals("2025-01-15", Granularity.DAY.format(SAMPLE));
        assertEquals("2025-03", Granularity.WEEK.format(SAMPLE));
        assertEquals("2025-01", Granularity.MONTH.format(SAMPLE));
        assertEquals("2025", Granularity.YEAR.format(SAMPLE));
    }

    @Test
    void weekTextUsesIsoWeekBasedYear() {
        assertEquals("2025-01", Granularity.WEEK.format(LocalDate.of(2024, 12, 30).atStartOfDay()));
        assertEquals("2020-53", Granularity.WEEK.format(LocalDate.of(2021, 1, 1).atStartOfDay()));
        assertEquals("2026-53", Granularity.WEEK.format(LocalDate.of(2027, 1, 3).atStartOfDay()));
    }

    @Test
    void toStringIsUnitName() {
        assertEquals("week", Granularity.WEEK.toString());
        assertEquals("YYYY-WW", Granularity.WEEK.getCanonicalFormat());
    }
}
