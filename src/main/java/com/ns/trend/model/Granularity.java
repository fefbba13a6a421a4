package com.ns.trend.model;

import com.ns.trend.exception.UnsupportedGranularityException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Time-bucket size of a trend. This is the single table of granularity semantics: bucket
 * truncation, the calendar increment between buckets and the canonical bucket text that every
 * dialect expression computes.
 *
 * Weeks follow ISO-8601 everywhere: they start on Monday and belong to the ISO week-based year.
 */
public enum Granularity {
    MINUTE("minute", "yyyy-MM-dd HH:mm:00"),
    HOUR("hour", "yyyy-MM-dd HH:00"),
    DAY("day", "yyyy-MM-dd"),
    WEEK("week", "YYYY-WW"),
    MONTH("month", "yyyy-MM"),
    YEAR("year", "yyyy");

    private final String unitName;
    private final String canonicalFormat;

    Granularity(String unitName, String canonicalFormat) {
        this.unitName = unitName;
        this.canonicalFormat = canonicalFormat;
    }

    public String getUnitName() {
        return unitName;
    }

    /**
     * Human-readable shape of the bucket text, e.g. {@code yyyy-MM} for months.
     */
    public String getCanonicalFormat() {
        return canonicalFormat;
    }

    /**
     * Returns the start of the bucket containing {@code timestamp}.
     */
    public LocalDateTime truncate(LocalDateTime timestamp) {
        switch (this) {
            case MINUTE:
                return timestamp.truncatedTo(ChronoUnit.MINUTES);
            case HOUR:
                return timestamp.truncatedTo(ChronoUnit.HOURS);
            case DAY:
                return timestamp.truncatedTo(ChronoUnit.DAYS);
            case WEEK:
                return timestamp.toLocalDate()
                        .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                        .atStartOfDay();
            case MONTH:
                return timestamp.toLocalDate().withDayOfMonth(1).atStartOfDay();
            case YEAR:
                return LocalDate.of(timestamp.getYear(), 1, 1).atStartOfDay();
            default:
                throw new UnsupportedGranularityException(unitName);
        }
    }

    /**
     * Returns the start of the bucket following the one starting at {@code bucketStart}.
     */
    public LocalDateTime next(LocalDateTime bucketStart) {
        switch (this) {
            case MINUTE:
                return bucketStart.plusMinutes(1);
            case HOUR:
                return bucketStart.plusHours(1);
            case DAY:
                return bucketStart.plusDays(1);
            case WEEK:
                return bucketStart.plusDays(7);
            case MONTH:
                return bucketStart.plusMonths(1);
            case YEAR:
                return bucketStart.plusYears(1);
            default:
                throw new UnsupportedGranularityException(unitName);
        }
    }

    /**
     * Formats the bucket containing {@code timestamp} as canonical bucket text.
     */
    public String format(LocalDateTime timestamp) {
        switch (this) {
            case MINUTE:
                return String.format(Locale.ROOT, "%04d-%02d-%02d %02d:%02d:00",
                        timestamp.getYear(), timestamp.getMonthValue(), timestamp.getDayOfMonth(),
                        timestamp.getHour(), timestamp.getMinute());
            case HOUR:
                return String.format(Locale.ROOT, "%04d-%02d-%02d %02d:00",
                        timestamp.getYear(), timestamp.getMonthValue(), timestamp.getDayOfMonth(),
                        timestamp.getHour());
            case DAY:
                return String.format(Locale.ROOT, "%04d-%02d-%02d",
                        timestamp.getYear(), timestamp.getMonthValue(), timestamp.getDayOfMonth());
            case WEEK:
                return String.format(Locale.ROOT, "%04d-%02d",
                        timestamp.get(IsoFields.WEEK_BASED_YEAR), timestamp.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case MONTH:
                return String.format(Locale.ROOT, "%04d-%02d", timestamp.getYear(), timestamp.getMonthValue());
            case YEAR:
                return String.format(Locale.ROOT, "%04d", timestamp.getYear());
            default:
                throw new UnsupportedGranularityException(unitName);
        }
    }

    /**
     * Parse granularity from unit string (case-insensitive).
     *
     * @throws UnsupportedGranularityException for anything but the six known units
     */
    public static Granularity fromName(String unit) {
        if (unit == null) {
            throw new UnsupportedGranularityException(null);
        }

        String normalizedUnit = unit.toLowerCase(Locale.ROOT).trim();
        switch (normalizedUnit) {
            case "minute": return MINUTE;
            case "hour": return HOUR;
            case "day": return DAY;
            case "week": return WEEK;
            case "month": return MONTH;
            case "year": return YEAR;
            default:
                throw new UnsupportedGranularityException(unit);
        }
    }

    @Override
    public String toString() {
        return unitName;
    }
}
