package com.ns.trend.model;

import com.ns.trend.exception.UnsupportedGranularityException;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A time bucket at a given granularity, used as the grouping key of a trend.
 *
 * All five calendar components are captured; only the ones significant at the granularity take
 * part in equality. Two week periods are equal when they fall in the same ISO week.
 */
public final class Period implements Comparable<Period> {
    private static final Pattern WEEK_TEXT = Pattern.compile("^(?<year>\\d{4})-(?<week>\\d{2})$");

    private final int year;
    private final int month;
    private final int day;
    private final int hour;
    private final int minute;
    private final Granularity granularity;

    public Period(int year, int month, int day, int hour, int minute, Granularity granularity) {
        this.year = year;
        this.month = month;
        this.day = day;
        this.hour = hour;
        this.minute = minute;
        this.granularity = Objects.requireNonNull(granularity, "granularity is null");
    }

    public Period(int year, int month, int day, int hour, int minute, String granularity) {
        this(year, month, day, hour, minute, Granularity.fromName(granularity));
    }

    public static Period of(LocalDateTime timestamp, Granularity granularity) {
        Objects.requireNonNull(timestamp, "timestamp is null");
        return new Period(timestamp.getYear(), timestamp.getMonthValue(), timestamp.getDayOfMonth(),
                timestamp.getHour(), timestamp.getMinute(), granularity);
    }

    /**
     * Reads canonical bucket text (as produced by {@link #format()} or by any dialect's
     * truncation expression) back into a period.
     *
     * @throws IllegalArgumentException if the text does not have the granularity's shape
     */
    public static Period parse(String text, Granularity granularity) {
        Objects.requireNonNull(text, "text is null");
        Objects.requireNonNull(granularity, "granularity is null");
        String trimmed = text.trim();
        try {
            switch (granularity) {
                case MINUTE:
                    return of(LocalDateTime.parse(trimmed.replace(' ', 'T')), granularity);
                case HOUR:
                    return of(LocalDateTime.parse(trimmed.replace(' ', 'T') + ":00"), granularity);
                case DAY:
                    return of(LocalDate.parse(trimmed).atStartOfDay(), granularity);
                case WEEK:
                    return parseWeek(trimmed);
                case MONTH:
                    return of(LocalDate.parse(trimmed + "-01").atStartOfDay(), granularity);
                case YEAR:
                    return new Period(Integer.parseInt(trimmed), 1, 1, 0, 0, granularity);
                default:
                    throw new UnsupportedGranularityException(granularity.getUnitName());
            }
        } catch (DateTimeException | NumberFormatException e) {
            throw new IllegalArgumentException(
                    "'" + text + "' is not a " + granularity + " bucket (" + granularity.getCanonicalFormat() + ")", e);
        }
    }

    private static Period parseWeek(String text) {
        Matcher matcher = WEEK_TEXT.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                    "'" + text + "' is not a week bucket (" + Granularity.WEEK.getCanonicalFormat() + ")");
        }
        int weekYear = Integer.parseInt(matcher.group("year"));
        int week = Integer.parseInt(matcher.group("week"));
        // Jan 4th always lies in ISO week 1
        LocalDate monday = LocalDate.of(weekYear, 1, 4)
                .with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, week)
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return of(monday.atStartOfDay(), Granularity.WEEK);
    }

    public int getYear() {
        return year;
    }

    public int getMonth() {
        return month;
    }

    public int getDay() {
        return day;
    }

    public int getHour() {
        return hour;
    }

    public int getMinute() {
        return minute;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    /**
     * Converts this period to the timestamp of its bucket start. Week periods map to the Monday
     * of their ISO week.
     */
    public LocalDateTime toTimestamp() {
        switch (granularity) {
            case MINUTE:
                return LocalDateTime.of(year, month, day, hour, minute, 0);
            case HOUR:
                return LocalDateTime.of(year, month, day, hour, 0, 0);
            case DAY:
                return LocalDate.of(year, month, day).atStartOfDay();
            case WEEK:
                return Granularity.WEEK.truncate(LocalDate.of(year, month, day).atStartOfDay());
            case MONTH:
                return LocalDate.of(year, month, 1).atStartOfDay();
            case YEAR:
                return LocalDate.of(year, 1, 1).atStartOfDay();
            default:
                throw new UnsupportedGranularityException(granularity.getUnitName());
        }
    }

    /**
     * Canonical bucket text, e.g. {@code 2025-01-15 09:00} for an hour or {@code 2025-03} for
     * the third ISO week of 2025.
     */
    public String format() {
        return granularity.format(toTimestamp());
    }

    @Override
    public int compareTo(Period other) {
        return toTimestamp().compareTo(other.toTimestamp());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Period)) return false;
        Period other = (Period) o;
        if (granularity != other.granularity) return false;

        switch (granularity) {
            case MINUTE:
                return year == other.year && month == other.month && day == other.day
                        && hour == other.hour && minute == other.minute;
            case HOUR:
                return year == other.year && month == other.month && day == other.day && hour == other.hour;
            case DAY:
                return year == other.year && month == other.month && day == other.day;
            case WEEK:
                return weekStart().equals(other.weekStart());
            case MONTH:
                return year == other.year && month == other.month;
            case YEAR:
                return year == other.year;
            default:
                return false;
        }
    }

    @Override
    public int hashCode() {
        switch (granularity) {
            case MINUTE:
                return Objects.hash(granularity, year, month, day, hour, minute);
            case HOUR:
                return Objects.hash(granularity, year, month, day, hour);
            case DAY:
                return Objects.hash(granularity, year, month, day);
            case WEEK:
                return Objects.hash(granularity, weekStart());
            case MONTH:
                return Objects.hash(granularity, year, month);
            case YEAR:
                return Objects.hash(granularity, year);
            default:
                return 0;
        }
    }

    private LocalDate weekStart() {
        return LocalDate.of(year, month, day).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    @Override
    public String toString() {
        return granularity + ":" + format();
    }
}
