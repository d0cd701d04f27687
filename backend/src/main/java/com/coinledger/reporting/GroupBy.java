package com.coinledger.reporting;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Bucket size for gains-by-period. Weeks are ISO weeks starting on Monday.
 */
public enum GroupBy {
    DAY,
    WEEK,
    MONTH,
    YEAR;

    public static GroupBy parse(String value) {
        if (value == null || value.isBlank()) {
            return MONTH;
        }
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterException("group_by must be one of day, week, month, year; got '" + value + "'");
        }
    }

    /** First day of the bucket containing {@code date}. */
    public LocalDate periodStart(LocalDate date) {
        return switch (this) {
            case DAY -> date;
            case WEEK -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> date.withDayOfMonth(1);
            case YEAR -> date.withDayOfYear(1);
        };
    }

    /** {@code 2024-01-05}, {@code 2024-W01}, {@code 2024-01} or {@code 2024}. */
    public String label(LocalDate periodStart) {
        return switch (this) {
            case DAY -> periodStart.toString();
            case WEEK -> String.format(Locale.ROOT, "%d-W%02d",
                    periodStart.get(IsoFields.WEEK_BASED_YEAR), periodStart.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case MONTH -> String.format(Locale.ROOT, "%d-%02d", periodStart.getYear(), periodStart.getMonthValue());
            case YEAR -> Integer.toString(periodStart.getYear());
        };
    }
}
