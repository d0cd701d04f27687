package com.coinledger.reporting;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Parsed dashboard/export query. Date bounds are inclusive UTC calendar days; asset and type match
 * case-insensitively. Null fields do not filter.
 */
public record ReportFilter(GroupBy groupBy, LocalDate startDate, LocalDate endDate, String asset, String type) {

    public static ReportFilter none() {
        return new ReportFilter(GroupBy.MONTH, null, null, null, null);
    }

    /**
     * @throws InvalidFilterException for unknown group_by, malformed dates, or a start after the end
     */
    public static ReportFilter of(String groupBy, String startDate, String endDate, String asset, String type) {
        LocalDate start = parseDate("start_date", startDate);
        LocalDate end = parseDate("end_date", endDate);
        if (start != null && end != null && start.isAfter(end)) {
            throw new InvalidFilterException("start_date " + start + " is after end_date " + end);
        }
        return new ReportFilter(GroupBy.parse(groupBy), start, end, blankToNull(asset), blankToNull(type));
    }

    public boolean inRange(Instant timestamp) {
        LocalDate day = timestamp.atZone(ZoneOffset.UTC).toLocalDate();
        return (startDate == null || !day.isBefore(startDate)) && (endDate == null || !day.isAfter(endDate));
    }

    public boolean matchesAsset(String value) {
        return asset == null || asset.equalsIgnoreCase(value);
    }

    public boolean matchesType(String value) {
        return type == null || type.equalsIgnoreCase(value);
    }

    private static LocalDate parseDate(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.strip());
        } catch (DateTimeParseException e) {
            throw new InvalidFilterException(name + " must be an ISO date (yyyy-MM-dd), got '" + value + "'");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip().toUpperCase(Locale.ROOT);
    }
}
