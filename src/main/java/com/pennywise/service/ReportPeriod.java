package com.pennywise.service;

import com.pennywise.exception.LedgerValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive whole-day reporting window.
 *
 * Bounds accept {@code YYYY-MM} or {@code YYYY-MM-DD}. A month-only start means the
 * first day of that month, a month-only end means its last day. A missing bound is open.
 * Days are interpreted in the reporting time zone.
 */
public final class ReportPeriod {

    private static final Instant OPEN_START = Instant.EPOCH;
    private static final Instant OPEN_END = Instant.parse("3000-01-01T00:00:00Z");

    private final LocalDate startDate;
    private final LocalDate endDate;
    private final Instant from;
    private final Instant to;

    private ReportPeriod(LocalDate startDate, LocalDate endDate, ZoneId zone) {
        this.startDate = startDate;
        this.endDate = endDate;
        this.from = startDate == null ? OPEN_START : startDate.atStartOfDay(zone).toInstant();
        // timestamps are stored with microsecond precision
        this.to = endDate == null
                ? OPEN_END
                : endDate.plusDays(1).atStartOfDay(zone).toInstant().minus(1, ChronoUnit.MICROS);
    }

    /**
     * @throws LedgerValidationException if a bound is malformed or start is after end
     */
    public static ReportPeriod parse(String start, String end, ZoneId zone) {
        LocalDate startDate = parseBound(start, "start", false);
        LocalDate endDate = parseBound(end, "end", true);
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new LedgerValidationException("start", "start cannot be after end");
        }
        return new ReportPeriod(startDate, endDate, zone);
    }

    public static ReportPeriod month(YearMonth month, ZoneId zone) {
        return new ReportPeriod(month.atDay(1), month.atEndOfMonth(), zone);
    }

    public static ReportPeriod unbounded() {
        return new ReportPeriod(null, null, ZoneId.of("UTC"));
    }

    private static LocalDate parseBound(String value, String field, boolean endOfMonth) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.strip();
        try {
            if (trimmed.length() == 7) {
                YearMonth month = YearMonth.parse(trimmed);
                return endOfMonth ? month.atEndOfMonth() : month.atDay(1);
            }
            return LocalDate.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new LedgerValidationException(field,
                    "Invalid " + field + " '" + trimmed + "'. Use YYYY-MM or YYYY-MM-DD");
        }
    }

    /** First day, or null when open. */
    public LocalDate getStartDate() {
        return startDate;
    }

    /** Last day, or null when open. */
    public LocalDate getEndDate() {
        return endDate;
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    @Override
    public String toString() {
        return "ReportPeriod{" + startDate + ".." + endDate + '}';
    }
}
