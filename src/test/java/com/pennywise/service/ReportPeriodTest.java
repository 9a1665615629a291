package com.pennywise.service;

import com.pennywise.exception.LedgerValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.*;

class ReportPeriodTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test @DisplayName("month-only bounds → first day of start month to last day of end month")
    void monthBounds() {
        ReportPeriod period = ReportPeriod.parse("2024-01", "2024-02", UTC);

        assertThat(period.getStartDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(period.getEndDate()).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(period.getFrom()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(period.getTo()).isEqualTo(Instant.parse("2024-02-29T23:59:59.999999Z"));
    }

    @Test @DisplayName("full dates → inclusive whole days")
    void dayBounds() {
        ReportPeriod period = ReportPeriod.parse("2024-03-05", "2024-03-05", UTC);

        assertThat(period.getFrom()).isEqualTo(Instant.parse("2024-03-05T00:00:00Z"));
        assertThat(period.getTo()).isAfter(Instant.parse("2024-03-05T23:59:59Z"));
        assertThat(period.getTo()).isBefore(Instant.parse("2024-03-06T00:00:00Z"));
    }

    @Test @DisplayName("missing bounds → open period")
    void openBounds() {
        ReportPeriod period = ReportPeriod.parse(null, " ", UTC);

        assertThat(period.getStartDate()).isNull();
        assertThat(period.getEndDate()).isNull();
        assertThat(period.getFrom()).isEqualTo(Instant.EPOCH);
        assertThat(period.getTo()).isAfter(Instant.parse("2999-12-31T00:00:00Z"));
    }

    @Test @DisplayName("days are interpreted in the reporting zone")
    void zoneAware() {
        ReportPeriod period = ReportPeriod.parse("2024-06-01", null, ZoneId.of("Europe/Berlin"));

        assertThat(period.getFrom()).isEqualTo(Instant.parse("2024-05-31T22:00:00Z"));
    }

    @Test @DisplayName("month(YearMonth) covers the calendar month")
    void monthFactory() {
        ReportPeriod period = ReportPeriod.month(YearMonth.of(2023, 4), UTC);

        assertThat(period.getStartDate()).isEqualTo(LocalDate.of(2023, 4, 1));
        assertThat(period.getEndDate()).isEqualTo(LocalDate.of(2023, 4, 30));
    }

    @Test @DisplayName("start after end → validation error")
    void startAfterEnd() {
        assertThatThrownBy(() -> ReportPeriod.parse("2024-05", "2024-04", UTC))
                .isInstanceOf(LedgerValidationException.class)
                .hasMessageContaining("start cannot be after end");
    }

    @Test @DisplayName("malformed date → validation error naming the format")
    void malformed() {
        assertThatThrownBy(() -> ReportPeriod.parse("2024/01", null, UTC))
                .isInstanceOf(LedgerValidationException.class)
                .hasMessageContaining("Use YYYY-MM or YYYY-MM-DD");
        assertThatThrownBy(() -> ReportPeriod.parse(null, "2024-13-01", UTC))
                .isInstanceOf(LedgerValidationException.class)
                .hasMessageContaining("Invalid end");
    }
}
