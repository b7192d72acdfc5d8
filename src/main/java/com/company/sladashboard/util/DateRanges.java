package com.company.sladashboard.util;

import com.company.sladashboard.domain.enums.PredefinedRange;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Date range helpers for dashboard queries. Dashboard days are UTC days.
 */
public class DateRanges {

    public static final ZoneId DASHBOARD_ZONE = ZoneOffset.UTC;

    private DateRanges() {
    }

    public static LocalDate today(Clock clock) {
        return LocalDate.now(clock.withZone(DASHBOARD_ZONE));
    }

    /**
     * Classify an inclusive {@code [start, end]} range against the preset ranges.
     *
     * @param defaultRangeDays length of the precomputed range, in days ending today
     * @return the preset the range matches exactly, or {@link PredefinedRange#CUSTOM}
     */
    public static PredefinedRange classify(LocalDate start, LocalDate end, LocalDate today, int defaultRangeDays) {
        if (start == null || end == null) {
            return PredefinedRange.LAST_30_DAYS;
        }

        if (start.equals(today) && end.equals(today)) {
            return PredefinedRange.TODAY;
        }

        LocalDate yesterday = today.minusDays(1);
        if (start.equals(yesterday) && end.equals(yesterday)) {
            return PredefinedRange.YESTERDAY;
        }

        if (!end.equals(today)) {
            return PredefinedRange.CUSTOM;
        }

        // Day-count presets win over "this month" when both describe the same days
        if (start.equals(today.minusDays(6))) {
            return PredefinedRange.LAST_7_DAYS;
        }
        if (start.equals(today.minusDays(defaultRangeDays - 1L))) {
            return PredefinedRange.LAST_30_DAYS;
        }
        if (start.equals(today.withDayOfMonth(1))) {
            return PredefinedRange.THIS_MONTH;
        }

        return PredefinedRange.CUSTOM;
    }

    /**
     * Start date of the default range ending today.
     */
    public static LocalDate defaultRangeStart(LocalDate today, int defaultRangeDays) {
        return today.minusDays(defaultRangeDays - 1L);
    }
}
