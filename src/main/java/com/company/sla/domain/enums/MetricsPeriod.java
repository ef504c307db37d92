package com.company.sla.domain.enums;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

public enum MetricsPeriod {
    DAILY,
    WEEKLY,
    MONTHLY;

    /**
     * Start of the reporting window containing {@code now}. Weeks start on Sunday.
     */
    public ZonedDateTime windowStart(ZonedDateTime now) {
        ZonedDateTime midnight = now.truncatedTo(ChronoUnit.DAYS);
        switch (this) {
            case DAILY:
                return midnight;
            case WEEKLY:
                return midnight.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
            case MONTHLY:
            default:
                return midnight.withDayOfMonth(1);
        }
    }

    public static MetricsPeriod fromString(String period) {
        if (period == null) {
            return MONTHLY;
        }
        try {
            return MetricsPeriod.valueOf(period.toUpperCase());
        } catch (IllegalArgumentException e) {
            return MONTHLY;
        }
    }
}
