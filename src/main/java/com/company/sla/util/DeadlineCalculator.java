package com.company.sla.util;

import com.company.sla.domain.SlaPolicy;
import com.company.sla.exception.InvalidPolicyException;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.Set;

/**
 * Converts a start time plus an SLA duration into an absolute deadline,
 * honouring the policy's business calendar when it asks for one.
 */
public final class DeadlineCalculator {

    public static final Set<DayOfWeek> DEFAULT_BUSINESS_DAYS = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);

    private static final long MILLIS_PER_HOUR = 3_600_000L;

    private DeadlineCalculator() {
    }

    public static Instant calculateDeadline(Instant startTime, BigDecimal hours, SlaPolicy policy) {
        if (hours == null) {
            throw new InvalidPolicyException("SLA duration is required for policy " + policy.getId());
        }
        return calculateDeadline(startTime, hours.doubleValue(), policy);
    }

    /**
     * @param startTime when the SLA clock starts
     * @param hours SLA duration, fractional hours allowed (2.5 = 2h 30m)
     * @param policy owner of the calendar rules
     * @return the instant at which the duration is used up
     */
    public static Instant calculateDeadline(Instant startTime, double hours, SlaPolicy policy) {
        if (startTime == null) {
            throw new IllegalArgumentException("Start time is required");
        }
        if (hours < 0) {
            throw new InvalidPolicyException("SLA duration must not be negative: " + hours);
        }

        if (!Boolean.TRUE.equals(policy.getBusinessHoursOnly())) {
            return startTime.plusMillis(Math.round(hours * MILLIS_PER_HOUR));
        }

        return walkBusinessCalendar(startTime, Math.round(hours * 60), policy);
    }

    /**
     * Each iteration either consumes all remaining minutes or moves {@code current}
     * to a later calendar day, so the loop ends after at most
     * (remaining / minutesPerBusinessDay + 1) business days plus the non-business days between them.
     */
    private static Instant walkBusinessCalendar(Instant startTime, long minutes, SlaPolicy policy) {
        int businessStart = businessHoursStart(policy);
        int businessEnd = businessHoursEnd(policy);
        Set<DayOfWeek> businessDays = businessDays(policy);
        validateCalendar(policy, businessStart, businessEnd, businessDays);

        ZonedDateTime current = startTime.atZone(zoneOf(policy));
        long remainingMinutes = minutes;

        while (remainingMinutes > 0) {
            if (!businessDays.contains(current.getDayOfWeek())) {
                current = nextDayStart(current, businessStart);
                continue;
            }

            int currentHour = current.getHour();

            if (currentHour < businessStart) {
                current = current.truncatedTo(ChronoUnit.DAYS).withHour(businessStart);
                continue;
            }

            if (currentHour >= businessEnd) {
                current = nextDayStart(current, businessStart);
                continue;
            }

            long minutesLeftToday = (long) (businessEnd - currentHour) * 60 - current.getMinute();

            if (remainingMinutes <= minutesLeftToday) {
                current = current.plusMinutes(remainingMinutes);
                remainingMinutes = 0;
            } else {
                remainingMinutes -= minutesLeftToday;
                current = nextDayStart(current, businessStart);
            }
        }

        return current.toInstant();
    }

    /**
     * Rejects a policy whose deadlines could not be computed: negative durations,
     * an unknown time zone, or a business calendar with no business minutes.
     */
    public static void validate(SlaPolicy policy) {
        if (isNegative(policy.getResponseTimeHours()) || isNegative(policy.getResolutionTimeHours())) {
            throw new InvalidPolicyException("SLA durations must not be negative");
        }
        try {
            zoneOf(policy);
        } catch (DateTimeException e) {
            throw new InvalidPolicyException("Unknown time zone: " + policy.getTimezone());
        }
        if (Boolean.TRUE.equals(policy.getBusinessHoursOnly())) {
            validateCalendar(policy, businessHoursStart(policy), businessHoursEnd(policy), businessDays(policy));
        }
    }

    private static boolean isNegative(BigDecimal hours) {
        return hours != null && hours.signum() < 0;
    }

    private static ZonedDateTime nextDayStart(ZonedDateTime current, int businessStart) {
        return current.plusDays(1).truncatedTo(ChronoUnit.DAYS).withHour(businessStart);
    }

    private static void validateCalendar(SlaPolicy policy, int start, int end, Set<DayOfWeek> days) {
        if (start < 0 || end > 24 || start >= end) {
            throw new InvalidPolicyException(String.format(
                    "Policy %s has invalid business hours %d-%d", policy.getId(), start, end));
        }
        if (days.isEmpty()) {
            throw new InvalidPolicyException("Policy " + policy.getId() + " has no business days");
        }
    }

    public static int businessHoursStart(SlaPolicy policy) {
        return policy.getBusinessHoursStart() != null
                ? policy.getBusinessHoursStart() : SlaPolicy.DEFAULT_BUSINESS_HOURS_START;
    }

    public static int businessHoursEnd(SlaPolicy policy) {
        return policy.getBusinessHoursEnd() != null
                ? policy.getBusinessHoursEnd() : SlaPolicy.DEFAULT_BUSINESS_HOURS_END;
    }

    public static Set<DayOfWeek> businessDays(SlaPolicy policy) {
        return policy.getBusinessDays() != null ? policy.getBusinessDays() : DEFAULT_BUSINESS_DAYS;
    }

    public static ZoneId zoneOf(SlaPolicy policy) {
        String timezone = policy.getTimezone();
        return ZoneId.of(timezone == null || timezone.isBlank() ? SlaPolicy.DEFAULT_TIMEZONE : timezone);
    }

    /**
     * Whole minutes from {@code from} to {@code to}, negative when {@code to} is earlier.
     */
    public static long minutesBetween(Instant from, Instant to) {
        return Math.floorDiv(to.toEpochMilli() - from.toEpochMilli(), 60_000L);
    }
}
