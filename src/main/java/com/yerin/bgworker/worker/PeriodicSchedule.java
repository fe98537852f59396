package com.yerin.bgworker.worker;

import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

public final class PeriodicSchedule {
    private PeriodicSchedule() {}

    /**
     * @throws IllegalArgumentException if the expression is not a valid cron expression
     */
    public static String normalize(String schedule) {
        if (schedule == null) throw new IllegalArgumentException("Cron schedule must not be null");
        String normalized = schedule.trim().replaceAll("\\s+", " ");
        CronExpression.parse(normalized);
        return normalized;
    }

    /**
     * Time from {@code now} until the schedule next fires, never negative. A schedule without a
     * future fire time yields zero.
     */
    public static Duration nextRunDelay(String schedule, Instant now) {
        ZonedDateTime next = CronExpression.parse(schedule).next(now.atZone(ZoneOffset.UTC));
        if (next == null) return Duration.ZERO;
        Duration delay = Duration.between(now, next.toInstant());
        return delay.isNegative() ? Duration.ZERO : delay;
    }
}
