package com.example.routex.service.schedule;

import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Pure next-fire-time computation for one schedule.
 */
public sealed interface ScheduleTrigger {

    /**
     * @param anchor the instant the schedule was armed
     * @param now    current instant
     * @return the first fire time strictly after {@code now}, or {@code null} if the trigger never fires again
     */
    Instant nextFireTime(Instant anchor, Instant now);

    /**
     * Cron expression evaluated in a fixed zone, so daylight-saving shifts follow local wall-clock time.
     */
    record Cron(CronExpression expression, ZoneId zone) implements ScheduleTrigger {

        @Override
        public Instant nextFireTime(Instant anchor, Instant now) {
            ZonedDateTime next = expression.next(now.atZone(zone));
            return next == null ? null : next.toInstant();
        }
    }

    /**
     * Fixed period counted from the arm time: fires at {@code anchor + k * period}, k >= 1.
     */
    record Interval(Duration period) implements ScheduleTrigger {

        public Interval {
            if (period == null || period.isZero() || period.isNegative()) {
                throw new IllegalArgumentException("Interval period must be positive, got " + period);
            }
        }

        @Override
        public Instant nextFireTime(Instant anchor, Instant now) {
            if (now.isBefore(anchor)) {
                return anchor.plus(period);
            }
            long periodMillis = period.toMillis();
            long elapsedMillis = Duration.between(anchor, now).toMillis();
            long periodsElapsed = elapsedMillis / periodMillis;
            return anchor.plus(period.multipliedBy(periodsElapsed + 1));
        }
    }
}
