package me.golemcore.scheduler.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.scheduler.domain.exception.ValidationException;
import me.golemcore.scheduler.domain.model.JobSchedule;
import me.golemcore.scheduler.domain.model.ScheduleUnit;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.regex.Pattern;

/**
 * Computes fire times for both schedule variants and validates schedules.
 *
 * <p>
 * Interval schedules advance on a fixed grid anchored at the previous firing
 * time, never at completion time, so execution latency does not drift the
 * schedule. Firings missed while the process was down (or while a run took
 * longer than the interval) are coalesced into the next grid point after
 * {@code now}. Calendar arithmetic ({@code at}, months, cron) happens in the
 * configured zone.
 */
@Service
public class ScheduleCalculator {

    private static final int CRON_FIVE_FIELDS = 5;
    private static final Pattern TIME_OF_DAY = Pattern.compile("\\d{1,2}:\\d{2}");

    private final ZoneId zone;

    public ScheduleCalculator(SchedulerProperties properties) {
        this(ZoneId.of(properties.getLoop().getZone()));
    }

    private ScheduleCalculator(ZoneId zone) {
        this.zone = zone;
    }

    public static ScheduleCalculator forZone(ZoneId zone) {
        return new ScheduleCalculator(zone);
    }

    /**
     * Validates a schedule.
     *
     * @throws ValidationException
     *             describing the first problem found
     */
    public void validate(JobSchedule schedule) {
        if (schedule == null || schedule.getType() == null) {
            throw new ValidationException("schedule is required");
        }
        switch (schedule.getType()) {
        case INTERVAL -> validateInterval(schedule);
        case CRON -> {
            if (schedule.getInterval() != null || schedule.getUnit() != null || schedule.hasTimeOfDay()) {
                throw new ValidationException("Cron schedule cannot also define interval, unit or 'at'");
            }
            normalizeCronExpression(schedule.getExpression());
        }
        default -> throw new ValidationException("Unsupported schedule type: " + schedule.getType());
        }
    }

    /**
     * First fire time of a new (or re-scheduled) job: the earliest valid fire
     * time at or after {@code createdAt}, or at or after {@code startDate} when
     * that is later.
     */
    public Instant firstRun(JobSchedule schedule, Instant createdAt, Instant startDate) {
        boolean startsLater = startDate != null && startDate.isAfter(createdAt);
        Instant reference = startsLater ? startDate : createdAt;

        return switch (schedule.getType()) {
        case INTERVAL -> {
            if (schedule.hasTimeOfDay()) {
                yield firstTimeOfDay(schedule.getAtTime(), reference);
            }
            yield startsLater ? startDate : plusUnits(createdAt, schedule.getInterval(), schedule.getUnit());
        }
        case CRON -> nextCron(schedule.getExpression(), reference.minusNanos(1));
        };
    }

    /**
     * Next fire time after a firing at {@code lastFire}, evaluated at
     * {@code now}. Always strictly after {@code now}.
     */
    public Instant nextRun(JobSchedule schedule, Instant lastFire, Instant now) {
        return switch (schedule.getType()) {
        case INTERVAL -> schedule.hasTimeOfDay()
                ? nextTimeOfDay(schedule, lastFire, now)
                : nextInterval(schedule, lastFire, now);
        case CRON -> nextCron(schedule.getExpression(), now);
        };
    }

    /**
     * Normalize a five-field cron expression to Spring's six-field format (with
     * seconds). Validates the result.
     *
     * @throws ValidationException
     *             if the cron expression is invalid
     */
    static String normalizeCronExpression(String input) {
        if (input == null || input.isBlank()) {
            throw new ValidationException("Cron expression cannot be empty");
        }

        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");
        if (parts.length != CRON_FIVE_FIELDS) {
            throw new ValidationException("Invalid cron expression: expected 5 fields, got " + parts.length);
        }

        String sixFieldCron = "0 " + String.join(" ", parts);
        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cron expression '" + trimmed + "': " + e.getMessage());
        }
        return sixFieldCron;
    }

    private void validateInterval(JobSchedule schedule) {
        if (schedule.getExpression() != null) {
            throw new ValidationException("Interval schedule cannot also define a cron expression");
        }
        if (schedule.getInterval() == null || schedule.getInterval() <= 0) {
            throw new ValidationException("interval must be a positive integer");
        }
        if (schedule.getUnit() == null) {
            throw new ValidationException("unit is required for interval schedules");
        }
        if (!schedule.hasTimeOfDay()) {
            return;
        }
        if (!schedule.getUnit().supportsTimeOfDay()) {
            throw new ValidationException("'at' is only supported for DAYS or WEEKS units, got " + schedule.getUnit());
        }
        String at = schedule.getAt().trim();
        if (!TIME_OF_DAY.matcher(at).matches()) {
            throw new ValidationException("'at' must be in HH:MM format (00:00-23:59)");
        }
        String[] parts = at.split(":");
        int hour = Integer.parseInt(parts[0]);
        int minute = Integer.parseInt(parts[1]);
        if (hour > 23 || minute > 59) {
            throw new ValidationException("'at' must be in HH:MM format (00:00-23:59)");
        }
    }

    private Instant nextInterval(JobSchedule schedule, Instant lastFire, Instant now) {
        int interval = schedule.getInterval();
        ScheduleUnit unit = schedule.getUnit();
        Instant next = plusUnits(lastFire, interval, unit);
        if (next.isAfter(now)) {
            return next;
        }

        // Jump close to now first; months and years only have an estimated length.
        Duration step = unit.toChronoUnit().getDuration().multipliedBy(interval);
        long steps = Math.max(1, Duration.between(lastFire, now).dividedBy(step));
        while (steps > 1 && plusUnits(lastFire, interval * steps, unit).isAfter(now)) {
            steps--;
        }
        next = plusUnits(lastFire, interval * steps, unit);
        while (!next.isAfter(now)) {
            steps++;
            next = plusUnits(lastFire, interval * steps, unit);
        }
        return next;
    }

    private Instant nextTimeOfDay(JobSchedule schedule, Instant lastFire, Instant now) {
        LocalTime at = schedule.getAtTime();
        ZonedDateTime next = lastFire.atZone(zone)
                .plus(schedule.getInterval(), schedule.getUnit().toChronoUnit())
                .with(at);
        while (!next.toInstant().isAfter(now)) {
            next = next.plus(schedule.getInterval(), schedule.getUnit().toChronoUnit()).with(at);
        }
        return next.toInstant();
    }

    private Instant firstTimeOfDay(LocalTime at, Instant reference) {
        ZonedDateTime candidate = reference.atZone(zone).with(at);
        if (candidate.toInstant().isBefore(reference)) {
            candidate = candidate.plusDays(1).with(at);
        }
        return candidate.toInstant();
    }

    private Instant nextCron(String expression, Instant after) {
        CronExpression cron = CronExpression.parse(normalizeCronExpression(expression));
        ZonedDateTime next = cron.next(after.atZone(zone));
        if (next == null) {
            throw new ValidationException("Cron expression never fires: " + expression);
        }
        return next.toInstant();
    }

    private Instant plusUnits(Instant instant, long amount, ScheduleUnit unit) {
        return instant.atZone(zone).plus(amount, unit.toChronoUnit()).toInstant();
    }
}
