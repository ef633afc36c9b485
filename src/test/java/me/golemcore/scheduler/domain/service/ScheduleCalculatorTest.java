package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.domain.exception.ValidationException;
import me.golemcore.scheduler.domain.model.JobSchedule;
import me.golemcore.scheduler.domain.model.ScheduleUnit;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleCalculatorTest {

    private static final Instant T = Instant.parse("2026-03-10T12:00:00Z");

    private final ScheduleCalculator calculator = ScheduleCalculator.forZone(ZoneOffset.UTC);

    @Test
    void shouldNormalizeFiveFieldCronToSixField() {
        assertEquals("0 */15 * * * *", ScheduleCalculator.normalizeCronExpression("*/15 * * * *"));
    }

    @Test
    void shouldRejectSixFieldCron() {
        assertThrows(ValidationException.class,
                () -> ScheduleCalculator.normalizeCronExpression("0 0 9 * * MON-FRI"));
    }

    @Test
    void shouldRejectInvalidCronExpression() {
        assertThrows(ValidationException.class,
                () -> ScheduleCalculator.normalizeCronExpression("61 * * * *"));
        assertThrows(ValidationException.class,
                () -> ScheduleCalculator.normalizeCronExpression(""));
    }

    @Test
    void shouldComputeNextCronFireStrictlyAfterNow() {
        Instant now = Instant.parse("2026-03-10T12:07:00Z");

        Instant next = calculator.nextRun(JobSchedule.cron("*/15 * * * *"), now, now);

        assertEquals(Instant.parse("2026-03-10T12:15:00Z"), next);
    }

    @Test
    void shouldSkipCronFireEqualToNow() {
        Instant now = Instant.parse("2026-03-10T12:15:00Z");

        Instant next = calculator.nextRun(JobSchedule.cron("*/15 * * * *"), now, now);

        assertEquals(Instant.parse("2026-03-10T12:30:00Z"), next);
    }

    @Test
    void shouldIncludeCreationInstantForFirstCronFire() {
        Instant createdAt = Instant.parse("2026-03-10T12:15:00Z");

        Instant first = calculator.firstRun(JobSchedule.cron("*/15 * * * *"), createdAt, null);

        assertEquals(createdAt, first);
    }

    @Test
    void shouldScheduleFirstIntervalRunOneIntervalAfterCreation() {
        Instant first = calculator.firstRun(JobSchedule.every(1, ScheduleUnit.HOURS), T, null);

        assertEquals(T.plusSeconds(3600), first);
    }

    @Test
    void shouldStartIntervalAtStartDateWhenLater() {
        Instant startDate = Instant.parse("2026-04-01T00:00:00Z");

        Instant first = calculator.firstRun(JobSchedule.every(1, ScheduleUnit.HOURS), T, startDate);

        assertEquals(startDate, first);
    }

    @Test
    void shouldAdvanceIntervalFromFiringTimeNotFromCompletion() {
        Instant firing = T.plusSeconds(3600);
        Instant completedAt = firing.plusSeconds(2);

        Instant next = calculator.nextRun(JobSchedule.every(1, ScheduleUnit.HOURS), firing, completedAt);

        assertEquals(T.plusSeconds(7200), next);
    }

    @Test
    void shouldCoalesceMissedIntervalFiringsOntoTheGrid() {
        Instant lastFire = T;
        Instant now = T.plusSeconds(3 * 3600 + 600);

        Instant next = calculator.nextRun(JobSchedule.every(1, ScheduleUnit.HOURS), lastFire, now);

        assertEquals(T.plusSeconds(4 * 3600), next);
    }

    @Test
    void shouldCoalesceMissedMonthlyFirings() {
        Instant lastFire = Instant.parse("2026-01-31T08:00:00Z");
        Instant now = Instant.parse("2026-05-15T00:00:00Z");

        Instant next = calculator.nextRun(JobSchedule.every(1, ScheduleUnit.MONTHS), lastFire, now);

        assertEquals(Instant.parse("2026-05-31T08:00:00Z"), next);
        assertTrue(next.isAfter(now));
    }

    @Test
    void shouldScheduleFirstDailyRunAtTimeOfDayLaterToday() {
        Instant first = calculator.firstRun(JobSchedule.everyAt(1, ScheduleUnit.DAYS, "14:30"), T, null);

        assertEquals(Instant.parse("2026-03-10T14:30:00Z"), first);
    }

    @Test
    void shouldScheduleFirstDailyRunTomorrowWhenTimeOfDayHasPassed() {
        Instant first = calculator.firstRun(JobSchedule.everyAt(1, ScheduleUnit.DAYS, "09:00"), T, null);

        assertEquals(Instant.parse("2026-03-11T09:00:00Z"), first);
    }

    @Test
    void shouldAdvanceWeeklyScheduleByIntervalAtTimeOfDay() {
        Instant lastFire = Instant.parse("2026-03-10T08:00:00Z");

        Instant next = calculator.nextRun(JobSchedule.everyAt(2, ScheduleUnit.WEEKS, "08:00"), lastFire,
                lastFire.plusSeconds(5));

        assertEquals(Instant.parse("2026-03-24T08:00:00Z"), next);
    }

    @Test
    void shouldAddIntervalsUntilTimeOfDayFireIsAfterNow() {
        Instant lastFire = Instant.parse("2026-03-01T08:00:00Z");
        Instant now = Instant.parse("2026-03-10T09:00:00Z");

        Instant next = calculator.nextRun(JobSchedule.everyAt(1, ScheduleUnit.DAYS, "08:00"), lastFire, now);

        assertEquals(Instant.parse("2026-03-11T08:00:00Z"), next);
    }

    @Test
    void shouldApplyTimeOfDayInConfiguredZone() {
        ScheduleCalculator berlin = ScheduleCalculator.forZone(ZoneId.of("Europe/Berlin"));

        Instant first = berlin.firstRun(JobSchedule.everyAt(1, ScheduleUnit.DAYS, "14:30"), T, null);

        assertEquals(Instant.parse("2026-03-10T13:30:00Z"), first);
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        assertThrows(ValidationException.class,
                () -> calculator.validate(JobSchedule.every(0, ScheduleUnit.MINUTES)));
    }

    @Test
    void shouldRejectTimeOfDayForSubDailyUnits() {
        assertThrows(ValidationException.class,
                () -> calculator.validate(JobSchedule.everyAt(2, ScheduleUnit.HOURS, "10:00")));
    }

    @Test
    void shouldRejectMalformedTimeOfDay() {
        assertThrows(ValidationException.class,
                () -> calculator.validate(JobSchedule.everyAt(1, ScheduleUnit.DAYS, "24:00")));
        assertThrows(ValidationException.class,
                () -> calculator.validate(JobSchedule.everyAt(1, ScheduleUnit.DAYS, "9am")));
    }

    @Test
    void shouldRejectScheduleDefiningBothVariants() {
        JobSchedule both = JobSchedule.builder()
                .type(JobSchedule.ScheduleType.CRON)
                .expression("* * * * *")
                .interval(5)
                .unit(ScheduleUnit.MINUTES)
                .build();

        assertThrows(ValidationException.class, () -> calculator.validate(both));
    }

    @Test
    void shouldRejectMissingSchedule() {
        assertThrows(ValidationException.class, () -> calculator.validate(null));
    }
}
