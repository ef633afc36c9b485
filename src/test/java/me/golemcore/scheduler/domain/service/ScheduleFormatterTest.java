package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.domain.model.JobSchedule;
import me.golemcore.scheduler.domain.model.ScheduleUnit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ScheduleFormatterTest {

    @Test
    void shouldDescribeIntervals() {
        assertEquals("Every 2 hours", ScheduleFormatter.describe(JobSchedule.every(2, ScheduleUnit.HOURS)));
        assertEquals("Every minute", ScheduleFormatter.describe(JobSchedule.every(1, ScheduleUnit.MINUTES)));
        assertEquals("Every day at 09:30",
                ScheduleFormatter.describe(JobSchedule.everyAt(1, ScheduleUnit.DAYS, "09:30")));
        assertEquals("Every 2 weeks at 08:00",
                ScheduleFormatter.describe(JobSchedule.everyAt(2, ScheduleUnit.WEEKS, "08:00")));
    }

    @Test
    void shouldDescribeCommonCronShapes() {
        assertEquals("Every 15 minutes", ScheduleFormatter.describe(JobSchedule.cron("*/15 * * * *")));
        assertEquals("Every minute", ScheduleFormatter.describe(JobSchedule.cron("* * * * *")));
        assertEquals("Every hour at minute 5", ScheduleFormatter.describe(JobSchedule.cron("5 * * * *")));
        assertEquals("Every day at 08:00", ScheduleFormatter.describe(JobSchedule.cron("0 8 * * *")));
        assertEquals("Every Monday at 09:30", ScheduleFormatter.describe(JobSchedule.cron("30 9 * * 1")));
        assertEquals("Every month on day 1 at 00:00", ScheduleFormatter.describe(JobSchedule.cron("0 0 1 * *")));
    }

    @Test
    void shouldFallBackToRawCronExpression() {
        assertEquals("Cron: 0 9 * * MON-FRI", ScheduleFormatter.describe(JobSchedule.cron("0 9 * * MON-FRI")));
        assertEquals("Cron: 0 0 1 1 *", ScheduleFormatter.describe(JobSchedule.cron("0 0 1 1 *")));
    }
}
