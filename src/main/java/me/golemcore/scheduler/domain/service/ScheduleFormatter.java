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

import me.golemcore.scheduler.domain.model.JobSchedule;
import me.golemcore.scheduler.domain.model.ScheduleUnit;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders schedules as short human-readable text for listings.
 */
public final class ScheduleFormatter {

    private static final Pattern NUMBER = Pattern.compile("\\d{1,2}");
    private static final Pattern MINUTE_STEP = Pattern.compile("\\*/(\\d{1,2})");
    private static final String[] DAY_NAMES = {
            "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday"
    };

    private ScheduleFormatter() {
    }

    public static String describe(JobSchedule schedule) {
        if (schedule == null || schedule.getType() == null) {
            return "Not scheduled";
        }
        return switch (schedule.getType()) {
        case INTERVAL -> describeInterval(schedule);
        case CRON -> describeCron(schedule.getExpression());
        };
    }

    private static String describeInterval(JobSchedule schedule) {
        Integer interval = schedule.getInterval();
        ScheduleUnit unit = schedule.getUnit();
        if (interval == null || unit == null) {
            return "Not scheduled";
        }

        String unitName = unit.name().toLowerCase(Locale.ROOT);
        String base = interval == 1
                ? "Every " + unitName.substring(0, unitName.length() - 1)
                : "Every " + interval + " " + unitName;
        return schedule.hasTimeOfDay() ? base + " at " + schedule.getAt().trim() : base;
    }

    private static String describeCron(String expression) {
        if (expression == null || expression.isBlank()) {
            return "Not scheduled";
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        if (fields.length != 5) {
            return "Cron: " + trimmed;
        }
        String minute = fields[0];
        String hour = fields[1];
        String dayOfMonth = fields[2];
        String month = fields[3];
        String dayOfWeek = fields[4];

        if (!"*".equals(month)) {
            return "Cron: " + trimmed;
        }
        boolean everyDay = "*".equals(dayOfMonth) && "*".equals(dayOfWeek);

        if (everyDay && "*".equals(hour)) {
            if ("*".equals(minute)) {
                return "Every minute";
            }
            Matcher step = MINUTE_STEP.matcher(minute);
            if (step.matches()) {
                int minutes = Integer.parseInt(step.group(1));
                return minutes == 1 ? "Every minute" : "Every " + minutes + " minutes";
            }
            if (NUMBER.matcher(minute).matches()) {
                return "Every hour at minute " + Integer.parseInt(minute);
            }
            return "Cron: " + trimmed;
        }

        if (!NUMBER.matcher(minute).matches() || !NUMBER.matcher(hour).matches()) {
            return "Cron: " + trimmed;
        }
        String time = String.format(Locale.ROOT, "%02d:%02d", Integer.parseInt(hour), Integer.parseInt(minute));
        if (everyDay) {
            return "Every day at " + time;
        }
        if ("*".equals(dayOfMonth) && NUMBER.matcher(dayOfWeek).matches()
                && Integer.parseInt(dayOfWeek) < DAY_NAMES.length) {
            return "Every " + DAY_NAMES[Integer.parseInt(dayOfWeek)] + " at " + time;
        }
        if ("*".equals(dayOfWeek) && NUMBER.matcher(dayOfMonth).matches()) {
            return "Every month on day " + Integer.parseInt(dayOfMonth) + " at " + time;
        }
        return "Cron: " + trimmed;
    }
}
