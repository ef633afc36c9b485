package me.golemcore.scheduler.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

/**
 * When a job fires. Exactly one variant is populated, selected by
 * {@link #type}:
 * <ul>
 * <li>{@link ScheduleType#INTERVAL} - {@code interval} x {@code unit}, with an
 * optional {@code at} clock time ({@code HH:MM}) for daily/weekly units</li>
 * <li>{@link ScheduleType#CRON} - a five-field cron {@code expression}</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSchedule {

    private ScheduleType type;
    private Integer interval;
    private ScheduleUnit unit;
    private String at;
    private String expression;

    public enum ScheduleType {
        INTERVAL, CRON
    }

    public static JobSchedule every(int interval, ScheduleUnit unit) {
        return JobSchedule.builder()
                .type(ScheduleType.INTERVAL)
                .interval(interval)
                .unit(unit)
                .build();
    }

    public static JobSchedule everyAt(int interval, ScheduleUnit unit, String at) {
        return JobSchedule.builder()
                .type(ScheduleType.INTERVAL)
                .interval(interval)
                .unit(unit)
                .at(at)
                .build();
    }

    public static JobSchedule cron(String expression) {
        return JobSchedule.builder()
                .type(ScheduleType.CRON)
                .expression(expression)
                .build();
    }

    @JsonIgnore
    public boolean hasTimeOfDay() {
        return at != null && !at.isBlank();
    }

    /**
     * Parsed {@code at} value. Only meaningful after validation.
     */
    @JsonIgnore
    public LocalTime getAtTime() {
        if (!hasTimeOfDay()) {
            return null;
        }
        String[] parts = at.trim().split(":");
        return LocalTime.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
    }
}
