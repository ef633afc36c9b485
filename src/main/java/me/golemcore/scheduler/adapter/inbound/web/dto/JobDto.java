package me.golemcore.scheduler.adapter.inbound.web.dto;

import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.JobOptions;
import me.golemcore.scheduler.domain.model.JobSchedule;
import me.golemcore.scheduler.domain.service.ScheduleFormatter;

import java.time.Instant;
import java.util.Map;

public record JobDto(
        String id,
        String name,
        String task,
        Map<String, Object> params,
        JobSchedule schedule,
        String scheduleDescription,
        JobOptions options,
        String status,
        boolean defaultJob,
        Instant createdAt,
        Instant updatedAt,
        Instant lastRun,
        Instant nextRun,
        String lastError) {

    public static JobDto from(Job job) {
        return new JobDto(
                job.getId(),
                job.getName(),
                job.getTaskName(),
                job.getParams(),
                job.getSchedule(),
                ScheduleFormatter.describe(job.getSchedule()),
                job.getOptions(),
                job.getStatus().name(),
                job.isDefaultJob(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getLastRun(),
                job.getNextRun(),
                job.getLastError());
    }
}
