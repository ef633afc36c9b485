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

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.domain.model.ExecutionRecord;
import me.golemcore.scheduler.domain.model.ExecutionStatus;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.JobStatus;
import me.golemcore.scheduler.domain.model.TaskDefinition;
import me.golemcore.scheduler.port.outbound.ExecutionHistoryPort;
import me.golemcore.scheduler.port.outbound.JobStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read-only aggregates over jobs and execution history for dashboards.
 */
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    private final JobStorePort jobStore;
    private final ExecutionHistoryPort history;
    private final TaskRegistry taskRegistry;
    private final Clock clock;

    public List<ExecutionRecord> recentActivity(int limit) {
        return history.recent(limit);
    }

    /**
     * Enabled jobs by ascending {@code nextRun}.
     */
    public List<Job> upcomingExecutions(int limit) {
        return jobStore.list().stream()
                .filter(job -> job.getStatus() != JobStatus.DISABLED && job.getNextRun() != null)
                .sorted(Comparator.comparing(Job::getNextRun))
                .limit(limit)
                .toList();
    }

    /**
     * Per task: number of jobs and outcome counts of their executions. Every
     * registered task is listed, followed by unregistered tasks still
     * referenced by jobs.
     */
    public List<TaskDistribution> taskDistribution() {
        List<Job> jobs = jobStore.list();
        Map<String, String> taskByJobId = jobs.stream()
                .collect(Collectors.toMap(Job::getId, Job::getTaskName, (a, b) -> a));

        Map<String, long[]> counts = new LinkedHashMap<>();
        for (TaskDefinition task : taskRegistry.list()) {
            counts.put(task.getName(), new long[4]);
        }
        for (Job job : jobs) {
            counts.computeIfAbsent(job.getTaskName(), name -> new long[4])[0]++;
        }
        for (ExecutionRecord record : history.listSince(Instant.EPOCH)) {
            String taskName = taskByJobId.get(record.getJobId());
            if (taskName == null) {
                continue;
            }
            long[] taskCounts = counts.get(taskName);
            taskCounts[1]++;
            if (record.getStatus() == ExecutionStatus.COMPLETED) {
                taskCounts[2]++;
            } else if (record.getStatus() == ExecutionStatus.FAILED) {
                taskCounts[3]++;
            }
        }

        List<TaskDistribution> distribution = new ArrayList<>();
        counts.forEach((task, c) -> distribution.add(new TaskDistribution(task, c[0], c[1], c[2], c[3])));
        return distribution;
    }

    /**
     * Share of finished executions that failed; zero when nothing has
     * finished.
     */
    public ErrorRate errorRate() {
        Map<ExecutionStatus, Long> byStatus = history.listSince(Instant.EPOCH).stream()
                .filter(record -> record.getStatus() != null)
                .collect(Collectors.groupingBy(ExecutionRecord::getStatus, Collectors.counting()));
        long failed = byStatus.getOrDefault(ExecutionStatus.FAILED, 0L);
        long finished = failed + byStatus.getOrDefault(ExecutionStatus.COMPLETED, 0L);
        double rate = finished == 0 ? 0.0 : (double) failed / finished;
        return new ErrorRate(rate, failed, finished);
    }

    /**
     * Completed and failed executions per day over the last {@code days} days,
     * oldest first. Days without executions are included with zero counts.
     */
    public List<DailyExecutions> executionHistory(int days) {
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);
        LocalDate first = today.minusDays(Math.max(days, 1) - 1L);
        Instant since = first.atStartOfDay(zone).toInstant();

        Map<LocalDate, List<ExecutionRecord>> byDay = new TreeMap<>(history.listSince(since).stream()
                .collect(Collectors.groupingBy(record -> LocalDate.ofInstant(record.getStartedAt(), zone))));

        List<DailyExecutions> result = new ArrayList<>();
        for (LocalDate day = first; !day.isAfter(today); day = day.plusDays(1)) {
            Map<ExecutionStatus, Long> counts = byDay.getOrDefault(day, List.of()).stream()
                    .filter(record -> record.getStatus() != null)
                    .collect(Collectors.groupingBy(ExecutionRecord::getStatus, Collectors.counting()));
            long completed = counts.getOrDefault(ExecutionStatus.COMPLETED, 0L);
            long failed = counts.getOrDefault(ExecutionStatus.FAILED, 0L);
            long total = counts.values().stream().mapToLong(Long::longValue).sum();
            result.add(new DailyExecutions(day, completed, failed, total));
        }
        return result;
    }

    public record TaskDistribution(String task, long jobs, long total, long completed, long failed) {
    }

    public record ErrorRate(double errorRate, long failed, long total) {
    }

    public record DailyExecutions(LocalDate date, long completed, long failed, long total) {
    }
}
