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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.exception.ValidationException;
import me.golemcore.scheduler.domain.model.ExecutionRecord;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.JobDraft;
import me.golemcore.scheduler.domain.model.JobOptions;
import me.golemcore.scheduler.domain.model.JobSchedule;
import me.golemcore.scheduler.domain.model.JobStatus;
import me.golemcore.scheduler.domain.model.Page;
import me.golemcore.scheduler.domain.model.TaskDefinition;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.ExecutionHistoryPort;
import me.golemcore.scheduler.port.outbound.JobStorePort;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Job management: create, update, delete, enable/disable and history lookup.
 *
 * <p>
 * Input is validated before anything is persisted. Changes to existing jobs
 * go through {@link JobStorePort#modify} so they never overwrite the status,
 * {@code lastRun} or {@code nextRun} the scheduler loop writes concurrently.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class JobService {

    private static final int NAME_SUFFIX_LENGTH = 8;

    private final JobStorePort jobStore;
    private final ExecutionHistoryPort history;
    private final TaskRegistry taskRegistry;
    private final JobValidator validator;
    private final ScheduleCalculator calculator;
    private final ObjectMapper canonicalMapper;
    private final Clock clock;

    public JobService(JobStorePort jobStore, ExecutionHistoryPort history, TaskRegistry taskRegistry,
            JobValidator validator, ScheduleCalculator calculator, ObjectMapper objectMapper, Clock clock) {
        this.jobStore = jobStore;
        this.history = history;
        this.taskRegistry = taskRegistry;
        this.validator = validator;
        this.calculator = calculator;
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
    }

    /**
     * Validate and persist a new job. Its first {@code nextRun} is the earliest
     * fire time at or after now (or the start date, when later).
     *
     * @throws ValidationException
     *             on malformed input or a duplicate name
     * @throws me.golemcore.scheduler.domain.exception.UnknownTaskException
     *             if the task is not registered
     */
    public Job createJob(JobDraft draft) {
        String id = UUID.randomUUID().toString();
        Job created = jobStore.create(buildNewJob(id, draft, false));
        log.info("[Jobs] Created job {} ({}) for task {}, next run at {}",
                created.getName(), id, created.getTaskName(), created.getNextRun());
        return created;
    }

    public Optional<Job> getJob(String id) {
        return jobStore.get(id);
    }

    /**
     * Jobs ordered by creation time, optionally filtered by task and status.
     */
    public List<Job> listJobs(String taskName, JobStatus status) {
        return jobStore.list().stream()
                .filter(job -> taskName == null || taskName.equals(job.getTaskName()))
                .filter(job -> status == null || status == job.getStatus())
                .sorted(Comparator.comparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Partial update: {@code null} draft fields keep their current value.
     * {@code nextRun} is recomputed when the schedule or activation window
     * changes.
     *
     * @throws IllegalArgumentException
     *             if the job does not exist
     */
    public Job updateJob(String id, JobDraft draft) {
        Job current = requireJob(id);
        if (draft.getTaskName() != null && !draft.getTaskName().equals(current.getTaskName())) {
            throw new ValidationException("Task of an existing job cannot be changed");
        }
        TaskDefinition task = taskRegistry.lookup(current.getTaskName());

        String name = draft.getName() != null ? draft.getName().trim() : current.getName();
        Map<String, Object> params = draft.getParams() != null ? draft.getParams() : current.getParams();
        JobSchedule schedule = draft.getSchedule() != null ? draft.getSchedule() : current.getSchedule();
        JobOptions options = draft.getOptions() != null ? draft.getOptions() : current.getOptions();

        validateName(name, id);
        validator.validateParams(task, params);
        calculator.validate(schedule);
        validator.validateOptions(options, name);

        boolean reschedule = !Objects.equals(schedule, current.getSchedule())
                || !Objects.equals(options.getStartDate(), current.getOptions().getStartDate())
                || !Objects.equals(options.getEndDate(), current.getOptions().getEndDate());
        Instant now = clock.instant();

        Job updated = jobStore.modify(id, job -> {
            job.setName(name);
            job.setParams(new LinkedHashMap<>(params));
            job.setSchedule(schedule);
            job.setOptions(options);
            job.setUpdatedAt(now);
            if (reschedule && job.getStatus() != JobStatus.RUNNING) {
                job.setNextRun(calculator.firstRun(schedule, now, options.getStartDate()));
                job.setScheduledFor(null);
            }
            return job;
        }).orElseThrow(() -> new IllegalArgumentException("Job not found: " + id));

        log.info("[Jobs] Updated job {} ({})", updated.getName(), id);
        return updated;
    }

    /**
     * Delete a job. Its execution history stays in place.
     *
     * @return {@code false} when no job has this id
     */
    public boolean deleteJob(String id) {
        boolean deleted = jobStore.delete(id);
        if (deleted) {
            log.info("[Jobs] Deleted job {}", id);
        }
        return deleted;
    }

    /**
     * Re-enable a disabled job. Its {@code nextRun} is recomputed from now.
     *
     * @throws IllegalStateException
     *             if the job is running or its end date has passed
     */
    public Job enableJob(String id) {
        Instant now = clock.instant();
        Job enabled = jobStore.modify(id, job -> {
            if (job.getStatus() == JobStatus.RUNNING) {
                throw new IllegalStateException("Job is running: " + job.getName());
            }
            if (job.getStatus() == JobStatus.IDLE) {
                return job;
            }
            if (job.isExpiredAt(now)) {
                throw new IllegalStateException("Job end date has passed: " + job.getName());
            }
            job.setStatus(JobStatus.IDLE);
            job.setNextRun(calculator.firstRun(job.getSchedule(), now, job.getOptions().getStartDate()));
            job.setScheduledFor(null);
            job.setLastError(null);
            job.setUpdatedAt(now);
            return job;
        }).orElseThrow(() -> new IllegalArgumentException("Job not found: " + id));
        log.info("[Jobs] Enabled job {}, next run at {}", enabled.getName(), enabled.getNextRun());
        return enabled;
    }

    /**
     * Take a job off the schedule. A disabled job is never due.
     *
     * @throws IllegalStateException
     *             if the job is running
     */
    public Job disableJob(String id) {
        Instant now = clock.instant();
        Job disabled = jobStore.modify(id, job -> {
            if (job.getStatus() == JobStatus.RUNNING) {
                throw new IllegalStateException("Job is running: " + job.getName());
            }
            job.setStatus(JobStatus.DISABLED);
            job.setUpdatedAt(now);
            return job;
        }).orElseThrow(() -> new IllegalArgumentException("Job not found: " + id));
        log.info("[Jobs] Disabled job {}", disabled.getName());
        return disabled;
    }

    public Page<ExecutionRecord> getHistory(String id, int offset, int limit) {
        requireJob(id);
        return history.list(id, null, offset, limit);
    }

    /**
     * Create or refresh a job declared in configuration. The id is derived from
     * the task and params, so the same declaration always maps to the same job
     * and keeps its history across restarts.
     */
    public Job upsertDefault(SchedulerProperties.DefaultJobProperties defaults) {
        if (defaults.getTask() == null || defaults.getTask().isBlank()) {
            throw new ValidationException("Default job task is required");
        }
        TaskDefinition task = taskRegistry.lookup(defaults.getTask());
        Map<String, Object> params = validator.coerceParams(task, defaults.getParams());
        String id = defaultJobId(defaults.getTask(), params);
        String name = defaults.getName() != null && !defaults.getName().isBlank()
                ? defaults.getName()
                : defaults.getTask();
        JobDraft draft = JobDraft.builder()
                .name(name)
                .taskName(defaults.getTask())
                .params(new LinkedHashMap<>(params))
                .schedule(defaults.getSchedule())
                .options(defaults.getOptions())
                .build();

        if (jobStore.get(id).isPresent()) {
            Job refreshed = updateJob(id, draft);
            log.info("[Jobs] Refreshed default job {} ({})", refreshed.getName(), id);
            return refreshed;
        }
        Job created = jobStore.create(buildNewJob(id, draft, true));
        log.info("[Jobs] Created default job {} ({}), next run at {}", created.getName(), id, created.getNextRun());
        return created;
    }

    String defaultJobId(String taskName, Map<String, Object> params) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("task", taskName);
        canonical.put("params", new TreeMap<>(params));
        try {
            byte[] json = canonicalMapper.writeValueAsBytes(canonical);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Default job params are not serializable: " + e.getMessage());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Job buildNewJob(String id, JobDraft draft, boolean defaultJob) {
        TaskDefinition task = taskRegistry.lookup(draft.getTaskName());
        Map<String, Object> params = draft.getParams() != null ? draft.getParams() : Map.of();
        JobOptions options = draft.getOptions() != null ? draft.getOptions() : JobOptions.defaults();
        String name = draft.getName() != null && !draft.getName().isBlank()
                ? draft.getName().trim()
                : task.getName() + "-" + id.substring(0, NAME_SUFFIX_LENGTH);

        validateName(name, id);
        validator.validateParams(task, params);
        calculator.validate(draft.getSchedule());
        validator.validateOptions(options, name);

        Instant now = clock.instant();
        Instant nextRun = calculator.firstRun(draft.getSchedule(), now, options.getStartDate());
        boolean pastEnd = options.getEndDate() != null && nextRun.isAfter(options.getEndDate());

        return Job.builder()
                .id(id)
                .name(name)
                .taskName(task.getName())
                .params(new LinkedHashMap<>(params))
                .schedule(draft.getSchedule())
                .options(options)
                .status(pastEnd ? JobStatus.DISABLED : JobStatus.IDLE)
                .defaultJob(defaultJob)
                .createdAt(now)
                .updatedAt(now)
                .nextRun(nextRun)
                .build();
    }

    private void validateName(String name, String id) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Job name cannot be blank");
        }
        Optional<Job> existing = jobStore.findByName(name);
        if (existing.isPresent() && !existing.get().getId().equals(id)) {
            throw new ValidationException("Job name already in use: " + name);
        }
    }

    private Job requireJob(String id) {
        return jobStore.get(id).orElseThrow(() -> new IllegalArgumentException("Job not found: " + id));
    }
}
