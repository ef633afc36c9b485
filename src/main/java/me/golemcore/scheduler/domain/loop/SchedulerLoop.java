package me.golemcore.scheduler.domain.loop;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.exception.StorageException;
import me.golemcore.scheduler.domain.exception.ValidationException;
import me.golemcore.scheduler.domain.model.ExecutionFailureKind;
import me.golemcore.scheduler.domain.model.ExecutionOutcome;
import me.golemcore.scheduler.domain.model.ExecutionRecord;
import me.golemcore.scheduler.domain.model.ExecutionStatus;
import me.golemcore.scheduler.domain.model.ExecutionTrigger;
import me.golemcore.scheduler.domain.model.GateResult;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.JobStatus;
import me.golemcore.scheduler.domain.service.DependencyGate;
import me.golemcore.scheduler.domain.service.HistoryRetentionService;
import me.golemcore.scheduler.domain.service.JobExecutor;
import me.golemcore.scheduler.domain.service.ScheduleCalculator;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.ExecutionHistoryPort;
import me.golemcore.scheduler.port.outbound.JobStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The control loop that decides when jobs run.
 *
 * <p>
 * Every tick it:
 * <ul>
 * <li>Lists the due jobs (IDLE with {@code nextRun <= now})</li>
 * <li>Disables jobs whose end date has passed</li>
 * <li>Defers jobs whose dependencies are unmet by the configured grace</li>
 * <li>Claims each remaining job with an IDLE to RUNNING compare-and-set and
 * hands it to the {@link JobExecutor} without waiting for it</li>
 * </ul>
 *
 * <p>
 * When a firing finishes, the job goes back to IDLE with {@code lastRun} set
 * to the firing time and {@code nextRun} computed from that firing time, so
 * execution latency never shifts the schedule. A dependency deferral keeps the
 * original slot in {@code scheduledFor}, and that slot stays the firing time.
 * Jobs are not dispatched before their start date. The claim is the only thing
 * that keeps two firings of the same job apart; there is no in-process lock.
 * A tick never waits for executions, and a failure while handling one job is
 * logged and does not affect the others.
 *
 * <p>
 * On startup, jobs left RUNNING and records left in flight by a previous
 * process are reconciled before the first tick.
 *
 * @since 1.0
 * @see JobExecutor
 * @see DependencyGate
 */
@Component
@Slf4j
public class SchedulerLoop {

    static final String INTERRUPTED_BY_RESTART = "Interrupted by scheduler restart";

    private final JobStorePort jobStore;
    private final ExecutionHistoryPort history;
    private final JobExecutor executor;
    private final DependencyGate dependencyGate;
    private final ScheduleCalculator calculator;
    private final HistoryRetentionService retentionService;
    private final SchedulerProperties properties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final Queue<PendingCompletion> pendingCompletions = new ConcurrentLinkedQueue<>();
    private final ExecutorService dispatchPool;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public SchedulerLoop(JobStorePort jobStore, ExecutionHistoryPort history, JobExecutor executor,
            DependencyGate dependencyGate, ScheduleCalculator calculator, HistoryRetentionService retentionService,
            SchedulerProperties properties, Clock clock) {
        this.jobStore = jobStore;
        this.history = history;
        this.executor = executor;
        this.dependencyGate = dependencyGate;
        this.calculator = calculator;
        this.retentionService = retentionService;
        this.properties = properties;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.dispatchPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "job-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        reconcile();

        SchedulerProperties.LoopProperties loop = properties.getLoop();
        if (!loop.isEnabled()) {
            log.info("[Scheduler] Loop disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "job-scheduler");
            t.setDaemon(true);
            return t;
        });
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                loop.getTickIntervalMs(),
                loop.getTickIntervalMs(),
                TimeUnit.MILLISECONDS);

        long purgeMinutes = properties.getHistory().getPurgeIntervalMinutes();
        if (purgeMinutes > 0) {
            scheduler.scheduleAtFixedRate(this::purgeHistory, purgeMinutes, purgeMinutes, TimeUnit.MINUTES);
        }
        log.info("[Scheduler] Started with tick interval: {}ms", loop.getTickIntervalMs());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        dispatchPool.shutdownNow();
        log.info("[Scheduler] Shut down");
    }

    /**
     * Run a job immediately, outside its schedule. Takes the same exclusivity
     * claim as a scheduled firing and leaves {@code nextRun} unchanged.
     *
     * @throws IllegalArgumentException
     *             if the job does not exist
     * @throws IllegalStateException
     *             if the job is disabled or already running
     */
    public CompletableFuture<ExecutionOutcome> runNow(String jobId) {
        Job job = jobStore.get(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Job not found: " + jobId));
        if (job.getStatus() == JobStatus.DISABLED) {
            throw new IllegalStateException("Job is disabled: " + job.getName());
        }
        Instant now = clock.instant();
        if (!jobStore.compareAndSetStatus(jobId, JobStatus.IDLE, JobStatus.RUNNING, now)) {
            throw new IllegalStateException("Job is already running: " + job.getName());
        }
        log.info("[Scheduler] Manual run of job {}", job.getName());
        return dispatch(job, now, ExecutionTrigger.MANUAL);
    }

    /**
     * One pass over the due jobs.
     *
     * @return the dispatched firings, completing when each firing is finished
     *         and recorded
     */
    List<CompletableFuture<ExecutionOutcome>> tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Scheduler] Tick skipped: previous tick still in progress");
            return List.of();
        }

        try {
            retryPendingCompletions();

            Instant now = clock.instant();
            List<Job> dueJobs;
            try {
                dueJobs = jobStore.listDue(now);
            } catch (StorageException e) {
                log.error("[Scheduler] Failed to list due jobs: {}", e.getMessage(), e);
                return List.of();
            }
            if (dueJobs.isEmpty()) {
                return List.of();
            }

            log.info("[Scheduler] Tick: {} due jobs", dueJobs.size());
            List<CompletableFuture<ExecutionOutcome>> dispatched = new ArrayList<>();
            for (Job job : dueJobs) {
                try {
                    processDueJob(job, now).ifPresent(dispatched::add);
                } catch (RuntimeException e) {
                    log.error("[Scheduler] Failed to process job {}: {}", job.getName(), e.getMessage(), e);
                }
            }
            return dispatched;
        } catch (RuntimeException e) {
            log.error("[Scheduler] Tick failed: {}", e.getMessage(), e);
            return List.of();
        } finally {
            executing.set(false);
        }
    }

    /**
     * Reset state a previous process left behind: RUNNING jobs go back to IDLE
     * with their {@code nextRun} kept, and unfinished records are marked
     * FAILED.
     */
    void reconcile() {
        Instant now = clock.instant();
        int jobs = 0;
        int records = 0;
        try {
            for (Job job : jobStore.list()) {
                if (job.getStatus() == JobStatus.RUNNING
                        && jobStore.compareAndSetStatus(job.getId(), JobStatus.RUNNING, JobStatus.IDLE, now)) {
                    jobs++;
                }
            }
            for (ExecutionRecord record : history.listInFlight()) {
                history.append(record.finish(ExecutionStatus.FAILED, now).toBuilder()
                        .error(INTERRUPTED_BY_RESTART)
                        .failureKind(ExecutionFailureKind.INTERRUPTED)
                        .build());
                records++;
            }
        } catch (StorageException e) {
            log.error("[Scheduler] Startup reconciliation failed: {}", e.getMessage(), e);
        }
        if (jobs > 0 || records > 0) {
            log.warn("[Scheduler] Reconciled {} running jobs and {} in-flight records after restart", jobs, records);
        }
    }

    private Optional<CompletableFuture<ExecutionOutcome>> processDueJob(Job job, Instant now) {
        if (job.isExpiredAt(now)) {
            disable(job.getId(), "End date passed", now);
            log.info("[Scheduler] Job {} passed its end date, disabled", job.getName());
            return Optional.empty();
        }

        try {
            calculator.validate(job.getSchedule());
        } catch (ValidationException e) {
            disable(job.getId(), "Invalid schedule: " + e.getMessage(), now);
            log.error("[Scheduler] Job {} has an invalid schedule, disabled: {}", job.getName(), e.getMessage());
            return Optional.empty();
        }

        if (job.isNotStartedAt(now)) {
            Instant startAt = calculator.firstRun(job.getSchedule(), now, job.getOptions().getStartDate());
            jobStore.modify(job.getId(), current -> {
                if (current.getStatus() == JobStatus.IDLE) {
                    current.setNextRun(startAt);
                    current.setScheduledFor(null);
                    current.setUpdatedAt(now);
                }
                return current;
            });
            log.info("[Scheduler] Job {} not started yet, next run at {}", job.getName(), startAt);
            return Optional.empty();
        }

        GateResult gate = dependencyGate.evaluate(job, now);
        if (!gate.satisfied()) {
            defer(job, now);
            return Optional.empty();
        }

        if (!jobStore.compareAndSetStatus(job.getId(), JobStatus.IDLE, JobStatus.RUNNING, now)) {
            log.debug("[Scheduler] Job {} already claimed, skipping", job.getName());
            return Optional.empty();
        }

        Instant firingTime = job.getFiringTime();
        log.debug("[Scheduler] Dispatching job {} for {}", job.getName(), firingTime);
        return Optional.of(dispatch(job, firingTime, ExecutionTrigger.SCHEDULED));
    }

    private CompletableFuture<ExecutionOutcome> dispatch(Job job, Instant firingTime, ExecutionTrigger trigger) {
        return CompletableFuture.supplyAsync(() -> {
            ExecutionOutcome outcome;
            try {
                outcome = executor.execute(job, trigger);
            } catch (RuntimeException e) {
                log.error("[Scheduler] Executor failed for job {}: {}", job.getName(), e.getMessage(), e);
                outcome = ExecutionOutcome.failed(job.getId(), null, 0, e.getMessage(),
                        ExecutionFailureKind.TASK_ERROR);
            }
            complete(new PendingCompletion(job.getId(), job.getName(), firingTime, trigger, outcome));
            return outcome;
        }, dispatchPool);
    }

    private void complete(PendingCompletion completion) {
        try {
            applyCompletion(completion);
        } catch (RuntimeException e) {
            log.error("[Scheduler] Failed to record completion of job {}, will retry: {}",
                    completion.jobName(), e.getMessage(), e);
            pendingCompletions.add(completion);
        }
    }

    private void retryPendingCompletions() {
        int remaining = pendingCompletions.size();
        while (remaining-- > 0) {
            PendingCompletion completion = pendingCompletions.poll();
            if (completion == null) {
                return;
            }
            try {
                applyCompletion(completion);
            } catch (RuntimeException e) {
                log.warn("[Scheduler] Completion of job {} still not recorded: {}",
                        completion.jobName(), e.getMessage());
                pendingCompletions.add(completion);
                return;
            }
        }
    }

    private void applyCompletion(PendingCompletion completion) {
        ExecutionOutcome outcome = completion.outcome();
        Instant now = clock.instant();
        Optional<Job> updated = jobStore.modify(completion.jobId(), job -> {
            job.setLastRun(completion.firingTime());
            job.setUpdatedAt(now);
            job.setLastError(outcome.isSuccess() ? null : outcome.error());
            if (completion.trigger() == ExecutionTrigger.SCHEDULED) {
                job.setScheduledFor(null);
            }
            if (outcome.isFatal()) {
                job.setStatus(JobStatus.DISABLED);
                return job;
            }
            if (completion.trigger() == ExecutionTrigger.MANUAL && job.getNextRun() != null) {
                job.setStatus(JobStatus.IDLE);
                return job;
            }
            try {
                Instant next = calculator.nextRun(job.getSchedule(), completion.firingTime(), now);
                Instant startDate = job.getOptions() != null ? job.getOptions().getStartDate() : null;
                if (startDate != null && next.isBefore(startDate)) {
                    next = calculator.firstRun(job.getSchedule(), now, startDate);
                }
                Instant endDate = job.getOptions() != null ? job.getOptions().getEndDate() : null;
                job.setNextRun(next);
                job.setStatus(endDate != null && next.isAfter(endDate) ? JobStatus.DISABLED : JobStatus.IDLE);
            } catch (RuntimeException e) {
                job.setStatus(JobStatus.DISABLED);
                job.setLastError("Invalid schedule: " + e.getMessage());
            }
            return job;
        });

        if (updated.isEmpty()) {
            log.info("[Scheduler] Job {} was deleted while running", completion.jobName());
            return;
        }
        Job job = updated.get();
        if (job.getStatus() == JobStatus.DISABLED) {
            log.warn("[Scheduler] Job {} disabled after firing: {}", job.getName(), job.getLastError());
        } else {
            log.debug("[Scheduler] Job {} finished {}, next run at {}", job.getName(), outcome.status(),
                    job.getNextRun());
        }
    }

    private void defer(Job job, Instant now) {
        Instant retryAt = now.plus(Duration.ofSeconds(properties.getLoop().getDependencyGraceSeconds()));
        jobStore.modify(job.getId(), current -> {
            if (current.getStatus() == JobStatus.IDLE) {
                if (current.getScheduledFor() == null) {
                    current.setScheduledFor(current.getNextRun());
                }
                current.setNextRun(retryAt);
                current.setUpdatedAt(now);
            }
            return current;
        });
        log.debug("[Scheduler] Job {} deferred until {}", job.getName(), retryAt);
    }

    private void disable(String jobId, String reason, Instant now) {
        jobStore.modify(jobId, current -> {
            if (current.getStatus() == JobStatus.IDLE) {
                current.setStatus(JobStatus.DISABLED);
                current.setLastError(reason);
                current.setUpdatedAt(now);
            }
            return current;
        });
    }

    private void purgeHistory() {
        try {
            retentionService.purgeExpired();
        } catch (RuntimeException e) {
            log.error("[Scheduler] History purge failed: {}", e.getMessage(), e);
        }
    }

    private record PendingCompletion(String jobId, String jobName, Instant firingTime, ExecutionTrigger trigger,
            ExecutionOutcome outcome) {
    }
}
