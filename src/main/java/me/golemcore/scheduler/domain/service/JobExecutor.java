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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.exception.StorageException;
import me.golemcore.scheduler.domain.exception.TaskExecutionException;
import me.golemcore.scheduler.domain.model.ExecutionFailureKind;
import me.golemcore.scheduler.domain.model.ExecutionOutcome;
import me.golemcore.scheduler.domain.model.ExecutionRecord;
import me.golemcore.scheduler.domain.model.ExecutionStatus;
import me.golemcore.scheduler.domain.model.ExecutionTrigger;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.TaskDefinition;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.ExecutionHistoryPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one firing of one job: resolves the task, then runs up to
 * {@code maxRetries + 1} attempts, each under the job's timeout, with
 * exponential backoff between failed attempts.
 *
 * <p>
 * Every attempt is an {@link ExecutionRecord} appended to history: RUNNING
 * when it starts (PENDING first when it waits out a backoff) and a terminal
 * version when it ends. The executor never touches job state; the caller turns
 * the returned {@link ExecutionOutcome} into {@code lastRun}, {@code nextRun}
 * and status.
 *
 * <p>
 * Task handlers run on a dedicated worker pool. A timed-out attempt is
 * cancelled by interrupting its worker, and the executor waits at most
 * {@code scheduler.execution.cancel-grace-ms} for the handler to return before
 * moving on.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class JobExecutor {

    private final TaskRegistry taskRegistry;
    private final ExecutionHistoryPort history;
    private final BackoffPolicy backoffPolicy;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final long cancelGraceMs;
    private final ExecutorService workers;

    public JobExecutor(TaskRegistry taskRegistry, ExecutionHistoryPort history, BackoffPolicy backoffPolicy,
            SchedulerProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.taskRegistry = taskRegistry;
        this.history = history;
        this.backoffPolicy = backoffPolicy;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.cancelGraceMs = properties.getExecution().getCancelGraceMs();
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "job-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    public ExecutionOutcome execute(Job job, ExecutionTrigger trigger) {
        String firingId = UUID.randomUUID().toString();
        Optional<TaskDefinition> task = taskRegistry.find(job.getTaskName());
        if (task.isEmpty()) {
            return failUnknownTask(job, firingId, trigger);
        }

        int maxAttempts = job.getOptions() != null ? job.getOptions().getMaxRetries() + 1 : 1;
        Integer timeout = job.getOptions() != null ? job.getOptions().getTimeout() : null;
        ExecutionRecord pending = null;
        AttemptResult last = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            ExecutionRecord running = (pending != null ? pending.toBuilder() : ExecutionRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .jobId(job.getId())
                    .firingId(firingId)
                    .attempt(attempt + 1)
                    .trigger(trigger))
                    .status(ExecutionStatus.RUNNING)
                    .startedAt(clock.instant())
                    .build();
            appendQuietly(running);

            last = runAttempt(task.get(), job, timeout);
            Instant finishedAt = clock.instant();

            if (last.success()) {
                appendQuietly(running.finish(ExecutionStatus.COMPLETED, finishedAt).toBuilder()
                        .result(last.result())
                        .build());
                log.info("[Executor] Job {} completed (attempt {}/{})", job.getName(), attempt + 1, maxAttempts);
                return ExecutionOutcome.completed(job.getId(), firingId, attempt + 1, last.result());
            }

            appendQuietly(running.finish(ExecutionStatus.FAILED, finishedAt).toBuilder()
                    .error(last.error())
                    .failureKind(last.failureKind())
                    .build());
            log.warn("[Executor] Job {} attempt {}/{} failed: {}", job.getName(), attempt + 1, maxAttempts,
                    last.error());

            if (last.failureKind() == ExecutionFailureKind.INTERRUPTED) {
                return ExecutionOutcome.failed(job.getId(), firingId, attempt + 1, last.error(), last.failureKind());
            }
            if (attempt + 1 >= maxAttempts) {
                break;
            }

            pending = ExecutionRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .jobId(job.getId())
                    .firingId(firingId)
                    .attempt(attempt + 2)
                    .trigger(trigger)
                    .status(ExecutionStatus.PENDING)
                    .startedAt(clock.instant())
                    .build();
            appendQuietly(pending);

            Duration delay = backoffPolicy.delayFor(attempt);
            log.info("[Executor] Retrying job {} in {}ms", job.getName(), delay.toMillis());
            try {
                sleepBeforeRetry(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                String error = "Interrupted while waiting to retry";
                appendQuietly(pending.finish(ExecutionStatus.FAILED, clock.instant()).toBuilder()
                        .error(error)
                        .failureKind(ExecutionFailureKind.INTERRUPTED)
                        .build());
                return ExecutionOutcome.failed(job.getId(), firingId, attempt + 2, error,
                        ExecutionFailureKind.INTERRUPTED);
            }
        }

        return ExecutionOutcome.failed(job.getId(), firingId, maxAttempts, last.error(), last.failureKind());
    }

    protected void sleepBeforeRetry(long backoffMs) throws InterruptedException {
        Thread.sleep(backoffMs);
    }

    private AttemptResult runAttempt(TaskDefinition task, Job job, Integer timeout) {
        Map<String, Object> params = job.getParams() != null
                ? new LinkedHashMap<>(job.getParams())
                : new LinkedHashMap<>();
        CountDownLatch returned = new CountDownLatch(1);
        Future<Object> future = workers.submit(() -> {
            try {
                return task.getHandler().run(params);
            } finally {
                returned.countDown();
            }
        });

        try {
            Object value = timeout != null
                    ? future.get(timeout, TimeUnit.SECONDS)
                    : future.get();
            return AttemptResult.success(toResult(value));
        } catch (TimeoutException e) {
            future.cancel(true);
            awaitCancellation(task, returned);
            return AttemptResult.failure("Timed out after " + timeout + "s", ExecutionFailureKind.TIMEOUT);
        } catch (ExecutionException e) {
            TaskExecutionException failure = new TaskExecutionException(task.getName(), e.getCause());
            log.debug("[Executor] {}", failure.getMessage(), failure);
            return AttemptResult.failure(failure.getMessage(), ExecutionFailureKind.TASK_ERROR);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return AttemptResult.failure("Interrupted", ExecutionFailureKind.INTERRUPTED);
        }
    }

    private void awaitCancellation(TaskDefinition task, CountDownLatch returned) {
        try {
            if (!returned.await(cancelGraceMs, TimeUnit.MILLISECONDS)) {
                log.warn("[Executor] Task {} ignored cancellation, abandoning its worker", task.getName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ExecutionOutcome failUnknownTask(Job job, String firingId, ExecutionTrigger trigger) {
        String error = "Task not registered: " + job.getTaskName();
        Instant now = clock.instant();
        appendQuietly(ExecutionRecord.builder()
                .id(UUID.randomUUID().toString())
                .jobId(job.getId())
                .firingId(firingId)
                .attempt(1)
                .trigger(trigger)
                .startedAt(now)
                .build()
                .finish(ExecutionStatus.FAILED, now).toBuilder()
                .error(error)
                .failureKind(ExecutionFailureKind.UNKNOWN_TASK)
                .build());
        log.error("[Executor] Job {} references unknown task {}", job.getName(), job.getTaskName());
        return ExecutionOutcome.failed(job.getId(), firingId, 1, error, ExecutionFailureKind.UNKNOWN_TASK);
    }

    private Object toResult(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(value, Object.class);
        } catch (IllegalArgumentException e) {
            return String.valueOf(value);
        }
    }

    private void appendQuietly(ExecutionRecord record) {
        try {
            history.append(record);
        } catch (StorageException e) {
            log.error("[Executor] Failed to record attempt {} of job {}: {}",
                    record.getAttempt(), record.getJobId(), e.getMessage(), e);
        }
    }

    private record AttemptResult(boolean success, Object result, String error, ExecutionFailureKind failureKind) {

        static AttemptResult success(Object result) {
            return new AttemptResult(true, result, null, null);
        }

        static AttemptResult failure(String error, ExecutionFailureKind failureKind) {
            return new AttemptResult(false, null, error, failureKind);
        }
    }
}
