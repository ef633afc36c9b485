package me.golemcore.scheduler.port.outbound;

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

import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable store of job definitions and their scheduling state.
 *
 * <p>
 * Every operation is atomic for a single job; nothing spans multiple jobs.
 * Returned jobs are detached copies, so callers may mutate them freely.
 * Implementations signal I/O failures with
 * {@link me.golemcore.scheduler.domain.exception.StorageException}.
 */
public interface JobStorePort {

    Optional<Job> get(String id);

    Optional<Job> findByName(String name);

    List<Job> list();

    /**
     * Jobs that are IDLE with {@code nextRun <= now}, as of the latest committed
     * state.
     */
    List<Job> listDue(Instant now);

    /**
     * Persist a new job.
     *
     * @throws IllegalStateException
     *             if a job with the same id exists
     */
    Job create(Job job);

    /**
     * Whole-row replace of an existing job.
     *
     * @throws IllegalArgumentException
     *             if the job does not exist
     */
    Job update(Job job);

    /**
     * Atomic read-modify-write of one job. The change is applied to a copy of
     * the current row and the result persisted.
     *
     * @return the persisted job, or empty when no job has this id
     */
    Optional<Job> modify(String id, UnaryOperator<Job> change);

    /**
     * Conditional status transition, the exclusivity claim of the scheduler.
     *
     * @return {@code true} if the job was in {@code expected} and now is in
     *         {@code next}
     */
    boolean compareAndSetStatus(String id, JobStatus expected, JobStatus next, Instant updatedAt);

    boolean delete(String id);
}
