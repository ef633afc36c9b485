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

import me.golemcore.scheduler.domain.model.ExecutionRecord;
import me.golemcore.scheduler.domain.model.ExecutionStatus;
import me.golemcore.scheduler.domain.model.Page;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only log of execution attempts keyed by job.
 *
 * <p>
 * Appending a record whose id already exists stores a newer version of it; the
 * latest version is what every query sees.
 */
public interface ExecutionHistoryPort {

    void append(ExecutionRecord record);

    Optional<ExecutionRecord> get(String id);

    /**
     * Most recently started record of a job.
     */
    Optional<ExecutionRecord> latestForJob(String jobId);

    /**
     * Whether the job has a record in one of {@code statuses} that started at
     * or after {@code since}. The query behind dependency gating.
     */
    boolean findRecent(String jobId, Set<ExecutionStatus> statuses, Instant since);

    /**
     * Records newest first, optionally filtered by job and status.
     */
    Page<ExecutionRecord> list(String jobId, ExecutionStatus status, int offset, int limit);

    /**
     * Latest records across all jobs, newest first.
     */
    List<ExecutionRecord> recent(int limit);

    /**
     * All records started at or after {@code since}.
     */
    List<ExecutionRecord> listSince(Instant since);

    /**
     * Records that never reached a terminal status.
     */
    List<ExecutionRecord> listInFlight();

    /**
     * Remove finished records that started before {@code cutoff}.
     *
     * @return number of records removed
     */
    int purgeOlderThan(Instant cutoff);
}
