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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A scheduled binding of a registered task to parameters, a
 * {@link JobSchedule} and {@link JobOptions}. Persisted as
 * {@code jobs/<id>.json}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    private String id;
    private String name;
    private String taskName;

    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();

    private JobSchedule schedule;

    @Builder.Default
    private JobOptions options = new JobOptions();

    @Builder.Default
    private JobStatus status = JobStatus.IDLE;

    private boolean defaultJob;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastRun;
    private Instant nextRun;

    /**
     * Schedule slot of a firing held back by an unmet dependency. While set,
     * {@code nextRun} is only the retry time and this is the firing time.
     */
    private Instant scheduledFor;

    private String lastError;

    /**
     * Whether the job may be dispatched at {@code now}: enabled, idle, and past
     * its next run time.
     */
    @JsonIgnore
    public boolean isDueAt(Instant now) {
        return status == JobStatus.IDLE && nextRun != null && !nextRun.isAfter(now);
    }

    /**
     * The schedule slot the next dispatch fires for.
     */
    @JsonIgnore
    public Instant getFiringTime() {
        return scheduledFor != null ? scheduledFor : nextRun;
    }

    @JsonIgnore
    public boolean isExpiredAt(Instant now) {
        return options != null && options.getEndDate() != null && now.isAfter(options.getEndDate());
    }

    @JsonIgnore
    public boolean isNotStartedAt(Instant now) {
        return options != null && options.getStartDate() != null && options.getStartDate().isAfter(now);
    }
}
