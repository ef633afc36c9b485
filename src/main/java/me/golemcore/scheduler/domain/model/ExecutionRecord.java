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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * One attempt of one firing of a job. Records are append-only: a status
 * change is stored as a new version of the same {@code id}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecord {

    private String id;
    private String jobId;
    private String firingId;
    private int attempt;
    private ExecutionTrigger trigger;
    private ExecutionStatus status;
    private Instant startedAt;
    private Instant finishedAt;
    private Long durationMillis;
    private Object result;
    private String error;
    private ExecutionFailureKind failureKind;

    /**
     * Returns a finished copy of this record with the duration derived from
     * the start and finish timestamps.
     */
    public ExecutionRecord finish(ExecutionStatus finalStatus, Instant finishedAt) {
        Long duration = startedAt != null ? Duration.between(startedAt, finishedAt).toMillis() : null;
        return toBuilder()
                .status(finalStatus)
                .finishedAt(finishedAt)
                .durationMillis(duration)
                .build();
    }
}
