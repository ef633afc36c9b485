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

/**
 * Precondition on another job's recent history: the job named
 * {@code jobName} must have an execution with {@code requiredStatus} that
 * started within the last {@code withinHours} hours.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobDependency {

    private String jobName;

    @Builder.Default
    private ExecutionStatus requiredStatus = ExecutionStatus.COMPLETED;

    @Builder.Default
    private int withinHours = 24;
}
