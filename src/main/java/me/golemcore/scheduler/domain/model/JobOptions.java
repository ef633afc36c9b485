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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Execution options of a job: per-attempt timeout, retry budget, activation
 * window and dependency gates.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobOptions {

    /**
     * Seconds one attempt may run; {@code null} means no deadline.
     */
    private Integer timeout;

    @Builder.Default
    private int maxRetries = 0;

    private Instant startDate;
    private Instant endDate;

    @Builder.Default
    private List<JobDependency> dependencies = new ArrayList<>();

    public static JobOptions defaults() {
        return JobOptions.builder().build();
    }
}
