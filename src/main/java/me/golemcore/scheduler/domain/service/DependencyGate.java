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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.GateResult;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.JobDependency;
import me.golemcore.scheduler.port.outbound.ExecutionHistoryPort;
import me.golemcore.scheduler.port.outbound.JobStorePort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates a job's dependencies against execution history. A dependency is
 * met when the referenced job has a record with the required status that
 * started within the last {@code withinHours} hours. A dependency on a job
 * that no longer exists is never met.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DependencyGate {

    private final JobStorePort jobStore;
    private final ExecutionHistoryPort history;

    public GateResult evaluate(Job job, Instant now) {
        if (job.getOptions() == null || job.getOptions().getDependencies() == null
                || job.getOptions().getDependencies().isEmpty()) {
            return GateResult.open();
        }

        List<String> unmet = new ArrayList<>();
        for (JobDependency dependency : job.getOptions().getDependencies()) {
            if (!isSatisfied(dependency, now)) {
                unmet.add(dependency.getJobName());
            }
        }
        if (unmet.isEmpty()) {
            return GateResult.open();
        }
        log.debug("[Scheduler] Job {} waiting on dependencies {}", job.getName(), unmet);
        return GateResult.blocked(unmet);
    }

    private boolean isSatisfied(JobDependency dependency, Instant now) {
        Optional<Job> upstream = jobStore.findByName(dependency.getJobName());
        if (upstream.isEmpty()) {
            return false;
        }
        Instant since = now.minus(Duration.ofHours(dependency.getWithinHours()));
        return history.findRecent(upstream.get().getId(), Set.of(dependency.getRequiredStatus()), since);
    }
}
