package me.golemcore.scheduler.infrastructure.config;

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

import lombok.Data;
import me.golemcore.scheduler.domain.model.JobOptions;
import me.golemcore.scheduler.domain.model.JobSchedule;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the scheduler, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code scheduler.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where jobs and execution history live</li>
 * <li>{@link LoopProperties} - tick period, dependency grace, calendar
 * zone</li>
 * <li>{@link ExecutionProperties} - retry backoff and cancellation</li>
 * <li>{@link HistoryProperties} - execution history retention</li>
 * <li>{@link DefaultJobProperties} - jobs upserted at startup</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "scheduler")
@Data
public class SchedulerProperties {

    private StorageProperties storage = new StorageProperties();
    private LoopProperties loop = new LoopProperties();
    private ExecutionProperties execution = new ExecutionProperties();
    private HistoryProperties history = new HistoryProperties();
    private List<DefaultJobProperties> defaults = new ArrayList<>();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/scheduler";
    }

    @Data
    public static class DirectoriesProperties {
        private String jobs = "jobs";
        private String executions = "executions";
    }

    @Data
    public static class LoopProperties {
        private boolean enabled = true;
        private long tickIntervalMs = 1000;
        private int dependencyGraceSeconds = 30;
        private String zone = "UTC";
    }

    @Data
    public static class ExecutionProperties {
        private long backoffBaseMs = 2000;
        private long backoffMaxMs = 300_000;
        private long backoffJitterMs = 1000;
        private long cancelGraceMs = 500;
        private int maxRetriesLimit = 10;
    }

    @Data
    public static class HistoryProperties {
        private int retentionDays = 30;
        private int purgeIntervalMinutes = 60;
    }

    @Data
    public static class DefaultJobProperties {
        private String name;
        private String task;
        private Map<String, Object> params = new LinkedHashMap<>();
        private JobSchedule schedule;
        private JobOptions options = new JobOptions();
    }
}
