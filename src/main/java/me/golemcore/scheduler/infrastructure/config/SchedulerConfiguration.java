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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.exception.StorageException;
import me.golemcore.scheduler.domain.model.TaskDefinition;
import me.golemcore.scheduler.domain.service.JobService;
import me.golemcore.scheduler.domain.service.TaskRegistry;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Spring configuration that wires shared infrastructure beans and performs the
 * startup composition: logs the registered tasks and upserts the default jobs
 * declared under {@code scheduler.defaults}.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class SchedulerConfiguration {

    private final SchedulerProperties properties;
    private final TaskRegistry taskRegistry;
    private final JobService jobService;

    @Bean
    public static Clock clock(SchedulerProperties properties) {
        return Clock.system(ZoneId.of(properties.getLoop().getZone()));
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("GolemCore Scheduler starting...");
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        for (TaskDefinition task : taskRegistry.list()) {
            log.info("Registered task: {} ({})", task.getName(), task.getTitle());
        }

        int upserted = 0;
        for (SchedulerProperties.DefaultJobProperties defaults : properties.getDefaults()) {
            try {
                jobService.upsertDefault(defaults);
                upserted++;
            } catch (IllegalArgumentException | StorageException e) {
                log.error("Skipping default job for task '{}': {}", defaults.getTask(), e.getMessage());
            }
        }
        log.info("GolemCore Scheduler started: {} tasks, {} default jobs", taskRegistry.list().size(), upserted);
    }
}
