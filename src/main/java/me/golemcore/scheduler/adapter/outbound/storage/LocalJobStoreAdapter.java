package me.golemcore.scheduler.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.exception.StorageException;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.JobStatus;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.JobStorePort;
import me.golemcore.scheduler.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * {@link JobStorePort} backed by one JSON file per job under
 * {@code jobs/<id>.json}.
 *
 * <p>
 * The full set of jobs is cached in memory and loaded on first access. All
 * operations run under the store's monitor, and a change reaches the cache
 * only after the atomic file write succeeded, so the cache always mirrors
 * committed state and conditional updates are atomic.
 */
@Component
@Slf4j
public class LocalJobStoreAdapter implements JobStorePort {

    private static final String FILE_SUFFIX = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;

    private Map<String, Job> jobsCache;

    public LocalJobStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper, SchedulerProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = properties.getStorage().getDirectories().getJobs();
    }

    @Override
    public synchronized Optional<Job> get(String id) {
        return Optional.ofNullable(jobs().get(id)).map(this::copy);
    }

    @Override
    public synchronized Optional<Job> findByName(String name) {
        return jobs().values().stream()
                .filter(job -> Objects.equals(job.getName(), name))
                .findFirst()
                .map(this::copy);
    }

    @Override
    public synchronized List<Job> list() {
        return jobs().values().stream()
                .sorted(Comparator.comparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized List<Job> listDue(Instant now) {
        return jobs().values().stream()
                .filter(job -> job.isDueAt(now))
                .sorted(Comparator.comparing(Job::getNextRun))
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized Job create(Job job) {
        if (jobs().containsKey(job.getId())) {
            throw new IllegalStateException("Job already exists: " + job.getId());
        }
        return persist(job);
    }

    @Override
    public synchronized Job update(Job job) {
        if (!jobs().containsKey(job.getId())) {
            throw new IllegalArgumentException("Job not found: " + job.getId());
        }
        return persist(job);
    }

    @Override
    public synchronized Optional<Job> modify(String id, UnaryOperator<Job> change) {
        Job current = jobs().get(id);
        if (current == null) {
            return Optional.empty();
        }
        Job changed = change.apply(copy(current));
        if (!id.equals(changed.getId())) {
            throw new IllegalArgumentException("Job id cannot change: " + id);
        }
        return Optional.of(persist(changed));
    }

    @Override
    public synchronized boolean compareAndSetStatus(String id, JobStatus expected, JobStatus next, Instant updatedAt) {
        Job current = jobs().get(id);
        if (current == null || current.getStatus() != expected) {
            return false;
        }
        Job changed = copy(current);
        changed.setStatus(next);
        changed.setUpdatedAt(updatedAt);
        persist(changed);
        return true;
    }

    @Override
    public synchronized boolean delete(String id) {
        if (!jobs().containsKey(id)) {
            return false;
        }
        StorageFutures.await(storagePort.deleteObject(directory, fileName(id)), "Delete job " + id);
        jobs().remove(id);
        log.debug("[Storage] Deleted job {}", id);
        return true;
    }

    private Job persist(Job job) {
        Job stored = copy(job);
        String json;
        try {
            json = objectMapper.writeValueAsString(stored);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize job " + job.getId(), e);
        }
        StorageFutures.await(storagePort.putTextAtomic(directory, fileName(job.getId()), json),
                "Write job " + job.getId());
        jobs().put(stored.getId(), stored);
        return copy(stored);
    }

    private Map<String, Job> jobs() {
        if (jobsCache == null) {
            jobsCache = loadJobs();
        }
        return jobsCache;
    }

    private Map<String, Job> loadJobs() {
        Map<String, Job> loaded = new LinkedHashMap<>();
        List<String> files = StorageFutures.await(storagePort.listObjects(directory), "List jobs");
        for (String file : files) {
            if (!file.endsWith(FILE_SUFFIX)) {
                continue;
            }
            String json = StorageFutures.await(storagePort.getText(directory, file), "Read job " + file);
            if (json == null || json.isBlank()) {
                continue;
            }
            try {
                Job job = objectMapper.readValue(json, Job.class);
                loaded.put(job.getId(), job);
            } catch (IOException e) {
                log.warn("[Storage] Skipping unreadable job file {}: {}", file, e.getMessage());
            }
        }
        log.debug("[Storage] Loaded {} jobs", loaded.size());
        return loaded;
    }

    private Job copy(Job job) {
        return objectMapper.convertValue(job, Job.class);
    }

    private static String fileName(String id) {
        return id + FILE_SUFFIX;
    }
}
