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
import me.golemcore.scheduler.domain.model.ExecutionRecord;
import me.golemcore.scheduler.domain.model.ExecutionStatus;
import me.golemcore.scheduler.domain.model.Page;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.ExecutionHistoryPort;
import me.golemcore.scheduler.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * {@link ExecutionHistoryPort} backed by one JSONL file per job under
 * {@code executions/<jobId>.jsonl}.
 *
 * <p>
 * Every append writes a full record version as one line; on load the last
 * line for an id wins. Purging compacts a job's file with an atomic rewrite.
 */
@Component
@Slf4j
public class LocalExecutionHistoryAdapter implements ExecutionHistoryPort {

    private static final String FILE_SUFFIX = ".jsonl";
    private static final Comparator<ExecutionRecord> NEWEST_FIRST = Comparator
            .comparing(ExecutionRecord::getStartedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(ExecutionRecord::getAttempt, Comparator.reverseOrder());

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;

    private Map<String, Map<String, ExecutionRecord>> recordsByJob;

    public LocalExecutionHistoryAdapter(StoragePort storagePort, ObjectMapper objectMapper,
            SchedulerProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = properties.getStorage().getDirectories().getExecutions();
    }

    @Override
    public synchronized void append(ExecutionRecord record) {
        String line = toJson(record) + "\n";
        StorageFutures.await(storagePort.appendText(directory, fileName(record.getJobId()), line),
                "Append execution " + record.getId());
        records().computeIfAbsent(record.getJobId(), key -> new LinkedHashMap<>())
                .put(record.getId(), copy(record));
    }

    @Override
    public synchronized Optional<ExecutionRecord> get(String id) {
        return allRecords()
                .filter(record -> record.getId().equals(id))
                .findFirst()
                .map(this::copy);
    }

    @Override
    public synchronized Optional<ExecutionRecord> latestForJob(String jobId) {
        return jobRecords(jobId).stream()
                .min(NEWEST_FIRST)
                .map(this::copy);
    }

    @Override
    public synchronized boolean findRecent(String jobId, Set<ExecutionStatus> statuses, Instant since) {
        return jobRecords(jobId).stream()
                .anyMatch(record -> statuses.contains(record.getStatus())
                        && record.getStartedAt() != null
                        && !record.getStartedAt().isBefore(since));
    }

    @Override
    public synchronized Page<ExecutionRecord> list(String jobId, ExecutionStatus status, int offset, int limit) {
        Stream<ExecutionRecord> source = jobId != null ? jobRecords(jobId).stream() : allRecords();
        List<ExecutionRecord> matching = source
                .filter(record -> status == null || record.getStatus() == status)
                .sorted(NEWEST_FIRST)
                .toList();
        int from = Math.min(Math.max(offset, 0), matching.size());
        int to = Math.min(from + Math.max(limit, 0), matching.size());
        List<ExecutionRecord> items = matching.subList(from, to).stream()
                .map(this::copy)
                .toList();
        return new Page<>(items, matching.size(), from, limit);
    }

    @Override
    public synchronized List<ExecutionRecord> recent(int limit) {
        return allRecords()
                .sorted(NEWEST_FIRST)
                .limit(Math.max(limit, 0))
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized List<ExecutionRecord> listSince(Instant since) {
        return allRecords()
                .filter(record -> record.getStartedAt() != null && !record.getStartedAt().isBefore(since))
                .sorted(NEWEST_FIRST)
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized List<ExecutionRecord> listInFlight() {
        return allRecords()
                .filter(record -> record.getStatus() == null || !record.getStatus().isTerminal())
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized int purgeOlderThan(Instant cutoff) {
        int removed = 0;
        for (Map.Entry<String, Map<String, ExecutionRecord>> entry : new ArrayList<>(records().entrySet())) {
            String jobId = entry.getKey();
            Map<String, ExecutionRecord> kept = new LinkedHashMap<>();
            int expired = 0;
            for (ExecutionRecord record : entry.getValue().values()) {
                if (isExpired(record, cutoff)) {
                    expired++;
                } else {
                    kept.put(record.getId(), record);
                }
            }
            if (expired == 0) {
                continue;
            }

            if (kept.isEmpty()) {
                StorageFutures.await(storagePort.deleteObject(directory, fileName(jobId)),
                        "Delete history of " + jobId);
                records().remove(jobId);
            } else {
                StringBuilder content = new StringBuilder();
                for (ExecutionRecord record : kept.values()) {
                    content.append(toJson(record)).append('\n');
                }
                StorageFutures.await(storagePort.putTextAtomic(directory, fileName(jobId), content.toString()),
                        "Compact history of " + jobId);
                records().put(jobId, kept);
            }
            removed += expired;
        }
        return removed;
    }

    private static boolean isExpired(ExecutionRecord record, Instant cutoff) {
        return record.getStatus() != null && record.getStatus().isTerminal()
                && record.getStartedAt() != null && record.getStartedAt().isBefore(cutoff);
    }

    private List<ExecutionRecord> jobRecords(String jobId) {
        Map<String, ExecutionRecord> byId = records().get(jobId);
        return byId != null ? new ArrayList<>(byId.values()) : List.of();
    }

    private Stream<ExecutionRecord> allRecords() {
        return records().values().stream().flatMap(byId -> byId.values().stream());
    }

    private Map<String, Map<String, ExecutionRecord>> records() {
        if (recordsByJob == null) {
            recordsByJob = loadRecords();
        }
        return recordsByJob;
    }

    private Map<String, Map<String, ExecutionRecord>> loadRecords() {
        Map<String, Map<String, ExecutionRecord>> loaded = new HashMap<>();
        List<String> files = StorageFutures.await(storagePort.listObjects(directory), "List execution history");
        for (String file : files) {
            if (!file.endsWith(FILE_SUFFIX)) {
                continue;
            }
            String content = StorageFutures.await(storagePort.getText(directory, file), "Read " + file);
            if (content == null) {
                continue;
            }
            for (String line : content.split("\n")) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    ExecutionRecord record = objectMapper.readValue(line, ExecutionRecord.class);
                    loaded.computeIfAbsent(record.getJobId(), key -> new LinkedHashMap<>())
                            .put(record.getId(), record);
                } catch (IOException e) {
                    // A torn last line after a crash is expected
                    log.warn("[History] Skipping unreadable line in {}: {}", file, e.getMessage());
                }
            }
        }
        return loaded;
    }

    private String toJson(ExecutionRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize execution " + record.getId(), e);
        }
    }

    private ExecutionRecord copy(ExecutionRecord record) {
        return objectMapper.convertValue(record, ExecutionRecord.class);
    }

    private static String fileName(String jobId) {
        return jobId + FILE_SUFFIX;
    }
}
