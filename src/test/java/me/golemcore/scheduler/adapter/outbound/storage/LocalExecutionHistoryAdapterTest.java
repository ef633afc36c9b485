package me.golemcore.scheduler.adapter.outbound.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.scheduler.domain.model.ExecutionRecord;
import me.golemcore.scheduler.domain.model.ExecutionStatus;
import me.golemcore.scheduler.domain.model.Page;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalExecutionHistoryAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @TempDir
    Path tempDir;

    private SchedulerProperties properties;
    private ObjectMapper objectMapper;
    private LocalStorageAdapter storage;
    private LocalExecutionHistoryAdapter history;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        storage = new LocalStorageAdapter(properties);
        storage.init();
        history = new LocalExecutionHistoryAdapter(storage, objectMapper, properties);
    }

    @Test
    void shouldKeepLatestVersionOfRecordAfterReload() throws Exception {
        ExecutionRecord running = record("rec-1", "job-1", ExecutionStatus.RUNNING, NOW);
        history.append(running);
        history.append(running.finish(ExecutionStatus.COMPLETED, NOW.plusSeconds(2)));

        List<String> lines = Files.readAllLines(tempDir.resolve("executions").resolve("job-1.jsonl"));
        assertEquals(2, lines.size());

        ExecutionRecord reloaded = reload().get("rec-1").orElseThrow();
        assertEquals(ExecutionStatus.COMPLETED, reloaded.getStatus());
        assertEquals(2000L, reloaded.getDurationMillis());
    }

    @Test
    void shouldIgnoreTornLastLine() throws Exception {
        history.append(record("rec-1", "job-1", ExecutionStatus.COMPLETED, NOW));
        Files.writeString(tempDir.resolve("executions").resolve("job-1.jsonl"), "{\"id\":\"rec-2\",\"jo",
                StandardOpenOption.APPEND);

        LocalExecutionHistoryAdapter reloaded = reload();

        assertEquals(1, reloaded.list("job-1", null, 0, 10).total());
    }

    @Test
    void shouldFindRecentRecordsByStatusAndWindow() {
        history.append(record("rec-1", "job-1", ExecutionStatus.COMPLETED, NOW.minus(Duration.ofHours(2))));
        history.append(record("rec-2", "job-1", ExecutionStatus.FAILED, NOW.minus(Duration.ofMinutes(10))));

        Set<ExecutionStatus> completed = Set.of(ExecutionStatus.COMPLETED);
        assertTrue(history.findRecent("job-1", completed, NOW.minus(Duration.ofHours(3))));
        assertFalse(history.findRecent("job-1", completed, NOW.minus(Duration.ofHours(1))));
        assertTrue(history.findRecent("job-1", Set.of(ExecutionStatus.FAILED), NOW.minus(Duration.ofHours(1))));
        assertFalse(history.findRecent("job-2", completed, Instant.EPOCH));
    }

    @Test
    void shouldPageNewestFirstWithFilters() {
        history.append(record("rec-1", "job-1", ExecutionStatus.COMPLETED, NOW.minusSeconds(30)));
        history.append(record("rec-2", "job-1", ExecutionStatus.FAILED, NOW.minusSeconds(20)));
        history.append(record("rec-3", "job-2", ExecutionStatus.COMPLETED, NOW.minusSeconds(10)));

        Page<ExecutionRecord> all = history.list(null, null, 0, 2);
        assertEquals(List.of("rec-3", "rec-2"), all.items().stream().map(ExecutionRecord::getId).toList());
        assertEquals(3, all.total());
        assertTrue(all.hasMore());

        Page<ExecutionRecord> completed = history.list(null, ExecutionStatus.COMPLETED, 0, 10);
        assertEquals(List.of("rec-3", "rec-1"), completed.items().stream().map(ExecutionRecord::getId).toList());

        Page<ExecutionRecord> secondPage = history.list("job-1", null, 1, 10);
        assertEquals(List.of("rec-1"), secondPage.items().stream().map(ExecutionRecord::getId).toList());
        assertFalse(secondPage.hasMore());
    }

    @Test
    void shouldListRecordsStillInFlight() {
        history.append(record("rec-1", "job-1", ExecutionStatus.RUNNING, NOW));
        history.append(record("rec-2", "job-1", ExecutionStatus.PENDING, NOW.plusSeconds(1)));
        history.append(record("rec-3", "job-1", ExecutionStatus.COMPLETED, NOW.minusSeconds(5)));

        List<String> inFlight = history.listInFlight().stream().map(ExecutionRecord::getId).sorted().toList();

        assertEquals(List.of("rec-1", "rec-2"), inFlight);
    }

    @Test
    void shouldPurgeFinishedRecordsBeforeCutoffAndCompactFile() throws Exception {
        history.append(record("old", "job-1", ExecutionStatus.COMPLETED, NOW.minus(Duration.ofDays(40))));
        history.append(record("old-running", "job-1", ExecutionStatus.RUNNING, NOW.minus(Duration.ofDays(40))));
        history.append(record("new", "job-1", ExecutionStatus.FAILED, NOW.minus(Duration.ofDays(1))));
        history.append(record("gone", "job-2", ExecutionStatus.COMPLETED, NOW.minus(Duration.ofDays(50))));

        int purged = history.purgeOlderThan(NOW.minus(Duration.ofDays(30)));

        assertEquals(2, purged);
        assertEquals(2, Files.readAllLines(tempDir.resolve("executions").resolve("job-1.jsonl")).size());
        assertFalse(Files.exists(tempDir.resolve("executions").resolve("job-2.jsonl")));
        LocalExecutionHistoryAdapter reloaded = reload();
        assertTrue(reloaded.get("old").isEmpty());
        assertTrue(reloaded.get("old-running").isPresent());
        assertTrue(reloaded.get("new").isPresent());
    }

    @Test
    void shouldReturnLatestRecordOfJob() {
        history.append(record("rec-1", "job-1", ExecutionStatus.COMPLETED, NOW.minusSeconds(30)));
        history.append(record("rec-2", "job-1", ExecutionStatus.FAILED, NOW.minusSeconds(10)));

        assertEquals("rec-2", history.latestForJob("job-1").orElseThrow().getId());
        assertTrue(history.latestForJob("job-9").isEmpty());
    }

    private LocalExecutionHistoryAdapter reload() {
        return new LocalExecutionHistoryAdapter(storage, objectMapper, properties);
    }

    private static ExecutionRecord record(String id, String jobId, ExecutionStatus status, Instant startedAt) {
        return ExecutionRecord.builder()
                .id(id)
                .jobId(jobId)
                .firingId("firing-" + id)
                .attempt(1)
                .status(status)
                .startedAt(startedAt)
                .build();
    }
}
