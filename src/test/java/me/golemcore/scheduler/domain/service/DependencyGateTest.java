package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.domain.model.ExecutionRecord;
import me.golemcore.scheduler.domain.model.ExecutionStatus;
import me.golemcore.scheduler.domain.model.GateResult;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.JobDependency;
import me.golemcore.scheduler.domain.model.JobOptions;
import me.golemcore.scheduler.domain.model.JobSchedule;
import me.golemcore.scheduler.domain.model.ScheduleUnit;
import me.golemcore.scheduler.testsupport.InMemoryExecutionHistory;
import me.golemcore.scheduler.testsupport.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyGateTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private InMemoryJobStore jobStore;
    private InMemoryExecutionHistory history;
    private DependencyGate gate;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryJobStore();
        history = new InMemoryExecutionHistory();
        gate = new DependencyGate(jobStore, history);
        jobStore.create(job("upstream-id", "upstream", JobOptions.defaults()));
    }

    @Test
    void shouldOpenGateWithoutDependencies() {
        GateResult result = gate.evaluate(job("j", "plain", JobOptions.defaults()), NOW);

        assertTrue(result.satisfied());
    }

    @Test
    void shouldBlockWhenUpstreamHasNoRecord() {
        GateResult result = gate.evaluate(dependent(ExecutionStatus.COMPLETED, 24), NOW);

        assertFalse(result.satisfied());
        assertEquals(List.of("upstream"), result.unmetDependencies());
    }

    @Test
    void shouldOpenWhenUpstreamCompletedWithinWindow() {
        history.append(record(ExecutionStatus.COMPLETED, NOW.minus(Duration.ofHours(23))));

        assertTrue(gate.evaluate(dependent(ExecutionStatus.COMPLETED, 24), NOW).satisfied());
    }

    @Test
    void shouldBlockWhenQualifyingRecordIsOutsideWindow() {
        history.append(record(ExecutionStatus.COMPLETED, NOW.minus(Duration.ofHours(25))));

        assertFalse(gate.evaluate(dependent(ExecutionStatus.COMPLETED, 24), NOW).satisfied());
    }

    @Test
    void shouldRequireMatchingStatus() {
        history.append(record(ExecutionStatus.FAILED, NOW.minus(Duration.ofHours(1))));

        assertFalse(gate.evaluate(dependent(ExecutionStatus.COMPLETED, 24), NOW).satisfied());
        assertTrue(gate.evaluate(dependent(ExecutionStatus.FAILED, 24), NOW).satisfied());
    }

    @Test
    void shouldBlockOnDependencyToMissingJob() {
        JobOptions options = JobOptions.builder()
                .dependencies(List.of(JobDependency.builder().jobName("ghost").build()))
                .build();

        GateResult result = gate.evaluate(job("j", "dependent", options), NOW);

        assertEquals(List.of("ghost"), result.unmetDependencies());
    }

    private Job dependent(ExecutionStatus requiredStatus, int withinHours) {
        JobOptions options = JobOptions.builder()
                .dependencies(List.of(JobDependency.builder()
                        .jobName("upstream")
                        .requiredStatus(requiredStatus)
                        .withinHours(withinHours)
                        .build()))
                .build();
        return job("dependent-id", "dependent", options);
    }

    private static ExecutionRecord record(ExecutionStatus status, Instant startedAt) {
        return ExecutionRecord.builder()
                .id("rec-" + startedAt.toEpochMilli())
                .jobId("upstream-id")
                .attempt(1)
                .status(status)
                .startedAt(startedAt)
                .finishedAt(startedAt.plusSeconds(1))
                .build();
    }

    private static Job job(String id, String name, JobOptions options) {
        return Job.builder()
                .id(id)
                .name(name)
                .taskName("noop")
                .schedule(JobSchedule.every(1, ScheduleUnit.HOURS))
                .options(options)
                .createdAt(NOW)
                .nextRun(NOW)
                .build();
    }
}
