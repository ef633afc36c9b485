package me.golemcore.scheduler.adapter.inbound.web.controller;

import me.golemcore.scheduler.adapter.inbound.web.dto.JobDto;
import me.golemcore.scheduler.adapter.inbound.web.dto.JobRequest;
import me.golemcore.scheduler.domain.loop.SchedulerLoop;
import me.golemcore.scheduler.domain.model.ExecutionRecord;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.JobDraft;
import me.golemcore.scheduler.domain.model.JobSchedule;
import me.golemcore.scheduler.domain.model.JobStatus;
import me.golemcore.scheduler.domain.model.Page;
import me.golemcore.scheduler.domain.model.ScheduleUnit;
import me.golemcore.scheduler.domain.service.JobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobsControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private JobService jobService;
    private SchedulerLoop schedulerLoop;
    private JobsController controller;

    @BeforeEach
    void setUp() {
        jobService = mock(JobService.class);
        schedulerLoop = mock(SchedulerLoop.class);
        controller = new JobsController(jobService, schedulerLoop);
    }

    @Test
    void shouldCreateJobAndReturnCreated() {
        JobRequest request = JobRequest.builder()
                .task("ping")
                .params(Map.of("url", "https://example.com"))
                .schedule(JobSchedule.every(1, ScheduleUnit.HOURS))
                .build();
        when(jobService.createJob(any(JobDraft.class))).thenReturn(job("job-1", JobStatus.IDLE));

        StepVerifier.create(controller.createJob(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    JobDto body = response.getBody();
                    assertNotNull(body);
                    assertEquals("job-1", body.id());
                    assertEquals("IDLE", body.status());
                    assertEquals("Every hour", body.scheduleDescription());
                })
                .verifyComplete();

        ArgumentCaptor<JobDraft> draft = ArgumentCaptor.forClass(JobDraft.class);
        verify(jobService).createJob(draft.capture());
        assertEquals("ping", draft.getValue().getTaskName());
    }

    @Test
    void shouldRejectCreateWithoutTask() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.createJob(JobRequest.builder().build()));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(jobService, never()).createJob(any());
    }

    @Test
    void shouldFilterListByTaskAndStatus() {
        when(jobService.listJobs("ping", JobStatus.DISABLED)).thenReturn(List.of(job("job-1", JobStatus.DISABLED)));

        StepVerifier.create(controller.listJobs("ping", "disabled"))
                .assertNext(response -> assertEquals(1, response.getBody().size()))
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownStatusFilter() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.listJobs(null, "sleeping"));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void shouldReturnNotFoundForMissingJob() {
        when(jobService.getJob("missing")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.getJob("missing"));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    @Test
    void shouldStartManualRunAndReturnAccepted() {
        when(jobService.getJob("job-1")).thenReturn(Optional.of(job("job-1", JobStatus.IDLE)));

        StepVerifier.create(controller.runJob("job-1"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
                    assertEquals(new JobsController.RunJobResponse("job-1", "STARTED"), response.getBody());
                })
                .verifyComplete();

        verify(schedulerLoop).runNow("job-1");
    }

    @Test
    void shouldPropagateConflictWhenJobIsRunning() {
        when(jobService.getJob("job-1")).thenReturn(Optional.of(job("job-1", JobStatus.RUNNING)));
        when(schedulerLoop.runNow("job-1")).thenThrow(new IllegalStateException("Job is already running"));

        assertThrows(IllegalStateException.class, () -> controller.runJob("job-1"));
    }

    @Test
    void shouldDeleteExistingJob() {
        when(jobService.deleteJob("job-1")).thenReturn(true);
        when(jobService.deleteJob("missing")).thenReturn(false);

        StepVerifier.create(controller.deleteJob("job-1"))
                .assertNext(response -> assertEquals("job-1", response.getBody().deletedId()))
                .verifyComplete();
        assertThrows(ResponseStatusException.class, () -> controller.deleteJob("missing"));
    }

    @Test
    void shouldDisableJob() {
        when(jobService.getJob("job-1")).thenReturn(Optional.of(job("job-1", JobStatus.IDLE)));
        when(jobService.disableJob("job-1")).thenReturn(job("job-1", JobStatus.DISABLED));

        StepVerifier.create(controller.disableJob("job-1"))
                .assertNext(response -> assertEquals("DISABLED", response.getBody().status()))
                .verifyComplete();
    }

    @Test
    void shouldClampExecutionPageLimit() {
        when(jobService.getJob("job-1")).thenReturn(Optional.of(job("job-1", JobStatus.IDLE)));
        Page<ExecutionRecord> page = new Page<>(List.of(), 0, 0, 200);
        when(jobService.getHistory("job-1", 0, 200)).thenReturn(page);

        StepVerifier.create(controller.getJobExecutions("job-1", -5, 10_000))
                .assertNext(response -> assertEquals(page, response.getBody()))
                .verifyComplete();
    }

    private static Job job(String id, JobStatus status) {
        return Job.builder()
                .id(id)
                .name("health")
                .taskName("ping")
                .schedule(JobSchedule.every(1, ScheduleUnit.HOURS))
                .status(status)
                .createdAt(NOW)
                .nextRun(NOW.plusSeconds(3600))
                .build();
    }
}
