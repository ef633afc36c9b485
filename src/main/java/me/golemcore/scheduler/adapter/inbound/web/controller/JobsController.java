package me.golemcore.scheduler.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.adapter.inbound.web.dto.JobDto;
import me.golemcore.scheduler.adapter.inbound.web.dto.JobRequest;
import me.golemcore.scheduler.domain.loop.SchedulerLoop;
import me.golemcore.scheduler.domain.model.ExecutionRecord;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.JobStatus;
import me.golemcore.scheduler.domain.model.Page;
import me.golemcore.scheduler.domain.service.JobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Job management endpoints.
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobsController {

    private final JobService jobService;
    private final SchedulerLoop schedulerLoop;

    @GetMapping
    public Mono<ResponseEntity<List<JobDto>>> listJobs(
            @RequestParam(required = false) String task,
            @RequestParam(required = false) String status) {
        List<JobDto> jobs = jobService.listJobs(blankToNull(task), parseStatus(status)).stream()
                .map(JobDto::from)
                .toList();
        return Mono.just(ResponseEntity.ok(jobs));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<JobDto>> getJob(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(JobDto.from(requireJob(id))));
    }

    @PostMapping
    public Mono<ResponseEntity<JobDto>> createJob(@RequestBody JobRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        if (request.getTask() == null || request.getTask().isBlank()) {
            throw badRequest("task is required");
        }
        Job job = jobService.createJob(request.toDraft());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(JobDto.from(job)));
    }

    @PutMapping("/{id}")
    public Mono<ResponseEntity<JobDto>> updateJob(@PathVariable String id, @RequestBody JobRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        requireJob(id);
        return Mono.just(ResponseEntity.ok(JobDto.from(jobService.updateJob(id, request.toDraft()))));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<DeleteJobResponse>> deleteJob(@PathVariable String id) {
        if (!jobService.deleteJob(id)) {
            throw notFound(id);
        }
        return Mono.just(ResponseEntity.ok(new DeleteJobResponse(id)));
    }

    @PostMapping("/{id}/run")
    public Mono<ResponseEntity<RunJobResponse>> runJob(@PathVariable String id) {
        requireJob(id);
        schedulerLoop.runNow(id);
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(new RunJobResponse(id, "STARTED")));
    }

    @PostMapping("/{id}/enable")
    public Mono<ResponseEntity<JobDto>> enableJob(@PathVariable String id) {
        requireJob(id);
        return Mono.just(ResponseEntity.ok(JobDto.from(jobService.enableJob(id))));
    }

    @PostMapping("/{id}/disable")
    public Mono<ResponseEntity<JobDto>> disableJob(@PathVariable String id) {
        requireJob(id);
        return Mono.just(ResponseEntity.ok(JobDto.from(jobService.disableJob(id))));
    }

    @GetMapping("/{id}/executions")
    public Mono<ResponseEntity<Page<ExecutionRecord>>> getJobExecutions(
            @PathVariable String id,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "20") int limit) {
        requireJob(id);
        return Mono.just(ResponseEntity.ok(jobService.getHistory(id, Math.max(offset, 0), PageLimits.clamp(limit))));
    }

    private Job requireJob(String id) {
        return jobService.getJob(id).orElseThrow(() -> notFound(id));
    }

    private static JobStatus parseStatus(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw badRequest("Unknown job status: " + value);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static ResponseStatusException notFound(String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id);
    }

    private static ResponseStatusException badRequest(String message) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, message);
    }

    public record DeleteJobResponse(String deletedId) {
    }

    public record RunJobResponse(String jobId, String status) {
    }
}
