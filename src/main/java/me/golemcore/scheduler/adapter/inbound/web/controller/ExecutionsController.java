package me.golemcore.scheduler.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.domain.model.ExecutionRecord;
import me.golemcore.scheduler.domain.model.ExecutionStatus;
import me.golemcore.scheduler.domain.model.Page;
import me.golemcore.scheduler.port.outbound.ExecutionHistoryPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Execution history across all jobs, newest first.
 */
@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionsController {

    private final ExecutionHistoryPort history;

    @GetMapping
    public Mono<ResponseEntity<Page<ExecutionRecord>>> listExecutions(
            @RequestParam(required = false) String jobId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "20") int limit) {
        String job = jobId == null || jobId.isBlank() ? null : jobId.trim();
        Page<ExecutionRecord> page = history.list(job, parseStatus(status), Math.max(offset, 0),
                PageLimits.clamp(limit));
        return Mono.just(ResponseEntity.ok(page));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ExecutionRecord>> getExecution(@PathVariable String id) {
        ExecutionRecord record = history.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Execution not found: " + id));
        return Mono.just(ResponseEntity.ok(record));
    }

    private static ExecutionStatus parseStatus(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ExecutionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown execution status: " + value);
        }
    }
}
