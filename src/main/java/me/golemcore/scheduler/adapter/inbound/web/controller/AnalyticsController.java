package me.golemcore.scheduler.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.adapter.inbound.web.dto.JobDto;
import me.golemcore.scheduler.domain.model.ExecutionRecord;
import me.golemcore.scheduler.domain.service.AnalyticsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Dashboard aggregates.
 */
@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private static final int MAX_DAYS = 365;

    private final AnalyticsService analyticsService;

    @GetMapping("/recent-activity")
    public Mono<ResponseEntity<List<ExecutionRecord>>> getRecentActivity(
            @RequestParam(defaultValue = "10") int limit) {
        return Mono.just(ResponseEntity.ok(analyticsService.recentActivity(PageLimits.clamp(limit))));
    }

    @GetMapping("/upcoming-executions")
    public Mono<ResponseEntity<List<JobDto>>> getUpcomingExecutions(
            @RequestParam(defaultValue = "10") int limit) {
        List<JobDto> jobs = analyticsService.upcomingExecutions(PageLimits.clamp(limit)).stream()
                .map(JobDto::from)
                .toList();
        return Mono.just(ResponseEntity.ok(jobs));
    }

    @GetMapping("/task-distribution")
    public Mono<ResponseEntity<List<AnalyticsService.TaskDistribution>>> getTaskDistribution() {
        return Mono.just(ResponseEntity.ok(analyticsService.taskDistribution()));
    }

    @GetMapping("/error-rate")
    public Mono<ResponseEntity<AnalyticsService.ErrorRate>> getErrorRate() {
        return Mono.just(ResponseEntity.ok(analyticsService.errorRate()));
    }

    @GetMapping("/execution-history")
    public Mono<ResponseEntity<List<AnalyticsService.DailyExecutions>>> getExecutionHistory(
            @RequestParam(defaultValue = "30") int days) {
        int window = Math.min(Math.max(days, 1), MAX_DAYS);
        return Mono.just(ResponseEntity.ok(analyticsService.executionHistory(window)));
    }
}
