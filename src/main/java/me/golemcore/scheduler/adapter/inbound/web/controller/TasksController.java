package me.golemcore.scheduler.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.domain.model.TaskDefinition;
import me.golemcore.scheduler.domain.model.TaskParameter;
import me.golemcore.scheduler.domain.service.TaskRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Registered task catalog.
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TasksController {

    private final TaskRegistry taskRegistry;

    @GetMapping
    public Mono<ResponseEntity<List<TaskDto>>> listTasks() {
        List<TaskDto> tasks = taskRegistry.list().stream()
                .map(TasksController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(tasks));
    }

    @GetMapping("/{name}")
    public Mono<ResponseEntity<TaskDto>> getTask(@PathVariable String name) {
        TaskDefinition task = taskRegistry.find(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Task not found: " + name));
        return Mono.just(ResponseEntity.ok(toDto(task)));
    }

    private static TaskDto toDto(TaskDefinition task) {
        return new TaskDto(task.getName(), task.getTitle(), task.getDescription(), task.getParameters());
    }

    public record TaskDto(String name, String title, String description, List<TaskParameter> parameters) {
    }
}
