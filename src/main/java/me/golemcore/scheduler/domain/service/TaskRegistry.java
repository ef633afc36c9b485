package me.golemcore.scheduler.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.component.TaskComponent;
import me.golemcore.scheduler.domain.exception.DuplicateTaskException;
import me.golemcore.scheduler.domain.exception.UnknownTaskException;
import me.golemcore.scheduler.domain.model.TaskDefinition;
import me.golemcore.scheduler.domain.model.TaskHandler;
import me.golemcore.scheduler.domain.model.TaskParameter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of invocable tasks, keyed by unique name.
 *
 * <p>
 * Populated during startup composition, from {@link TaskComponent} beans and
 * explicit {@link #register} calls, and read-only afterwards. Listing
 * preserves registration order. An instance is passed to the executor and the
 * job service explicitly, so independent registries can coexist in tests.
 */
@Component
@Slf4j
public class TaskRegistry {

    private final Map<String, TaskDefinition> tasksByName = new ConcurrentHashMap<>();
    private final List<TaskDefinition> orderedTasks = new CopyOnWriteArrayList<>();

    public TaskRegistry(List<TaskComponent> taskComponents) {
        if (taskComponents == null) {
            return;
        }
        for (TaskComponent component : taskComponents) {
            TaskDefinition metadata = component.getDefinition();
            register(metadata.getName(), metadata.getTitle(), metadata.getDescription(),
                    metadata.getParameters(), component::execute);
        }
    }

    public static TaskRegistry empty() {
        return new TaskRegistry(List.of());
    }

    public TaskDefinition register(String name, String title, String description, TaskHandler handler) {
        return register(name, title, description, List.of(), handler);
    }

    /**
     * Registers a task.
     *
     * @throws DuplicateTaskException
     *             if {@code name} is already registered
     * @throws IllegalArgumentException
     *             if {@code name} is blank or {@code handler} is null
     */
    public synchronized TaskDefinition register(String name, String title, String description,
            List<TaskParameter> parameters, TaskHandler handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name is required");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Task handler is required: " + name);
        }
        if (tasksByName.containsKey(name)) {
            throw new DuplicateTaskException(name);
        }

        TaskDefinition definition = TaskDefinition.builder()
                .name(name)
                .title(title != null && !title.isBlank() ? title : name)
                .description(description)
                .parameters(parameters != null ? List.copyOf(parameters) : List.of())
                .handler(handler)
                .build();
        tasksByName.put(name, definition);
        orderedTasks.add(definition);
        log.debug("[Tasks] Registered task: {}", name);
        return definition;
    }

    /**
     * @throws UnknownTaskException
     *             if no task has this name
     */
    public TaskDefinition lookup(String name) {
        return find(name).orElseThrow(() -> new UnknownTaskException(name));
    }

    public Optional<TaskDefinition> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasksByName.get(name));
    }

    public List<TaskDefinition> list() {
        return List.copyOf(orderedTasks);
    }
}
