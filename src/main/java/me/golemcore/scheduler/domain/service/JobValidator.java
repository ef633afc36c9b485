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

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.domain.exception.ValidationException;
import me.golemcore.scheduler.domain.model.ExecutionStatus;
import me.golemcore.scheduler.domain.model.JobDependency;
import me.golemcore.scheduler.domain.model.JobOptions;
import me.golemcore.scheduler.domain.model.TaskDefinition;
import me.golemcore.scheduler.domain.model.TaskParameter;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Rejects malformed job input before it is persisted. Every failure is a
 * {@link ValidationException} naming the offending field.
 */
@Component
@RequiredArgsConstructor
public class JobValidator {

    private static final Set<ExecutionStatus> DEPENDENCY_STATUSES = Set.of(
            ExecutionStatus.COMPLETED, ExecutionStatus.FAILED);

    private final SchedulerProperties properties;

    /**
     * Checks params against the parameters the task declares: unknown names,
     * missing required names and type mismatches are rejected.
     */
    public void validateParams(TaskDefinition task, Map<String, Object> params) {
        Map<String, Object> actual = params != null ? params : Map.of();
        Set<String> declared = new HashSet<>();
        for (TaskParameter parameter : task.getParameters()) {
            declared.add(parameter.getName());
            Object value = actual.get(parameter.getName());
            if (value == null) {
                if (parameter.isRequired()) {
                    throw new ValidationException("Missing required parameter '" + parameter.getName()
                            + "' for task " + task.getName());
                }
                continue;
            }
            if (!matchesType(parameter.getType(), value)) {
                throw new ValidationException("Parameter '" + parameter.getName() + "' must be of type "
                        + parameter.getType() + ", got " + value.getClass().getSimpleName());
            }
        }
        for (String name : actual.keySet()) {
            if (!declared.contains(name)) {
                throw new ValidationException("Unknown parameter '" + name + "' for task " + task.getName());
            }
        }
    }

    /**
     * Converts textual values of typed parameters, as bound from configuration
     * properties, to the declared type. Values that do not parse are left as
     * they are for {@link #validateParams} to reject.
     */
    public Map<String, Object> coerceParams(TaskDefinition task, Map<String, Object> params) {
        Map<String, Object> coerced = new LinkedHashMap<>(params != null ? params : Map.of());
        for (TaskParameter parameter : task.getParameters()) {
            if (coerced.get(parameter.getName()) instanceof String text) {
                coerced.put(parameter.getName(), coerce(parameter.getType(), text.trim()));
            }
        }
        return coerced;
    }

    /**
     * Checks timeout, retry budget, activation window and dependencies.
     *
     * @param jobName
     *            name of the job the options belong to, used to reject
     *            self-dependencies
     */
    public void validateOptions(JobOptions options, String jobName) {
        if (options == null) {
            return;
        }
        if (options.getTimeout() != null && options.getTimeout() < 1) {
            throw new ValidationException("timeout must be at least 1 second");
        }
        int limit = properties.getExecution().getMaxRetriesLimit();
        if (options.getMaxRetries() < 0 || options.getMaxRetries() > limit) {
            throw new ValidationException("maxRetries must be between 0 and " + limit);
        }
        if (options.getStartDate() != null && options.getEndDate() != null
                && !options.getStartDate().isBefore(options.getEndDate())) {
            throw new ValidationException("startDate must be before endDate");
        }
        if (options.getDependencies() == null) {
            return;
        }
        Set<String> seen = new HashSet<>();
        for (JobDependency dependency : options.getDependencies()) {
            validateDependency(dependency, jobName);
            if (!seen.add(dependency.getJobName())) {
                throw new ValidationException("Duplicate dependency on job " + dependency.getJobName());
            }
        }
    }

    private void validateDependency(JobDependency dependency, String jobName) {
        if (dependency == null || dependency.getJobName() == null || dependency.getJobName().isBlank()) {
            throw new ValidationException("dependency jobName is required");
        }
        if (dependency.getJobName().equals(jobName)) {
            throw new ValidationException("Job cannot depend on itself: " + jobName);
        }
        if (!DEPENDENCY_STATUSES.contains(dependency.getRequiredStatus())) {
            throw new ValidationException("dependency requiredStatus must be COMPLETED or FAILED");
        }
        if (dependency.getWithinHours() <= 0) {
            throw new ValidationException("dependency withinHours must be positive");
        }
    }

    private Object coerce(TaskParameter.ParameterType type, String text) {
        try {
            return switch (type) {
            case INTEGER -> Long.parseLong(text);
            case NUMBER -> Double.parseDouble(text);
            case BOOLEAN -> "true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)
                    ? Boolean.parseBoolean(text)
                    : text;
            default -> text;
            };
        } catch (NumberFormatException e) {
            return text;
        }
    }

    private boolean matchesType(TaskParameter.ParameterType type, Object value) {
        return switch (type) {
        case STRING -> value instanceof String;
        case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof BigInteger;
        case NUMBER -> value instanceof Number;
        case BOOLEAN -> value instanceof Boolean;
        case OBJECT -> value instanceof Map || value instanceof Collection;
        case ANY -> true;
        };
    }
}
