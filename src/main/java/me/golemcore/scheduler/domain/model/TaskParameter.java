package me.golemcore.scheduler.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A parameter a task declares. Job params are validated against these.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskParameter {

    private String name;

    @Builder.Default
    private ParameterType type = ParameterType.ANY;

    private boolean required;
    private String description;

    public enum ParameterType {
        STRING, INTEGER, NUMBER, BOOLEAN, OBJECT, ANY
    }

    public static TaskParameter required(String name, ParameterType type) {
        return TaskParameter.builder().name(name).type(type).required(true).build();
    }

    public static TaskParameter optional(String name, ParameterType type) {
        return TaskParameter.builder().name(name).type(type).required(false).build();
    }
}
