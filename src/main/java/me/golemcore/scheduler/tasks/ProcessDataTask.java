package me.golemcore.scheduler.tasks;

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

import me.golemcore.scheduler.domain.component.TaskComponent;
import me.golemcore.scheduler.domain.model.TaskDefinition;
import me.golemcore.scheduler.domain.model.TaskParameter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simulated batch job: waits for a fixed processing time and reports the
 * batch it processed.
 */
@Component
public class ProcessDataTask implements TaskComponent {

    static final String NAME = "process_data";
    private static final int DEFAULT_BATCH_SIZE = 100;

    private final Duration processingTime;

    @Autowired
    public ProcessDataTask() {
        this(Duration.ofSeconds(5));
    }

    ProcessDataTask(Duration processingTime) {
        this.processingTime = processingTime;
    }

    @Override
    public TaskDefinition getDefinition() {
        return TaskDefinition.builder()
                .name(NAME)
                .title("Data Processing")
                .description("Process data in batches.")
                .parameters(List.of(
                        TaskParameter.builder()
                                .name("input_path")
                                .type(TaskParameter.ParameterType.STRING)
                                .required(true)
                                .description("Path to input data")
                                .build(),
                        TaskParameter.builder()
                                .name("batch_size")
                                .type(TaskParameter.ParameterType.INTEGER)
                                .description("Size of each processing batch")
                                .build()))
                .build();
    }

    @Override
    public Object execute(Map<String, Object> params) throws InterruptedException {
        String inputPath = (String) params.get("input_path");
        Object batchSize = params.get("batch_size");
        int size = batchSize instanceof Number number ? number.intValue() : DEFAULT_BATCH_SIZE;

        Thread.sleep(processingTime.toMillis());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("processed_records", size);
        result.put("input_path", inputPath);
        return result;
    }
}
