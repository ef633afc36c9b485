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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.component.TaskComponent;
import me.golemcore.scheduler.domain.model.TaskDefinition;
import me.golemcore.scheduler.domain.model.TaskParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Website health check: GETs a URL and reports the status code and response
 * headers. Non-2xx responses are reported, not treated as failures; only
 * connection errors fail the attempt.
 */
@Component
@Slf4j
public class PingTask implements TaskComponent {

    static final String NAME = "ping";

    private final WebClient webClient;

    public PingTask(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    @Override
    public TaskDefinition getDefinition() {
        return TaskDefinition.builder()
                .name(NAME)
                .title("Website Health Check")
                .description("Ping a website and return its status code and headers.")
                .parameters(List.of(TaskParameter.builder()
                        .name("url")
                        .type(TaskParameter.ParameterType.STRING)
                        .required(true)
                        .description("The URL to check")
                        .build()))
                .build();
    }

    @Override
    public Object execute(Map<String, Object> params) {
        String url = (String) params.get("url");
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }

        ResponseEntity<Void> response = webClient.get()
                .uri(url)
                .exchangeToMono(clientResponse -> clientResponse.toBodilessEntity())
                .block();
        if (response == null) {
            throw new IllegalStateException("No response from " + url);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", response.getStatusCode().value());
        result.put("headers", flatten(response.getHeaders()));
        log.debug("[Ping] {} -> {}", url, response.getStatusCode().value());
        return result;
    }

    private Map<String, String> flatten(HttpHeaders headers) {
        Map<String, String> flat = new LinkedHashMap<>();
        headers.forEach((name, values) -> flat.put(name, String.join(", ", values)));
        return flat;
    }
}
