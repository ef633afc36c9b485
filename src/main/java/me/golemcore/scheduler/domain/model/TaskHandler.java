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

import java.util.Map;

/**
 * The invocable unit of work behind a task. Implementations should honour
 * thread interruption, which is how a timed-out attempt is cancelled.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Runs the task.
     *
     * @param params
     *            the job's parameters
     * @return a structured result, serialized into the execution record
     * @throws Exception
     *             any failure; the attempt is marked FAILED and may be retried
     */
    Object run(Map<String, Object> params) throws Exception;
}
