package me.golemcore.scheduler.domain.component;

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

import me.golemcore.scheduler.domain.model.TaskDefinition;

import java.util.Map;

/**
 * A task contributed as a Spring bean. The {@link
 * me.golemcore.scheduler.domain.service.TaskRegistry} registers every
 * component at startup under its definition's name, with {@link #execute} as
 * the handler.
 */
public interface TaskComponent {

    /**
     * Returns the task metadata: name, title, description and declared
     * parameters. The handler field is ignored.
     *
     * @return the task definition
     */
    TaskDefinition getDefinition();

    /**
     * Runs the task with the job's parameters. Long-running work should check
     * for thread interruption, which signals a timed-out attempt.
     *
     * @param params
     *            the job parameters, already validated against the declared
     *            parameters
     * @return a structured result stored in the execution record
     * @throws Exception
     *             on failure; the attempt is retried per the job's options
     */
    Object execute(Map<String, Object> params) throws Exception;
}
