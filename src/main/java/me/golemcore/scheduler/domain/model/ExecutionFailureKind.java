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

/**
 * Classification of why an attempt or firing failed.
 */
public enum ExecutionFailureKind {

    /**
     * The task raised an exception.
     */
    TASK_ERROR,

    /**
     * The attempt exceeded the job's timeout and was cancelled.
     */
    TIMEOUT,

    /**
     * The job references a task that is not registered. Not retried and fatal
     * for the job.
     */
    UNKNOWN_TASK,

    /**
     * The scheduler was interrupted (shutdown or restart) while the attempt was
     * in flight.
     */
    INTERRUPTED;

    public boolean isFatal() {
        return this == UNKNOWN_TASK;
    }
}
