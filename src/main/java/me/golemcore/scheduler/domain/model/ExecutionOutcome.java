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
 * Terminal result of one firing as returned by the executor: final status,
 * number of attempts made and the last result or error.
 */
public record ExecutionOutcome(
        String jobId,
        String firingId,
        ExecutionStatus status,
        int attempts,
        Object result,
        String error,
        ExecutionFailureKind failureKind) {

    public static ExecutionOutcome completed(String jobId, String firingId, int attempts, Object result) {
        return new ExecutionOutcome(jobId, firingId, ExecutionStatus.COMPLETED, attempts, result, null, null);
    }

    public static ExecutionOutcome failed(String jobId, String firingId, int attempts, String error,
            ExecutionFailureKind failureKind) {
        return new ExecutionOutcome(jobId, firingId, ExecutionStatus.FAILED, attempts, null, error, failureKind);
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.COMPLETED;
    }

    public boolean isFatal() {
        return failureKind != null && failureKind.isFatal();
    }
}
