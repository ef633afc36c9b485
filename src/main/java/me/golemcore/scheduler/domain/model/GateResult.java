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

import java.util.List;

/**
 * Result of evaluating a job's dependency gate. An unsatisfied gate defers the
 * firing; it is never recorded as a failure.
 */
public record GateResult(boolean satisfied, List<String> unmetDependencies) {

    public static GateResult open() {
        return new GateResult(true, List.of());
    }

    public static GateResult blocked(List<String> unmetDependencies) {
        return new GateResult(false, List.copyOf(unmetDependencies));
    }
}
