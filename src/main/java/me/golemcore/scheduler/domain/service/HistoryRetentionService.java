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
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.ExecutionHistoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Drops finished execution records older than
 * {@code scheduler.history.retention-days}. Invoked periodically by the
 * scheduler loop.
 */
@Service
@Slf4j
public class HistoryRetentionService {

    private final ExecutionHistoryPort history;
    private final Clock clock;
    private final int retentionDays;

    public HistoryRetentionService(ExecutionHistoryPort history, SchedulerProperties properties, Clock clock) {
        this.history = history;
        this.clock = clock;
        this.retentionDays = properties.getHistory().getRetentionDays();
    }

    /**
     * @return number of records removed; zero when retention is disabled
     *         ({@code retention-days <= 0})
     */
    public int purgeExpired() {
        if (retentionDays <= 0) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int purged = history.purgeOlderThan(cutoff);
        if (purged > 0) {
            log.info("[History] Purged {} execution records older than {}", purged, cutoff);
        }
        return purged;
    }
}
