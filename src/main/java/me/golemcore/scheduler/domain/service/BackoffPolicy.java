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

import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential retry delay: {@code base * 2^attempt}, capped, plus a random
 * jitter so jobs that failed on the same tick do not retry in lockstep.
 */
@Component
public class BackoffPolicy {

    private static final int MAX_SHIFT = 30;

    private final long baseMs;
    private final long maxMs;
    private final long jitterMs;
    private final Random random;

    @Autowired
    public BackoffPolicy(SchedulerProperties properties) {
        this(properties.getExecution().getBackoffBaseMs(),
                properties.getExecution().getBackoffMaxMs(),
                properties.getExecution().getBackoffJitterMs(),
                null);
    }

    BackoffPolicy(long baseMs, long maxMs, long jitterMs, Random random) {
        this.baseMs = baseMs;
        this.maxMs = maxMs;
        this.jitterMs = jitterMs;
        this.random = random;
    }

    public static BackoffPolicy fixed(long baseMs, long maxMs) {
        return new BackoffPolicy(baseMs, maxMs, 0, null);
    }

    /**
     * Delay before the retry that follows failed attempt {@code attempt}
     * (zero-based).
     */
    public Duration delayFor(int attempt) {
        int shift = Math.min(Math.max(attempt, 0), MAX_SHIFT);
        long exponential = baseMs << shift;
        if (exponential < baseMs) {
            exponential = maxMs;
        }
        long delay = Math.min(exponential, maxMs);
        if (jitterMs > 0) {
            delay += nextJitter();
        }
        return Duration.ofMillis(delay);
    }

    private long nextJitter() {
        if (random != null) {
            return (long) (random.nextDouble() * jitterMs);
        }
        return ThreadLocalRandom.current().nextLong(jitterMs + 1);
    }
}
