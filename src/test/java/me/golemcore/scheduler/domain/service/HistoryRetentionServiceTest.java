package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.ExecutionHistoryPort;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HistoryRetentionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-31T00:00:00Z");

    @Test
    void shouldPurgeRecordsOlderThanRetention() {
        ExecutionHistoryPort history = mock(ExecutionHistoryPort.class);
        when(history.purgeOlderThan(any())).thenReturn(4);
        SchedulerProperties properties = new SchedulerProperties();
        properties.getHistory().setRetentionDays(30);

        HistoryRetentionService service = new HistoryRetentionService(history, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertEquals(4, service.purgeExpired());
        verify(history).purgeOlderThan(Instant.parse("2026-03-01T00:00:00Z"));
    }

    @Test
    void shouldSkipPurgeWhenRetentionDisabled() {
        ExecutionHistoryPort history = mock(ExecutionHistoryPort.class);
        SchedulerProperties properties = new SchedulerProperties();
        properties.getHistory().setRetentionDays(0);

        HistoryRetentionService service = new HistoryRetentionService(history, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertEquals(0, service.purgeExpired());
        verify(history, never()).purgeOlderThan(any());
    }
}
