package com.phillippitts.voicestream.service.health;

import com.phillippitts.voicestream.domain.WorkerState;
import com.phillippitts.voicestream.service.pool.WorkerPool;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SynthesisHealthIndicatorTest {

    private static Map<WorkerState, Integer> counts(int idle, int processing, int reading) {
        Map<WorkerState, Integer> counts = new EnumMap<>(WorkerState.class);
        counts.put(WorkerState.IDLE, idle);
        counts.put(WorkerState.PROCESSING, processing);
        counts.put(WorkerState.READING, reading);
        return counts;
    }

    private static WorkerPool pool(boolean running, Map<WorkerState, Integer> counts, int waiting) {
        WorkerPool pool = mock(WorkerPool.class);
        when(pool.isRunning()).thenReturn(running);
        when(pool.stateCounts()).thenReturn(counts);
        when(pool.size()).thenReturn(counts.values().stream().mapToInt(Integer::intValue).sum());
        when(pool.waitingRequests()).thenReturn(waiting);
        when(pool.supportedFormatIds()).thenReturn(Set.of("wav", "mp3"));
        return pool;
    }

    @Test
    void shouldReportUpWhenAWorkerIsIdle() {
        SynthesisHealthIndicator indicator = new SynthesisHealthIndicator(pool(true, counts(1, 1, 0), 0));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("workers", 2);
        assertThat(health.getDetails()).containsEntry("idle", 1);
        assertThat(health.getDetails()).containsEntry("processing", 1);
        assertThat(health.getDetails()).containsKey("formats");
    }

    @Test
    void shouldReportBusyWhenEveryWorkerIsOccupied() {
        SynthesisHealthIndicator indicator = new SynthesisHealthIndicator(pool(true, counts(0, 1, 1), 3));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(new Status("BUSY"));
        assertThat(health.getDetails()).containsEntry("reading", 1);
        assertThat(health.getDetails()).containsEntry("waiting", 3);
    }

    @Test
    void shouldReportDownAfterShutdown() {
        SynthesisHealthIndicator indicator = new SynthesisHealthIndicator(pool(false, counts(2, 0, 0), 0));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
