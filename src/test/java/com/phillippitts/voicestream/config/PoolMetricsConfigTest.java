package com.phillippitts.voicestream.config;

import com.phillippitts.voicestream.domain.WorkerState;
import com.phillippitts.voicestream.service.pool.WorkerPool;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PoolMetricsConfigTest {

    @Test
    void registersPoolGauges() {
        WorkerPool pool = mock(WorkerPool.class);
        Map<WorkerState, Integer> counts = new EnumMap<>(WorkerState.class);
        counts.put(WorkerState.IDLE, 1);
        counts.put(WorkerState.PROCESSING, 2);
        counts.put(WorkerState.READING, 0);
        when(pool.size()).thenReturn(3);
        when(pool.stateCounts()).thenReturn(counts);
        when(pool.waitingRequests()).thenReturn(4);
        when(pool.completedRequests()).thenReturn(17L);

        DefaultListableBeanFactory beans = new DefaultListableBeanFactory();
        beans.registerSingleton("workerPool", pool);
        ObjectProvider<WorkerPool> poolProvider = beans.getBeanProvider(WorkerPool.class);
        // No stream executor registered
        ObjectProvider<ThreadPoolTaskExecutor> executorProvider = beans.getBeanProvider(ThreadPoolTaskExecutor.class);

        PoolMetricsConfig config = new PoolMetricsConfig(poolProvider, executorProvider);
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        config.workerPoolMetrics().bindTo(registry);

        assertThat(registry.get("tts.pool.workers").gauge().value()).isEqualTo(3.0);
        assertThat(registry.get("tts.pool.idle").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("tts.pool.processing").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get("tts.pool.reading").gauge().value()).isEqualTo(0.0);
        assertThat(registry.get("tts.pool.waiting").gauge().value()).isEqualTo(4.0);
        assertThat(registry.get("tts.pool.completed").gauge().value()).isEqualTo(17.0);
        assertThat(registry.find("tts.stream.active").gauge()).isNull();

        // Scheduled summary must not throw
        config.logPoolHealth();
    }
}
