package com.phillippitts.voicestream.config;

import com.phillippitts.voicestream.domain.WorkerState;
import com.phillippitts.voicestream.service.pool.WorkerPool;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for synthesis pool metrics exposure via Micrometer.
 *
 * <p>Exposes:
 * <ul>
 *   <li>tts.pool.workers - Configured number of workers</li>
 *   <li>tts.pool.idle / tts.pool.processing / tts.pool.reading - Workers per state</li>
 *   <li>tts.pool.waiting - Requests waiting for an idle worker</li>
 *   <li>tts.pool.completed - Cumulative count of finished requests</li>
 *   <li>tts.stream.active - Streaming responses being written</li>
 * </ul>
 *
 * <p>These metrics are available via:
 * <ul>
 *   <li>HTTP: {@code GET /actuator/metrics/tts.pool.idle}</li>
 *   <li>Prometheus: {@code tts_pool_idle}</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes for operational visibility.
 */
@Configuration
public class PoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(PoolMetricsConfig.class);

    private final ObjectProvider<WorkerPool> poolProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> streamExecutorProvider;

    public PoolMetricsConfig(ObjectProvider<WorkerPool> poolProvider,
                             @Qualifier("streamExecutor") ObjectProvider<ThreadPoolTaskExecutor> streamExecutorProvider) {
        this.poolProvider = poolProvider;
        this.streamExecutorProvider = streamExecutorProvider;
    }

    /**
     * Binds worker pool metrics to Micrometer registry.
     *
     * @return MeterBinder that registers custom metrics
     */
    @Bean
    public MeterBinder workerPoolMetrics() {
        return registry -> {
            WorkerPool pool = this.poolProvider.getObject();

            Gauge.builder("tts.pool.workers", pool, WorkerPool::size)
                    .description("Configured number of synthesis workers")
                    .register(registry);

            Gauge.builder("tts.pool.idle", pool, p -> p.stateCounts().get(WorkerState.IDLE))
                    .description("Workers ready for a new request")
                    .register(registry);

            Gauge.builder("tts.pool.processing", pool, p -> p.stateCounts().get(WorkerState.PROCESSING))
                    .description("Workers generating audio")
                    .register(registry);

            Gauge.builder("tts.pool.reading", pool, p -> p.stateCounts().get(WorkerState.READING))
                    .description("Workers whose stream is still being consumed")
                    .register(registry);

            Gauge.builder("tts.pool.waiting", pool, WorkerPool::waitingRequests)
                    .description("Requests waiting for an idle worker")
                    .register(registry);

            Gauge.builder("tts.pool.completed", pool, WorkerPool::completedRequests)
                    .description("Cumulative count of finished synthesis requests")
                    .register(registry);

            ThreadPoolTaskExecutor streamExecutor = this.streamExecutorProvider.getIfAvailable();
            if (streamExecutor != null) {
                ThreadPoolExecutor executor = streamExecutor.getThreadPoolExecutor();
                Gauge.builder("tts.stream.active", executor, ThreadPoolExecutor::getActiveCount)
                        .description("Streaming responses being written")
                        .register(registry);
            }

            LOG.info("Synthesis pool metrics registered: tts.pool.* available via /actuator/metrics");
        };
    }

    /**
     * Logs pool health summary every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logPoolHealth() {
        WorkerPool pool = this.poolProvider.getIfAvailable();
        if (pool == null) {
            return;
        }
        Map<WorkerState, Integer> counts = pool.stateCounts();
        LOG.info("Synthesis Pool Health: workers={}, idle={}, processing={}, reading={}, waiting={}, completed={}",
                pool.size(),
                counts.get(WorkerState.IDLE),
                counts.get(WorkerState.PROCESSING),
                counts.get(WorkerState.READING),
                pool.waitingRequests(),
                pool.completedRequests()
        );
    }
}
