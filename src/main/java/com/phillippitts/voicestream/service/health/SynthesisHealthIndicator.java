package com.phillippitts.voicestream.service.health;

import com.phillippitts.voicestream.domain.WorkerState;
import com.phillippitts.voicestream.service.pool.WorkerPool;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for the synthesis worker pool.
 *
 * <p>Reports pool capacity for monitoring and alerting:
 * <ul>
 *   <li>UP: At least one worker idle</li>
 *   <li>BUSY: Every worker occupied; new requests wait for admission</li>
 *   <li>DOWN: Pool shut down</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SynthesisHealthIndicator implements HealthIndicator {

    static final Status BUSY = new Status("BUSY", "All workers occupied");

    private final WorkerPool pool;

    public SynthesisHealthIndicator(WorkerPool pool) {
        this.pool = pool;
    }

    @Override
    public Health health() {
        Map<WorkerState, Integer> counts = pool.stateCounts();
        int idle = counts.get(WorkerState.IDLE);

        Health.Builder builder;
        if (!pool.isRunning()) {
            builder = Health.down();
        } else if (idle > 0) {
            builder = Health.up();
        } else {
            builder = Health.status(BUSY);
        }

        return builder
                .withDetail("workers", pool.size())
                .withDetail("idle", idle)
                .withDetail("processing", counts.get(WorkerState.PROCESSING))
                .withDetail("reading", counts.get(WorkerState.READING))
                .withDetail("waiting", pool.waitingRequests())
                .withDetail("formats", pool.supportedFormatIds())
                .build();
    }
}
