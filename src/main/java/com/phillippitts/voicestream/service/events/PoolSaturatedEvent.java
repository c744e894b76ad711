package com.phillippitts.voicestream.service.events;

import java.time.Instant;

/**
 * Published when a request was rejected because every worker stayed occupied for the whole
 * admission timeout.
 */
public record PoolSaturatedEvent(int poolSize, long waitedMs, Instant at) {
    public PoolSaturatedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
