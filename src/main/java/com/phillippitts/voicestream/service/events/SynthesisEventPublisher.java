package com.phillippitts.voicestream.service.events;

import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Utility class for publishing synthesis events.
 *
 * <p>Centralizes null-checking of the publisher so workers and the admission guard also run
 * without a Spring context in tests.
 */
public final class SynthesisEventPublisher {

    private SynthesisEventPublisher() {
        // Utility class - prevent instantiation
    }

    /**
     * Publishes a failure event if a publisher is available.
     *
     * @param publisher the Spring event publisher (may be null)
     * @param worker name of the worker that failed
     * @param stage failing pipeline stage
     * @param message a human-readable description of the failure
     * @param cause the exception that caused the failure (may be null)
     * @param context additional context as key-value pairs (may be null or empty)
     */
    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String worker,
                                      String stage,
                                      String message,
                                      Throwable cause,
                                      Map<String, String> context) {
        if (publisher != null) {
            publisher.publishEvent(new SynthesisFailureEvent(worker, stage, Instant.now(), message, cause, context));
        }
    }

    public static void publishSaturated(ApplicationEventPublisher publisher, int poolSize, long waitedMs) {
        if (publisher != null) {
            publisher.publishEvent(new PoolSaturatedEvent(poolSize, waitedMs, Instant.now()));
        }
    }
}
