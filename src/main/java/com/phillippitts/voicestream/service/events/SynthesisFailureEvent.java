package com.phillippitts.voicestream.service.events;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a request fails inside a worker: engine error, encoder spawn failure or
 * a broken output target.
 *
 * <p>PII note: do not include request text in context. Restrict to technical diagnostics.
 */
public record SynthesisFailureEvent(
        String worker,
        String stage,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public SynthesisFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
