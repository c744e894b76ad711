package com.phillippitts.voicestream.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized handler for synthesis error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class SynthesisEventsListener {
    private static final Logger LOG = LogManager.getLogger(SynthesisEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong rejections = new AtomicLong();

    @EventListener
    void onSynthesisFailure(SynthesisFailureEvent e) {
        long total = failures.incrementAndGet();
        String key = "failure-" + e.stage();
        if (shouldLog(key)) {
            LOG.warn("Synthesis failed in stage '{}' on {}: {} (failures so far: {})",
                    e.stage(), e.worker(), e.message(), total);
        }
    }

    @EventListener
    void onPoolSaturated(PoolSaturatedEvent e) {
        long total = rejections.incrementAndGet();
        if (shouldLog("saturated")) {
            LOG.warn("All {} workers stayed busy for {}ms; rejecting requests (rejected so far: {}). "
                    + "Consider raising tts.pool.workers.", e.poolSize(), e.waitedMs(), total);
        }
    }

    long failureCount() {
        return failures.get();
    }

    long rejectionCount() {
        return rejections.get();
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
