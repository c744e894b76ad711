package com.phillippitts.voicestream.service.pool;

import com.phillippitts.voicestream.exception.SynthesisBusyException;
import com.phillippitts.voicestream.exception.SynthesisException;
import com.phillippitts.voicestream.service.events.SynthesisEventPublisher;
import org.springframework.context.ApplicationEventPublisher;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds how long a request waits for an idle worker.
 *
 * <p>One permit exists per idle worker: the pool starts with one per worker, a request consumes
 * one before claiming a worker, and a worker returns it the moment it becomes idle again. A
 * waiting request is therefore woken as soon as any worker frees up instead of polling.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Waiters are served in arrival order.
 */
final class AdmissionGuard {

    private final Semaphore semaphore;
    private final int capacity;
    private final long timeoutMs;
    private final ApplicationEventPublisher publisher;

    /**
     * @param capacity number of workers
     * @param timeoutMs maximum time to wait for an idle worker in milliseconds
     * @param publisher event publisher for saturation notifications (nullable)
     */
    AdmissionGuard(int capacity, long timeoutMs, ApplicationEventPublisher publisher) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must not be negative: " + timeoutMs);
        }
        this.semaphore = new Semaphore(capacity, true);
        this.capacity = capacity;
        this.timeoutMs = timeoutMs;
        this.publisher = publisher;
    }

    /**
     * Waits for an idle worker, up to the configured timeout.
     *
     * @throws SynthesisBusyException if no worker became idle in time
     * @throws SynthesisException if the thread is interrupted while waiting
     */
    void acquire() {
        try {
            boolean acquired = semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                SynthesisEventPublisher.publishSaturated(publisher, capacity, timeoutMs);
                throw new SynthesisBusyException(capacity, timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisException("Interrupted while waiting for an idle worker", "admission", e);
        }
    }

    /** Returns a permit; called when a worker becomes idle. */
    void release() {
        semaphore.release();
    }

    int availablePermits() {
        return semaphore.availablePermits();
    }

    /** Requests currently blocked in {@link #acquire()}. */
    int waiting() {
        return semaphore.getQueueLength();
    }
}
