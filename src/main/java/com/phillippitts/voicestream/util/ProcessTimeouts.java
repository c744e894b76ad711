package com.phillippitts.voicestream.util;

import java.time.Duration;

/**
 * Standard timeout values for encoder subprocess and worker thread management.
 *
 * <p><b>Usage:</b> Used by {@link com.phillippitts.voicestream.service.encoder.EncoderRelay}
 * and {@link com.phillippitts.voicestream.service.pool.WorkerPool} for subprocess and
 * thread lifecycle management.
 *
 * @see com.phillippitts.voicestream.service.encoder.EncoderRelay
 * @see com.phillippitts.voicestream.service.pool.WorkerPool
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Default wait for an encoder to exit after its stdin is closed.
     *
     * <p>Encoders flush their trailing frames on EOF; 5s covers long utterances on slow hosts.
     * Overridable with {@code tts.encoder.exit-timeout-ms}.
     */
    public static final Duration ENCODER_EXIT_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Timeout for the relay thread to push the encoder's last bytes after the process exited.
     */
    public static final Duration RELAY_DRAIN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for the stderr gobbler thread during cleanup (best-effort).
     *
     * <p>If the thread does not terminate it is a daemon and dies with the JVM.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     *
     * <p>Processes that survive this are typically unkillable due to OS bugs.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for a worker thread to create its engine at startup.
     *
     * <p>Voice data is loaded from disk here, so this is deliberately generous.
     */
    public static final Duration WORKER_START_TIMEOUT = Duration.ofSeconds(60);

    /**
     * Timeout for a worker thread to finish during pool shutdown.
     *
     * <p>Generation is aborted at the next engine callback, so workers normally stop
     * within one callback interval; the encoder exit wait bounds the rest.
     */
    public static final Duration WORKER_JOIN_TIMEOUT = Duration.ofSeconds(10);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
