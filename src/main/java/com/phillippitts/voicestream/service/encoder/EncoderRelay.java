package com.phillippitts.voicestream.service.encoder;

import com.phillippitts.voicestream.domain.OutputFormat;
import com.phillippitts.voicestream.service.stream.ChunkChannel;
import com.phillippitts.voicestream.util.ProcessTimeouts;
import com.phillippitts.voicestream.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one external encoder for one request and relays its stdout into a {@link ChunkChannel}.
 *
 * <p>Responsibilities:
 * - Expose the encoder's stdin as the target the WAV framer writes into
 * - Read stdout in {@code chunkSize} blocks on a daemon relay thread, in order, ending the
 *   channel at EOF
 * - Capture stderr (capped) for diagnostics
 * - On {@link #close()}, signal EOF on stdin and wait a bounded time for the encoder to exit,
 *   terminating it if it does not
 *
 * <p>Instances are created by {@link EncoderLauncher#open}.
 */
public final class EncoderRelay implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(EncoderRelay.class);
    private static final int STDERR_SNIPPET_MAX_CHARS = 500;

    private final OutputFormat format;
    private final List<String> command;
    private final Process process;
    private final ChunkChannel channel;
    private final Duration exitTimeout;
    private final StderrGobbler stderr;
    private final Thread relayThread;
    private final Thread errGobbler;
    private final long startNanos = System.nanoTime();

    private volatile long relayedBytes;
    private boolean closed;

    EncoderRelay(OutputFormat format, List<String> command, Process process, ChunkChannel channel,
                 int chunkSize, Duration exitTimeout, int stderrMaxChars) {
        this.format = Objects.requireNonNull(format, "format");
        this.command = List.copyOf(command);
        this.process = Objects.requireNonNull(process, "process");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.exitTimeout = Objects.requireNonNull(exitTimeout, "exitTimeout");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }

        // Start both readers before anything is written to stdin to avoid pipe deadlock
        this.stderr = new StderrGobbler(process.getErrorStream(), "encoder-err-" + format.id(), stderrMaxChars);
        this.errGobbler = StderrGobbler.start(stderr);
        this.relayThread = new Thread(() -> relay(chunkSize), "encoder-relay-" + format.id());
        this.relayThread.setDaemon(true);
        this.relayThread.start();
    }

    /** The encoder's stdin. Closing it signals end of input. */
    public OutputStream input() {
        return process.getOutputStream();
    }

    public OutputFormat format() {
        return format;
    }

    /** Encoded bytes handed to the channel so far. */
    public long relayedBytes() {
        return relayedBytes;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    private void relay(int chunkSize) {
        byte[] buf = new byte[chunkSize];
        long total = 0;
        try (InputStream in = process.getInputStream()) {
            while (true) {
                int n = in.readNBytes(buf, 0, chunkSize);
                if (n == 0) {
                    break;
                }
                channel.write(Arrays.copyOf(buf, n));
                total += n;
                relayedBytes = total;
            }
        } catch (IOException e) {
            // Expected when the encoder is terminated mid-stream
            LOG.debug("Encoder {} stdout closed: {}", format.id(), e.toString());
        } finally {
            channel.end();
            LOG.debug("Encoder {} relay finished after {} bytes", format.id(), total);
        }
    }

    /**
     * Closes stdin, then waits up to the exit timeout for the encoder to finish. An encoder that
     * does not exit in time is terminated; that is logged, not thrown, and whatever it produced
     * before termination stays in the stream. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        closeInput();
        boolean exited = waitForExit();
        if (!exited) {
            LOG.warn("Encoder {} did not exit within {}ms after end of input; terminating (command={})",
                    format.id(), exitTimeout.toMillis(), command);
            destroyProcess(process);
        }

        joinQuietly(relayThread, ProcessTimeouts.RELAY_DRAIN_TIMEOUT);
        joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        // Guarantees the reader sees an end even if the relay thread is stuck
        channel.end();

        if (exited) {
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                LOG.warn("Encoder {} exited with code {} after {}ms: {}", format.id(), exitCode,
                        TimeUtils.elapsedMillis(startNanos), stderr.snippet(STDERR_SNIPPET_MAX_CHARS));
            } else {
                LOG.debug("Encoder {} finished in {}ms, relayed {} bytes", format.id(),
                        TimeUtils.elapsedMillis(startNanos), relayedBytes);
            }
        }
    }

    /** Terminates the encoder immediately, dropping any output it has not flushed yet. */
    public void abort() {
        if (closed) {
            return;
        }
        closed = true;
        closeInput();
        destroyProcess(process);
        joinQuietly(relayThread, ProcessTimeouts.RELAY_DRAIN_TIMEOUT);
        joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        channel.end();
        LOG.debug("Encoder {} aborted after {}ms", format.id(), TimeUtils.elapsedMillis(startNanos));
    }

    private void closeInput() {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            // A dead encoder makes the final flush fail with a broken pipe
            LOG.debug("Encoder {} stdin close failed: {}", format.id(), e.toString());
        }
    }

    private boolean waitForExit() {
        try {
            return process.waitFor(exitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for encoder {} to exit", format.id());
            return false;
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Encoder process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying encoder process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying encoder process: {}", e.toString());
        }
    }
}
