package com.phillippitts.voicestream.service.stream;

import com.phillippitts.voicestream.exception.SynthesisException;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-pass, non-restartable sequence of audio chunks for one request.
 *
 * <p>Reaching the end of the stream, or closing it early, runs the finish callback exactly once;
 * the owning worker uses it to leave the {@code READING} state. Always close the stream
 * (try-with-resources) so an abandoned stream does not keep its worker occupied.
 *
 * <p>If the producer recorded a failure, every chunk produced before the failure is still
 * returned and {@link #hasNext()} then throws {@link SynthesisException}.
 */
public final class SpeechStream implements Iterator<byte[]>, Closeable {

    private final ChunkChannel channel;
    private final Runnable onFinished;
    private final AtomicBoolean finished = new AtomicBoolean();

    private byte[] lookahead;
    private volatile boolean exhausted;

    public SpeechStream(ChunkChannel channel, Runnable onFinished) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.onFinished = Objects.requireNonNull(onFinished, "onFinished");
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        byte[] chunk = channel.read();
        if (chunk.length == 0) {
            exhausted = true;
            finish();
            Throwable failure = channel.failure();
            if (failure != null) {
                throw failure instanceof SynthesisException se
                        ? se
                        : new SynthesisException("Speech stream failed: " + failure.getMessage(), "stream", failure);
            }
            return false;
        }
        lookahead = chunk;
        return true;
    }

    @Override
    public byte[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException("speech stream exhausted");
        }
        byte[] chunk = lookahead;
        lookahead = null;
        return chunk;
    }

    /**
     * Writes every remaining chunk, in order, to the given stream.
     *
     * @param out destination (not closed by this method)
     * @return number of bytes written
     * @throws IOException if writing to {@code out} fails
     */
    public long transferTo(OutputStream out) throws IOException {
        Objects.requireNonNull(out, "out");
        long total = 0;
        while (hasNext()) {
            byte[] chunk = next();
            out.write(chunk);
            total += chunk.length;
        }
        out.flush();
        return total;
    }

    /** True once the end was reached or the stream was closed. */
    public boolean isFinished() {
        return finished.get();
    }

    /**
     * Releases the stream. Unread data is discarded.
     */
    @Override
    public void close() {
        if (!exhausted) {
            exhausted = true;
            lookahead = null;
            channel.discard();
        }
        finish();
    }

    private void finish() {
        if (finished.compareAndSet(false, true)) {
            onFinished.run();
        }
    }
}
