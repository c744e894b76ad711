package com.phillippitts.voicestream.service.stream;

import com.phillippitts.voicestream.exception.SynthesisException;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Unbounded, closable FIFO of byte chunks that lets a push-style producer (engine callback or
 * encoder relay thread) feed a pull-style consumer.
 *
 * <p>The empty chunk is reserved as the end-of-stream sentinel. It is enqueued at most once,
 * no matter how often {@link #end()} is called, and once the reader has consumed it every
 * further {@link #read()} returns the empty chunk immediately.
 *
 * <p><b>Thread Safety:</b> one producer and one consumer. Producer-side operations are
 * serialized on an internal monitor so that a late relay write can never land behind the
 * sentinel.
 */
public final class ChunkChannel {

    /** Sentinel returned by {@link #read()} once the stream is over. */
    public static final byte[] END_OF_STREAM = new byte[0];

    private final LinkedBlockingQueue<byte[]> queue = new LinkedBlockingQueue<>();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final Object writeLock = new Object();

    // @GuardedBy("writeLock")
    private boolean ended;
    private volatile boolean discarded;
    // Reader side; only the consumer flips it
    private volatile boolean open = true;

    /**
     * Enqueues a chunk without blocking.
     *
     * @param chunk bytes to enqueue; ownership passes to the channel
     * @return false if the chunk was empty or the channel no longer accepts data
     */
    public boolean write(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        if (chunk.length == 0) {
            return false;
        }
        synchronized (writeLock) {
            if (ended || discarded) {
                return false;
            }
            queue.offer(chunk);
            return true;
        }
    }

    /**
     * Enqueues the end-of-stream sentinel if it has not been enqueued yet.
     */
    public void end() {
        synchronized (writeLock) {
            if (ended) {
                return;
            }
            ended = true;
            queue.offer(END_OF_STREAM);
        }
    }

    /**
     * Records a producer-side failure and ends the stream. Only the first failure is kept.
     *
     * @param cause what went wrong
     */
    public void fail(Throwable cause) {
        failure.compareAndSet(null, Objects.requireNonNull(cause, "cause"));
        end();
    }

    /**
     * Returns the next chunk, blocking until one is available.
     *
     * <p>When more than one chunk is already queued they are coalesced into a single returned
     * chunk to save consumer wake-ups.
     *
     * @return next chunk, or {@link #END_OF_STREAM} once the stream is over
     * @throws SynthesisException if the calling thread is interrupted while waiting
     */
    public byte[] read() {
        if (!open) {
            return END_OF_STREAM;
        }
        try {
            byte[] chunk = queue.size() > 1 ? coalesce() : queue.take();
            if (chunk.length == 0) {
                open = false;
            }
            return chunk;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisException("Interrupted while waiting for audio", "stream", e);
        }
    }

    private byte[] coalesce() {
        List<byte[]> drained = new ArrayList<>();
        queue.drainTo(drained);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] chunk : drained) {
            if (chunk.length == 0) {
                open = false;
                break;
            }
            out.writeBytes(chunk);
        }
        return out.toByteArray();
    }

    /**
     * Abandons the channel from the reader side: pending chunks are dropped and later writes
     * are ignored.
     */
    public void discard() {
        discarded = true;
        open = false;
        queue.clear();
    }

    /** First failure recorded by {@link #fail(Throwable)}, or null. */
    public Throwable failure() {
        return failure.get();
    }

    public boolean isEnded() {
        synchronized (writeLock) {
            return ended;
        }
    }

    /** True until the reader has consumed the sentinel or discarded the channel. */
    public boolean isOpen() {
        return open;
    }

    /** Number of queued entries, the sentinel included. */
    public int pending() {
        return queue.size();
    }

    /**
     * Returns an {@link OutputStream} view that copies every write into a new chunk.
     *
     * <p>Closing the view does not end the channel; end-of-stream is always signalled
     * explicitly through {@link #end()}.
     */
    public OutputStream asOutputStream() {
        return new ChannelOutputStream();
    }

    private final class ChannelOutputStream extends OutputStream {

        @Override
        public void write(int b) {
            ChunkChannel.this.write(new byte[] {(byte) b});
        }

        @Override
        public void write(byte[] b, int off, int len) {
            Objects.checkFromIndexSize(off, len, b.length);
            if (len == 0) {
                return;
            }
            ChunkChannel.this.write(Arrays.copyOfRange(b, off, off + len));
        }
    }
}
