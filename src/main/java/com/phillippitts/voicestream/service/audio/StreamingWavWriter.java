package com.phillippitts.voicestream.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

import static com.phillippitts.voicestream.service.audio.PcmFormat.BITS_PER_SAMPLE;
import static com.phillippitts.voicestream.service.audio.PcmFormat.BLOCK_ALIGN;
import static com.phillippitts.voicestream.service.audio.PcmFormat.CHANNELS;
import static com.phillippitts.voicestream.service.audio.PcmFormat.PLACEHOLDER_DATA_LENGTH;
import static com.phillippitts.voicestream.service.audio.PcmFormat.WAV_HEADER_SIZE;

/**
 * Writes PCM WAV incrementally to an append-only target (encoder stdin or a chunk channel).
 *
 * <p>The header is written once, when the sample rate becomes known, and declares
 * {@link PcmFormat#PLACEHOLDER_FRAMES} frames. It is never patched: the target is a pipe, so
 * readers that check the declared length against the real one will see a mismatch.
 *
 * <p>Not thread-safe; owned by a single worker thread.
 */
public final class StreamingWavWriter implements Closeable {

    private final OutputStream target;
    private int sampleRate;
    private long dataBytes;
    private boolean headerWritten;
    private boolean closed;

    public StreamingWavWriter(OutputStream target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    /**
     * Writes the streaming header for the given sample rate.
     *
     * @param sampleRate sample rate announced by the engine
     * @throws IllegalStateException if the header was already written or the writer is closed
     * @throws IOException if the target rejects the write
     */
    public void begin(int sampleRate) throws IOException {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        ensureOpen();
        if (headerWritten) {
            throw new IllegalStateException("WAV header already written (sampleRate=" + this.sampleRate + ")");
        }
        this.sampleRate = sampleRate;
        // One write so the header travels as a single chunk
        target.write(header(sampleRate));
        headerWritten = true;
    }

    /**
     * Appends raw PCM bytes verbatim. Starts the stream at {@link PcmFormat#DEFAULT_SAMPLE_RATE}
     * if no rate was announced yet.
     *
     * @param pcm buffer holding PCM16LE samples
     * @param off offset of the first byte
     * @param len number of bytes
     * @throws IOException if the target rejects the write
     */
    public void writeSamples(byte[] pcm, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, pcm.length);
        ensureOpen();
        if (!headerWritten) {
            begin(PcmFormat.DEFAULT_SAMPLE_RATE);
        }
        if (len == 0) {
            return;
        }
        target.write(pcm, off, len);
        dataBytes += len;
    }

    public boolean isHeaderWritten() {
        return headerWritten;
    }

    public int sampleRate() {
        return sampleRate;
    }

    /** PCM bytes written after the header. */
    public long dataBytes() {
        return dataBytes;
    }

    /**
     * Flushes and closes the target. Idempotent.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            target.flush();
        } finally {
            target.close();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("WAV writer already closed");
        }
    }

    /**
     * Builds the 44-byte streaming header for mono 16-bit PCM at the given rate.
     */
    static byte[] header(int sampleRate) {
        ByteArrayOutputStream os = new ByteArrayOutputStream(WAV_HEADER_SIZE);
        // ChunkID: "RIFF"
        os.writeBytes(new byte[] { 'R', 'I', 'F', 'F' });
        // ChunkSize: 36 + declared data length
        writeLEInt(os, 36 + PLACEHOLDER_DATA_LENGTH);
        os.writeBytes(new byte[] { 'W', 'A', 'V', 'E' });

        // Subchunk1ID: "fmt "
        os.writeBytes(new byte[] { 'f', 'm', 't', ' ' });
        // Subchunk1Size: 16 for PCM
        writeLEInt(os, 16);
        // AudioFormat: 1 for PCM
        writeLEShort(os, (short) 1);
        writeLEShort(os, (short) CHANNELS);
        writeLEInt(os, sampleRate);
        // ByteRate: SampleRate * NumChannels * BitsPerSample/8
        writeLEInt(os, sampleRate * BLOCK_ALIGN);
        writeLEShort(os, (short) BLOCK_ALIGN);
        writeLEShort(os, (short) BITS_PER_SAMPLE);

        // Subchunk2ID: "data"
        os.writeBytes(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, PLACEHOLDER_DATA_LENGTH);
        return os.toByteArray();
    }

    private static void writeLEShort(ByteArrayOutputStream os, short v) {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(ByteArrayOutputStream os, int v) {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
