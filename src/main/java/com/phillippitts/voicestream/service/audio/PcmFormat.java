package com.phillippitts.voicestream.service.audio;

/**
 * Single source of truth for the engine's PCM output and the streaming WAV layout.
 * Engine output: 16-bit signed PCM, mono, little-endian, sample rate announced per utterance.
 */
public final class PcmFormat {

    /** Number of channels produced by the engine (mono). */
    public static final int CHANNELS = 1;
    /** Bytes per sample. */
    public static final int SAMPLE_WIDTH_BYTES = 2;
    /** Bits per sample. */
    public static final int BITS_PER_SAMPLE = SAMPLE_WIDTH_BYTES * 8;
    /** Bytes per PCM frame (sample for all channels). */
    public static final int BLOCK_ALIGN = SAMPLE_WIDTH_BYTES * CHANNELS;                  // 2 bytes

    /** Rate assumed until the engine announces one. */
    public static final int DEFAULT_SAMPLE_RATE = 24_000;

    /**
     * Frame count declared in a streaming header. The true length is unknown while the header
     * is written and the target cannot seek, so the header claims more frames than any utterance.
     */
    public static final int PLACEHOLDER_FRAMES = 0x0FFF_FFFF;
    /** Data chunk length declared in a streaming header. */
    public static final int PLACEHOLDER_DATA_LENGTH = PLACEHOLDER_FRAMES * BLOCK_ALIGN;   // 0x1FFFFFFE

    // WAV header constants (PCM simple header)
    public static final int WAV_HEADER_SIZE = 44;
    public static final int WAV_RIFF_SIZE_OFFSET = 4;            // 4 bytes (LE)
    public static final int WAV_CHANNELS_OFFSET = 22;            // 2 bytes (LE)
    public static final int WAV_SAMPLE_RATE_OFFSET = 24;         // 4 bytes (LE)
    public static final int WAV_BYTE_RATE_OFFSET = 28;           // 4 bytes (LE)
    public static final int WAV_BLOCK_ALIGN_OFFSET = 32;         // 2 bytes (LE)
    public static final int WAV_BITS_PER_SAMPLE_OFFSET = 34;     // 2 bytes (LE)
    public static final int WAV_DATA_SIZE_OFFSET = 40;           // 4 bytes (LE)

    private PcmFormat() {}
}
