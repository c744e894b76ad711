package com.phillippitts.voicestream.domain;

import java.util.Objects;

/**
 * Immutable synthesis request.
 *
 * @param text text to synthesize
 * @param voice engine voice identifier (e.g., "anna")
 * @param format requested output format
 * @param chunkSize read size in bytes used when relaying encoder output
 */
public record SpeechRequest(String text, String voice, OutputFormat format, int chunkSize) {

    /** Default relay read size, matching the engine's typical callback buffer. */
    public static final int DEFAULT_CHUNK_SIZE = 1024;

    public SpeechRequest {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(format, "format");
        if (voice == null || voice.isBlank()) {
            throw new IllegalArgumentException("voice must not be blank");
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
    }

    public static SpeechRequest of(String text, String voice, OutputFormat format) {
        return new SpeechRequest(text, voice, format, DEFAULT_CHUNK_SIZE);
    }
}
