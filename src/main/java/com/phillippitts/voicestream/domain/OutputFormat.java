package com.phillippitts.voicestream.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Output formats a speech stream can be delivered in.
 *
 * <p>{@link #WAV} is the container-native format produced directly from engine samples;
 * every other format requires an external encoder that reads WAV on stdin.
 */
public enum OutputFormat {

    WAV("wav", "audio/wav", "wav"),
    MP3("mp3", "audio/mpeg", "mp3"),
    OPUS("opus", "audio/ogg", "ogg");

    private final String id;
    private final String mediaType;
    private final String fileExtension;

    OutputFormat(String id, String mediaType, String fileExtension) {
        this.id = id;
        this.mediaType = mediaType;
        this.fileExtension = fileExtension;
    }

    public String id() {
        return id;
    }

    public String mediaType() {
        return mediaType;
    }

    public String fileExtension() {
        return fileExtension;
    }

    /** True for the format written straight from engine samples, without an encoder. */
    public boolean isNative() {
        return this == WAV;
    }

    /**
     * Looks up a format by its identifier, ignoring case and surrounding whitespace.
     *
     * @param id format identifier such as "mp3" (may be null)
     * @return matching format, or empty if unknown
     */
    public static Optional<OutputFormat> find(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat format : values()) {
            if (format.id.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
