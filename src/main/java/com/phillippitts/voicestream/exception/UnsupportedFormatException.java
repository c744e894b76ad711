package com.phillippitts.voicestream.exception;

import java.util.Set;

/**
 * Thrown when a request asks for an output format that is neither the native WAV
 * container nor backed by an available encoder. Raised before any worker is engaged.
 */
public class UnsupportedFormatException extends VoiceStreamException {

    private final String format;
    private final Set<String> supported;

    public UnsupportedFormatException(String format, Set<String> supported) {
        super("Unsupported format: " + format + " (supported: " + supported + ")");
        this.format = format;
        this.supported = Set.copyOf(supported);
    }

    public String getFormat() {
        return format;
    }

    public Set<String> getSupported() {
        return supported;
    }
}
