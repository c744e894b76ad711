package com.phillippitts.voicestream.exception;

/**
 * Base exception for all voice-stream application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VoiceStreamException extends RuntimeException {

    public VoiceStreamException(String message) {
        super(message);
    }

    public VoiceStreamException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceStreamException(Throwable cause) {
        super(cause);
    }
}
