package com.phillippitts.voicestream.exception;

/**
 * Thrown when no synthesis engine can be created (no factory registered, native
 * library failed to load, worker failed to start). This is a fatal startup error.
 */
public class EngineUnavailableException extends VoiceStreamException {

    public EngineUnavailableException(String message) {
        super(message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
