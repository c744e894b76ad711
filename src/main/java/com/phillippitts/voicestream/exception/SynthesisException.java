package com.phillippitts.voicestream.exception;

/**
 * Thrown when producing a speech stream fails.
 * This may occur due to engine errors, encoder failures, or a broken output target.
 */
public class SynthesisException extends VoiceStreamException {

    private final String stage;

    public SynthesisException(String message) {
        super(message);
        this.stage = "unknown";
    }

    public SynthesisException(String message, String stage) {
        super(message + " (stage: " + stage + ")");
        this.stage = stage;
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
        this.stage = "unknown";
    }

    public SynthesisException(String message, String stage, Throwable cause) {
        super(message + " (stage: " + stage + ")", cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
