package com.phillippitts.voicestream.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing SynthesisException with rich contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Simple exception
 * throw SynthesisExceptionBuilder.create("Generation failed")
 *         .stage("engine")
 *         .build();
 *
 * // Encoder failure with metadata
 * throw SynthesisExceptionBuilder.create("Failed to start encoder")
 *         .stage("encoder")
 *         .cause(exception)
 *         .metadata("format", "mp3")
 *         .metadata("command", command)
 *         .build();
 * </pre>
 */
public final class SynthesisExceptionBuilder {

    private final String message;
    private String stage;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private SynthesisExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static SynthesisExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new SynthesisExceptionBuilder(message);
    }

    /**
     * Sets the pipeline stage that failed.
     *
     * @param stage stage name (e.g., "engine", "encoder", "target")
     * @return this builder for chaining
     */
    public SynthesisExceptionBuilder stage(String stage) {
        this.stage = stage;
        return this;
    }

    public SynthesisExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets how long the request had been running when it failed.
     *
     * @param durationMs elapsed milliseconds
     * @return this builder for chaining
     */
    public SynthesisExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     * Null keys or values are skipped.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public SynthesisExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the SynthesisException with the configured properties.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (durationMs={ms}, {key1}={val1}, ...) (stage: {stage})
     * </pre>
     *
     * @return constructed SynthesisException
     */
    public SynthesisException build() {
        String detailedMessage = buildDetailedMessage();
        String resolvedStage = stage != null ? stage : "unknown";

        if (cause != null) {
            return new SynthesisException(detailedMessage, resolvedStage, cause);
        } else {
            return new SynthesisException(detailedMessage, resolvedStage);
        }
    }

    private String buildDetailedMessage() {
        boolean hasDetails = durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return sb.append(")").toString();
    }
}
