package com.phillippitts.voicestream.config.properties;

import com.phillippitts.voicestream.util.ProcessTimeouts;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * External encoder process settings.
 *
 * <p>Properties:
 * <ul>
 *   <li>tts.encoder.exit-timeout-ms - Wait for an encoder to exit after end of input before it is
 *       terminated (default: 5000)</li>
 *   <li>tts.encoder.stderr-max-chars - Cap on captured encoder diagnostics (default: 8192)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "tts.encoder")
@Validated
public class EncoderProperties {

    @Positive(message = "Encoder exit timeout must be positive")
    private long exitTimeoutMs = ProcessTimeouts.ENCODER_EXIT_TIMEOUT.toMillis();

    @Positive(message = "Encoder stderr cap must be positive")
    private int stderrMaxChars = 8192;

    public long getExitTimeoutMs() {
        return exitTimeoutMs;
    }

    public void setExitTimeoutMs(long exitTimeoutMs) {
        this.exitTimeoutMs = exitTimeoutMs;
    }

    public int getStderrMaxChars() {
        return stderrMaxChars;
    }

    public void setStderrMaxChars(int stderrMaxChars) {
        this.stderrMaxChars = stderrMaxChars;
    }
}
