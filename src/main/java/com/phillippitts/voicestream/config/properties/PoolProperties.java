package com.phillippitts.voicestream.config.properties;

import com.phillippitts.voicestream.domain.SpeechRequest;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Worker pool sizing, admission and request defaults.
 *
 * <p>Properties:
 * <ul>
 *   <li>tts.pool.workers - Number of synthesis workers (default: 1)</li>
 *   <li>tts.pool.admission-timeout-ms - How long a request waits for an idle worker before it is
 *       rejected as busy (default: 30000)</li>
 *   <li>tts.pool.ready-timeout-ms - How long a request waits for its stream to start producing
 *       (default: 3600000)</li>
 *   <li>tts.pool.default-voice - Voice used when a request names none (default: anna)</li>
 *   <li>tts.pool.default-format - Format used when a request names none (default: mp3)</li>
 *   <li>tts.pool.default-chunk-size - Encoder relay read size in bytes (default: 1024)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "tts.pool")
@Validated
public class PoolProperties {

    /** Number of workers. Each worker owns one engine instance. */
    @Positive(message = "Worker count must be positive")
    private int workers = 1;

    /**
     * Milliseconds to wait for a free worker. Set to 0 to reject immediately when all workers
     * are occupied.
     */
    @Min(value = 0, message = "Admission timeout must not be negative")
    private long admissionTimeoutMs = 30_000;

    @Positive(message = "Ready timeout must be positive")
    private long readyTimeoutMs = 3_600_000;

    @NotBlank(message = "Default voice must not be blank")
    private String defaultVoice = "anna";

    @NotBlank(message = "Default format must not be blank")
    private String defaultFormat = "mp3";

    @Positive(message = "Default chunk size must be positive")
    private int defaultChunkSize = SpeechRequest.DEFAULT_CHUNK_SIZE;

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public long getAdmissionTimeoutMs() {
        return admissionTimeoutMs;
    }

    public void setAdmissionTimeoutMs(long admissionTimeoutMs) {
        this.admissionTimeoutMs = admissionTimeoutMs;
    }

    public long getReadyTimeoutMs() {
        return readyTimeoutMs;
    }

    public void setReadyTimeoutMs(long readyTimeoutMs) {
        this.readyTimeoutMs = readyTimeoutMs;
    }

    public String getDefaultVoice() {
        return defaultVoice;
    }

    public void setDefaultVoice(String defaultVoice) {
        this.defaultVoice = defaultVoice;
    }

    public String getDefaultFormat() {
        return defaultFormat;
    }

    public void setDefaultFormat(String defaultFormat) {
        this.defaultFormat = defaultFormat;
    }

    public int getDefaultChunkSize() {
        return defaultChunkSize;
    }

    public void setDefaultChunkSize(int defaultChunkSize) {
        this.defaultChunkSize = defaultChunkSize;
    }
}
