package com.phillippitts.voicestream.service.pool;

import com.phillippitts.voicestream.domain.OutputFormat;
import com.phillippitts.voicestream.domain.SpeechRequest;
import com.phillippitts.voicestream.service.stream.SpeechStream;

import java.nio.file.Path;
import java.util.Set;

/**
 * Entry point for speech synthesis.
 *
 * <p>Implementations must be thread-safe; any number of callers may request speech at once.
 */
public interface SpeechSynthesizer {

    /**
     * Synthesizes a request and returns its audio as a stream.
     *
     * <p>The call returns once the stream is ready to be read. The caller must close the stream.
     *
     * @param request what to say, and how
     * @return single-pass stream of encoded chunks
     * @throws com.phillippitts.voicestream.exception.UnsupportedFormatException if the format has no encoder
     * @throws com.phillippitts.voicestream.exception.SynthesisBusyException if no worker became free in time
     * @throws com.phillippitts.voicestream.exception.SynthesisException if the pool is shut down or the
     *         stream did not become ready in time
     */
    SpeechStream say(SpeechRequest request);

    /**
     * Synthesizes a request straight into a file.
     *
     * @param path destination, created or truncated
     * @param request what to say, and how
     * @return number of bytes written
     */
    long toFile(Path path, SpeechRequest request);

    /** Formats this synthesizer can produce. */
    Set<OutputFormat> supportedFormats();
}
