package com.phillippitts.voicestream.service.engine;

/**
 * Contract for a native text-to-speech engine instance.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Created by a {@link SynthesisEngineFactory} with the callbacks it will invoke</li>
 *   <li>{@link #setVoice(String)} and {@link #generate(String)} are called once per request</li>
 *   <li>{@link #close()} releases native resources when the owning worker stops</li>
 * </ol>
 *
 * <p>Thread Safety: instances are <b>not</b> thread-safe. Each instance is owned by exactly one
 * worker thread and is only ever called from it; {@link #generate(String)} is never invoked
 * concurrently on the same instance.
 */
public interface SynthesisEngine extends AutoCloseable {

    /**
     * Version of the engine library, compared against {@code tts.engine.expected-version}.
     *
     * @return version identifier (e.g., "1.2.3")
     */
    String version();

    /**
     * Selects the voice used by the next {@link #generate(String)} call.
     *
     * @param voice voice identifier known to the engine's data files
     */
    void setVoice(String voice);

    /**
     * Synthesizes the text, blocking until the utterance is complete or a callback returned false.
     *
     * <p>Invokes {@link SynthesisCallbacks#onSampleRate(int)} once when audio starts, then
     * {@link SynthesisCallbacks#onSamples(byte[], int)} zero or more times.
     *
     * @param text text to synthesize
     */
    void generate(String text);

    /**
     * Releases all native resources. Called once, from the owning worker thread.
     */
    @Override
    void close();
}
