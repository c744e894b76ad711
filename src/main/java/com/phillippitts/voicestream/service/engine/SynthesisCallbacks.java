package com.phillippitts.voicestream.service.engine;

/**
 * Callbacks a {@link SynthesisEngine} invokes synchronously from inside
 * {@link SynthesisEngine#generate(String)}, on the thread that called it.
 *
 * <p>Both methods return a continuation flag: {@code false} asks the engine to stop the current
 * utterance. Implementations must not throw; failures are reported by returning {@code false}.
 */
public interface SynthesisCallbacks {

    /**
     * Announces the sample rate at the moment the engine starts producing audio for an utterance.
     *
     * @param sampleRate sample rate in Hz
     * @return true to continue synthesis
     */
    boolean onSampleRate(int sampleRate);

    /**
     * Delivers raw PCM16LE mono samples.
     *
     * @param samples buffer holding at least {@code sampleCount * 2} bytes; only valid during the call
     * @param sampleCount number of 16-bit samples in the buffer
     * @return true to continue synthesis
     */
    boolean onSamples(byte[] samples, int sampleCount);
}
