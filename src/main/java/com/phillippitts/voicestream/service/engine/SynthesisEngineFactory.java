package com.phillippitts.voicestream.service.engine;

/**
 * Creates engine instances for workers.
 *
 * <p>Register one implementation as a Spring bean; the worker pool calls {@link #create} once per
 * worker, from that worker's own thread. Instances handed out for a pool larger than one must not
 * share mutable native state, otherwise parallel synthesis is unsafe.
 */
@FunctionalInterface
public interface SynthesisEngineFactory {

    /**
     * Creates and initializes a new engine instance.
     *
     * @param settings library and data locations
     * @param callbacks callbacks the engine invokes during {@link SynthesisEngine#generate(String)}
     * @return a ready engine
     * @throws RuntimeException if the native library or voice data cannot be loaded
     */
    SynthesisEngine create(EngineSettings settings, SynthesisCallbacks callbacks);
}
