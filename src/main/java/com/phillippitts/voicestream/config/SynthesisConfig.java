package com.phillippitts.voicestream.config;

import com.phillippitts.voicestream.config.properties.EncoderProperties;
import com.phillippitts.voicestream.config.properties.EngineProperties;
import com.phillippitts.voicestream.config.properties.PoolProperties;
import com.phillippitts.voicestream.exception.EngineUnavailableException;
import com.phillippitts.voicestream.service.encoder.EncoderLauncher;
import com.phillippitts.voicestream.service.encoder.EncoderProbe;
import com.phillippitts.voicestream.service.encoder.EncoderRegistry;
import com.phillippitts.voicestream.service.engine.SynthesisEngineFactory;
import com.phillippitts.voicestream.service.pool.WorkerPool;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the synthesis pipeline: encoder discovery, encoder launcher and the worker pool.
 *
 * <p>The native engine binding is supplied by the deployment as a {@link SynthesisEngineFactory}
 * bean. Without one the application fails at startup rather than on the first request.
 */
@Configuration
public class SynthesisConfig {

    /** Probes {@code PATH} for the known encoders; formats without one are disabled. */
    @Bean
    public EncoderRegistry encoderRegistry() {
        return new EncoderProbe().probe();
    }

    @Bean
    public EncoderLauncher encoderLauncher(EncoderRegistry encoderRegistry, EncoderProperties encoderProperties) {
        return new EncoderLauncher(encoderRegistry, encoderProperties);
    }

    @Bean
    public WorkerPool workerPool(ObjectProvider<SynthesisEngineFactory> engineFactories,
                                 EngineProperties engineProperties,
                                 PoolProperties poolProperties,
                                 EncoderLauncher encoderLauncher,
                                 ApplicationEventPublisher publisher) {
        SynthesisEngineFactory engineFactory = engineFactories.getIfUnique();
        if (engineFactory == null) {
            throw new EngineUnavailableException("No unique SynthesisEngineFactory bean registered. "
                    + "Provide one that binds the native synthesis library.");
        }
        return new WorkerPool(engineFactory, engineProperties, poolProperties, encoderLauncher, publisher);
    }
}
