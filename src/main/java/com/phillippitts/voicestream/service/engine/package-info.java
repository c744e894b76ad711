/**
 * Boundary to the native speech synthesis engine.
 *
 * <p>The engine itself lives outside this project. Deployments register a
 * {@link com.phillippitts.voicestream.service.engine.SynthesisEngineFactory} bean that binds
 * the native library; tests use an in-memory fake.
 */
package com.phillippitts.voicestream.service.engine;
