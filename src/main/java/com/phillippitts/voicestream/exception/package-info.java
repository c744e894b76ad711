/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicestream.exception.VoiceStreamException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.voicestream.exception.UnsupportedFormatException} - Thrown when
 *       a request names a format without an available encoder</li>
 *   <li>{@link com.phillippitts.voicestream.exception.SynthesisBusyException} - Thrown when the
 *       worker pool stays saturated past the admission timeout</li>
 *   <li>{@link com.phillippitts.voicestream.exception.EngineUnavailableException} - Thrown when
 *       no synthesis engine can be created at startup</li>
 *   <li>{@link com.phillippitts.voicestream.exception.SynthesisException} - Thrown when the
 *       engine, the encoder, or the output target fails while producing a stream</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP status codes via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.voicestream.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.voicestream.exception;
