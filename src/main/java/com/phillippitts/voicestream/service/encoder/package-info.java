/**
 * External encoder support.
 *
 * <p>Non-native formats are produced by piping the WAV stream through a command-line encoder
 * ({@code lame} for MP3, {@code opusenc} for Ogg/Opus). {@link com.phillippitts.voicestream.service.encoder.EncoderProbe}
 * decides at startup which encoders exist; {@link com.phillippitts.voicestream.service.encoder.EncoderRelay}
 * runs one per request.
 */
package com.phillippitts.voicestream.service.encoder;
