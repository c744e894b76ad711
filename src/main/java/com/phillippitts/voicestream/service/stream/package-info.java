/**
 * Push-to-pull bridging between the synthesis engine callbacks and stream consumers.
 *
 * <p>{@link com.phillippitts.voicestream.service.stream.ChunkChannel} is the per-request queue;
 * {@link com.phillippitts.voicestream.service.stream.SpeechStream} is the consumer view handed
 * out by the worker pool.
 */
package com.phillippitts.voicestream.service.stream;
