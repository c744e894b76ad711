package com.phillippitts.voicestream.domain;

/**
 * Observable state of a synthesis worker.
 *
 * <p>A worker moves {@code IDLE -> PROCESSING -> READING -> IDLE}. {@code PROCESSING} wins while
 * the engine is still generating; {@code READING} means generation is over but the consumer has
 * not yet drained (or closed) the stream.
 */
public enum WorkerState {
    IDLE,
    PROCESSING,
    READING
}
