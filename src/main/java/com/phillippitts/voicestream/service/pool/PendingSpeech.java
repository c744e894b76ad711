package com.phillippitts.voicestream.service.pool;

import com.phillippitts.voicestream.service.stream.SpeechStream;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A submitted request: its stream plus the latch the worker counts down once the stream is
 * ready to be read (target opened, or the request finished without audio).
 */
record PendingSpeech(SpeechStream stream, CountDownLatch ready) {

    boolean awaitReady(long timeoutMs) throws InterruptedException {
        return ready.await(timeoutMs, TimeUnit.MILLISECONDS);
    }
}
