package com.phillippitts.voicestream.testutil;

import com.phillippitts.voicestream.service.engine.SynthesisCallbacks;
import com.phillippitts.voicestream.service.engine.SynthesisEngine;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Engine created by {@link FakeEngineFactory}; records how the worker drove it.
 */
public class FakeSynthesisEngine implements SynthesisEngine {

    private final FakeEngineFactory script;
    private final SynthesisCallbacks callbacks;

    public final List<String> voices = new CopyOnWriteArrayList<>();
    public final List<String> texts = new CopyOnWriteArrayList<>();
    public final String creatorThread = Thread.currentThread().getName();
    public volatile boolean aborted;
    public volatile boolean closed;

    FakeSynthesisEngine(FakeEngineFactory script, SynthesisCallbacks callbacks) {
        this.script = script;
        this.callbacks = callbacks;
    }

    @Override
    public String version() {
        return script.version;
    }

    @Override
    public void setVoice(String voice) {
        voices.add(voice);
    }

    @Override
    public void generate(String text) {
        texts.add(text);
        script.generateCalls.incrementAndGet();
        aborted = false;
        await(script.gate);
        if (script.generateFailure != null) {
            throw script.generateFailure;
        }
        if (script.sampleRate > 0) {
            if (!callbacks.onSampleRate(script.sampleRate)) {
                aborted = true;
                return;
            }
            if (script.announceRateTwice && !callbacks.onSampleRate(script.sampleRate / 2)) {
                aborted = true;
                return;
            }
        }
        boolean first = true;
        for (byte[] chunk : script.chunks) {
            if (!first) {
                await(script.chunkGate);
            }
            first = false;
            if (!callbacks.onSamples(chunk.clone(), chunk.length / 2)) {
                aborted = true;
                return;
            }
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    private static void await(CountDownLatch latch) {
        if (latch == null) {
            return;
        }
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
