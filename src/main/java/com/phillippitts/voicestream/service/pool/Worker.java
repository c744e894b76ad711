package com.phillippitts.voicestream.service.pool;

import com.phillippitts.voicestream.domain.SpeechRequest;
import com.phillippitts.voicestream.domain.WorkerState;
import com.phillippitts.voicestream.exception.EngineUnavailableException;
import com.phillippitts.voicestream.exception.SynthesisException;
import com.phillippitts.voicestream.exception.SynthesisExceptionBuilder;
import com.phillippitts.voicestream.service.audio.PcmFormat;
import com.phillippitts.voicestream.service.audio.StreamingWavWriter;
import com.phillippitts.voicestream.service.encoder.EncoderLauncher;
import com.phillippitts.voicestream.service.encoder.EncoderRelay;
import com.phillippitts.voicestream.service.engine.EngineSettings;
import com.phillippitts.voicestream.service.engine.SynthesisCallbacks;
import com.phillippitts.voicestream.service.engine.SynthesisEngine;
import com.phillippitts.voicestream.service.engine.SynthesisEngineFactory;
import com.phillippitts.voicestream.service.events.SynthesisEventPublisher;
import com.phillippitts.voicestream.service.stream.ChunkChannel;
import com.phillippitts.voicestream.service.stream.SpeechStream;
import com.phillippitts.voicestream.util.LogSanitizer;
import com.phillippitts.voicestream.util.ProcessTimeouts;
import com.phillippitts.voicestream.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One synthesis engine on its own dedicated thread, serving one request at a time.
 *
 * <p>The engine is created on the worker thread and only ever called from it. Requests arrive
 * through a job queue; engine callbacks frame samples as WAV and write them either straight into
 * the request's channel or into an external encoder's stdin.
 *
 * <p>State: a claimed worker is {@link WorkerState#PROCESSING} until generation ends, and
 * {@link WorkerState#READING} until the consumer has finished its stream. Only when both are
 * over is it {@link WorkerState#IDLE} again and the idle callback runs.
 */
final class Worker {

    private static final Logger LOG = LogManager.getLogger(Worker.class);

    private record Job(SpeechRequest request, ChunkChannel channel, CountDownLatch ready,
                       Map<String, String> context) {
    }

    private static final Job POISON = new Job(null, null, null, Map.of());

    private final String name;
    private final SynthesisEngineFactory engineFactory;
    private final EngineSettings settings;
    private final String expectedVersion;
    private final EncoderLauncher encoders;
    private final ApplicationEventPublisher publisher;
    private final Runnable onIdle;

    private final BlockingQueue<Job> jobs = new LinkedBlockingQueue<>();
    private final CountDownLatch started = new CountDownLatch(1);
    private final AtomicLong completed = new AtomicLong();

    private final Object stateLock = new Object();
    // @GuardedBy("stateLock")
    private boolean processing;
    // @GuardedBy("stateLock")
    private boolean reading;

    private volatile boolean running = true;
    private volatile Throwable startFailure;
    private volatile String engineVersion;
    private Thread thread;

    // Confined to the worker thread
    private SynthesisEngine engine;
    private Job current;
    private StreamingWavWriter writer;
    private EncoderRelay relay;
    private int sampleRate = PcmFormat.DEFAULT_SAMPLE_RATE;
    private long requestStartNanos;

    /**
     * @param name thread and log name, e.g. "tts-worker-1"
     * @param engineFactory creates this worker's engine
     * @param settings engine library and data locations
     * @param expectedVersion engine version to compare against, or null to skip the check
     * @param encoders spawns encoder relays for non-native formats
     * @param publisher event publisher for failure notifications (nullable)
     * @param onIdle runs every time the worker becomes idle after a request
     */
    Worker(String name,
           SynthesisEngineFactory engineFactory,
           EngineSettings settings,
           String expectedVersion,
           EncoderLauncher encoders,
           ApplicationEventPublisher publisher,
           Runnable onIdle) {
        this.name = Objects.requireNonNull(name, "name");
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.expectedVersion = expectedVersion;
        this.encoders = Objects.requireNonNull(encoders, "encoders");
        this.publisher = publisher;
        this.onIdle = Objects.requireNonNull(onIdle, "onIdle");
    }

    /**
     * Starts the worker thread and waits until its engine is ready.
     *
     * @throws EngineUnavailableException if the engine cannot be created
     */
    void start() {
        start(ProcessTimeouts.WORKER_START_TIMEOUT);
    }

    void start(Duration timeout) {
        thread = new Thread(this::run, name);
        thread.setDaemon(true);
        thread.start();
        try {
            if (!started.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                running = false;
                throw new EngineUnavailableException(name + " engine did not start within " + timeout.toMillis() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
            throw new EngineUnavailableException("Interrupted while starting " + name, e);
        }
        if (startFailure != null) {
            throw new EngineUnavailableException("Failed to create synthesis engine for " + name + ": "
                    + startFailure.getMessage(), startFailure);
        }
    }

    /**
     * Marks the worker as occupied if it is idle.
     *
     * @return true if the caller now owns the worker and must {@link #submit} exactly one request
     */
    boolean tryClaim() {
        synchronized (stateLock) {
            if (!running || processing || reading) {
                return false;
            }
            processing = true;
            reading = true;
            return true;
        }
    }

    /**
     * Queues a request on a claimed worker. If the worker has stopped since it was claimed, the
     * request is failed at once and its stream raises the failure on first read.
     *
     * @param request request to synthesize
     * @return the request's stream and readiness latch
     * @throws IllegalStateException if the worker was not claimed
     */
    PendingSpeech submit(SpeechRequest request) {
        Objects.requireNonNull(request, "request");
        ChunkChannel channel = new ChunkChannel();
        CountDownLatch ready = new CountDownLatch(1);
        SpeechStream stream = new SpeechStream(channel, this::finishReading);
        // Enqueued under stateLock so that stop() either sees this job ahead of its POISON
        // or this method sees the worker as stopped
        synchronized (stateLock) {
            if (!processing) {
                throw new IllegalStateException(name + " must be claimed before submitting");
            }
            if (running) {
                jobs.add(new Job(request, channel, ready, ThreadContext.getImmutableContext()));
                return new PendingSpeech(stream, ready);
            }
        }
        LOG.warn("{} stopped before the request could be queued", name);
        rejectJob(channel, ready);
        return new PendingSpeech(stream, ready);
    }

    WorkerState state() {
        synchronized (stateLock) {
            if (processing) {
                return WorkerState.PROCESSING;
            }
            if (reading) {
                return WorkerState.READING;
            }
            return WorkerState.IDLE;
        }
    }

    String name() {
        return name;
    }

    /** Engine version reported at startup, or null before the engine exists. */
    String engineVersion() {
        return engineVersion;
    }

    long completedRequests() {
        return completed.get();
    }

    boolean isRunning() {
        return running;
    }

    /**
     * Asks the worker to stop. A generation in progress is aborted at its next engine callback;
     * queued requests are failed.
     */
    void stop() {
        synchronized (stateLock) {
            running = false;
            jobs.add(POISON);
        }
    }

    /**
     * Waits for the worker thread to finish.
     *
     * @return true if the thread terminated in time
     */
    boolean join(Duration timeout) {
        Thread t = thread;
        if (t == null) {
            return true;
        }
        try {
            t.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            LOG.warn("{} did not stop within {}ms", name, timeout.toMillis());
            return false;
        }
        return true;
    }

    private void run() {
        ThreadContext.put("worker", name);
        try {
            engine = engineFactory.create(settings, new EngineCallbacks());
            engineVersion = engine.version();
            checkVersion(engineVersion);
        } catch (RuntimeException | LinkageError e) {
            LOG.error("{} failed to create synthesis engine (library={}, data={})",
                    name, settings.libraryPath(), settings.dataPath(), e);
            startFailure = e;
            running = false;
            closeEngine();
            started.countDown();
            ThreadContext.clearAll();
            return;
        }
        started.countDown();
        LOG.info("{} ready (engine version {})", name, engineVersion);

        try {
            while (true) {
                Job job = jobs.take();
                if (job == POISON) {
                    break;
                }
                process(job);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("{} interrupted; stopping", name);
        } finally {
            synchronized (stateLock) {
                running = false;
            }
            failQueuedJobs();
            closeEngine();
            LOG.info("{} stopped after {} requests", name, completed.get());
            ThreadContext.clearAll();
        }
    }

    private void checkVersion(String actual) {
        if (expectedVersion == null || expectedVersion.isBlank()) {
            return;
        }
        if (!expectedVersion.equals(actual)) {
            LOG.warn("{} engine version mismatch: expected {}, got {}. Synthesis may misbehave.",
                    name, expectedVersion, actual);
        }
    }

    private void process(Job job) {
        requestStartNanos = System.nanoTime();
        SpeechRequest request = job.request();
        ThreadContext.putAll(job.context());
        ThreadContext.put("worker", name);
        current = job;
        sampleRate = PcmFormat.DEFAULT_SAMPLE_RATE;
        LOG.debug("{} generating: voice={}, format={}, text='{}'", name, request.voice(),
                request.format().id(), LogSanitizer.preview(request.text()));
        try {
            // Leftovers from an aborted request must not receive this request's audio
            closeTarget();
            engine.setVoice(request.voice());
            engine.generate(request.text());
            if (!running) {
                LOG.info("{} aborted generation for shutdown", name);
            }
        } catch (RuntimeException e) {
            LOG.error("{} generation failed: voice={}, format={}", name, request.voice(), request.format().id(), e);
            failCurrent("engine", "Synthesis failed", e);
        } finally {
            closeTarget();
            job.channel().end();
            job.ready().countDown();
            current = null;
            completed.incrementAndGet();
            LOG.debug("{} finished in {}ms", name, TimeUtils.elapsedMillis(requestStartNanos));
            ThreadContext.clearAll();
            ThreadContext.put("worker", name);
            finishProcessing();
        }
    }

    /**
     * Opens the output target for the current request: the encoder's stdin for encoded formats,
     * otherwise the request's channel directly.
     */
    private void openTarget(Job job, int rate) throws IOException {
        SpeechRequest request = job.request();
        OutputStream target;
        if (encoders.hasEncoder(request.format())) {
            relay = encoders.open(request.format(), job.channel(), request.chunkSize());
            target = relay.input();
        } else {
            target = job.channel().asOutputStream();
        }
        writer = new StreamingWavWriter(target);
        writer.begin(rate);
    }

    private void closeTarget() {
        StreamingWavWriter w = writer;
        EncoderRelay r = relay;
        writer = null;
        relay = null;
        if (w != null) {
            try {
                w.close();
            } catch (IOException e) {
                LOG.warn("{} failed to close output target: {}", name, e.toString());
            }
        }
        if (r != null) {
            if (current != null && current.channel().failure() != null) {
                r.abort();
            } else {
                r.close();
            }
        }
    }

    private void failCurrent(String stage, String message, Throwable cause) {
        Job job = current;
        if (job == null) {
            return;
        }
        SynthesisException failure = cause instanceof SynthesisException se ? se
                : SynthesisExceptionBuilder.create(message)
                        .stage(stage)
                        .cause(cause)
                        .durationMs(TimeUtils.elapsedMillis(requestStartNanos))
                        .metadata("worker", name)
                        .metadata("voice", job.request().voice())
                        .metadata("format", job.request().format().id())
                        .build();
        job.channel().fail(failure);
        SynthesisEventPublisher.publishFailure(publisher, name, stage, message + ": " + cause.getMessage(), cause,
                Map.of("voice", job.request().voice(), "format", job.request().format().id()));
    }

    private void failQueuedJobs() {
        List<Job> pending = new ArrayList<>();
        jobs.drainTo(pending);
        for (Job job : pending) {
            if (job != POISON) {
                rejectJob(job.channel(), job.ready());
            }
        }
    }

    private void rejectJob(ChunkChannel channel, CountDownLatch ready) {
        channel.fail(new SynthesisException(name + " stopped before the request was processed", "pool"));
        ready.countDown();
        finishProcessing();
    }

    private void closeEngine() {
        SynthesisEngine e = engine;
        engine = null;
        if (e == null) {
            return;
        }
        try {
            e.close();
        } catch (RuntimeException ex) {
            LOG.warn("{} failed to release engine: {}", name, ex.toString());
        }
    }

    private void finishProcessing() {
        boolean idle;
        synchronized (stateLock) {
            processing = false;
            idle = !reading;
        }
        if (idle) {
            becameIdle();
        }
    }

    private void finishReading() {
        boolean idle;
        synchronized (stateLock) {
            reading = false;
            idle = !processing;
        }
        if (idle) {
            becameIdle();
        }
    }

    private void becameIdle() {
        LOG.trace("{} idle", name);
        onIdle.run();
    }

    /**
     * Engine callbacks. Invoked on the worker thread from inside {@link SynthesisEngine#generate}.
     */
    private final class EngineCallbacks implements SynthesisCallbacks {

        @Override
        public boolean onSampleRate(int rate) {
            Job job = current;
            if (job == null) {
                LOG.warn("{} got a sample rate announcement outside of a request", name);
                return running;
            }
            if (writer != null) {
                // The header is already out; a second one would corrupt the stream
                LOG.warn("{} ignoring repeated sample rate announcement ({} Hz, streaming at {} Hz)",
                        name, rate, sampleRate);
                return running && job.channel().failure() == null;
            }
            sampleRate = rate;
            try {
                openTarget(job, rate);
                return running;
            } catch (IOException | RuntimeException e) {
                LOG.warn("{} failed to open output target for {}: {}", name, job.request().format().id(), e.toString());
                failCurrent("target", "Failed to open output target", e);
                return false;
            } finally {
                job.ready().countDown();
            }
        }

        @Override
        public boolean onSamples(byte[] samples, int sampleCount) {
            Job job = current;
            if (!running || job == null) {
                return false;
            }
            ChunkChannel channel = job.channel();
            if (channel.failure() != null) {
                return false;
            }
            if (!channel.isOpen()) {
                LOG.debug("{} stream abandoned by reader; stopping generation", name);
                return false;
            }
            try {
                if (writer == null) {
                    // Samples before any rate announcement: frame them at the current rate
                    openTarget(job, sampleRate);
                    job.ready().countDown();
                }
                writer.writeSamples(samples, 0, sampleCount * PcmFormat.SAMPLE_WIDTH_BYTES);
                return true;
            } catch (IOException | RuntimeException e) {
                LOG.warn("{} failed to write samples: {}", name, e.toString());
                failCurrent("target", "Failed to write audio", e);
                return false;
            }
        }
    }
}
