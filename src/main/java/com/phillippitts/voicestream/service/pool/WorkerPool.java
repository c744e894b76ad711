package com.phillippitts.voicestream.service.pool;

import com.phillippitts.voicestream.config.properties.EngineProperties;
import com.phillippitts.voicestream.config.properties.PoolProperties;
import com.phillippitts.voicestream.domain.OutputFormat;
import com.phillippitts.voicestream.domain.SpeechRequest;
import com.phillippitts.voicestream.domain.WorkerState;
import com.phillippitts.voicestream.exception.SynthesisException;
import com.phillippitts.voicestream.exception.SynthesisExceptionBuilder;
import com.phillippitts.voicestream.exception.UnsupportedFormatException;
import com.phillippitts.voicestream.service.encoder.EncoderLauncher;
import com.phillippitts.voicestream.service.engine.SynthesisEngineFactory;
import com.phillippitts.voicestream.service.stream.SpeechStream;
import com.phillippitts.voicestream.util.LogSanitizer;
import com.phillippitts.voicestream.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import jakarta.annotation.PreDestroy;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed pool of synthesis {@link Worker}s behind a single {@link SpeechSynthesizer} facade.
 *
 * <p>Request flow:
 * <ol>
 *   <li>Reject unsupported formats before any worker is engaged</li>
 *   <li>Wait up to {@code tts.pool.admission-timeout-ms} for an idle worker
 *       ({@link AdmissionGuard}); fail with a busy error otherwise</li>
 *   <li>Claim the idle worker, submit the request, and return its stream once the worker has
 *       opened the output target</li>
 * </ol>
 *
 * <p>A worker is occupied from claim until both its generation and the caller's stream have
 * finished, so a slow reader keeps its worker out of rotation.
 *
 * <p><b>Thread Safety:</b> all public methods are thread-safe.
 */
public class WorkerPool implements SpeechSynthesizer {

    private static final Logger LOG = LogManager.getLogger(WorkerPool.class);

    private final List<Worker> workers;
    private final AdmissionGuard admission;
    private final EncoderLauncher encoders;
    private final PoolProperties properties;
    private final Object dispatchLock = new Object();

    private volatile boolean running;

    public WorkerPool(SynthesisEngineFactory engineFactory,
                      EngineProperties engineProperties,
                      PoolProperties properties,
                      EncoderLauncher encoders,
                      ApplicationEventPublisher publisher) {
        Objects.requireNonNull(engineFactory, "engineFactory");
        Objects.requireNonNull(engineProperties, "engineProperties");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.encoders = Objects.requireNonNull(encoders, "encoders");
        this.admission = new AdmissionGuard(properties.getWorkers(), properties.getAdmissionTimeoutMs(), publisher);
        if (properties.getWorkers() > 1) {
            LOG.warn("Running {} workers as threads of one process. The engine binding must give each "
                    + "worker an independent instance; use tts.pool.workers=1 if the native engine "
                    + "keeps process-wide state", properties.getWorkers());
        }

        List<Worker> created = new ArrayList<>(properties.getWorkers());
        for (int i = 1; i <= properties.getWorkers(); i++) {
            created.add(new Worker("tts-worker-" + i, engineFactory, engineProperties.toSettings(),
                    engineProperties.expectedVersion(), encoders, publisher, admission::release));
        }
        this.workers = Collections.unmodifiableList(created);
        startWorkers();
        this.running = true;
        LOG.info("Worker pool started: workers={}, formats={}, admissionTimeoutMs={}",
                workers.size(), supportedFormats(), properties.getAdmissionTimeoutMs());
    }

    private void startWorkers() {
        List<Worker> started = new ArrayList<>();
        try {
            for (Worker worker : workers) {
                worker.start();
                started.add(worker);
            }
        } catch (RuntimeException e) {
            // Do not leave half a pool running
            started.forEach(Worker::stop);
            started.forEach(w -> w.join(ProcessTimeouts.WORKER_JOIN_TIMEOUT));
            throw e;
        }
    }

    @Override
    public SpeechStream say(SpeechRequest request) {
        Objects.requireNonNull(request, "request");
        ensureSupported(request.format());
        ensureRunning();

        admission.acquire();
        Worker worker = claimIdleWorker();
        PendingSpeech pending = worker.submit(request);
        LOG.debug("Dispatched to {}: voice={}, format={}, text='{}'", worker.name(), request.voice(),
                request.format().id(), LogSanitizer.preview(request.text()));
        return awaitReady(pending);
    }

    /**
     * Convenience overload that fills unset fields from the pool defaults.
     *
     * @see #newRequest(String, String, String, Integer)
     */
    public SpeechStream say(String text, String voice, String format, Integer chunkSize) {
        return say(newRequest(text, voice, format, chunkSize));
    }

    /**
     * Builds a request, filling null or blank fields from {@code tts.pool.default-*}.
     *
     * @throws UnsupportedFormatException if the format identifier is unknown
     */
    public SpeechRequest newRequest(String text, String voice, String format, Integer chunkSize) {
        String resolvedVoice = voice == null || voice.isBlank() ? properties.getDefaultVoice() : voice;
        String formatId = format == null || format.isBlank() ? properties.getDefaultFormat() : format;
        OutputFormat resolvedFormat = OutputFormat.find(formatId)
                .orElseThrow(() -> new UnsupportedFormatException(formatId, supportedFormatIds()));
        int resolvedChunkSize = chunkSize == null ? properties.getDefaultChunkSize() : chunkSize;
        return new SpeechRequest(text, resolvedVoice, resolvedFormat, resolvedChunkSize);
    }

    @Override
    public long toFile(Path path, SpeechRequest request) {
        Objects.requireNonNull(path, "path");
        try (SpeechStream stream = say(request);
             OutputStream out = Files.newOutputStream(path)) {
            long written = stream.transferTo(out);
            LOG.debug("Wrote {} bytes of {} to {}", written, request.format().id(), path);
            return written;
        } catch (IOException e) {
            throw SynthesisExceptionBuilder.create("Failed to write speech to file")
                    .stage("file")
                    .cause(e)
                    .metadata("path", path)
                    .build();
        }
    }

    @Override
    public Set<OutputFormat> supportedFormats() {
        return encoders.registry().supportedFormats();
    }

    /** Identifiers of {@link #supportedFormats()}, in declaration order. */
    public Set<String> supportedFormatIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (OutputFormat format : supportedFormats()) {
            ids.add(format.id());
        }
        return Collections.unmodifiableSet(ids);
    }

    public OutputFormat defaultFormat() {
        return OutputFormat.find(properties.getDefaultFormat()).orElse(OutputFormat.WAV);
    }

    public int size() {
        return workers.size();
    }

    /** Snapshot of every worker's state, in worker order. */
    public List<WorkerState> workerStates() {
        List<WorkerState> states = new ArrayList<>(workers.size());
        for (Worker worker : workers) {
            states.add(worker.state());
        }
        return states;
    }

    /** Number of workers per state. Every state is present. */
    public Map<WorkerState, Integer> stateCounts() {
        Map<WorkerState, Integer> counts = new EnumMap<>(WorkerState.class);
        for (WorkerState state : WorkerState.values()) {
            counts.put(state, 0);
        }
        for (Worker worker : workers) {
            counts.merge(worker.state(), 1, Integer::sum);
        }
        return counts;
    }

    /** Requests currently waiting for an idle worker. */
    public int waitingRequests() {
        return admission.waiting();
    }

    public long completedRequests() {
        long total = 0;
        for (Worker worker : workers) {
            total += worker.completedRequests();
        }
        return total;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stops every worker and waits for their threads. Generations in progress are aborted at
     * their next engine callback. Idempotent.
     */
    @PreDestroy
    public void shutdown() {
        synchronized (dispatchLock) {
            if (!running) {
                return;
            }
            running = false;
        }
        LOG.info("Shutting down worker pool ({} workers)", workers.size());
        workers.forEach(Worker::stop);
        for (Worker worker : workers) {
            worker.join(ProcessTimeouts.WORKER_JOIN_TIMEOUT);
        }
        LOG.info("Worker pool stopped after {} requests", completedRequests());
    }

    private void ensureSupported(OutputFormat format) {
        if (!encoders.registry().supports(format)) {
            throw new UnsupportedFormatException(format.id(), supportedFormatIds());
        }
    }

    private void ensureRunning() {
        if (!running) {
            throw new SynthesisException("Worker pool is shut down", "pool");
        }
    }

    private Worker claimIdleWorker() {
        synchronized (dispatchLock) {
            if (running) {
                for (Worker worker : workers) {
                    if (worker.tryClaim()) {
                        return worker;
                    }
                }
            }
        }
        admission.release();
        ensureRunning();
        // A permit without an idle worker means a worker died without returning to idle
        throw new SynthesisException("No idle worker available despite free capacity", "pool");
    }

    private SpeechStream awaitReady(PendingSpeech pending) {
        long timeoutMs = properties.getReadyTimeoutMs();
        try {
            if (!pending.awaitReady(timeoutMs)) {
                pending.stream().close();
                throw SynthesisExceptionBuilder.create("Stream did not become ready in time")
                        .stage("pool")
                        .metadata("timeoutMs", timeoutMs)
                        .build();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.stream().close();
            throw new SynthesisException("Interrupted while waiting for the stream", "pool", e);
        }
        return pending.stream();
    }
}
