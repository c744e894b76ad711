package com.phillippitts.voicestream.service.pool;

import com.phillippitts.voicestream.domain.OutputFormat;
import com.phillippitts.voicestream.domain.SpeechRequest;
import com.phillippitts.voicestream.domain.WorkerState;
import com.phillippitts.voicestream.exception.EngineUnavailableException;
import com.phillippitts.voicestream.exception.SynthesisException;
import com.phillippitts.voicestream.service.encoder.EncoderLauncher;
import com.phillippitts.voicestream.service.encoder.EncoderRegistry;
import com.phillippitts.voicestream.service.engine.EngineSettings;
import com.phillippitts.voicestream.service.events.SynthesisFailureEvent;
import com.phillippitts.voicestream.service.stream.SpeechStream;
import com.phillippitts.voicestream.testutil.EventCapturingPublisher;
import com.phillippitts.voicestream.testutil.FakeEngineFactory;
import com.phillippitts.voicestream.testutil.FakeSynthesisEngine;
import com.phillippitts.voicestream.testutil.PassThroughProcess;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.voicestream.testutil.WavBytes.HEADER_SIZE;
import static com.phillippitts.voicestream.testutil.WavBytes.countRiffMarkers;
import static com.phillippitts.voicestream.testutil.WavBytes.fourCc;
import static com.phillippitts.voicestream.testutil.WavBytes.payload;
import static com.phillippitts.voicestream.testutil.WavBytes.readLEInt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class WorkerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private FakeEngineFactory engines;
    private EventCapturingPublisher events;
    private AtomicInteger idleCalls;
    private Worker worker;

    @BeforeEach
    void setUp() {
        engines = new FakeEngineFactory();
        events = new EventCapturingPublisher();
        idleCalls = new AtomicInteger();
    }

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.stop();
            worker.join(WAIT);
        }
    }

    private Worker startWorker(EncoderLauncher launcher, String expectedVersion) {
        worker = new Worker("tts-worker-test", engines, EngineSettings.defaults(), expectedVersion,
                launcher, events, idleCalls::incrementAndGet);
        worker.start(WAIT);
        return worker;
    }

    private Worker startWorker() {
        return startWorker(nativeOnly(), null);
    }

    private static EncoderLauncher nativeOnly() {
        return new EncoderLauncher(EncoderRegistry.nativeOnly(), command -> new PassThroughProcess(),
                Duration.ofSeconds(2), 1024);
    }

    private SpeechStream request(SpeechRequest request) throws InterruptedException {
        assertThat(worker.tryClaim()).isTrue();
        PendingSpeech pending = worker.submit(request);
        assertThat(pending.awaitReady(WAIT.toMillis())).isTrue();
        return pending.stream();
    }

    private static byte[] readAll(SpeechStream stream) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        stream.transferTo(out);
        return out.toByteArray();
    }

    @Test
    void createsEngineOnItsOwnThread() {
        startWorker();

        assertThat(engines.engines).hasSize(1);
        assertThat(engines.engines.get(0).creatorThread).isEqualTo("tts-worker-test");
        assertThat(worker.engineVersion()).isEqualTo("1.0.0");
        assertThat(worker.state()).isEqualTo(WorkerState.IDLE);
        assertThat(worker.isRunning()).isTrue();
    }

    @Test
    void wavRequestStreamsOneHeaderFollowedByPcm() throws Exception {
        startWorker();

        byte[] wav = readAll(request(SpeechRequest.of("Hallo Welt", "anna", OutputFormat.WAV)));

        assertThat(countRiffMarkers(wav)).isEqualTo(1);
        assertThat(fourCc(wav, 0)).isEqualTo("RIFF");
        assertThat(readLEInt(wav, 24)).isEqualTo(24_000);
        assertThat(payload(wav)).containsExactly(engines.expectedPcm());

        FakeSynthesisEngine engine = engines.engines.get(0);
        assertThat(engine.voices).containsExactly("anna");
        assertThat(engine.texts).containsExactly("Hallo Welt");
        assertThat(worker.completedRequests()).isEqualTo(1);
    }

    @Test
    void workerIsBusyUntilGenerationAndReadingAreBothDone() throws Exception {
        startWorker();
        engines.chunkGate = new CountDownLatch(1);

        SpeechStream stream = request(SpeechRequest.of("text", "anna", OutputFormat.WAV));

        assertThat(worker.state()).isEqualTo(WorkerState.PROCESSING);
        assertThat(worker.tryClaim()).isFalse();

        engines.chunkGate.countDown();
        await().atMost(WAIT).until(() -> worker.state() == WorkerState.READING);
        assertThat(idleCalls).hasValue(0);
        assertThat(worker.tryClaim()).isFalse();

        readAll(stream);

        assertThat(worker.state()).isEqualTo(WorkerState.IDLE);
        assertThat(idleCalls).hasValue(1);
    }

    @Test
    void closingStreamEarlyAbortsGeneration() throws Exception {
        startWorker();
        engines.chunkGate = new CountDownLatch(1);

        SpeechStream stream = request(SpeechRequest.of("text", "anna", OutputFormat.WAV));
        stream.close();
        engines.chunkGate.countDown();

        await().atMost(WAIT).until(() -> worker.state() == WorkerState.IDLE);
        assertThat(engines.engines.get(0).aborted).isTrue();
        assertThat(idleCalls).hasValue(1);
    }

    @Test
    void engineFailureSurfacesThroughStream() throws Exception {
        startWorker();
        engines.generateFailure = new IllegalStateException("voice data corrupt");

        SpeechStream stream = request(SpeechRequest.of("text", "anna", OutputFormat.WAV));

        assertThatThrownBy(() -> readAll(stream))
            .isInstanceOf(SynthesisException.class)
            .hasMessageContaining("Synthesis failed")
            .hasRootCauseMessage("voice data corrupt")
            .satisfies(e -> assertThat(((SynthesisException) e).getStage()).isEqualTo("engine"));

        List<SynthesisFailureEvent> failures = events.ofType(SynthesisFailureEvent.class);
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0).worker()).isEqualTo("tts-worker-test");
        assertThat(failures.get(0).stage()).isEqualTo("engine");
        assertThat(failures.get(0).context()).containsEntry("voice", "anna");

        await().atMost(WAIT).until(() -> worker.state() == WorkerState.IDLE);
    }

    @Test
    void workerRecoversAfterFailedRequest() throws Exception {
        startWorker();
        engines.generateFailure = new IllegalStateException("boom");
        SpeechStream failed = request(SpeechRequest.of("one", "anna", OutputFormat.WAV));
        assertThatThrownBy(() -> readAll(failed)).isInstanceOf(SynthesisException.class);
        await().atMost(WAIT).until(() -> worker.state() == WorkerState.IDLE);

        engines.generateFailure = null;
        byte[] wav = readAll(request(SpeechRequest.of("two", "anna", OutputFormat.WAV)));

        assertThat(payload(wav)).containsExactly(engines.expectedPcm());
    }

    @Test
    void versionMismatchOnlyWarns() {
        startWorker(nativeOnly(), "2.0.0");

        assertThat(worker.isRunning()).isTrue();
        assertThat(worker.engineVersion()).isEqualTo("1.0.0");
    }

    @Test
    void engineCreationFailureFailsStart() {
        engines.createFailure = new IllegalStateException("libtts.so: cannot open shared object file");
        Worker w = new Worker("tts-worker-broken", engines, EngineSettings.defaults(), null,
                nativeOnly(), events, idleCalls::incrementAndGet);

        assertThatThrownBy(() -> w.start(WAIT))
            .isInstanceOf(EngineUnavailableException.class)
            .hasMessageContaining("tts-worker-broken")
            .hasMessageContaining("cannot open shared object file");
        assertThat(w.isRunning()).isFalse();
        assertThat(w.tryClaim()).isFalse();
        assertThat(w.join(WAIT)).isTrue();
    }

    @Test
    void repeatedSampleRateAnnouncementIsIgnored() throws Exception {
        startWorker();
        engines.announceRateTwice = true;

        byte[] wav = readAll(request(SpeechRequest.of("text", "anna", OutputFormat.WAV)));

        assertThat(countRiffMarkers(wav)).isEqualTo(1);
        assertThat(readLEInt(wav, 24)).isEqualTo(24_000);
        assertThat(payload(wav)).containsExactly(engines.expectedPcm());
    }

    @Test
    void samplesWithoutRateAnnouncementUseDefaultRate() throws Exception {
        startWorker();
        engines.sampleRate = 0;

        byte[] wav = readAll(request(SpeechRequest.of("text", "anna", OutputFormat.WAV)));

        assertThat(countRiffMarkers(wav)).isEqualTo(1);
        assertThat(readLEInt(wav, 24)).isEqualTo(24_000);
        assertThat(wav.length).isEqualTo(HEADER_SIZE + engines.expectedPcm().length);
    }

    @Test
    void generationWithoutAudioYieldsEmptyStream() throws Exception {
        startWorker();
        engines.sampleRate = 0;
        engines.chunks = List.of();

        byte[] out = readAll(request(SpeechRequest.of("", "anna", OutputFormat.WAV)));

        assertThat(out).isEmpty();
        await().atMost(WAIT).until(() -> worker.state() == WorkerState.IDLE);
    }

    @Test
    void encodedFormatIsPipedThroughEncoder() throws Exception {
        PassThroughProcess process = new PassThroughProcess();
        EncoderLauncher launcher = new EncoderLauncher(
                EncoderRegistry.of(Map.of(OutputFormat.MP3, List.of("lame", "-", "-"))),
                command -> process, Duration.ofSeconds(2), 1024);
        startWorker(launcher, null);

        byte[] out = readAll(request(new SpeechRequest("text", "anna", OutputFormat.MP3, 256)));

        byte[] marker = Arrays.copyOf(out, PassThroughProcess.MARKER.length);
        byte[] wav = Arrays.copyOfRange(out, PassThroughProcess.MARKER.length, out.length);
        assertThat(marker).containsExactly(PassThroughProcess.MARKER);
        assertThat(wav).containsExactly(process.received());
        assertThat(countRiffMarkers(wav)).isEqualTo(1);
        assertThat(payload(wav)).containsExactly(engines.expectedPcm());
        assertThat(process.isStdinClosed()).isTrue();
    }

    @Test
    void encoderSpawnFailureFailsRequest() throws Exception {
        EncoderLauncher launcher = new EncoderLauncher(
                EncoderRegistry.of(Map.of(OutputFormat.MP3, List.of("lame", "-", "-"))),
                command -> {
                    throw new IOException("error=2, No such file or directory");
                }, Duration.ofSeconds(2), 1024);
        startWorker(launcher, null);

        SpeechStream stream = request(SpeechRequest.of("text", "anna", OutputFormat.MP3));

        assertThatThrownBy(() -> readAll(stream))
            .isInstanceOf(SynthesisException.class)
            .hasMessageContaining("Failed to start encoder");
        assertThat(engines.engines.get(0).aborted).isTrue();
        assertThat(events.ofType(SynthesisFailureEvent.class))
            .extracting(SynthesisFailureEvent::stage)
            .containsExactly("target");
    }

    @Test
    void stopAbortsGenerationInProgress() throws Exception {
        startWorker();
        engines.chunkGate = new CountDownLatch(1);
        SpeechStream stream = request(SpeechRequest.of("text", "anna", OutputFormat.WAV));

        worker.stop();
        engines.chunkGate.countDown();

        assertThat(worker.join(WAIT)).isTrue();
        FakeSynthesisEngine engine = engines.engines.get(0);
        assertThat(engine.aborted).isTrue();
        assertThat(engine.closed).isTrue();
        assertThat(worker.isRunning()).isFalse();
        // Whatever was produced before the abort is still delivered
        byte[] wav = readAll(stream);
        assertThat(payload(wav)).containsExactly(engines.chunks.get(0));
    }

    @Test
    void submitAfterStopFailsRequestAndReleasesWorker() throws Exception {
        startWorker();
        assertThat(worker.tryClaim()).isTrue();
        worker.stop();
        assertThat(worker.join(WAIT)).isTrue();

        PendingSpeech pending = worker.submit(SpeechRequest.of("late", "anna", OutputFormat.WAV));

        assertThat(pending.awaitReady(WAIT.toMillis())).isTrue();
        try (SpeechStream stream = pending.stream()) {
            assertThatThrownBy(() -> readAll(stream))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("stopped before the request was processed");
        }
        assertThat(worker.state()).isEqualTo(WorkerState.IDLE);
        assertThat(idleCalls.get()).isEqualTo(1);
        assertThat(engines.engines.get(0).texts).isEmpty();
    }

    @Test
    void submitRequiresClaim() {
        startWorker();

        assertThatThrownBy(() -> worker.submit(SpeechRequest.of("text", "anna", OutputFormat.WAV)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("must be claimed");
    }
}
