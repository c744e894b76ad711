package com.phillippitts.voicestream.service.encoder;

import com.phillippitts.voicestream.config.properties.EncoderProperties;
import com.phillippitts.voicestream.domain.OutputFormat;
import com.phillippitts.voicestream.exception.SynthesisExceptionBuilder;
import com.phillippitts.voicestream.service.stream.ChunkChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Spawns {@link EncoderRelay}s for the formats in an {@link EncoderRegistry}.
 */
public final class EncoderLauncher {

    private static final Logger LOG = LogManager.getLogger(EncoderLauncher.class);

    private final EncoderRegistry registry;
    private final ProcessFactory processFactory;
    private final Duration exitTimeout;
    private final int stderrMaxChars;

    public EncoderLauncher(EncoderRegistry registry, EncoderProperties properties) {
        this(registry, new DefaultProcessFactory(),
                Duration.ofMillis(properties.getExitTimeoutMs()), properties.getStderrMaxChars());
    }

    public EncoderLauncher(EncoderRegistry registry, ProcessFactory processFactory,
                           Duration exitTimeout, int stderrMaxChars) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.exitTimeout = Objects.requireNonNull(exitTimeout, "exitTimeout");
        if (stderrMaxChars <= 0) {
            throw new IllegalArgumentException("stderrMaxChars must be positive: " + stderrMaxChars);
        }
        this.stderrMaxChars = stderrMaxChars;
    }

    public EncoderRegistry registry() {
        return registry;
    }

    /** True if output in this format goes through an external encoder. */
    public boolean hasEncoder(OutputFormat format) {
        return registry.hasEncoder(format);
    }

    /**
     * Starts the encoder for a format, relaying its output into the channel.
     *
     * @param format output format with a registered encoder
     * @param channel destination for encoded chunks
     * @param chunkSize stdout read size in bytes
     * @return running relay; the caller owns it and must close it
     * @throws com.phillippitts.voicestream.exception.SynthesisException if the format has no
     *         encoder or the process cannot be started
     */
    public EncoderRelay open(OutputFormat format, ChunkChannel channel, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        List<String> command = registry.commandFor(format).orElseThrow(() ->
                SynthesisExceptionBuilder.create("No encoder registered").stage("encoder")
                        .metadata("format", format.id())
                        .build());
        Process process;
        try {
            process = processFactory.start(command);
        } catch (IOException | RuntimeException e) {
            throw SynthesisExceptionBuilder.create("Failed to start encoder")
                    .stage("encoder")
                    .cause(e)
                    .metadata("format", format.id())
                    .metadata("command", String.join(" ", command))
                    .build();
        }
        LOG.debug("Started encoder for {}: {}", format.id(), command);
        return new EncoderRelay(format, command, process, channel, chunkSize, exitTimeout, stderrMaxChars);
    }
}
