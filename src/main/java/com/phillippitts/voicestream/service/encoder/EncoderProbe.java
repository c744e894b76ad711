package com.phillippitts.voicestream.service.encoder;

import com.phillippitts.voicestream.domain.OutputFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Discovers which external encoders are installed and builds an {@link EncoderRegistry} from them.
 *
 * <p>Each known encoder is checked by looking its executable up on {@code PATH}. A missing
 * encoder is not an error: its format is disabled with a warning naming the package to install.
 */
public final class EncoderProbe {

    private static final Logger LOG = LogManager.getLogger(EncoderProbe.class);

    /**
     * Known encoder: the format it produces, its command line (executable first) and the OS
     * package that provides the executable.
     */
    public record EncoderSpec(OutputFormat format, List<String> command, String packageName) {

        public EncoderSpec {
            Objects.requireNonNull(format, "format");
            if (command == null || command.isEmpty()) {
                throw new IllegalArgumentException("command must not be empty");
            }
            command = List.copyOf(command);
        }

        public String binary() {
            return command.get(0);
        }
    }

    /** Encoders read WAV from stdin and write the encoded stream to stdout. */
    public static final List<EncoderSpec> DEFAULT_ENCODERS = List.of(
            new EncoderSpec(OutputFormat.MP3, List.of("lame", "-htv", "--silent", "-", "-"), "lame"),
            new EncoderSpec(OutputFormat.OPUS,
                    List.of("opusenc", "--quiet", "--discard-comments", "--ignorelength", "-", "-"), "opus-tools")
    );

    private final Predicate<String> binaryResolver;

    public EncoderProbe() {
        this(EncoderProbe::isOnPath);
    }

    EncoderProbe(Predicate<String> binaryResolver) {
        this.binaryResolver = Objects.requireNonNull(binaryResolver, "binaryResolver");
    }

    /** Probes the default encoders. */
    public EncoderRegistry probe() {
        return probe(DEFAULT_ENCODERS);
    }

    /**
     * Probes the given encoders.
     *
     * @param specs candidate encoders; the first available one per format wins
     * @return registry of the encoders found
     */
    public EncoderRegistry probe(List<EncoderSpec> specs) {
        Map<OutputFormat, List<String>> found = new LinkedHashMap<>();
        for (EncoderSpec spec : specs) {
            if (found.containsKey(spec.format())) {
                continue;
            }
            if (binaryResolver.test(spec.binary())) {
                found.put(spec.format(), spec.command());
                LOG.info("Enabled {} support via '{}'", spec.format().id(), spec.binary());
            } else {
                LOG.warn("Disable {} support - {} not found. Use apt install {}",
                        spec.format().id(), spec.binary(), spec.packageName());
            }
        }
        EncoderRegistry registry = EncoderRegistry.of(found);
        LOG.info("Supported output formats: {}", registry.supportedFormats());
        return registry;
    }

    /**
     * Checks whether an executable can be resolved the way {@link ProcessBuilder} would.
     *
     * @param binary executable name or path
     * @return true if an executable file was found
     */
    static boolean isOnPath(String binary) {
        if (binary == null || binary.isBlank()) {
            return false;
        }
        try {
            if (binary.contains(File.separator)) {
                return Files.isExecutable(Path.of(binary));
            }
            String path = System.getenv("PATH");
            if (path == null || path.isBlank()) {
                return false;
            }
            for (String dir : path.split(File.pathSeparator)) {
                if (dir.isBlank()) {
                    continue;
                }
                Path candidate = Path.of(dir).resolve(binary);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return true;
                }
            }
            return false;
        } catch (InvalidPathException e) {
            LOG.debug("Cannot resolve encoder binary '{}': {}", binary, e.toString());
            return false;
        }
    }
}
