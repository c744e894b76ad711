package com.phillippitts.voicestream.service.encoder;

import com.phillippitts.voicestream.domain.OutputFormat;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from output format to the encoder command line that produces it.
 *
 * <p>The native format is always supported and never has a command. Build one with
 * {@link EncoderProbe#probe()} in production, or {@link #of(Map)} in tests.
 */
public final class EncoderRegistry {

    private final Map<OutputFormat, List<String>> commands;

    private EncoderRegistry(Map<OutputFormat, List<String>> commands) {
        this.commands = commands;
    }

    /**
     * Creates a registry from explicit commands.
     *
     * @param commands encoder command per non-native format
     * @return registry
     * @throws IllegalArgumentException if a command is empty or a native format is mapped
     */
    public static EncoderRegistry of(Map<OutputFormat, List<String>> commands) {
        Objects.requireNonNull(commands, "commands");
        EnumMap<OutputFormat, List<String>> copy = new EnumMap<>(OutputFormat.class);
        for (Map.Entry<OutputFormat, List<String>> entry : commands.entrySet()) {
            OutputFormat format = Objects.requireNonNull(entry.getKey(), "format");
            if (format.isNative()) {
                throw new IllegalArgumentException(format.id() + " is written natively and takes no encoder");
            }
            List<String> command = entry.getValue();
            if (command == null || command.isEmpty()) {
                throw new IllegalArgumentException("Encoder command for " + format.id() + " must not be empty");
            }
            copy.put(format, List.copyOf(command));
        }
        return new EncoderRegistry(Collections.unmodifiableMap(copy));
    }

    /** Registry with no external encoders: only the native format is available. */
    public static EncoderRegistry nativeOnly() {
        return new EncoderRegistry(Map.of());
    }

    /**
     * Returns the encoder command for a format.
     *
     * @param format output format
     * @return command line, or empty for the native format and for formats without an encoder
     */
    public Optional<List<String>> commandFor(OutputFormat format) {
        return Optional.ofNullable(commands.get(format));
    }

    public boolean hasEncoder(OutputFormat format) {
        return commands.containsKey(format);
    }

    /** True if streams in this format can be produced. */
    public boolean supports(OutputFormat format) {
        return format != null && (format.isNative() || commands.containsKey(format));
    }

    /** Every format that can be produced, in declaration order. */
    public Set<OutputFormat> supportedFormats() {
        EnumSet<OutputFormat> formats = EnumSet.noneOf(OutputFormat.class);
        for (OutputFormat format : OutputFormat.values()) {
            if (supports(format)) {
                formats.add(format);
            }
        }
        return Collections.unmodifiableSet(formats);
    }

    @Override
    public String toString() {
        return "EncoderRegistry" + supportedFormats();
    }
}
