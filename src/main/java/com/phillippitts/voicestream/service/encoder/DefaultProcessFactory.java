package com.phillippitts.voicestream.service.encoder;

import java.io.IOException;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        // stdout carries encoded audio, so diagnostics must stay on their own pipe
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
