package com.phillippitts.voicestream.service.encoder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Drains an encoder's stderr into a capped buffer.
 *
 * <p>Once the cap is reached the stream is still drained, so a chatty encoder can never block
 * on a full stderr pipe, but further output is dropped.
 */
final class StderrGobbler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StderrGobbler.class);

    private final InputStream inputStream;
    private final StringBuffer sink = new StringBuffer();
    private final String name;
    private final int maxChars;

    StderrGobbler(InputStream inputStream, String name, int maxChars) {
        this.inputStream = inputStream;
        this.name = name;
        this.maxChars = maxChars;
    }

    static Thread start(StderrGobbler gobbler) {
        Thread thread = new Thread(gobbler, gobbler.name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            boolean capReached = false;
            while ((line = br.readLine()) != null) {
                if (sink.length() >= maxChars) {
                    if (!capReached) {
                        LOG.debug("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                        capReached = true;
                    }
                    continue;
                }
                if (sink.length() > 0) {
                    sink.append('\n');
                }
                int available = maxChars - sink.length();
                sink.append(line, 0, Math.min(line.length(), available));
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }

    /** Captured output so far, at most {@code maxLength} characters of it. */
    String snippet(int maxLength) {
        synchronized (sink) {
            return sink.substring(0, Math.min(maxLength, sink.length()));
        }
    }
}
