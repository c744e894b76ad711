package com.phillippitts.voicestream.exception;

/**
 * Thrown when every worker stayed busy for the whole admission timeout.
 * No worker is left claimed when this is raised.
 */
public class SynthesisBusyException extends VoiceStreamException {

    private final int poolSize;
    private final long waitedMs;

    public SynthesisBusyException(int poolSize, long waitedMs) {
        super("Still busy: all " + poolSize + " workers occupied after " + waitedMs + "ms wait");
        this.poolSize = poolSize;
        this.waitedMs = waitedMs;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public long getWaitedMs() {
        return waitedMs;
    }
}
