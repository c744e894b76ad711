package com.phillippitts.voicestream.testutil;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Little-endian readers for asserting on WAV bytes.
 */
public final class WavBytes {

    public static final int HEADER_SIZE = 44;

    private WavBytes() {}

    public static int readLEInt(byte[] b, int offset) {
        return (b[offset] & 0xFF)
                | ((b[offset + 1] & 0xFF) << 8)
                | ((b[offset + 2] & 0xFF) << 16)
                | ((b[offset + 3] & 0xFF) << 24);
    }

    public static int readLEShort(byte[] b, int offset) {
        return (b[offset] & 0xFF) | ((b[offset + 1] & 0xFF) << 8);
    }

    public static String fourCc(byte[] b, int offset) {
        return new String(b, offset, 4, StandardCharsets.US_ASCII);
    }

    /** Bytes after the 44-byte header. */
    public static byte[] payload(byte[] wav) {
        return Arrays.copyOfRange(wav, HEADER_SIZE, wav.length);
    }

    /** Number of "RIFF" markers in the data; a well-formed stream has exactly one. */
    public static int countRiffMarkers(byte[] data) {
        int count = 0;
        for (int i = 0; i + 4 <= data.length; i++) {
            if (data[i] == 'R' && data[i + 1] == 'I' && data[i + 2] == 'F' && data[i + 3] == 'F') {
                count++;
            }
        }
        return count;
    }
}
