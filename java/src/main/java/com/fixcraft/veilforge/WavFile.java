package com.fixcraft.veilforge;

import java.nio.charset.StandardCharsets;

/**
 * Locates the PCM sample area of a RIFF/WAVE file without copying it.
 */
final class WavFile {
    private static final int WAVE_FORMAT_PCM = 1;
    private static final int WAVE_FORMAT_EXTENSIBLE = 0xFFFE;

    final int channels;
    final int sampleRate;
    final int bitsPerSample;
    final int dataOffset;
    final int dataLength;

    private WavFile(int channels, int sampleRate, int bitsPerSample, int dataOffset, int dataLength) {
        this.channels = channels;
        this.sampleRate = sampleRate;
        this.bitsPerSample = bitsPerSample;
        this.dataOffset = dataOffset;
        this.dataLength = dataLength;
    }

    static boolean looksLikeWav(byte[] data) {
        return data.length >= 12
            && data[0] == 'R' && data[1] == 'I' && data[2] == 'F' && data[3] == 'F'
            && data[8] == 'W' && data[9] == 'A' && data[10] == 'V' && data[11] == 'E';
    }

    /** Returns the layout, or {@code null} when the bytes are not an uncompressed PCM WAV. */
    static WavFile parse(byte[] data) {
        if (!looksLikeWav(data)) {
            return null;
        }
        int pos = 12;
        int format = -1;
        int channels = 0;
        int sampleRate = 0;
        int bits = 0;
        while (pos + 8 <= data.length) {
            String id = new String(data, pos, 4, StandardCharsets.US_ASCII);
            long size = Format.readU32(data, pos + 4);
            int body = pos + 8;
            if ("fmt ".equals(id)) {
                if (size < 16 || body + 16 > data.length) {
                    return null;
                }
                format = Format.readU16(data, body);
                channels = Format.readU16(data, body + 2);
                sampleRate = (int) Format.readU32(data, body + 4);
                bits = Format.readU16(data, body + 14);
                if (format == WAVE_FORMAT_EXTENSIBLE && size >= 40 && body + 26 <= data.length) {
                    format = Format.readU16(data, body + 24);
                }
            } else if ("data".equals(id)) {
                if (format != WAVE_FORMAT_PCM || channels <= 0) {
                    return null;
                }
                long available = data.length - (long) body;
                int length = (int) Math.min(size, available);
                return new WavFile(channels, sampleRate, bits, body, length);
            }
            long next = body + size + (size & 1);
            if (next > data.length) {
                break;
            }
            pos = (int) next;
        }
        return null;
    }

    int sampleCount() {
        return dataLength / (bitsPerSample / 8);
    }
}
