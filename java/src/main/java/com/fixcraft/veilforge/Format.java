package com.fixcraft.veilforge;

/**
 * Little-endian integer helpers and byte searching shared by the container and carrier codecs.
 */
public final class Format {
    private Format() {}

    public static void writeU32(byte[] out, int offset, long value) {
        if (value < 0 || value > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("u32 out of range: " + value);
        }
        out[offset] = (byte) value;
        out[offset + 1] = (byte) (value >>> 8);
        out[offset + 2] = (byte) (value >>> 16);
        out[offset + 3] = (byte) (value >>> 24);
    }

    public static byte[] u32(long value) {
        byte[] out = new byte[4];
        writeU32(out, 0, value);
        return out;
    }

    public static long readU32(byte[] data, int offset) {
        return (data[offset] & 0xFFL)
            | ((data[offset + 1] & 0xFFL) << 8)
            | ((data[offset + 2] & 0xFFL) << 16)
            | ((data[offset + 3] & 0xFFL) << 24);
    }

    public static int readU16(byte[] data, int offset) {
        return (data[offset] & 0xFF) | ((data[offset + 1] & 0xFF) << 8);
    }

    public static void writeU16(byte[] out, int offset, int value) {
        out[offset] = (byte) value;
        out[offset + 1] = (byte) (value >>> 8);
    }

    public static int indexOf(byte[] data, byte[] needle, int from) {
        if (needle.length == 0) {
            return from;
        }
        int limit = data.length - needle.length;
        outer:
        for (int i = Math.max(0, from); i <= limit; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (data[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    public static int lastIndexOf(byte[] data, byte[] needle) {
        for (int i = data.length - needle.length; i >= 0; i--) {
            if (startsWith(data, i, needle)) {
                return i;
            }
        }
        return -1;
    }

    public static boolean startsWith(byte[] data, int offset, byte[] prefix) {
        if (offset < 0 || offset + prefix.length > data.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[offset + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    public static byte[] concat(byte[]... parts) {
        long total = 0;
        for (byte[] part : parts) {
            total += part.length;
        }
        if (total > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("concatenation too large");
        }
        byte[] out = new byte[(int) total];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, out, offset, part.length);
            offset += part.length;
        }
        return out;
    }
}
