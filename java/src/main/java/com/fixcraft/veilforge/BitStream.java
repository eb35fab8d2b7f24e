package com.fixcraft.veilforge;

import java.util.Arrays;

/**
 * Fixed-length bit buffer. Bytes convert MSB-first, so bit {@code i*8} is the high bit of byte {@code i}.
 */
public final class BitStream {
    private final long[] words;
    private final int length;

    public BitStream(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length < 0");
        }
        this.length = length;
        this.words = new long[(length + 63) >>> 6];
    }

    public static BitStream fromBytes(byte[] data) {
        if (data.length > Integer.MAX_VALUE / 8) {
            throw new IllegalArgumentException("data too large for a bitstream");
        }
        BitStream bits = new BitStream(data.length * 8);
        for (int i = 0; i < data.length; i++) {
            int value = data[i] & 0xFF;
            for (int b = 0; b < 8; b++) {
                if (((value >>> (7 - b)) & 1) != 0) {
                    bits.set(i * 8 + b, true);
                }
            }
        }
        return bits;
    }

    /** Packs the first {@code length / 8} whole bytes; trailing partial bits are dropped. */
    public byte[] toBytes() {
        byte[] out = new byte[length / 8];
        for (int i = 0; i < out.length; i++) {
            int value = 0;
            for (int b = 0; b < 8; b++) {
                value = (value << 1) | (get(i * 8 + b) ? 1 : 0);
            }
            out[i] = (byte) value;
        }
        return out;
    }

    /** Packs all bits, zero-padding the last byte. */
    public byte[] toPaddedBytes() {
        byte[] out = new byte[(length + 7) / 8];
        for (int i = 0; i < length; i++) {
            if (get(i)) {
                out[i >>> 3] |= (byte) (0x80 >>> (i & 7));
            }
        }
        return out;
    }

    public int length() {
        return length;
    }

    public boolean get(int index) {
        checkIndex(index);
        return (words[index >>> 6] & (1L << (index & 63))) != 0;
    }

    public int bit(int index) {
        return get(index) ? 1 : 0;
    }

    public void set(int index, boolean value) {
        checkIndex(index);
        if (value) {
            words[index >>> 6] |= 1L << (index & 63);
        } else {
            words[index >>> 6] &= ~(1L << (index & 63));
        }
    }

    public void flip(int index) {
        checkIndex(index);
        words[index >>> 6] ^= 1L << (index & 63);
    }

    public BitStream slice(int from, int count) {
        if (from < 0 || count < 0 || from + count > length) {
            throw new IndexOutOfBoundsException("slice " + from + "+" + count + " of " + length);
        }
        BitStream out = new BitStream(count);
        for (int i = 0; i < count; i++) {
            if (get(from + i)) {
                out.set(i, true);
            }
        }
        return out;
    }

    public BitStream concat(BitStream other) {
        BitStream out = new BitStream(length + other.length);
        for (int i = 0; i < length; i++) {
            if (get(i)) {
                out.set(i, true);
            }
        }
        for (int i = 0; i < other.length; i++) {
            if (other.get(i)) {
                out.set(length + i, true);
            }
        }
        return out;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("bit " + index + " of " + length);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BitStream)) {
            return false;
        }
        BitStream other = (BitStream) o;
        return length == other.length && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        return 31 * length + Arrays.hashCode(words);
    }
}
