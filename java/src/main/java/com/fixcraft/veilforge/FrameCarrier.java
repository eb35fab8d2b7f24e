package com.fixcraft.veilforge;

/**
 * Slot addressing shared by decoded video carriers. Frames are packed rgb24; slot {@code k} lives
 * in frame {@code k mod F} at channel byte {@code k div F}.
 *
 * <p>Each slot uses the low {@link Constants#VIDEO_MASK_BITS} bits of a channel byte: a one is
 * written as all-ones, a zero as all-zeros, and reads threshold at the midpoint, so small
 * re-encoding drift in a pixel does not flip the bit.
 */
abstract class FrameCarrier implements SlotCarrier {
    static final int MASK = (1 << Constants.VIDEO_MASK_BITS) - 1;
    static final int THRESHOLD = (MASK + 1) / 2;

    private final int width;
    private final int height;
    private final String frameRate;

    FrameCarrier(int width, int height, String frameRate) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("invalid frame size " + width + "x" + height);
        }
        if ((long) width * height * 3 > Integer.MAX_VALUE) {
            throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT,
                "Frame size " + width + "x" + height + " is too large");
        }
        this.width = width;
        this.height = height;
        this.frameRate = frameRate;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public String frameRate() {
        return frameRate;
    }

    public int frameSize() {
        return width * height * 3;
    }

    public abstract int frameCount();

    /** Returns a copy of frame {@code index}. */
    public abstract byte[] frame(int index);

    /** Bytes {@code [from, from + length)} of every frame, indexed by frame. */
    abstract byte[][] frameSlices(int from, int length);

    @Override
    public int spreadWidth() {
        return frameCount();
    }

    @Override
    public long writableSlots() {
        return (long) frameCount() * frameSize();
    }

    @Override
    public long readableSlots() {
        return writableSlots();
    }

    @Override
    public BitStream read(long offset, int count) {
        CarrierCodec.checkReadable(this, offset, count);
        BitStream bits = new BitStream(count);
        if (count == 0) {
            return bits;
        }
        int frames = frameCount();
        int firstRow = (int) (offset / frames);
        int lastRow = (int) ((offset + count - 1) / frames);
        byte[][] slices = frameSlices(firstRow, lastRow - firstRow + 1);
        for (int i = 0; i < count; i++) {
            long slot = offset + i;
            int value = slices[(int) (slot % frames)][(int) (slot / frames) - firstRow] & MASK;
            bits.set(i, value >= THRESHOLD);
        }
        return bits;
    }

    /** Writes the slots of {@code bits} that belong to frame {@code frameIndex} into {@code frame}. */
    static void embedFrame(byte[] frame, int frameIndex, int frameCount, BitStream bits) {
        for (long k = frameIndex; k < bits.length(); k += frameCount) {
            int idx = (int) (k / frameCount);
            int value = frame[idx] & ~MASK;
            frame[idx] = (byte) (bits.get((int) k) ? value | MASK : value);
        }
    }
}
