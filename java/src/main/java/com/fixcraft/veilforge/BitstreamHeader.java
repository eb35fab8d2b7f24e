package com.fixcraft.veilforge;

/**
 * Fixed-size header at the front of every physical bitstream: marker, body redundancy factor and
 * container byte length. Written with its own fixed replication so a reader can learn the body
 * layout before anything else.
 */
public final class BitstreamHeader {
    private final int factor;
    private final long containerLength;

    public BitstreamHeader(int factor, long containerLength) {
        if (factor < 1 || factor > Constants.MAX_REDUNDANCY) {
            throw new IllegalArgumentException("redundancy factor out of range: " + factor);
        }
        if (containerLength <= 0 || containerLength > Constants.MAX_CONTAINER_LEN) {
            throw new IllegalArgumentException("container length out of range: " + containerLength);
        }
        this.factor = factor;
        this.containerLength = containerLength;
    }

    public int factor() {
        return factor;
    }

    public long containerLength() {
        return containerLength;
    }

    public long bodyBits() {
        return containerLength * 8L * factor;
    }

    public long totalBits() {
        return Constants.HEADER_SLOTS + bodyBits();
    }

    public BitStream encode() {
        byte[] raw = new byte[Constants.HEADER_BYTES];
        raw[0] = (byte) Constants.HEADER_MARKER;
        raw[1] = (byte) factor;
        Format.writeU32(raw, 2, containerLength);
        return RedundancyCoder.expand(BitStream.fromBytes(raw), Constants.HEADER_COPIES);
    }

    /**
     * Decodes the header from the first {@link Constants#HEADER_SLOTS} physical bits.
     * Returns {@code null} when the bits do not describe a plausible stream.
     */
    public static BitstreamHeader decode(BitStream physical) {
        if (physical.length() < Constants.HEADER_SLOTS) {
            return null;
        }
        BitStream slice = physical.length() == Constants.HEADER_SLOTS
            ? physical
            : physical.slice(0, Constants.HEADER_SLOTS);
        byte[] raw = RedundancyCoder.collapse(slice, Constants.HEADER_COPIES).toBytes();
        if ((raw[0] & 0xFF) != Constants.HEADER_MARKER) {
            return null;
        }
        int factor = raw[1] & 0xFF;
        long length = Format.readU32(raw, 2);
        if (factor < 1 || length < Constants.CONTAINER_MAGIC.length + 8L || length > Constants.MAX_CONTAINER_LEN) {
            return null;
        }
        return new BitstreamHeader(factor, length);
    }
}
