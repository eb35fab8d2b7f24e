package com.fixcraft.veilforge;

/**
 * A decoded carrier exposing a deterministic sequence of one-bit slots. Slot order is part of the
 * stego format: it depends only on what can be recovered from the carrier itself.
 */
public interface SlotCarrier extends AutoCloseable {
    /** Slots available to a write. */
    long writableSlots();

    /** Slots that currently hold candidate bits. */
    long readableSlots();

    /** Reads {@code count} bits starting at slot {@code offset}. */
    BitStream read(long offset, int count);

    /**
     * Writes {@code bits} into slots {@code 0..bits.length()-1} of a copy of the carrier and returns
     * the encoded result. The source buffer is never modified.
     */
    byte[] write(BitStream bits);

    /**
     * Number of frames the slots interleave across: slot {@code s} lives in frame
     * {@code s mod spreadWidth()}. Carriers without frames return 1.
     */
    default int spreadWidth() {
        return 1;
    }

    /** Releases scratch resources such as decoded frame files. */
    @Override
    default void close() {
    }
}
