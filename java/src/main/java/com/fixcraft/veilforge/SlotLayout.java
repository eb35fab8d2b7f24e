package com.fixcraft.veilforge;

/**
 * Places the copy-major bitstream (header segment, then body segment) onto carrier slots.
 *
 * <p>A carrier whose slots interleave across {@code width} frames (slot {@code s} lives in frame
 * {@code s mod width}) gets a rotated layout: each copy of a segment fills whole rows of
 * {@code width} slots, and copy {@code r} of bit {@code i} goes to frame {@code (i + r) mod width}.
 * One frame therefore holds at most {@code ceil(copies / width)} copies of any bit. With
 * {@code width == 1} this is the plain sequential layout.
 */
final class SlotLayout {
    private static final long HEADER_BITS = Constants.HEADER_BYTES * 8L;

    private final int width;

    SlotLayout(int width) {
        if (width < 1) {
            throw new IllegalArgumentException("layout width must be >= 1: " + width);
        }
        this.width = width;
    }

    static SlotLayout of(SlotCarrier carrier) {
        return new SlotLayout(carrier.spreadWidth());
    }

    int width() {
        return width;
    }

    long headerSlots() {
        return headerRows() * width;
    }

    /** Slots a stream with {@code containerBits} logical body bits at {@code factor} occupies. */
    long totalSlots(int factor, long containerBits) {
        return (headerRows() + factor * rowsPerCopy(containerBits)) * width;
    }

    /** Largest container, in bits, that fits {@code slots} at {@code factor}. */
    long capacityBits(long slots, int factor) {
        if (factor < 1) {
            throw new IllegalArgumentException("factor < 1");
        }
        long bodyRows = slots / width - headerRows();
        return bodyRows <= 0 ? 0 : (bodyRows / factor) * width;
    }

    /** Slot index of copy {@code copy} of bit {@code bit} in a segment starting at {@code startRow}. */
    long slot(long copyBits, long startRow, int copy, long bit) {
        long row = startRow + copy * rowsPerCopy(copyBits) + bit / width;
        return row * width + (bit + copy) % width;
    }

    /**
     * Lays out a copy-major header ({@link Constants#HEADER_COPIES} copies) and a copy-major body
     * ({@code factor} copies). Unused slots in partially filled rows stay zero.
     */
    BitStream place(BitStream header, BitStream body, int factor) {
        long total = totalSlots(factor, body.length() / factor);
        if (total > Integer.MAX_VALUE) {
            throw new StegoException(StegoErrorKind.PAYLOAD_TOO_LARGE, "Stream exceeds addressable slots");
        }
        BitStream out = new BitStream((int) total);
        scatter(header, Constants.HEADER_COPIES, 0, out);
        scatter(body, factor, headerRows(), out);
        return out;
    }

    /** Copy-major header bits from the {@link #headerSlots()} slots at the start of the carrier. */
    BitStream gatherHeader(BitStream region) {
        return gather(region, Constants.HEADER_COPIES, HEADER_BITS);
    }

    /** Copy-major body bits from the slots that follow the header. */
    BitStream gatherBody(BitStream region, int factor, long containerBits) {
        return gather(region, factor, containerBits);
    }

    private void scatter(BitStream physical, int copies, long startRow, BitStream out) {
        long copyBits = physical.length() / copies;
        for (int p = 0; p < physical.length(); p++) {
            if (physical.get(p)) {
                out.set((int) slot(copyBits, startRow, (int) (p / copyBits), p % copyBits), true);
            }
        }
    }

    private BitStream gather(BitStream region, int copies, long copyBits) {
        BitStream out = new BitStream((int) (copies * copyBits));
        for (int r = 0; r < copies; r++) {
            for (long i = 0; i < copyBits; i++) {
                if (region.get((int) slot(copyBits, 0, r, i))) {
                    out.set((int) (r * copyBits + i), true);
                }
            }
        }
        return out;
    }

    private long headerRows() {
        return Constants.HEADER_COPIES * rowsPerCopy(HEADER_BITS);
    }

    private long rowsPerCopy(long copyBits) {
        return (copyBits + width - 1) / width;
    }
}
