package com.fixcraft.veilforge;

/**
 * Copy-major replication layout: copy {@code r} of logical bit {@code i} lives at physical index
 * {@code r * logicalBits + i}, so the copies of one bit are a full stream length apart.
 */
public final class RedundancyPlan {
    private final int factor;
    private final int logicalBits;

    public RedundancyPlan(int factor, int logicalBits) {
        if (factor < 1) {
            throw new IllegalArgumentException("redundancy factor must be >= 1");
        }
        if (logicalBits < 0) {
            throw new IllegalArgumentException("logicalBits < 0");
        }
        if ((long) factor * logicalBits > Integer.MAX_VALUE) {
            throw new StegoException(StegoErrorKind.PAYLOAD_TOO_LARGE, "Replicated stream exceeds addressable bits");
        }
        this.factor = factor;
        this.logicalBits = logicalBits;
    }

    public int factor() {
        return factor;
    }

    public int logicalBits() {
        return logicalBits;
    }

    public int physicalBits() {
        return factor * logicalBits;
    }

    public int position(int logicalBit, int copy) {
        return copy * logicalBits + logicalBit;
    }
}
