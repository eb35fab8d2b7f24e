package com.fixcraft.veilforge;

/**
 * Bit replication with majority-vote recovery. Carrier-agnostic: it only reorders and votes on bits.
 *
 * <p>Ties, possible only for even factors, decode to {@code 0}. That biases damaged even-factor
 * streams toward zero bits, which is why automatic factors are always odd.
 */
public final class RedundancyCoder {
    private RedundancyCoder() {}

    public static BitStream expand(BitStream bits, int factor) {
        RedundancyPlan plan = new RedundancyPlan(factor, bits.length());
        BitStream out = new BitStream(plan.physicalBits());
        for (int i = 0; i < bits.length(); i++) {
            if (!bits.get(i)) {
                continue;
            }
            for (int r = 0; r < factor; r++) {
                out.set(plan.position(i, r), true);
            }
        }
        return out;
    }

    public static BitStream collapse(BitStream physical, int factor) {
        if (factor < 1) {
            throw new IllegalArgumentException("redundancy factor must be >= 1");
        }
        if (physical.length() % factor != 0) {
            throw new IllegalArgumentException("physical length " + physical.length() + " is not a multiple of " + factor);
        }
        RedundancyPlan plan = new RedundancyPlan(factor, physical.length() / factor);
        BitStream out = new BitStream(plan.logicalBits());
        for (int i = 0; i < plan.logicalBits(); i++) {
            int ones = 0;
            for (int r = 0; r < factor; r++) {
                ones += physical.bit(plan.position(i, r));
            }
            if (ones * 2 > factor) {
                out.set(i, true);
            }
        }
        return out;
    }
}
