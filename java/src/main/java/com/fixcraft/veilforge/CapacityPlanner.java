package com.fixcraft.veilforge;

import java.util.function.IntToLongFunction;

/**
 * Capacity arithmetic shared by hide and capacity queries. Capacity is counted in container bits
 * after the fixed header and redundancy expansion are paid for.
 */
public final class CapacityPlanner {
    private CapacityPlanner() {}

    private static final SlotLayout SEQUENTIAL = new SlotLayout(1);

    /** Capacity of {@code writableSlots} sequential slots. */
    public static long capacityBits(long writableSlots, int factor) {
        return SEQUENTIAL.capacityBits(writableSlots, factor);
    }

    public static long capacityBits(SlotCarrier carrier, int factor) {
        return SlotLayout.of(carrier).capacityBits(carrier.writableSlots(), factor);
    }

    public static boolean fits(long containerLength, long writableSlots, int factor) {
        return containerLength * 8L <= capacityBits(writableSlots, factor);
    }

    public static boolean fits(long containerLength, SlotCarrier carrier, int factor) {
        return containerLength * 8L <= capacityBits(carrier, factor);
    }

    /**
     * Throws {@link StegoErrorKind#PAYLOAD_TOO_LARGE} unless a container of the given length fits.
     */
    public static void validate(long containerLength, SlotCarrier carrier, int factor) {
        if (!fits(containerLength, carrier, factor)) {
            throw tooLarge(containerLength, capacityBits(carrier, factor), factor);
        }
    }

    /**
     * Picks the redundancy factor for a hide. {@code containerLength} maps a candidate factor to the
     * container size it would produce, since the factor is recorded in the metadata.
     */
    public static int chooseFactor(SlotCarrier carrier, CarrierType type, Redundancy policy,
                                   IntToLongFunction containerLength) {
        if (!policy.isAuto()) {
            int factor = policy.factor();
            long length = containerLength.applyAsLong(factor);
            if (!fits(length, carrier, factor)) {
                throw tooLarge(length, capacityBits(carrier, factor), factor);
            }
            return factor;
        }
        int floor = Math.max(type.redundancyFloor(), policy.factor());
        int cap = Math.max(floor, type.autoRedundancyCap());
        for (int factor = cap; factor >= floor; factor--) {
            if (factor % 2 == 0 && factor != floor) {
                continue;
            }
            if (fits(containerLength.applyAsLong(factor), carrier, factor)) {
                StegoLog.debug("capacity", "auto redundancy " + factor + " (floor " + floor + ", cap " + cap + ")");
                return factor;
            }
        }
        throw tooLarge(containerLength.applyAsLong(floor), capacityBits(carrier, floor), floor);
    }

    private static StegoException tooLarge(long containerLength, long capacityBits, int factor) {
        return new StegoException(StegoErrorKind.PAYLOAD_TOO_LARGE,
            "Container needs " + (containerLength * 8L) + " bits at redundancy " + factor
                + ", carrier holds " + capacityBits);
    }
}
