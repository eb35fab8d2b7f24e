package com.fixcraft.veilforge;

import java.util.Locale;

/**
 * Redundancy policy for a hide call: a fixed factor, or automatic selection of the largest odd
 * factor that fits the carrier.
 */
public final class Redundancy {
    private final boolean auto;
    private final int factor;

    private Redundancy(boolean auto, int factor) {
        this.auto = auto;
        this.factor = factor;
    }

    public static Redundancy auto() {
        return new Redundancy(true, 0);
    }

    /** Automatic selection that never goes below {@code floor}. */
    public static Redundancy auto(int floor) {
        checkRange(floor);
        return new Redundancy(true, floor);
    }

    public static Redundancy fixed(int factor) {
        checkRange(factor);
        return new Redundancy(false, factor);
    }

    /** Accepts {@code auto}, {@code auto:N} or a plain factor. */
    public static Redundancy parse(String label) {
        if (label == null || label.trim().isEmpty()) {
            return auto();
        }
        String value = label.trim().toLowerCase(Locale.US);
        try {
            if ("auto".equals(value)) {
                return auto();
            }
            if (value.startsWith("auto:")) {
                return auto(Integer.parseInt(value.substring(5)));
            }
            return fixed(Integer.parseInt(value));
        } catch (NumberFormatException exc) {
            throw new IllegalArgumentException("Invalid redundancy: " + label, exc);
        }
    }

    private static void checkRange(int factor) {
        if (factor < 1 || factor > Constants.MAX_REDUNDANCY) {
            throw new IllegalArgumentException("redundancy factor must be 1.." + Constants.MAX_REDUNDANCY + ": " + factor);
        }
    }

    public boolean isAuto() {
        return auto;
    }

    /** Fixed factor, or the explicit floor of an automatic policy (0 when none was given). */
    public int factor() {
        return factor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Redundancy)) {
            return false;
        }
        Redundancy other = (Redundancy) o;
        return auto == other.auto && factor == other.factor;
    }

    @Override
    public int hashCode() {
        return (auto ? 31 : 0) + factor;
    }

    @Override
    public String toString() {
        if (auto) {
            return factor == 0 ? "auto" : "auto:" + factor;
        }
        return Integer.toString(factor);
    }
}
