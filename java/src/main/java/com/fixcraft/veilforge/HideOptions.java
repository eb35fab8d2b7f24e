package com.fixcraft.veilforge;

/**
 * Tunables for a hide call. Immutable; the {@code with*} methods return modified copies.
 */
public final class HideOptions {
    private final Redundancy redundancy;
    private final KdfParams kdf;

    private HideOptions(Redundancy redundancy, KdfParams kdf) {
        this.redundancy = redundancy;
        this.kdf = kdf;
    }

    /** Automatic redundancy, PBKDF2 with the configured iteration count. */
    public static HideOptions defaults() {
        return new HideOptions(Redundancy.auto(), KdfParams.defaults());
    }

    public HideOptions withRedundancy(Redundancy redundancy) {
        if (redundancy == null) {
            throw new IllegalArgumentException("redundancy must not be null");
        }
        return new HideOptions(redundancy, kdf);
    }

    public HideOptions withKdf(KdfParams kdf) {
        if (kdf == null) {
            throw new IllegalArgumentException("kdf must not be null");
        }
        return new HideOptions(redundancy, kdf);
    }

    public Redundancy redundancy() {
        return redundancy;
    }

    public KdfParams kdf() {
        return kdf;
    }

    @Override
    public String toString() {
        return "HideOptions{redundancy=" + redundancy + ", kdf=" + kdf + "}";
    }
}
