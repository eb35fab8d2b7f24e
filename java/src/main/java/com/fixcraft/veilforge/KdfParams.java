package com.fixcraft.veilforge;

import java.util.Locale;
import java.util.Objects;

/**
 * Password-hashing parameters recorded in container metadata, so extraction derives the same key.
 */
public final class KdfParams {
    private final String algorithm;
    private final int iterations;
    private final int memoryKib;
    private final int parallelism;

    private KdfParams(String algorithm, int iterations, int memoryKib, int parallelism) {
        this.algorithm = algorithm;
        this.iterations = iterations;
        this.memoryKib = memoryKib;
        this.parallelism = parallelism;
    }

    public static KdfParams pbkdf2(int iterations) {
        if (iterations < Constants.PBKDF2_MIN_ITERS || iterations > Constants.PBKDF2_MAX_ITERS) {
            throw new IllegalArgumentException("PBKDF2 iterations out of range: " + iterations);
        }
        return new KdfParams(Constants.KDF_PBKDF2, iterations, 0, 0);
    }

    public static KdfParams argon2id(int iterations, int memoryKib, int parallelism) {
        if (iterations < 1 || iterations > Constants.ARGON2_MAX_ITERS) {
            throw new IllegalArgumentException("Argon2 iterations out of range: " + iterations);
        }
        if (memoryKib < 8 * parallelism || memoryKib > Constants.ARGON2_MAX_MEMORY_KIB) {
            throw new IllegalArgumentException("Argon2 memory out of range: " + memoryKib);
        }
        if (parallelism < 1 || parallelism > Constants.ARGON2_MAX_PARALLELISM) {
            throw new IllegalArgumentException("Argon2 parallelism out of range: " + parallelism);
        }
        return new KdfParams(Constants.KDF_ARGON2ID, iterations, memoryKib, parallelism);
    }

    public static KdfParams defaults() {
        return pbkdf2(StegoConfig.kdfIterations());
    }

    public static KdfParams argon2idDefaults() {
        return argon2id(Constants.ARGON2_DEFAULT_ITERS, Constants.ARGON2_DEFAULT_MEMORY_KIB,
            Constants.ARGON2_DEFAULT_PARALLELISM);
    }

    /** Parses a CLI label such as {@code pbkdf2}, {@code pbkdf2:50000} or {@code argon2id}. */
    public static KdfParams parse(String label) {
        if (label == null || label.trim().isEmpty()) {
            return defaults();
        }
        String normalized = label.trim().toLowerCase(Locale.US);
        String name = normalized;
        String arg = null;
        int colon = normalized.indexOf(':');
        if (colon >= 0) {
            name = normalized.substring(0, colon);
            arg = normalized.substring(colon + 1);
        }
        try {
            if (name.equals("pbkdf2") || name.equals(Constants.KDF_PBKDF2)) {
                return arg == null ? defaults() : pbkdf2(Integer.parseInt(arg));
            }
            if (name.equals(Constants.KDF_ARGON2ID) || name.equals("argon2")) {
                return arg == null ? argon2idDefaults()
                    : argon2id(Integer.parseInt(arg), Constants.ARGON2_DEFAULT_MEMORY_KIB,
                        Constants.ARGON2_DEFAULT_PARALLELISM);
            }
        } catch (NumberFormatException exc) {
            throw new IllegalArgumentException("Invalid KDF parameter: " + label, exc);
        }
        throw new IllegalArgumentException("Unsupported KDF: " + label);
    }

    public String algorithm() {
        return algorithm;
    }

    public int iterations() {
        return iterations;
    }

    public int memoryKib() {
        return memoryKib;
    }

    public int parallelism() {
        return parallelism;
    }

    public boolean isArgon2() {
        return Constants.KDF_ARGON2ID.equals(algorithm);
    }

    void writeTo(Metadata metadata) {
        metadata.put(Constants.META_KDF, algorithm);
        metadata.putInt(Constants.META_KDF_ITERS, iterations);
        if (isArgon2()) {
            metadata.putInt(Constants.META_KDF_MEMORY, memoryKib);
            metadata.putInt(Constants.META_KDF_PARALLELISM, parallelism);
        }
    }

    /**
     * Reads parameters back from metadata. Values outside the bounds {@link #pbkdf2} and
     * {@link #argon2id} accept are {@link StegoErrorKind#MALFORMED_METADATA}, so a crafted carrier
     * cannot demand unbounded key-derivation work.
     */
    static KdfParams readFrom(Metadata metadata) {
        String algorithm = metadata.require(Constants.META_KDF);
        int iterations = metadata.requireInt(Constants.META_KDF_ITERS);
        try {
            if (Constants.KDF_PBKDF2.equals(algorithm)) {
                return pbkdf2(iterations);
            }
            if (Constants.KDF_ARGON2ID.equals(algorithm)) {
                return argon2id(iterations, metadata.requireInt(Constants.META_KDF_MEMORY),
                    metadata.requireInt(Constants.META_KDF_PARALLELISM));
            }
        } catch (IllegalArgumentException exc) {
            throw new StegoException(StegoErrorKind.MALFORMED_METADATA, exc.getMessage(), exc);
        }
        throw new StegoException(StegoErrorKind.MALFORMED_METADATA, "Unsupported KDF: " + algorithm);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KdfParams)) {
            return false;
        }
        KdfParams other = (KdfParams) o;
        return iterations == other.iterations
            && memoryKib == other.memoryKib
            && parallelism == other.parallelism
            && algorithm.equals(other.algorithm);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, iterations, memoryKib, parallelism);
    }

    @Override
    public String toString() {
        if (isArgon2()) {
            return algorithm + "(t=" + iterations + ", m=" + memoryKib + "KiB, p=" + parallelism + ")";
        }
        return algorithm + "(" + iterations + ")";
    }
}
