package com.fixcraft.veilforge;

public class StegoException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private static final String UNIFIED_AUTH_MESSAGE = "Wrong password or corrupted carrier";

    private final StegoErrorKind kind;

    public StegoException(StegoErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StegoException(StegoErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public StegoErrorKind kind() {
        return kind;
    }

    /**
     * Authentication failures and checksum mismatches share one message and drop the cause,
     * so the failure reveals nothing about which check rejected the input.
     */
    public static StegoException wrongPasswordOrCorruption() {
        return new StegoException(StegoErrorKind.WRONG_PASSWORD_OR_CORRUPTION, UNIFIED_AUTH_MESSAGE);
    }

    @Override
    public String toString() {
        return "StegoException[" + kind + "]: " + getMessage();
    }
}
