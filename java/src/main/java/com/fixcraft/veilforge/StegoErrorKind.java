package com.fixcraft.veilforge;

public enum StegoErrorKind {
    PAYLOAD_TOO_LARGE,
    UNSUPPORTED_CARRIER_FORMAT,
    NO_HIDDEN_DATA,
    MALFORMED_METADATA,
    WRONG_PASSWORD_OR_CORRUPTION,
    CARRIER_TOO_SMALL,
    /** Container-level: magic marker absent. Surfaced to callers as {@link #NO_HIDDEN_DATA}. */
    NO_CONTAINER_FOUND,
    /** Container-level: a declared block length runs past the data. Surfaced as {@link #NO_HIDDEN_DATA}. */
    TRUNCATED_CONTAINER
}
