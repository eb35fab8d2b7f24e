package com.fixcraft.veilforge;

public enum ExtractionState {
    START,
    LOCATE_CONTAINER,
    PARSE_METADATA,
    DECRYPT,
    VERIFY_CHECKSUM,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
