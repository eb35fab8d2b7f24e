package com.fixcraft.veilforge;

public enum ContentType {
    TEXT("text"),
    FILE("file");

    private final String wireName;

    ContentType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    static ContentType fromWire(String value) {
        for (ContentType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new StegoException(StegoErrorKind.MALFORMED_METADATA, "Unknown content_type: " + value);
    }
}
