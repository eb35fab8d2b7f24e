package com.fixcraft.veilforge;

import java.nio.charset.StandardCharsets;

/**
 * Result of a successful extraction. {@link #originalFilename()} is {@code null} for text payloads.
 */
public final class ExtractedPayload {
    private final byte[] payload;
    private final String originalFilename;
    private final ContentType contentType;

    ExtractedPayload(byte[] payload, String originalFilename, ContentType contentType) {
        this.payload = payload;
        this.originalFilename = originalFilename;
        this.contentType = contentType;
    }

    public byte[] payload() {
        return payload.clone();
    }

    public String originalFilename() {
        return originalFilename;
    }

    public ContentType contentType() {
        return contentType;
    }

    /** Decodes a text payload as UTF-8. */
    public String text() {
        if (contentType != ContentType.TEXT) {
            throw new IllegalStateException("payload is a file, not text");
        }
        return new String(payload, StandardCharsets.UTF_8);
    }
}
