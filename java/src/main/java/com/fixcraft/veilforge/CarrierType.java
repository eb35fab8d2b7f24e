package com.fixcraft.veilforge;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

public enum CarrierType {
    IMAGE("image", 1, 3),
    AUDIO("audio", 1, 3),
    VIDEO("video", 3, Integer.MAX_VALUE),
    DOCUMENT("document", 1, 1);

    private static final Set<String> IMAGE_EXTS = buildSet(
        ".png", ".bmp", ".gif", ".jpg", ".jpeg", ".tif", ".tiff", ".wbmp"
    );
    private static final Set<String> AUDIO_EXTS = buildSet(
        ".wav", ".wave", ".mp3", ".flac", ".ogg", ".aac", ".m4a", ".opus", ".aiff"
    );
    private static final Set<String> VIDEO_EXTS = buildSet(
        ".mp4", ".avi", ".mov", ".mkv", ".webm", ".m4v", ".mpg", ".mpeg", ".wmv"
    );
    private static final Set<String> DOCUMENT_EXTS = buildSet(
        ".pdf", ".docx", ".doc", ".xlsx", ".pptx", ".odt", ".txt", ".md", ".csv", ".rtf", ".zip"
    );

    private final String tag;
    private final int redundancyFloor;
    private final int autoRedundancyCap;

    CarrierType(String tag, int redundancyFloor, int autoRedundancyCap) {
        this.tag = tag;
        this.redundancyFloor = redundancyFloor;
        this.autoRedundancyCap = autoRedundancyCap;
    }

    public String tag() {
        return tag;
    }

    /** Smallest factor automatic redundancy will choose for this carrier. */
    public int redundancyFloor() {
        return redundancyFloor;
    }

    /** Largest factor automatic redundancy will choose, before the configured global maximum. */
    public int autoRedundancyCap() {
        return Math.min(autoRedundancyCap, StegoConfig.maxAutoRedundancy());
    }

    public boolean lossy() {
        return this == VIDEO;
    }

    public CarrierCodec codec() {
        switch (this) {
            case IMAGE:
                return ImageCodec.INSTANCE;
            case AUDIO:
                return AudioCodec.INSTANCE;
            case VIDEO:
                return VideoCodec.INSTANCE;
            case DOCUMENT:
                return DocumentCodec.INSTANCE;
            default:
                throw new IllegalStateException("No codec for " + this);
        }
    }

    public static CarrierType fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.US);
            for (CarrierType type : values()) {
                if (type.tag.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, "Unknown carrier type: " + tag);
    }

    /**
     * Picks a carrier type from the file name extension, falling back to content sniffing.
     */
    public static CarrierType detect(String fileName, byte[] data) {
        String ext = extensionLower(fileName);
        if (IMAGE_EXTS.contains(ext)) {
            return IMAGE;
        }
        if (AUDIO_EXTS.contains(ext)) {
            return AUDIO;
        }
        if (VIDEO_EXTS.contains(ext)) {
            return VIDEO;
        }
        if (DOCUMENT_EXTS.contains(ext)) {
            return DOCUMENT;
        }
        CarrierType sniffed = sniff(data);
        if (sniffed == null) {
            throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT,
                "Cannot determine carrier type for " + (fileName == null ? "input" : fileName));
        }
        return sniffed;
    }

    static CarrierType sniff(byte[] data) {
        if (data == null || data.length < 4) {
            return null;
        }
        if (hasPrefix(data, 0x89, 'P', 'N', 'G') || hasPrefix(data, 'B', 'M') || hasPrefix(data, 'G', 'I', 'F', '8')
            || hasPrefix(data, 0xFF, 0xD8, 0xFF)) {
            return IMAGE;
        }
        if (hasPrefix(data, 'R', 'I', 'F', 'F') && data.length >= 12) {
            if (data[8] == 'W' && data[9] == 'A' && data[10] == 'V' && data[11] == 'E') {
                return AUDIO;
            }
            if (data[8] == 'A' && data[9] == 'V' && data[10] == 'I') {
                return VIDEO;
            }
        }
        if (hasPrefix(data, 'I', 'D', '3') || hasPrefix(data, 'f', 'L', 'a', 'C') || hasPrefix(data, 'O', 'g', 'g', 'S')) {
            return AUDIO;
        }
        if (data.length >= 8 && data[4] == 'f' && data[5] == 't' && data[6] == 'y' && data[7] == 'p') {
            return VIDEO;
        }
        if (hasPrefix(data, 0x1A, 0x45, 0xDF, 0xA3)) {
            return VIDEO;
        }
        if (hasPrefix(data, '%', 'P', 'D', 'F') || hasPrefix(data, 'P', 'K', 0x03, 0x04)) {
            return DOCUMENT;
        }
        return null;
    }

    private static boolean hasPrefix(byte[] data, int... prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((data[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    static String extensionLower(String fileName) {
        if (fileName == null) {
            return "";
        }
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String name = fileName.substring(slash + 1);
        int idx = name.lastIndexOf('.');
        if (idx < 0) {
            return "";
        }
        return name.substring(idx).toLowerCase(Locale.US);
    }

    private static Set<String> buildSet(String... values) {
        return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(values)));
    }
}
