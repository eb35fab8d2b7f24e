package com.fixcraft.veilforge;

import java.util.Locale;

/**
 * Runtime tunables, resolved from system properties first, then the environment, then defaults.
 */
public final class StegoConfig {
    private StegoConfig() {}

    public static final int DEFAULT_KDF_ITERATIONS = 200000;
    public static final int DEFAULT_MAX_AUTO_REDUNDANCY = 15;
    public static final long DEFAULT_DOCUMENT_LIMIT = 64L * 1024 * 1024;

    public static int kdfIterations() {
        Integer explicit = intSetting("veilforge.kdf.iterations", "VEILFORGE_KDF_ITERS");
        if (explicit != null && explicit >= Constants.PBKDF2_MIN_ITERS) {
            return explicit;
        }
        Integer test = envInt("VEILFORGE_TEST_KDF_ITERS");
        if (test != null && test >= Constants.PBKDF2_MIN_ITERS) {
            return test;
        }
        return DEFAULT_KDF_ITERATIONS;
    }

    public static int mediaWorkers() {
        Integer parsed = intSetting("veilforge.workers", "VEILFORGE_MEDIA_WORKERS");
        if (parsed != null && parsed > 0) {
            return parsed;
        }
        int workers = Runtime.getRuntime().availableProcessors();
        return workers > 0 ? workers : 1;
    }

    public static String ffmpegBinary() {
        return stringSetting("veilforge.ffmpeg", "VEILFORGE_FFMPEG", "ffmpeg");
    }

    public static String ffprobeBinary() {
        return stringSetting("veilforge.ffprobe", "VEILFORGE_FFPROBE", "ffprobe");
    }

    public static String videoCodec() {
        return stringSetting("veilforge.video.codec", "VEILFORGE_VIDEO_CODEC", "ffv1").toLowerCase(Locale.US);
    }

    public static int maxAutoRedundancy() {
        Integer parsed = intSetting("veilforge.redundancy.max", "VEILFORGE_MAX_REDUNDANCY");
        if (parsed != null && parsed >= 1 && parsed <= Constants.MAX_REDUNDANCY) {
            return parsed;
        }
        return DEFAULT_MAX_AUTO_REDUNDANCY;
    }

    public static long documentLimit() {
        String raw = lookup("veilforge.document.limit", "VEILFORGE_DOCUMENT_LIMIT");
        if (raw != null) {
            try {
                long parsed = Long.parseLong(raw);
                if (parsed > 0) {
                    return Math.min(parsed, (long) Constants.MAX_CONTAINER_LEN);
                }
            } catch (NumberFormatException exc) {
                StegoLog.warn("Ignoring malformed document limit: " + raw);
            }
        }
        return DEFAULT_DOCUMENT_LIMIT;
    }

    static boolean truthy(String raw) {
        if (raw == null) {
            return false;
        }
        String value = raw.trim().toLowerCase(Locale.US);
        return "1".equals(value) || "true".equals(value) || "yes".equals(value) || "on".equals(value);
    }

    private static String stringSetting(String property, String env, String fallback) {
        String raw = lookup(property, env);
        return raw == null ? fallback : raw;
    }

    private static Integer intSetting(String property, String env) {
        String raw = lookup(property, env);
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException exc) {
            return null;
        }
    }

    private static String lookup(String property, String env) {
        String raw = System.getProperty(property);
        if (raw == null || raw.trim().isEmpty()) {
            raw = System.getenv(env);
        }
        if (raw == null) {
            return null;
        }
        raw = raw.trim();
        return raw.isEmpty() ? null : raw;
    }

    private static Integer envInt(String name) {
        String raw = System.getenv(name);
        if (raw == null) {
            return null;
        }
        raw = raw.trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException exc) {
            return null;
        }
    }
}
