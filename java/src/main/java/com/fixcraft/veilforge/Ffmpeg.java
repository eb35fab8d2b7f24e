package com.fixcraft.veilforge;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Thin wrapper around the external ffmpeg/ffprobe tools. Every failure surfaces as
 * {@link StegoErrorKind#UNSUPPORTED_CARRIER_FORMAT}.
 */
final class Ffmpeg {
    private Ffmpeg() {}

    private static final int OUTPUT_CAP = 64 * 1024;

    static final class VideoInfo {
        final int width;
        final int height;
        final String frameRate;
        final boolean hasAudio;

        VideoInfo(int width, int height, String frameRate, boolean hasAudio) {
            this.width = width;
            this.height = height;
            this.frameRate = frameRate;
            this.hasAudio = hasAudio;
        }
    }

    static boolean available() {
        return toolAvailable(StegoConfig.ffmpegBinary()) && toolAvailable(StegoConfig.ffprobeBinary());
    }

    static void ensureAvailable(String purpose) {
        if (!available()) {
            throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT,
                "ffmpeg/ffprobe are required for " + purpose);
        }
    }

    private static boolean toolAvailable(String name) {
        try {
            Process process = new ProcessBuilder(name, "-version")
                .redirectErrorStream(true)
                .start();
            drain(process.getInputStream());
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException exc) {
            return false;
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static List<String> baseCommand() {
        List<String> cmd = new ArrayList<>();
        cmd.add(StegoConfig.ffmpegBinary());
        cmd.add("-y");
        cmd.add("-v");
        cmd.add("error");
        int threads = StegoConfig.mediaWorkers();
        if (threads > 0) {
            cmd.add("-threads");
            cmd.add(Integer.toString(threads));
        }
        return cmd;
    }

    static String run(List<String> cmd) {
        StegoLog.debug("ffmpeg", "exec " + String.join(" ", cmd));
        ProcessBuilder builder = new ProcessBuilder(cmd);
        builder.redirectErrorStream(true);
        try {
            Process process = builder.start();
            String output = drain(process.getInputStream());
            int code = process.waitFor();
            if (code != 0) {
                throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT,
                    cmd.get(0) + " failed: " + (output.isEmpty() ? "exit " + code : output));
            }
            return output;
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
            throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, cmd.get(0) + " interrupted", exc);
        } catch (IOException exc) {
            throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, cmd.get(0) + " failed to start", exc);
        }
    }

    private static String drain(InputStream stream) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (InputStream in = stream) {
            byte[] buf = new byte[4096];
            int read;
            int remaining = OUTPUT_CAP;
            while ((read = in.read(buf)) != -1) {
                if (remaining <= 0) {
                    continue;
                }
                int take = Math.min(read, remaining);
                out.write(buf, 0, take);
                remaining -= take;
            }
        }
        return out.toString(StandardCharsets.UTF_8.name()).trim();
    }

    static VideoInfo probeVideo(Path input) {
        Map<String, String> video = probeStream(input, "v:0", "width,height,avg_frame_rate,r_frame_rate");
        int width = (int) parseLong(video.get("width"));
        int height = (int) parseLong(video.get("height"));
        if (width <= 0 || height <= 0) {
            throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, "No decodable video stream");
        }
        String rate = video.get("avg_frame_rate");
        if (parseRate(rate) <= 0) {
            rate = video.get("r_frame_rate");
        }
        if (parseRate(rate) <= 0) {
            rate = "25";
        }
        boolean hasAudio = !probeStream(input, "a:0", "codec_name").isEmpty();
        return new VideoInfo(width, height, rate, hasAudio);
    }

    private static Map<String, String> probeStream(Path input, String selector, String entries) {
        List<String> cmd = Arrays.asList(
            StegoConfig.ffprobeBinary(), "-v", "error", "-select_streams", selector,
            "-show_entries", "stream=" + entries, "-of", "default=nw=1", input.toString());
        String output;
        try {
            output = run(cmd);
        } catch (StegoException exc) {
            StegoLog.debug("ffmpeg", "ffprobe " + selector + ": " + exc.getMessage());
            return Collections.emptyMap();
        }
        return parseKeyValues(output);
    }

    /** Transcodes any ffmpeg-readable audio to 16-bit PCM WAV. */
    static byte[] transcodeToPcmWav(byte[] input) {
        ensureAvailable("audio transcoding");
        Path dir = createTempDir();
        try {
            Path in = dir.resolve("input.bin");
            Path out = dir.resolve("output.wav");
            Files.write(in, input);
            List<String> cmd = baseCommand();
            cmd.addAll(Arrays.asList("-i", in.toString(), "-vn", "-c:a", "pcm_s16le", "-f", "wav", out.toString()));
            run(cmd);
            return Files.readAllBytes(out);
        } catch (IOException exc) {
            throw new UncheckedIOException("Failed to stage audio transcode", exc);
        } finally {
            deleteTree(dir);
        }
    }

    /**
     * Decodes every video frame to a rawvideo rgb24 file in a fresh scratch directory. The returned
     * carrier owns that directory and deletes it on {@link RawVideoFile#close()}.
     */
    static RawVideoFile decodeToFile(byte[] input) {
        ensureAvailable("video carriers");
        Path dir = createTempDir();
        try {
            Path in = dir.resolve("input.bin");
            Path raw = dir.resolve("frames.rgb");
            Files.write(in, input);
            VideoInfo info = probeVideo(in);
            long frameSize = (long) info.width * info.height * 3;
            if (frameSize > Integer.MAX_VALUE) {
                throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT,
                    "Frame size " + info.width + "x" + info.height + " is too large");
            }
            List<String> cmd = baseCommand();
            cmd.addAll(Arrays.asList("-i", in.toString(), "-map", "0:v:0", "-f", "rawvideo",
                "-pix_fmt", "rgb24", raw.toString()));
            run(cmd);
            Files.delete(in);
            long frames = Files.size(raw) / frameSize;
            if (frames <= 0 || frames > Integer.MAX_VALUE) {
                throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT,
                    "Video has an unsupported frame count: " + frames);
            }
            return new RawVideoFile(dir, raw, info.width, info.height, info.frameRate, (int) frames, input);
        } catch (IOException exc) {
            deleteTree(dir);
            throw new UncheckedIOException("Failed to stage video decode", exc);
        } catch (RuntimeException exc) {
            deleteTree(dir);
            throw exc;
        }
    }

    /**
     * Encodes a rawvideo rgb24 file with a lossless codec, carrying over the audio streams of
     * {@code source} unchanged.
     */
    static byte[] encodeRaw(Path raw, int width, int height, String frameRate, byte[] source) {
        ensureAvailable("video carriers");
        Path dir = createTempDir();
        try {
            Path src = dir.resolve("source.bin");
            String codec = StegoConfig.videoCodec();
            Path out = dir.resolve("output" + containerExtension(codec));
            Files.write(src, source);
            boolean hasAudio = source.length > 0 && !probeStream(src, "a:0", "codec_name").isEmpty();
            List<String> cmd = baseCommand();
            cmd.addAll(Arrays.asList("-f", "rawvideo", "-pix_fmt", "rgb24",
                "-s", width + "x" + height, "-r", frameRate, "-i", raw.toString()));
            if (hasAudio) {
                cmd.addAll(Arrays.asList("-i", src.toString(), "-map", "0:v:0", "-map", "1:a", "-c:a", "copy"));
            }
            cmd.addAll(codecArgs(codec));
            cmd.add(out.toString());
            run(cmd);
            return Files.readAllBytes(out);
        } catch (IOException exc) {
            throw new UncheckedIOException("Failed to stage video encode", exc);
        } finally {
            deleteTree(dir);
        }
    }

    static String containerExtension(String codec) {
        if ("libx264rgb".equals(codec)) {
            return ".mp4";
        }
        return ".mkv";
    }

    private static List<String> codecArgs(String codec) {
        if ("ffv1".equals(codec)) {
            return Arrays.asList("-c:v", "ffv1", "-level", "3", "-pix_fmt", "gbrp");
        }
        if ("libx264rgb".equals(codec)) {
            return Arrays.asList("-c:v", "libx264rgb", "-qp", "0", "-preset", "veryfast", "-pix_fmt", "rgb24");
        }
        if ("png".equals(codec)) {
            return Arrays.asList("-c:v", "png", "-pix_fmt", "rgb24");
        }
        StegoLog.warn("Video codec " + codec + " may not be lossless; embedded data relies on redundancy");
        return Arrays.asList("-c:v", codec);
    }

    static double parseRate(String rate) {
        if (rate == null || rate.isEmpty() || "0/0".equals(rate)) {
            return 0.0;
        }
        try {
            if (rate.contains("/")) {
                String[] parts = rate.split("/", 2);
                double den = Double.parseDouble(parts[1]);
                return den == 0.0 ? 0.0 : Double.parseDouble(parts[0]) / den;
            }
            return Double.parseDouble(rate);
        } catch (NumberFormatException exc) {
            return 0.0;
        }
    }

    private static long parseLong(String raw) {
        if (raw == null || raw.isEmpty()) {
            return 0L;
        }
        try {
            return (long) Double.parseDouble(raw);
        } catch (NumberFormatException exc) {
            return 0L;
        }
    }

    static Map<String, String> parseKeyValues(String output) {
        Map<String, String> map = new HashMap<>();
        for (String line : output.split("\\r?\\n")) {
            String trimmed = line.trim();
            int idx = trimmed.indexOf('=');
            if (idx <= 0) {
                continue;
            }
            map.put(trimmed.substring(0, idx).trim(), trimmed.substring(idx + 1).trim());
        }
        return map;
    }

    private static Path createTempDir() {
        try {
            return Files.createTempDirectory("veilforge-");
        } catch (IOException exc) {
            throw new UncheckedIOException("Failed to create temp directory", exc);
        }
    }

    static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException exc) {
            StegoLog.debug("ffmpeg", "Could not delete " + path + ": " + exc.getMessage());
        }
    }

    static void deleteTree(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(Ffmpeg::deleteQuietly);
        } catch (IOException exc) {
            StegoLog.debug("ffmpeg", "Could not clean " + dir + ": " + exc.getMessage());
        }
    }
}
