package com.fixcraft.veilforge;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ExecutorService;

/**
 * Decoded video kept on disk as a rawvideo rgb24 file in a private scratch directory. Reads touch
 * only the frame rows they need; writes stream the frames in batches, embed each batch in
 * parallel, and hand the result to ffmpeg. Heap use stays at one batch of frames regardless of the
 * clip length.
 */
final class RawVideoFile extends FrameCarrier {
    private final Path dir;
    private final Path raw;
    private final int frameCount;
    private final byte[] source;

    RawVideoFile(Path dir, Path raw, int width, int height, String frameRate, int frameCount, byte[] source) {
        super(width, height, frameRate);
        if (frameCount <= 0) {
            throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, "Video has no complete frames");
        }
        this.dir = dir;
        this.raw = raw;
        this.frameCount = frameCount;
        this.source = source;
    }

    Path scratchDir() {
        return dir;
    }

    @Override
    public int frameCount() {
        return frameCount;
    }

    @Override
    public byte[] frame(int index) {
        if (index < 0 || index >= frameCount) {
            throw new IndexOutOfBoundsException("frame " + index + " of " + frameCount);
        }
        return frameSlices(0, frameSize(), index, index + 1)[0];
    }

    @Override
    byte[][] frameSlices(int from, int length) {
        return frameSlices(from, length, 0, frameCount);
    }

    private byte[][] frameSlices(int from, int length, int firstFrame, int endFrame) {
        byte[][] out = new byte[endFrame - firstFrame][];
        try (FileChannel channel = FileChannel.open(raw, StandardOpenOption.READ)) {
            for (int f = firstFrame; f < endFrame; f++) {
                ByteBuffer buf = ByteBuffer.allocate(length);
                long position = (long) f * frameSize() + from;
                while (buf.hasRemaining()) {
                    if (channel.read(buf, position + buf.position()) < 0) {
                        throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT,
                            "Decoded video ends inside frame " + f);
                    }
                }
                out[f - firstFrame] = buf.array();
            }
        } catch (IOException exc) {
            throw new UncheckedIOException("Failed to read decoded frames", exc);
        }
        return out;
    }

    @Override
    public byte[] write(BitStream bits) {
        CarrierCodec.checkWritable(this, bits);
        int frameSize = frameSize();
        int batch = Math.max(1, Math.min(StegoConfig.mediaWorkers(), frameCount));
        Path embedded;
        try {
            embedded = Files.createTempFile(dir, "embedded-", ".rgb");
        } catch (IOException exc) {
            throw new UncheckedIOException("Failed to stage embedded frames", exc);
        }
        ExecutorService pool = Parallel.newPool(batch);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(raw), frameSize);
             OutputStream out = new BufferedOutputStream(Files.newOutputStream(embedded), frameSize)) {
            int frameIndex = 0;
            while (frameIndex < frameCount) {
                int n = Math.min(batch, frameCount - frameIndex);
                byte[][] frames = new byte[n][];
                for (int i = 0; i < n; i++) {
                    frames[i] = new byte[frameSize];
                    if (readFully(in, frames[i], frameSize) < frameSize) {
                        throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT,
                            "Decoded video ends inside frame " + (frameIndex + i));
                    }
                }
                int batchStart = frameIndex;
                Parallel.forEachIndex(pool, n, idx -> embedFrame(frames[idx], batchStart + idx, frameCount, bits));
                for (byte[] frame : frames) {
                    out.write(frame);
                }
                frameIndex += n;
            }
        } catch (IOException exc) {
            throw new UncheckedIOException("Failed to stream video frames", exc);
        } finally {
            Parallel.shutdownPool(pool);
        }
        try {
            return Ffmpeg.encodeRaw(embedded, width(), height(), frameRate(), source);
        } finally {
            Ffmpeg.deleteQuietly(embedded);
        }
    }

    @Override
    public void close() {
        Ffmpeg.deleteTree(dir);
    }

    private static int readFully(InputStream in, byte[] buffer, int len) throws IOException {
        int offset = 0;
        while (offset < len) {
            int read = in.read(buffer, offset, len - offset);
            if (read == -1) {
                break;
            }
            offset += read;
        }
        return offset;
    }
}
