package com.fixcraft.veilforge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Decoded video held in memory as packed rgb24 frames. Suited to short clips and frame sequences a
 * caller already has; {@link VideoCodec} streams real videos through {@link RawVideoFile} instead.
 *
 * <p>{@link #write(BitStream)} returns the raw concatenated frames.
 */
public final class VideoFrames extends FrameCarrier {
    private final List<byte[]> frames;

    public VideoFrames(int width, int height, String frameRate, List<byte[]> frames) {
        super(width, height, frameRate);
        int frameSize = frameSize();
        for (byte[] frame : frames) {
            if (frame.length != frameSize) {
                throw new IllegalArgumentException("frame length " + frame.length + " != " + frameSize);
            }
        }
        this.frames = Collections.unmodifiableList(new ArrayList<>(frames));
    }

    public static VideoFrames fromRaw(byte[] raw, int width, int height, String frameRate) {
        long frameSize = (long) width * height * 3;
        if (frameSize <= 0 || raw.length < frameSize) {
            throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, "Video has no complete frames");
        }
        int size = (int) frameSize;
        int count = raw.length / size;
        List<byte[]> frames = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            frames.add(Arrays.copyOfRange(raw, i * size, (i + 1) * size));
        }
        return new VideoFrames(width, height, frameRate, frames);
    }

    @Override
    public int frameCount() {
        return frames.size();
    }

    @Override
    public byte[] frame(int index) {
        return frames.get(index).clone();
    }

    @Override
    byte[][] frameSlices(int from, int length) {
        byte[][] out = new byte[frames.size()][];
        for (int f = 0; f < out.length; f++) {
            out[f] = Arrays.copyOfRange(frames.get(f), from, from + length);
        }
        return out;
    }

    /** Embeds {@code bits} and returns the new frames. Frames are processed in parallel. */
    public VideoFrames embed(BitStream bits) {
        CarrierCodec.checkWritable(this, bits);
        int frameCount = frames.size();
        byte[][] out = new byte[frameCount][];
        Parallel.forEachIndex(frameCount, f -> {
            byte[] frame = frames.get(f).clone();
            embedFrame(frame, f, frameCount, bits);
            out[f] = frame;
        });
        return new VideoFrames(width(), height(), frameRate(), Arrays.asList(out));
    }

    /** Embeds {@code bits} and returns the frames as packed rgb24. */
    @Override
    public byte[] write(BitStream bits) {
        return embed(bits).toRaw();
    }

    public byte[] toRaw() {
        int frameSize = frameSize();
        byte[] raw = new byte[frames.size() * frameSize];
        for (int i = 0; i < frames.size(); i++) {
            System.arraycopy(frames.get(i), 0, raw, i * frameSize, frameSize);
        }
        return raw;
    }
}
