package com.fixcraft.veilforge;

/**
 * Video through ffmpeg: frames are decoded to an on-disk rgb24 file, embedded batch by batch, and
 * re-encoded with the configured lossless codec (ffv1 in Matroska by default). Audio streams are
 * copied through unchanged.
 */
final class VideoCodec implements CarrierCodec {
    static final VideoCodec INSTANCE = new VideoCodec();

    private VideoCodec() {}

    @Override
    public CarrierType type() {
        return CarrierType.VIDEO;
    }

    @Override
    public SlotCarrier open(byte[] carrierBytes) {
        RawVideoFile frames = Ffmpeg.decodeToFile(carrierBytes);
        StegoLog.debug("video", frames.width() + "x" + frames.height() + ", " + frames.frameCount() + " frames at "
            + frames.frameRate());
        return frames;
    }
}
