package com.fixcraft.veilforge;

/**
 * 16-bit PCM WAV. One slot per sample, in stored (channel-interleaved) order, carried in the
 * sample's least significant bit. Other audio is transcoded to PCM WAV through ffmpeg when it is
 * installed.
 */
final class AudioCodec implements CarrierCodec {
    static final AudioCodec INSTANCE = new AudioCodec();

    private AudioCodec() {}

    @Override
    public CarrierType type() {
        return CarrierType.AUDIO;
    }

    @Override
    public SlotCarrier open(byte[] carrierBytes) {
        WavFile wav = WavFile.parse(carrierBytes);
        byte[] source = carrierBytes;
        if (wav == null || wav.bitsPerSample != Constants.AUDIO_SAMPLE_BITS) {
            if (!Ffmpeg.available()) {
                throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT,
                    "Audio carrier must be 16-bit PCM WAV (ffmpeg not available to convert)");
            }
            StegoLog.warn("Audio input is not 16-bit PCM WAV; transcoding, output is WAV");
            source = Ffmpeg.transcodeToPcmWav(carrierBytes);
            wav = WavFile.parse(source);
            if (wav == null || wav.bitsPerSample != Constants.AUDIO_SAMPLE_BITS) {
                throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, "Audio transcode produced no PCM data");
            }
        }
        return new WavCarrier(source, wav);
    }

    static final class WavCarrier implements SlotCarrier {
        private final byte[] data;
        private final WavFile wav;

        WavCarrier(byte[] data, WavFile wav) {
            this.data = data;
            this.wav = wav;
        }

        @Override
        public long writableSlots() {
            return wav.sampleCount();
        }

        @Override
        public long readableSlots() {
            return writableSlots();
        }

        @Override
        public BitStream read(long offset, int count) {
            CarrierCodec.checkReadable(this, offset, count);
            BitStream bits = new BitStream(count);
            int base = wav.dataOffset + (int) offset * 2;
            for (int i = 0; i < count; i++) {
                bits.set(i, (data[base + i * 2] & 1) != 0);
            }
            return bits;
        }

        @Override
        public byte[] write(BitStream bits) {
            CarrierCodec.checkWritable(this, bits);
            byte[] out = data.clone();
            // little-endian: the low byte comes first
            for (int i = 0; i < bits.length(); i++) {
                int idx = wav.dataOffset + i * 2;
                out[idx] = (byte) (bits.get(i) ? (out[idx] | 1) : (out[idx] & ~1));
            }
            return out;
        }
    }
}
