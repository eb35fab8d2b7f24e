package com.fixcraft.veilforge;

/**
 * Container framing: {@code magic || u32le(metaLen) || metadata || u32le(payloadLen) || payload}.
 */
public final class ContainerCodec {
    private ContainerCodec() {}

    public static int framedLength(int metadataLength, long payloadLength) {
        long total = (long) Constants.CONTAINER_MAGIC.length + 4L + metadataLength + 4L + payloadLength;
        if (total > Constants.MAX_CONTAINER_LEN) {
            throw new StegoException(StegoErrorKind.PAYLOAD_TOO_LARGE, "Container exceeds " + Constants.MAX_CONTAINER_LEN + " bytes");
        }
        return (int) total;
    }

    public static byte[] frame(Metadata metadata, byte[] payload) {
        byte[] meta = metadata.encode();
        if (meta.length > Constants.MAX_METADATA_LEN) {
            throw new IllegalArgumentException("metadata too large: " + meta.length);
        }
        byte[] out = new byte[framedLength(meta.length, payload.length)];
        int offset = 0;
        System.arraycopy(Constants.CONTAINER_MAGIC, 0, out, offset, Constants.CONTAINER_MAGIC.length);
        offset += Constants.CONTAINER_MAGIC.length;
        Format.writeU32(out, offset, meta.length);
        offset += 4;
        System.arraycopy(meta, 0, out, offset, meta.length);
        offset += meta.length;
        Format.writeU32(out, offset, payload.length);
        offset += 4;
        System.arraycopy(payload, 0, out, offset, payload.length);
        return out;
    }

    /**
     * Scans for the magic marker and reads both length-prefixed blocks. The metadata block is
     * returned as-is; JSON decoding happens in the orchestrator's parse step.
     */
    public static RawContainer parse(byte[] data) {
        int start = Format.indexOf(data, Constants.CONTAINER_MAGIC, 0);
        if (start < 0) {
            throw new StegoException(StegoErrorKind.NO_CONTAINER_FOUND, "No container marker found");
        }
        int offset = start + Constants.CONTAINER_MAGIC.length;
        byte[] metadata = readBlock(data, offset, Constants.MAX_METADATA_LEN, "metadata");
        offset += 4 + metadata.length;
        byte[] payload = readBlock(data, offset, Constants.MAX_CONTAINER_LEN, "payload");
        return new RawContainer(metadata, payload);
    }

    private static byte[] readBlock(byte[] data, int offset, int max, String label) {
        if (offset > data.length - 4) {
            throw new StegoException(StegoErrorKind.TRUNCATED_CONTAINER, "Container truncated before " + label + " length");
        }
        long len = Format.readU32(data, offset);
        if (len > max) {
            throw new StegoException(StegoErrorKind.TRUNCATED_CONTAINER, "Declared " + label + " length too large: " + len);
        }
        int body = offset + 4;
        if (len > data.length - body) {
            throw new StegoException(StegoErrorKind.TRUNCATED_CONTAINER,
                "Declared " + label + " length " + len + " exceeds available " + (data.length - body) + " bytes");
        }
        byte[] out = new byte[(int) len];
        System.arraycopy(data, body, out, 0, out.length);
        return out;
    }

    public static final class RawContainer {
        private final byte[] metadata;
        private final byte[] payload;

        RawContainer(byte[] metadata, byte[] payload) {
            this.metadata = metadata;
            this.payload = payload;
        }

        public byte[] metadata() {
            return metadata;
        }

        public byte[] payload() {
            return payload;
        }
    }
}
