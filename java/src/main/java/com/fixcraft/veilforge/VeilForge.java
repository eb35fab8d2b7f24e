package com.fixcraft.veilforge;

import java.nio.charset.StandardCharsets;

/**
 * Entry points: hide a payload in a carrier, extract it again, and query capacity.
 *
 * <p>A {@code null} password produces an unencrypted container. An empty password is accepted and
 * encrypts with a very weak key; rejecting it is up to the caller.
 */
public final class VeilForge {
    private VeilForge() {}

    private static final String CHECKSUM_PLACEHOLDER = "0000000000000000000000000000000000000000000000000000000000000000";

    public static byte[] hide(byte[] carrierBytes, CarrierType type, byte[] payload, String originalFilename,
                              String password) {
        return hide(carrierBytes, type, payload, originalFilename, password, HideOptions.defaults());
    }

    public static byte[] hide(byte[] carrierBytes, CarrierType type, byte[] payload, String originalFilename,
                              String password, HideOptions options) {
        requireNonNull(payload, "payload");
        try (SlotCarrier carrier = open(carrierBytes, type)) {
            return hide(carrier, type, payload, ContentType.FILE, originalFilename, password, options);
        }
    }

    public static byte[] hideText(byte[] carrierBytes, CarrierType type, String text, String password) {
        return hideText(carrierBytes, type, text, password, HideOptions.defaults());
    }

    public static byte[] hideText(byte[] carrierBytes, CarrierType type, String text, String password,
                                  HideOptions options) {
        requireNonNull(text, "text");
        try (SlotCarrier carrier = open(carrierBytes, type)) {
            return hide(carrier, type, text.getBytes(StandardCharsets.UTF_8), ContentType.TEXT, null, password,
                options);
        }
    }

    public static ExtractedPayload extract(byte[] carrierBytes, CarrierType type, String password) {
        try (SlotCarrier carrier = open(carrierBytes, type)) {
            return extract(carrier, password);
        }
    }

    /** Container bits the carrier can hold at the carrier type's minimum redundancy. */
    public static long capacity(byte[] carrierBytes, CarrierType type) {
        try (SlotCarrier carrier = open(carrierBytes, type)) {
            return CapacityPlanner.capacityBits(carrier, type.redundancyFloor());
        }
    }

    public static long capacity(byte[] carrierBytes, CarrierType type, int factor) {
        try (SlotCarrier carrier = open(carrierBytes, type)) {
            return CapacityPlanner.capacityBits(carrier, factor);
        }
    }

    /**
     * Exact byte length of the container a hide call would build, for planning payload sizes
     * against {@link #capacity}. {@code originalFilename == null} sizes a text payload.
     */
    public static int containerSize(int payloadLength, String originalFilename, boolean encrypted, KdfParams kdf,
                                    int factor) {
        if (payloadLength < 0) {
            throw new IllegalArgumentException("payloadLength < 0");
        }
        ContentType contentType = originalFilename == null ? ContentType.TEXT : ContentType.FILE;
        Metadata metadata = buildMetadata(contentType, originalFilename, CHECKSUM_PLACEHOLDER, encrypted, kdf);
        metadata.putInt(Constants.META_REDUNDANCY, factor);
        int bodyLength = encrypted ? CipherLayer.sealedLength(payloadLength) : payloadLength;
        return ContainerCodec.framedLength(metadata.encode().length, bodyLength);
    }

    static byte[] hide(SlotCarrier carrier, CarrierType type, byte[] payload, ContentType contentType,
                       String originalFilename, String password, HideOptions options) {
        requireNonNull(options, "options");
        boolean encrypted = password != null;
        Metadata metadata = buildMetadata(contentType, originalFilename, Crypto.sha256Hex(payload), encrypted,
            options.kdf());
        int bodyLength = encrypted ? CipherLayer.sealedLength(payload.length) : payload.length;

        // sized before sealing so an oversized payload never pays for key derivation
        int factor = CapacityPlanner.chooseFactor(carrier, type, options.redundancy(), f -> {
            metadata.putInt(Constants.META_REDUNDANCY, f);
            return ContainerCodec.framedLength(metadata.encode().length, bodyLength);
        });
        metadata.putInt(Constants.META_REDUNDANCY, factor);

        byte[] body = encrypted ? CipherLayer.seal(payload, password, options.kdf()) : payload;
        byte[] container = ContainerCodec.frame(metadata, body);
        CapacityPlanner.validate(container.length, carrier, factor);
        SlotLayout layout = SlotLayout.of(carrier);
        StegoLog.debug("hide", type.tag() + ": container " + container.length + " bytes, redundancy " + factor
            + ", spread over " + layout.width() + (encrypted ? ", encrypted" : ", plain"));

        BitstreamHeader header = new BitstreamHeader(factor, container.length);
        BitStream bits = RedundancyCoder.expand(BitStream.fromBytes(container), factor);
        return carrier.write(layout.place(header.encode(), bits, factor));
    }

    static ExtractedPayload extract(SlotCarrier carrier, String password) {
        return new ExtractionOrchestrator(carrier, password).run();
    }

    private static Metadata buildMetadata(ContentType contentType, String originalFilename, String checksum,
                                          boolean encrypted, KdfParams kdf) {
        Metadata metadata = new Metadata()
            .put(Constants.META_VERSION, Constants.CONTAINER_VERSION)
            .putBoolean(Constants.META_ENCRYPTED, encrypted)
            .put(Constants.META_CONTENT_TYPE, contentType.wireName())
            .put(Constants.META_FILENAME, contentType == ContentType.TEXT
                ? Constants.TEXT_FILENAME_SENTINEL
                : (originalFilename == null ? "" : originalFilename))
            .put(Constants.META_CHECKSUM, checksum)
            .putInt(Constants.META_REDUNDANCY, 1);
        if (encrypted) {
            requireNonNull(kdf, "kdf");
            metadata.put(Constants.META_CIPHER, Constants.CIPHER_NAME);
            kdf.writeTo(metadata);
        }
        return metadata;
    }

    private static SlotCarrier open(byte[] carrierBytes, CarrierType type) {
        if (type == null) {
            throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, "Carrier type is required");
        }
        requireNonNull(carrierBytes, "carrier");
        return type.codec().open(carrierBytes);
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
    }
}
