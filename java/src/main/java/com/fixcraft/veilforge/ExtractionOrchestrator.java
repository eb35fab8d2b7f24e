package com.fixcraft.veilforge;

/**
 * One extraction attempt as a linear state machine:
 * {@code START -> LOCATE_CONTAINER -> PARSE_METADATA -> DECRYPT -> VERIFY_CHECKSUM -> DONE}, with
 * any step able to end in {@code FAILED}. An instance runs once and never retries.
 *
 * <p>Container-level misses (no magic, truncated blocks, implausible header) are reported as
 * {@link StegoErrorKind#NO_HIDDEN_DATA}; decryption and checksum failures share
 * {@link StegoErrorKind#WRONG_PASSWORD_OR_CORRUPTION}.
 */
public final class ExtractionOrchestrator {
    private final SlotCarrier carrier;
    private final String password;
    private ExtractionState state = ExtractionState.START;
    private StegoErrorKind failure;

    public ExtractionOrchestrator(SlotCarrier carrier, String password) {
        if (carrier == null) {
            throw new IllegalArgumentException("carrier must not be null");
        }
        this.carrier = carrier;
        this.password = password;
    }

    public ExtractionState state() {
        return state;
    }

    /** Kind of the failure that ended the run, or {@code null}. */
    public StegoErrorKind failure() {
        return failure;
    }

    public ExtractedPayload run() {
        if (state != ExtractionState.START) {
            throw new IllegalStateException("orchestrator already ran (state " + state + ")");
        }
        try {
            transition(ExtractionState.LOCATE_CONTAINER);
            Located located = locate();

            transition(ExtractionState.PARSE_METADATA);
            Parsed parsed = parseMetadata(located);

            transition(ExtractionState.DECRYPT);
            byte[] plaintext = decrypt(parsed, located.raw.payload());

            transition(ExtractionState.VERIFY_CHECKSUM);
            if (!Crypto.constantTimeEquals(Crypto.sha256Hex(plaintext), parsed.checksum)) {
                throw StegoException.wrongPasswordOrCorruption();
            }

            transition(ExtractionState.DONE);
            return new ExtractedPayload(plaintext, parsed.filename, parsed.contentType);
        } catch (StegoException exc) {
            fail(exc.kind());
            throw exc;
        } catch (RuntimeException exc) {
            fail(null);
            throw exc;
        }
    }

    private Located locate() {
        SlotLayout layout = SlotLayout.of(carrier);
        long readable = carrier.readableSlots();
        long headerSlots = layout.headerSlots();
        if (readable < headerSlots || headerSlots > Integer.MAX_VALUE) {
            throw noHiddenData("carrier holds no bitstream header", null);
        }
        BitstreamHeader header = BitstreamHeader.decode(layout.gatherHeader(carrier.read(0, (int) headerSlots)));
        if (header == null) {
            throw noHiddenData("no bitstream header", null);
        }
        long containerBits = header.containerLength() * 8L;
        long totalSlots = layout.totalSlots(header.factor(), containerBits);
        if (totalSlots > readable || totalSlots - headerSlots > Integer.MAX_VALUE
            || header.bodyBits() > Integer.MAX_VALUE) {
            throw noHiddenData("header declares more bits than the carrier holds", null);
        }
        StegoLog.debug("extract", "header: factor " + header.factor() + ", container "
            + header.containerLength() + " bytes");
        BitStream region = carrier.read(headerSlots, (int) (totalSlots - headerSlots));
        BitStream body = layout.gatherBody(region, header.factor(), containerBits);
        byte[] container = RedundancyCoder.collapse(body, header.factor()).toBytes();
        try {
            return new Located(header, ContainerCodec.parse(container));
        } catch (StegoException exc) {
            if (exc.kind() == StegoErrorKind.NO_CONTAINER_FOUND || exc.kind() == StegoErrorKind.TRUNCATED_CONTAINER) {
                throw noHiddenData(exc.getMessage(), exc);
            }
            throw exc;
        }
    }

    private static Parsed parseMetadata(Located located) {
        Metadata metadata = Metadata.decode(located.raw.metadata());
        String version = metadata.require(Constants.META_VERSION);
        if (!Constants.CONTAINER_VERSION.equals(version)) {
            throw new StegoException(StegoErrorKind.MALFORMED_METADATA, "Unsupported container version: " + version);
        }
        boolean encrypted = metadata.requireBoolean(Constants.META_ENCRYPTED);
        ContentType contentType = ContentType.fromWire(metadata.require(Constants.META_CONTENT_TYPE));
        String filename = metadata.require(Constants.META_FILENAME);
        String checksum = metadata.require(Constants.META_CHECKSUM);
        if (!isSha256Hex(checksum)) {
            throw new StegoException(StegoErrorKind.MALFORMED_METADATA, "Malformed checksum");
        }
        int redundancy = metadata.requireInt(Constants.META_REDUNDANCY);
        if (redundancy != located.header.factor()) {
            throw new StegoException(StegoErrorKind.MALFORMED_METADATA,
                "Recorded redundancy " + redundancy + " does not match stream factor " + located.header.factor());
        }
        KdfParams kdf = null;
        if (encrypted) {
            String cipher = metadata.require(Constants.META_CIPHER);
            if (!Constants.CIPHER_NAME.equals(cipher)) {
                throw new StegoException(StegoErrorKind.MALFORMED_METADATA, "Unsupported cipher: " + cipher);
            }
            kdf = KdfParams.readFrom(metadata);
        }
        return new Parsed(encrypted, contentType, contentType == ContentType.TEXT || filename.isEmpty() ? null : filename, checksum, kdf);
    }

    private byte[] decrypt(Parsed parsed, byte[] payload) {
        if (!parsed.encrypted) {
            return payload;
        }
        if (password == null) {
            throw StegoException.wrongPasswordOrCorruption();
        }
        return CipherLayer.open(payload, password, parsed.kdf);
    }

    private static boolean isSha256Hex(String value) {
        if (value.length() != 64) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }

    private void transition(ExtractionState next) {
        StegoLog.debug("extract", state + " -> " + next);
        state = next;
    }

    private void fail(StegoErrorKind kind) {
        StegoLog.debug("extract", state + " -> FAILED" + (kind == null ? "" : " (" + kind + ")"));
        state = ExtractionState.FAILED;
        failure = kind;
    }

    private static StegoException noHiddenData(String detail, Throwable cause) {
        return new StegoException(StegoErrorKind.NO_HIDDEN_DATA, "No hidden data: " + detail, cause);
    }

    private static final class Located {
        final BitstreamHeader header;
        final ContainerCodec.RawContainer raw;

        Located(BitstreamHeader header, ContainerCodec.RawContainer raw) {
            this.header = header;
            this.raw = raw;
        }
    }

    private static final class Parsed {
        final boolean encrypted;
        final ContentType contentType;
        final String filename;
        final String checksum;
        final KdfParams kdf;

        Parsed(boolean encrypted, ContentType contentType, String filename, String checksum, KdfParams kdf) {
            this.encrypted = encrypted;
            this.contentType = contentType;
            this.filename = filename;
            this.checksum = checksum;
            this.kdf = kdf;
        }
    }
}
