package com.fixcraft.veilforge;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class ExtractionOrchestratorTest {

    private static final byte[] PNG = CarrierFixtures.png(64, 64, 1);

    /** Writes arbitrary container bytes into a fresh image at the given factor. */
    private static SlotCarrier embed(byte[] container, int factor) {
        BitStream physical = new BitstreamHeader(factor, container.length).encode()
            .concat(RedundancyCoder.expand(BitStream.fromBytes(container), factor));
        return ImageCodec.INSTANCE.open(ImageCodec.INSTANCE.open(PNG).write(physical));
    }

    private static Metadata plainMetadata(byte[] payload, int redundancy) {
        return new Metadata()
            .put(Constants.META_VERSION, Constants.CONTAINER_VERSION)
            .putBoolean(Constants.META_ENCRYPTED, false)
            .put(Constants.META_CONTENT_TYPE, "file")
            .put(Constants.META_FILENAME, "a.bin")
            .put(Constants.META_CHECKSUM, Crypto.sha256Hex(payload))
            .putInt(Constants.META_REDUNDANCY, redundancy);
    }

    private static ExtractionOrchestrator failing(SlotCarrier carrier, String password, StegoErrorKind kind) {
        ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(carrier, password);
        StegoException exc = assertThrows(StegoException.class, orchestrator::run);
        assertEquals(kind, exc.kind(), exc.getMessage());
        assertEquals(ExtractionState.FAILED, orchestrator.state());
        assertEquals(kind, orchestrator.failure());
        return orchestrator;
    }

    @Test
    void successfulRunEndsInDone() {
        byte[] payload = {4, 5, 6};
        SlotCarrier carrier = embed(ContainerCodec.frame(plainMetadata(payload, 1), payload), 1);
        ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(carrier, null);
        assertEquals(ExtractionState.START, orchestrator.state());

        ExtractedPayload out = orchestrator.run();
        assertArrayEquals(payload, out.payload());
        assertEquals("a.bin", out.originalFilename());
        assertEquals(ExtractionState.DONE, orchestrator.state());
        assertTrue(orchestrator.state().isTerminal());
        assertNull(orchestrator.failure());
    }

    @Test
    void orchestratorRunsOnlyOnce() {
        byte[] payload = {1};
        ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(
            embed(ContainerCodec.frame(plainMetadata(payload, 1), payload), 1), null);
        orchestrator.run();
        assertThrows(IllegalStateException.class, orchestrator::run);
    }

    @Test
    void plainImageIsNoHiddenData() {
        failing(ImageCodec.INSTANCE.open(PNG), "pw", StegoErrorKind.NO_HIDDEN_DATA);
    }

    @Test
    void headerWithoutContainerMagicIsNoHiddenData() {
        failing(embed(new byte[40], 1), "pw", StegoErrorKind.NO_HIDDEN_DATA);
    }

    @Test
    void truncatedContainerIsNoHiddenData() {
        byte[] framed = ContainerCodec.frame(plainMetadata(new byte[50], 1), new byte[50]);
        byte[] cut = java.util.Arrays.copyOf(framed, framed.length - 10);
        failing(embed(cut, 1), "pw", StegoErrorKind.NO_HIDDEN_DATA);
    }

    @Test
    void headerClaimingMoreThanTheCarrierIsNoHiddenData() {
        BitStream header = new BitstreamHeader(1, 100_000).encode();
        SlotCarrier carrier = ImageCodec.INSTANCE.open(ImageCodec.INSTANCE.open(PNG).write(header));
        failing(carrier, "pw", StegoErrorKind.NO_HIDDEN_DATA);
    }

    @Test
    void nonJsonMetadataIsMalformed() {
        byte[] garbage = "not json".getBytes(StandardCharsets.US_ASCII);
        byte[] container = Format.concat(Constants.CONTAINER_MAGIC, Format.u32(garbage.length), garbage, Format.u32(0));
        ExtractionOrchestrator orchestrator = failing(embed(container, 1), "pw", StegoErrorKind.MALFORMED_METADATA);
        assertEquals(ExtractionState.FAILED, orchestrator.state());
    }

    @Test
    void unknownVersionIsMalformed() {
        byte[] payload = {1};
        Metadata meta = plainMetadata(payload, 1).put(Constants.META_VERSION, "0");
        failing(embed(ContainerCodec.frame(meta, payload), 1), null, StegoErrorKind.MALFORMED_METADATA);
    }

    @Test
    void missingRequiredKeyIsMalformed() {
        byte[] payload = {1};
        Metadata meta = new Metadata()
            .put(Constants.META_VERSION, Constants.CONTAINER_VERSION)
            .putBoolean(Constants.META_ENCRYPTED, false)
            .put(Constants.META_CONTENT_TYPE, "file");
        failing(embed(ContainerCodec.frame(meta, payload), 1), null, StegoErrorKind.MALFORMED_METADATA);
    }

    @Test
    void redundancyDisagreeingWithHeaderIsMalformed() {
        byte[] payload = {1, 2};
        failing(embed(ContainerCodec.frame(plainMetadata(payload, 3), payload), 1), null,
            StegoErrorKind.MALFORMED_METADATA);
    }

    @Test
    void unknownCipherIsMalformed() {
        byte[] payload = {1, 2};
        Metadata meta = plainMetadata(payload, 1)
            .putBoolean(Constants.META_ENCRYPTED, true)
            .put(Constants.META_CIPHER, "rot13");
        CarrierFixtures.FAST_KDF.writeTo(meta);
        failing(embed(ContainerCodec.frame(meta, payload), 1), "pw", StegoErrorKind.MALFORMED_METADATA);
    }

    @Test
    void checksumMismatchIsCorruption() {
        byte[] payload = {1, 2, 3};
        Metadata meta = plainMetadata(new byte[] {9}, 1);
        failing(embed(ContainerCodec.frame(meta, payload), 1), null, StegoErrorKind.WRONG_PASSWORD_OR_CORRUPTION);
    }

    @Test
    void encryptedContainerWithoutPasswordIsWrongPassword() {
        byte[] stego = VeilForge.hideText(PNG, CarrierType.IMAGE, "secret", "pw", CarrierFixtures.fastOptions());
        failing(ImageCodec.INSTANCE.open(stego), null, StegoErrorKind.WRONG_PASSWORD_OR_CORRUPTION);
    }
}
