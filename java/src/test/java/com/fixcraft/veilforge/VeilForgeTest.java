package com.fixcraft.veilforge;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class VeilForgeTest {

    private static final HideOptions FAST = CarrierFixtures.fastOptions();

    private static void assertKind(StegoErrorKind kind, Runnable action) {
        StegoException exc = assertThrows(StegoException.class, action::run);
        assertEquals(kind, exc.kind(), exc.getMessage());
    }

    // ---------------------------------------------------------------------
    // Reference scenario
    // ---------------------------------------------------------------------

    @Test
    void helloWorldInA64PixelImage() {
        byte[] png = CarrierFixtures.png(64, 64, 1);
        byte[] stego = VeilForge.hideText(png, CarrierType.IMAGE, "hello world", "p@ss", FAST);

        ExtractedPayload out = VeilForge.extract(stego, CarrierType.IMAGE, "p@ss");
        assertEquals("hello world", out.text());
        assertEquals(ContentType.TEXT, out.contentType());
        assertNull(out.originalFilename());

        assertKind(StegoErrorKind.WRONG_PASSWORD_OR_CORRUPTION,
            () -> VeilForge.extract(stego, CarrierType.IMAGE, "wrong"));
    }

    @Test
    void adversarialPasswordsNeverRecoverThePayload() {
        byte[] png = CarrierFixtures.png(64, 64, 2);
        byte[] stego = VeilForge.hideText(png, CarrierType.IMAGE, "hello world", "p@ss", FAST);
        String[] guesses = {"", "P@ss", "p@ss ", "p@s", "p@ss\u0000", "p@ssp@ss", null};
        for (String guess : guesses) {
            assertKind(StegoErrorKind.WRONG_PASSWORD_OR_CORRUPTION,
                () -> VeilForge.extract(stego, CarrierType.IMAGE, guess));
        }
    }

    @Test
    void fileInADocumentKeepsItsName() {
        byte[] payload = {(byte) 0xDE, (byte) 0xAD, (byte) 0xBE};
        byte[] stego = VeilForge.hide(CarrierFixtures.pdf(), CarrierType.DOCUMENT, payload, "original.bin",
            "pw", FAST);

        ExtractedPayload out = VeilForge.extract(stego, CarrierType.DOCUMENT, "pw");
        assertArrayEquals(payload, out.payload());
        assertEquals("original.bin", out.originalFilename());
        assertEquals(ContentType.FILE, out.contentType());
    }

    @Test
    void extractionIsIdempotent() {
        byte[] stego = VeilForge.hide(CarrierFixtures.png(40, 40, 3), CarrierType.IMAGE,
            CarrierFixtures.randomBytes(100, 4), "data.bin", "pw", FAST);
        ExtractedPayload first = VeilForge.extract(stego, CarrierType.IMAGE, "pw");
        ExtractedPayload second = VeilForge.extract(stego, CarrierType.IMAGE, "pw");
        assertArrayEquals(first.payload(), second.payload());
        assertEquals(first.originalFilename(), second.originalFilename());
    }

    @Test
    void payloadExactlyAtCapacityFitsAndOneMoreByteDoesNot() {
        byte[] png = CarrierFixtures.png(40, 40, 5);
        HideOptions options = FAST.withRedundancy(Redundancy.fixed(1));
        long capacityBytes = VeilForge.capacity(png, CarrierType.IMAGE, 1) / 8;
        int overhead = VeilForge.containerSize(0, "f.bin", true, CarrierFixtures.FAST_KDF, 1);
        int exact = (int) (capacityBytes - overhead);
        assertTrue(exact > 0);
        assertEquals(capacityBytes, VeilForge.containerSize(exact, "f.bin", true, CarrierFixtures.FAST_KDF, 1));

        byte[] payload = CarrierFixtures.randomBytes(exact, 6);
        byte[] stego = VeilForge.hide(png, CarrierType.IMAGE, payload, "f.bin", "pw", options);
        assertArrayEquals(payload, VeilForge.extract(stego, CarrierType.IMAGE, "pw").payload());

        assertKind(StegoErrorKind.PAYLOAD_TOO_LARGE, () -> VeilForge.hide(png, CarrierType.IMAGE,
            CarrierFixtures.randomBytes(exact + 1, 7), "f.bin", "pw", options));
    }

    // ---------------------------------------------------------------------
    // Carriers
    // ---------------------------------------------------------------------

    @Test
    void roundTripsThroughEveryLosslessCarrier() {
        byte[] payload = "the quick brown fox".getBytes(StandardCharsets.UTF_8);
        byte[][] carriers = {
            CarrierFixtures.png(48, 48, 8), CarrierFixtures.bmp(48, 48, 9), CarrierFixtures.wav(20000, 2, 16, 10),
            CarrierFixtures.pdf(), CarrierFixtures.zip(null), CarrierFixtures.text(), new byte[] {0, 1, 2}
        };
        CarrierType[] types = {
            CarrierType.IMAGE, CarrierType.IMAGE, CarrierType.AUDIO,
            CarrierType.DOCUMENT, CarrierType.DOCUMENT, CarrierType.DOCUMENT, CarrierType.DOCUMENT
        };
        for (int i = 0; i < carriers.length; i++) {
            byte[] stego = VeilForge.hide(carriers[i], types[i], payload, "fox.txt", "pw", FAST);
            ExtractedPayload out = VeilForge.extract(stego, types[i], "pw");
            assertArrayEquals(payload, out.payload(), "carrier " + i);
            assertEquals("fox.txt", out.originalFilename());
        }
    }

    @Test
    void hideLeavesTheCallersCarrierBytesAlone() {
        byte[] png = CarrierFixtures.png(32, 32, 11);
        byte[] copy = png.clone();
        VeilForge.hideText(png, CarrierType.IMAGE, "x", "pw", FAST);
        assertArrayEquals(copy, png);
    }

    @Test
    void unencryptedContainerNeedsNoPassword() {
        byte[] stego = VeilForge.hide(CarrierFixtures.wav(20000, 1, 16, 12), CarrierType.AUDIO,
            new byte[] {1, 2, 3}, null, null, FAST);
        ExtractedPayload out = VeilForge.extract(stego, CarrierType.AUDIO, null);
        assertArrayEquals(new byte[] {1, 2, 3}, out.payload());
        assertNull(out.originalFilename());
        assertArrayEquals(new byte[] {1, 2, 3}, VeilForge.extract(stego, CarrierType.AUDIO, "ignored").payload());
    }

    @Test
    void emptyPasswordStillEncrypts() {
        byte[] stego = VeilForge.hideText(CarrierFixtures.text(), CarrierType.DOCUMENT, "weak", "", FAST);
        assertEquals("weak", VeilForge.extract(stego, CarrierType.DOCUMENT, "").text());
        assertKind(StegoErrorKind.WRONG_PASSWORD_OR_CORRUPTION,
            () -> VeilForge.extract(stego, CarrierType.DOCUMENT, null));
    }

    @Test
    void argon2idContainersRoundTrip() {
        HideOptions options = FAST.withKdf(KdfParams.argon2id(1, 256, 1));
        byte[] stego = VeilForge.hideText(CarrierFixtures.png(48, 48, 13), CarrierType.IMAGE, "argon", "pw", options);
        assertEquals("argon", VeilForge.extract(stego, CarrierType.IMAGE, "pw").text());
    }

    @Test
    void emptyAndUnicodeTextRoundTrip() {
        byte[] png = CarrierFixtures.png(48, 48, 14);
        assertEquals("", VeilForge.extract(VeilForge.hideText(png, CarrierType.IMAGE, "", "pw", FAST),
            CarrierType.IMAGE, "pw").text());
        String unicode = "über 日本 😀";
        assertEquals(unicode, VeilForge.extract(VeilForge.hideText(png, CarrierType.IMAGE, unicode, "pw", FAST),
            CarrierType.IMAGE, "pw").text());
    }

    // ---------------------------------------------------------------------
    // Redundancy
    // ---------------------------------------------------------------------

    @Test
    void flippedCiphertextBitWithoutRedundancyIsCorruption() {
        byte[] png = CarrierFixtures.png(48, 48, 15);
        byte[] stego = VeilForge.hideText(png, CarrierType.IMAGE, "fragile", "pw", FAST.withRedundancy(Redundancy.fixed(1)));
        int container = VeilForge.containerSize(7, null, true, CarrierFixtures.FAST_KDF, 1);
        byte[] damaged = flipSlot(stego, Constants.HEADER_SLOTS + container * 8 - 1);
        assertKind(StegoErrorKind.WRONG_PASSWORD_OR_CORRUPTION,
            () -> VeilForge.extract(damaged, CarrierType.IMAGE, "pw"));
    }

    @Test
    void singleFlippedCopyIsCorrectedAtFactorThree() {
        byte[] png = CarrierFixtures.png(64, 64, 16);
        byte[] stego = VeilForge.hideText(png, CarrierType.IMAGE, "sturdy", "pw", FAST.withRedundancy(Redundancy.fixed(3)));
        byte[] damaged = flipSlot(stego, Constants.HEADER_SLOTS + 5);
        assertEquals("sturdy", VeilForge.extract(damaged, CarrierType.IMAGE, "pw").text());
    }

    @Test
    void videoFramesSurviveOneDamagedCopyPerBit() {
        VideoFrames frames = CarrierFixtures.noiseFrames(32, 32, 4, 17);
        byte[] raw = VeilForge.hide(frames, CarrierType.VIDEO, "frame data".getBytes(StandardCharsets.UTF_8),
            ContentType.TEXT, null, "pw", FAST);
        BitstreamHeader header = headerOf(VideoFrames.fromRaw(raw, 32, 32, "25"));
        assertTrue(header.factor() >= 3 && header.factor() % 2 == 1);

        // wipe copy 1 of every body bit
        SlotLayout layout = new SlotLayout(frames.frameCount());
        long containerBits = header.containerLength() * 8;
        long bodyRow = layout.headerSlots() / layout.width();
        for (long i = 0; i < containerBits; i++) {
            long k = layout.slot(containerBits, bodyRow, 1, i);
            int frame = (int) (k % frames.frameCount());
            raw[frame * frames.frameSize() + (int) (k / frames.frameCount())] ^= 0x07;
        }
        VideoFrames damaged = VideoFrames.fromRaw(raw, 32, 32, "25");
        assertEquals("frame data", VeilForge.extract(damaged, "pw").text());
    }

    @Test
    void losingOneWholeFrameIsTolerated() {
        for (int frameCount : new int[] {3, 7, 8, 11, 16, 24}) {
            VideoFrames frames = CarrierFixtures.noiseFrames(32, 32, frameCount, 40 + frameCount);
            byte[] raw = VeilForge.hide(frames, CarrierType.VIDEO, "frame data".getBytes(StandardCharsets.UTF_8),
                ContentType.TEXT, null, "pw", FAST);

            int lost = frameCount / 2;
            int frameSize = frames.frameSize();
            for (int i = lost * frameSize; i < (lost + 1) * frameSize; i++) {
                raw[i] ^= 0x07;
            }
            VideoFrames damaged = VideoFrames.fromRaw(raw, 32, 32, "25");
            assertEquals("frame data", VeilForge.extract(damaged, "pw").text(), "frames=" + frameCount);
        }
    }

    @Test
    void copiesOfEveryBitSitInDifferentFrames() {
        VideoFrames frames = CarrierFixtures.noiseFrames(32, 32, 8, 18);
        byte[] raw = VeilForge.hide(frames, CarrierType.VIDEO, "spread".getBytes(StandardCharsets.UTF_8),
            ContentType.TEXT, null, null, FAST.withRedundancy(Redundancy.fixed(7)));
        BitstreamHeader header = headerOf(VideoFrames.fromRaw(raw, 32, 32, "25"));
        assertEquals(7, header.factor());

        SlotLayout layout = new SlotLayout(8);
        long containerBits = header.containerLength() * 8;
        long bodyRow = layout.headerSlots() / layout.width();
        for (long i = 0; i < containerBits; i++) {
            boolean[] seen = new boolean[8];
            for (int copy = 0; copy < 7; copy++) {
                int frame = (int) (layout.slot(containerBits, bodyRow, copy, i) % 8);
                assertFalse(seen[frame], "bit " + i + " copy " + copy);
                seen[frame] = true;
            }
        }
    }

    private static BitstreamHeader headerOf(SlotCarrier carrier) {
        SlotLayout layout = SlotLayout.of(carrier);
        BitstreamHeader header = BitstreamHeader.decode(
            layout.gatherHeader(carrier.read(0, (int) layout.headerSlots())));
        assertNotNull(header);
        return header;
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    @Test
    void plainCarriersHaveNoHiddenData() {
        assertKind(StegoErrorKind.NO_HIDDEN_DATA,
            () -> VeilForge.extract(CarrierFixtures.png(32, 32, 18), CarrierType.IMAGE, "pw"));
        assertKind(StegoErrorKind.NO_HIDDEN_DATA,
            () -> VeilForge.extract(CarrierFixtures.wav(5000, 1, 16, 19), CarrierType.AUDIO, "pw"));
        assertKind(StegoErrorKind.NO_HIDDEN_DATA,
            () -> VeilForge.extract(CarrierFixtures.pdf(), CarrierType.DOCUMENT, "pw"));
    }

    @Test
    void oversizedPayloadIsRejected() {
        assertKind(StegoErrorKind.PAYLOAD_TOO_LARGE, () -> VeilForge.hide(CarrierFixtures.png(16, 16, 20),
            CarrierType.IMAGE, new byte[1000], "big.bin", "pw", FAST));
        assertKind(StegoErrorKind.PAYLOAD_TOO_LARGE, () -> VeilForge.hide(CarrierFixtures.zip(null),
            CarrierType.DOCUMENT, new byte[70000], "big.bin", "pw", FAST));
    }

    @Test
    void wrongCarrierTypeOrMissingTypeIsUnsupported() {
        byte[] png = CarrierFixtures.png(16, 16, 21);
        assertKind(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT,
            () -> VeilForge.hideText(png, null, "x", "pw", FAST));
        assertKind(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT,
            () -> VeilForge.extract(CarrierFixtures.text(), CarrierType.IMAGE, "pw"));
    }

    @Test
    void capacityUsesTheCarrierMinimumRedundancy() {
        byte[] png = CarrierFixtures.png(20, 20, 22);
        assertEquals(20 * 20 * 3 - Constants.HEADER_SLOTS, VeilForge.capacity(png, CarrierType.IMAGE));
        assertEquals((20 * 20 * 3 - Constants.HEADER_SLOTS) / 5, VeilForge.capacity(png, CarrierType.IMAGE, 5));
    }

    /** Flips the low red/green/blue bit holding image slot {@code slot}. */
    private static byte[] flipSlot(byte[] png, int slot) {
        ImageCodec.ImageCarrier carrier = (ImageCodec.ImageCarrier) ImageCodec.INSTANCE.open(png);
        BitStream all = carrier.read(0, (int) carrier.readableSlots());
        all.flip(slot);
        return carrier.write(all);
    }
}
