package com.fixcraft.veilforge;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/** Full video pipeline; runs only where ffmpeg and ffprobe are installed. */
public class VideoCodecTest {

    @BeforeAll
    static void requireFfmpeg() {
        assumeTrue(Ffmpeg.available(), "ffmpeg/ffprobe not installed");
    }

    @AfterEach
    void resetWorkers() {
        System.clearProperty("veilforge.workers");
    }

    private static byte[] encode(VideoFrames frames) throws IOException {
        Path raw = Files.createTempFile("veilforge-test-", ".rgb");
        try {
            Files.write(raw, frames.toRaw());
            return Ffmpeg.encodeRaw(raw, frames.width(), frames.height(), frames.frameRate(), new byte[0]);
        } finally {
            Files.deleteIfExists(raw);
        }
    }

    private static byte[] sourceVideo() throws IOException {
        return encode(CarrierFixtures.noiseFrames(64, 48, 6, 1));
    }

    @Test
    void decodedFramesMatchTheEncodedOnes() throws IOException {
        VideoFrames frames = CarrierFixtures.noiseFrames(32, 16, 3, 2);
        try (RawVideoFile decoded = Ffmpeg.decodeToFile(encode(frames))) {
            assertEquals(32, decoded.width());
            assertEquals(16, decoded.height());
            assertEquals(3, decoded.frameCount());
            assertArrayEquals(frames.frame(2), decoded.frame(2));
        }
    }

    @Test
    void scratchFilesAreRemovedOnClose() throws IOException {
        Path dir;
        try (RawVideoFile carrier = Ffmpeg.decodeToFile(sourceVideo())) {
            BitStream bits = BitStream.fromBytes(CarrierFixtures.randomBytes(16, 3));
            byte[] stego = carrier.write(bits);
            assertTrue(stego.length > 0);
            dir = carrier.scratchDir();
            assertTrue(Files.isDirectory(dir));
        }
        assertFalse(Files.exists(dir));
    }

    @Test
    void streamedWriteMatchesInMemoryEmbedding() throws IOException {
        // batches of two frames exercise the batch boundaries
        System.setProperty("veilforge.workers", "2");
        VideoFrames frames = CarrierFixtures.noiseFrames(16, 8, 5, 4);
        BitStream bits = BitStream.fromBytes(CarrierFixtures.randomBytes(90, 5));
        try (RawVideoFile carrier = Ffmpeg.decodeToFile(encode(frames));
             RawVideoFile stego = Ffmpeg.decodeToFile(carrier.write(bits))) {
            VideoFrames expected = frames.embed(bits);
            for (int f = 0; f < frames.frameCount(); f++) {
                assertArrayEquals(expected.frame(f), stego.frame(f), "frame " + f);
            }
            assertEquals(bits.slice(100, 300), stego.read(100, 300));
        }
    }

    @Test
    void hideAndExtractThroughARealContainer() throws IOException {
        byte[] video = sourceVideo();
        byte[] stego = VeilForge.hideText(video, CarrierType.VIDEO, "rolling", "pw", CarrierFixtures.fastOptions());
        ExtractedPayload out = VeilForge.extract(stego, CarrierType.VIDEO, "pw");
        assertEquals("rolling", out.text());
    }

    @Test
    void wrongPasswordOnVideo() throws IOException {
        byte[] stego = VeilForge.hide(sourceVideo(), CarrierType.VIDEO, "clip".getBytes(StandardCharsets.UTF_8),
            "clip.txt", "pw", CarrierFixtures.fastOptions());
        StegoException exc = assertThrows(StegoException.class,
            () -> VeilForge.extract(stego, CarrierType.VIDEO, "nope"));
        assertEquals(StegoErrorKind.WRONG_PASSWORD_OR_CORRUPTION, exc.kind());
    }
}
