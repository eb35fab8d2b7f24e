package com.fixcraft.veilforge;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

import static org.junit.jupiter.api.Assertions.*;

public class ImageCodecTest {

    private static BufferedImage decode(byte[] data) throws IOException {
        return ImageIO.read(new ByteArrayInputStream(data));
    }

    @Test
    void slotsAreThreePerPixel() {
        SlotCarrier carrier = ImageCodec.INSTANCE.open(CarrierFixtures.png(10, 7, 1));
        assertEquals(10 * 7 * 3, carrier.writableSlots());
        assertEquals(carrier.writableSlots(), carrier.readableSlots());
    }

    @Test
    void writtenBitsReadBackInRasterChannelOrder() throws IOException {
        byte[] png = CarrierFixtures.png(8, 8, 2);
        BitStream bits = BitStream.fromBytes(CarrierFixtures.randomBytes(20, 3));
        byte[] stego = ImageCodec.INSTANCE.open(png).write(bits);

        assertEquals(bits, ImageCodec.INSTANCE.open(stego).read(0, bits.length()));

        // bit 0 is red of pixel (0,0), bit 4 is green of pixel (1,0)
        BufferedImage img = decode(stego);
        assertEquals(bits.bit(0), (img.getRGB(0, 0) >>> 16) & 1);
        assertEquals(bits.bit(4), (img.getRGB(1, 0) >>> 8) & 1);
    }

    @Test
    void onlyLeastSignificantBitsChangeAndSourceIsUntouched() throws IOException {
        byte[] png = CarrierFixtures.png(16, 16, 4);
        byte[] before = png.clone();
        BitStream bits = BitStream.fromBytes(CarrierFixtures.randomBytes(96, 5));
        byte[] stego = ImageCodec.INSTANCE.open(png).write(bits);

        assertArrayEquals(before, png);
        BufferedImage a = decode(png);
        BufferedImage b = decode(stego);
        for (int y = 0; y < 16; y++) {
            for (int x = 0; x < 16; x++) {
                assertEquals(a.getRGB(x, y) & 0xFEFEFEFE, b.getRGB(x, y) & 0xFEFEFEFE);
            }
        }
    }

    @Test
    void alphaChannelIsPreserved() throws IOException {
        byte[] png = CarrierFixtures.pngWithAlpha(12, 12, 6);
        BitStream bits = BitStream.fromBytes(CarrierFixtures.randomBytes(50, 7));
        byte[] stego = ImageCodec.INSTANCE.open(png).write(bits);

        BufferedImage a = decode(png);
        BufferedImage b = decode(stego);
        assertTrue(b.getColorModel().hasAlpha());
        for (int y = 0; y < 12; y++) {
            for (int x = 0; x < 12; x++) {
                assertEquals(a.getRGB(x, y) >>> 24, b.getRGB(x, y) >>> 24);
            }
        }
        assertEquals(bits, ImageCodec.INSTANCE.open(stego).read(0, bits.length()));
    }

    @Test
    void bmpStaysBmp() {
        ImageCodec.ImageCarrier carrier = (ImageCodec.ImageCarrier) ImageCodec.INSTANCE.open(CarrierFixtures.bmp(8, 8, 8));
        assertEquals("bmp", carrier.outputFormat());
        byte[] stego = carrier.write(BitStream.fromBytes(new byte[] {(byte) 0xA5}));
        assertEquals('B', stego[0]);
        assertEquals('M', stego[1]);
    }

    @Test
    void lossyInputIsWrittenAsPng() {
        ImageCodec.ImageCarrier carrier = (ImageCodec.ImageCarrier) ImageCodec.INSTANCE.open(CarrierFixtures.jpeg(8, 8, 9));
        assertEquals("png", carrier.outputFormat());
        BitStream bits = BitStream.fromBytes(new byte[] {0x3C, 0x42});
        byte[] stego = carrier.write(bits);
        assertEquals("png", ImageCodec.sniffFormat(stego));
        assertEquals(bits, ImageCodec.INSTANCE.open(stego).read(0, 16));
    }

    @Test
    void writingMoreBitsThanSlotsIsCarrierTooSmall() {
        SlotCarrier carrier = ImageCodec.INSTANCE.open(CarrierFixtures.png(2, 2, 10));
        StegoException exc = assertThrows(StegoException.class, () -> carrier.write(new BitStream(13)));
        assertEquals(StegoErrorKind.CARRIER_TOO_SMALL, exc.kind());
    }

    @Test
    void nonImageBytesAreUnsupported() {
        StegoException exc = assertThrows(StegoException.class,
            () -> ImageCodec.INSTANCE.open("not an image".getBytes()));
        assertEquals(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, exc.kind());
    }
}
