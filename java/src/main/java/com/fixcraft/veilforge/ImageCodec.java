package com.fixcraft.veilforge;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

/**
 * Raster images through ImageIO. One slot per color channel in raster order (R, G, B per pixel);
 * alpha is never touched. Output is PNG, or BMP when the input was BMP.
 */
final class ImageCodec implements CarrierCodec {
    static final ImageCodec INSTANCE = new ImageCodec();

    private ImageCodec() {}

    @Override
    public CarrierType type() {
        return CarrierType.IMAGE;
    }

    @Override
    public SlotCarrier open(byte[] carrierBytes) {
        String format = sniffFormat(carrierBytes);
        BufferedImage img;
        try {
            img = ImageIO.read(new ByteArrayInputStream(carrierBytes));
        } catch (IOException | RuntimeException exc) {
            throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, "Failed to decode image", exc);
        }
        if (img == null || format == null) {
            throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, "Unsupported image input");
        }
        int width = img.getWidth();
        int height = img.getHeight();
        boolean hasAlpha = img.getColorModel().hasAlpha();
        int[] argb = img.getRGB(0, 0, width, height, null, 0, width);
        String outFormat = outputFormat(format, hasAlpha);
        return new ImageCarrier(width, height, hasAlpha, argb, outFormat);
    }

    static String sniffFormat(byte[] data) {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            if (in == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                return reader.getFormatName().toLowerCase(Locale.US);
            } finally {
                reader.dispose();
            }
        } catch (IOException exc) {
            return null;
        }
    }

    private static String outputFormat(String inputFormat, boolean hasAlpha) {
        if ("png".equals(inputFormat)) {
            return "png";
        }
        if ("bmp".equals(inputFormat) && !hasAlpha) {
            return "bmp";
        }
        if ("bmp".equals(inputFormat)) {
            StegoLog.warn("BMP input with alpha is written as PNG");
        } else {
            StegoLog.warn("Image format " + inputFormat + " does not preserve low bits; output is PNG");
        }
        return "png";
    }

    static final class ImageCarrier implements SlotCarrier {
        private final int width;
        private final int height;
        private final boolean hasAlpha;
        private final int[] argb;
        private final String outFormat;

        ImageCarrier(int width, int height, boolean hasAlpha, int[] argb, String outFormat) {
            this.width = width;
            this.height = height;
            this.hasAlpha = hasAlpha;
            this.argb = argb;
            this.outFormat = outFormat;
        }

        String outputFormat() {
            return outFormat;
        }

        @Override
        public long writableSlots() {
            return (long) argb.length * 3;
        }

        @Override
        public long readableSlots() {
            return writableSlots();
        }

        @Override
        public BitStream read(long offset, int count) {
            CarrierCodec.checkReadable(this, offset, count);
            BitStream bits = new BitStream(count);
            for (int i = 0; i < count; i++) {
                long slot = offset + i;
                int pixel = argb[(int) (slot / 3)];
                int shift = channelShift((int) (slot % 3));
                bits.set(i, ((pixel >>> shift) & 1) != 0);
            }
            return bits;
        }

        @Override
        public byte[] write(BitStream bits) {
            CarrierCodec.checkWritable(this, bits);
            int[] out = argb.clone();
            for (int i = 0; i < bits.length(); i++) {
                int shift = channelShift(i % 3);
                int idx = i / 3;
                int mask = 1 << shift;
                out[idx] = bits.get(i) ? (out[idx] | mask) : (out[idx] & ~mask);
            }
            BufferedImage img = new BufferedImage(width, height,
                hasAlpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
            img.setRGB(0, 0, width, height, out, 0, width);
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try {
                if (!ImageIO.write(img, outFormat, buffer)) {
                    throw new IllegalStateException("No ImageIO writer for " + outFormat);
                }
            } catch (IOException exc) {
                throw new IllegalStateException("Failed to encode image", exc);
            }
            return buffer.toByteArray();
        }

        // R, G, B
        private static int channelShift(int channel) {
            return 16 - channel * 8;
        }
    }
}
