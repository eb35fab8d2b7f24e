package com.fixcraft.veilforge;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Documents carry a trailer region next to the original content rather than inside it:
 * <ul>
 *   <li>ZIP containers (docx, xlsx, odt, ...) keep it at the end of the archive comment;</li>
 *   <li>PDF appends it after the last {@code %%EOF} and re-issues the original {@code startxref};</li>
 *   <li>plain UTF-8 text gets it as trailing whitespace, one space or tab per bit;</li>
 *   <li>anything else gets it appended as raw bytes.</li>
 * </ul>
 * The trailer block is {@code MAGIC | u32 len | region | MAGIC | u32 len}; it is located from the
 * end. Embedding into a document that already has a block replaces the block.
 */
final class DocumentCodec implements CarrierCodec {
    static final DocumentCodec INSTANCE = new DocumentCodec();

    private static final byte[] MAGIC = Constants.DOCUMENT_TRAILER_MAGIC;
    private static final int FRAME_LEN = MAGIC.length + 4;
    static final int TRAILER_OVERHEAD = FRAME_LEN * 2;

    private static final byte[] ZIP_LOCAL = {'P', 'K', 3, 4};
    private static final byte[] ZIP_EOCD = {'P', 'K', 5, 6};
    private static final int ZIP_EOCD_LEN = 22;
    private static final int ZIP_MAX_COMMENT = 0xFFFF;
    private static final byte[] PDF_HEADER = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] PDF_STARTXREF = "startxref".getBytes(StandardCharsets.US_ASCII);

    enum Layout { PDF, ZIP, TEXT, BINARY }

    private DocumentCodec() {}

    @Override
    public CarrierType type() {
        return CarrierType.DOCUMENT;
    }

    @Override
    public SlotCarrier open(byte[] carrierBytes) {
        if (carrierBytes.length == 0) {
            throw new StegoException(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, "Empty document");
        }
        Layout layout = classify(carrierBytes);
        StegoLog.debug("document", "layout " + layout);
        return new TrailerCarrier(carrierBytes, layout);
    }

    static Layout classify(byte[] data) {
        int pdf = Format.indexOf(Arrays.copyOf(data, Math.min(data.length, 1024)), PDF_HEADER, 0);
        if (pdf >= 0) {
            return Layout.PDF;
        }
        if (Format.startsWith(data, 0, ZIP_LOCAL) && findEocd(data) >= 0) {
            return Layout.ZIP;
        }
        if (isPlainText(data)) {
            return Layout.TEXT;
        }
        return Layout.BINARY;
    }

    private static boolean isPlainText(byte[] data) {
        for (byte b : data) {
            int v = b & 0xFF;
            if (v < 0x20 && v != '\n' && v != '\r' && v != '\t' && v != '\f') {
                return false;
            }
            if (v == 0x7F) {
                return false;
            }
        }
        try {
            StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(data));
            return true;
        } catch (CharacterCodingException exc) {
            return false;
        }
    }

    /** End-of-central-directory offset whose comment runs exactly to the end of the file, or -1. */
    static int findEocd(byte[] data) {
        int start = data.length - ZIP_EOCD_LEN;
        int stop = Math.max(0, start - ZIP_MAX_COMMENT);
        for (int i = start; i >= stop; i--) {
            if (Format.startsWith(data, i, ZIP_EOCD)
                && i + ZIP_EOCD_LEN + Format.readU16(data, i + 20) == data.length) {
                return i;
            }
        }
        return -1;
    }

    /** Position of a trailer block inside a byte array. */
    static final class Block {
        final int start;
        final int regionStart;
        final int regionLength;
        final int end;

        Block(int start, int regionStart, int regionLength, int end) {
            this.start = start;
            this.regionStart = regionStart;
            this.regionLength = regionLength;
            this.end = end;
        }
    }

    static Block locate(byte[] data, boolean mustEndAtEof) {
        int footer = Format.lastIndexOf(data, MAGIC);
        if (footer < 0 || footer + FRAME_LEN > data.length) {
            return null;
        }
        long len = Format.readU32(data, footer + MAGIC.length);
        long regionStart = footer - len;
        long start = regionStart - FRAME_LEN;
        if (start < 0) {
            return null;
        }
        if (!Format.startsWith(data, (int) start, MAGIC) || Format.readU32(data, (int) start + MAGIC.length) != len) {
            return null;
        }
        int end = footer + FRAME_LEN;
        if (mustEndAtEof && end != data.length) {
            return null;
        }
        return new Block((int) start, (int) regionStart, (int) len, end);
    }

    static byte[] buildBlock(byte[] region) {
        byte[] frame = Format.concat(MAGIC, Format.u32(region.length));
        return Format.concat(frame, region, frame);
    }

    static byte[] toWhitespace(byte[] block) {
        byte[] out = new byte[block.length * 8];
        for (int i = 0; i < block.length; i++) {
            int v = block[i] & 0xFF;
            for (int b = 0; b < 8; b++) {
                out[i * 8 + b] = ((v >>> (7 - b)) & 1) != 0 ? (byte) '\t' : (byte) ' ';
            }
        }
        return out;
    }

    /** Decodes the whole-byte tail of the trailing whitespace run. */
    static byte[] fromWhitespace(byte[] data) {
        int run = 0;
        for (int i = data.length - 1; i >= 0 && (data[i] == ' ' || data[i] == '\t'); i--) {
            run++;
        }
        int usable = run - run % 8;
        byte[] out = new byte[usable / 8];
        int from = data.length - usable;
        for (int i = 0; i < out.length; i++) {
            int v = 0;
            for (int b = 0; b < 8; b++) {
                v = (v << 1) | (data[from + i * 8 + b] == '\t' ? 1 : 0);
            }
            out[i] = (byte) v;
        }
        return out;
    }

    static final class TrailerCarrier implements SlotCarrier {
        private final byte[] data;
        private final Layout layout;
        private final byte[] region;
        private final byte[] base;
        private final int eocd;
        private BitStream regionBits;

        TrailerCarrier(byte[] data, Layout layout) {
            this.data = data;
            this.layout = layout;
            if (layout == Layout.TEXT) {
                byte[] decoded = fromWhitespace(data);
                Block block = locate(decoded, true);
                if (block != null) {
                    this.region = Arrays.copyOfRange(decoded, block.regionStart, block.regionStart + block.regionLength);
                    int consumed = (decoded.length - block.start) * 8;
                    this.base = Arrays.copyOf(data, data.length - consumed);
                } else {
                    this.region = new byte[0];
                    this.base = data;
                }
                this.eocd = -1;
                return;
            }
            Block block = locate(data, layout != Layout.PDF);
            if (block != null) {
                this.region = Arrays.copyOfRange(data, block.regionStart, block.regionStart + block.regionLength);
                this.base = Arrays.copyOf(data, block.start);
            } else {
                this.region = new byte[0];
                this.base = data;
            }
            this.eocd = layout == Layout.ZIP ? findEocd(data) : -1;
        }

        Layout layout() {
            return layout;
        }

        private int baseCommentLength() {
            return base.length - (eocd + ZIP_EOCD_LEN);
        }

        @Override
        public long writableSlots() {
            long bytes;
            if (layout == Layout.ZIP) {
                bytes = Math.max(0, ZIP_MAX_COMMENT - baseCommentLength() - TRAILER_OVERHEAD);
            } else {
                bytes = StegoConfig.documentLimit();
            }
            return bytes * 8;
        }

        @Override
        public long readableSlots() {
            return region.length * 8L;
        }

        @Override
        public BitStream read(long offset, int count) {
            CarrierCodec.checkReadable(this, offset, count);
            if (regionBits == null) {
                regionBits = BitStream.fromBytes(region);
            }
            return regionBits.slice((int) offset, count);
        }

        @Override
        public byte[] write(BitStream bits) {
            CarrierCodec.checkWritable(this, bits);
            byte[] block = buildBlock(bits.toPaddedBytes());
            switch (layout) {
                case ZIP: {
                    byte[] out = Format.concat(base, block);
                    Format.writeU16(out, eocd + 20, baseCommentLength() + block.length);
                    return out;
                }
                case PDF:
                    return Format.concat(base, block, pdfEpilogue(base));
                case TEXT:
                    return Format.concat(base, toWhitespace(block));
                default:
                    return Format.concat(base, block);
            }
        }
    }

    /**
     * Readers look for {@code startxref} and {@code %%EOF} near the end of the file, so the last
     * cross-reference pointer is repeated after the block.
     */
    static byte[] pdfEpilogue(byte[] base) {
        int idx = Format.lastIndexOf(base, PDF_STARTXREF);
        if (idx < 0) {
            StegoLog.warn("PDF has no startxref; trailer appended without epilogue");
            return new byte[0];
        }
        int pos = idx + PDF_STARTXREF.length;
        while (pos < base.length && Character.isWhitespace(base[pos])) {
            pos++;
        }
        int digits = pos;
        while (digits < base.length && base[digits] >= '0' && base[digits] <= '9') {
            digits++;
        }
        if (digits == pos) {
            return new byte[0];
        }
        String offset = new String(base, pos, digits - pos, StandardCharsets.US_ASCII);
        return ("\nstartxref\n" + offset + "\n%%EOF\n").getBytes(StandardCharsets.US_ASCII);
    }
}
