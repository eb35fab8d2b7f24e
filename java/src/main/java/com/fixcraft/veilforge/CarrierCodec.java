package com.fixcraft.veilforge;

public interface CarrierCodec {
    CarrierType type();

    /**
     * Decodes carrier bytes into an addressable slot view.
     *
     * @throws StegoException with {@link StegoErrorKind#UNSUPPORTED_CARRIER_FORMAT} when the bytes are
     *         not a carrier of this type
     */
    SlotCarrier open(byte[] carrierBytes);

    static void checkWritable(SlotCarrier carrier, BitStream bits) {
        if (bits.length() > carrier.writableSlots()) {
            throw new StegoException(StegoErrorKind.CARRIER_TOO_SMALL,
                "Carrier holds " + carrier.writableSlots() + " slots, write needs " + bits.length());
        }
    }

    static void checkReadable(SlotCarrier carrier, long offset, int count) {
        if (offset < 0 || count < 0 || offset + count > carrier.readableSlots()) {
            throw new IndexOutOfBoundsException("slots " + offset + "+" + count + " of " + carrier.readableSlots());
        }
    }
}
