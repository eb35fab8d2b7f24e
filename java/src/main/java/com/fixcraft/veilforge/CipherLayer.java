package com.fixcraft.veilforge;

/**
 * AES-256-GCM sealing of payloads. Sealed layout: {@code salt(16) || nonce(12) || ciphertext || tag(16)}.
 */
public final class CipherLayer {
    private CipherLayer() {}

    public static int sealedLength(int plaintextLength) {
        return plaintextLength + Constants.SEALED_OVERHEAD;
    }

    public static byte[] seal(byte[] plaintext, String password, KdfParams params) {
        try (KeyMaterial keys = KeyMaterial.generate(password, params)) {
            return seal(plaintext, keys);
        }
    }

    static byte[] seal(byte[] plaintext, KeyMaterial keys) {
        byte[] body = Crypto.aesGcmEncryptWithIv(keys.key(), keys.nonce(), plaintext, Constants.PAYLOAD_AAD);
        return Format.concat(keys.salt(), keys.nonce(), body);
    }

    /**
     * Opens a sealed blob. Any failure, short input included, surfaces as
     * {@link StegoErrorKind#WRONG_PASSWORD_OR_CORRUPTION}.
     */
    public static byte[] open(byte[] sealed, String password, KdfParams params) {
        if (sealed.length < Constants.SEALED_OVERHEAD) {
            throw StegoException.wrongPasswordOrCorruption();
        }
        byte[] salt = new byte[Constants.SALT_LEN];
        byte[] nonce = new byte[Constants.NONCE_LEN];
        byte[] body = new byte[sealed.length - Constants.SALT_LEN - Constants.NONCE_LEN];
        System.arraycopy(sealed, 0, salt, 0, salt.length);
        System.arraycopy(sealed, salt.length, nonce, 0, nonce.length);
        System.arraycopy(sealed, salt.length + nonce.length, body, 0, body.length);
        try (KeyMaterial keys = KeyMaterial.recover(password, salt, nonce, params)) {
            return Crypto.aesGcmDecryptWithIv(keys.key(), nonce, body, Constants.PAYLOAD_AAD);
        } catch (IllegalArgumentException exc) {
            StegoLog.debug("cipher", "AEAD open rejected the payload");
            throw StegoException.wrongPasswordOrCorruption();
        }
    }
}
