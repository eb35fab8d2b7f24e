package com.fixcraft.veilforge;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

public final class Crypto {
    private static final SecureRandom RNG = new SecureRandom();
    private static final char[] HEX = "0123456789abcdef".toCharArray();
    private static final ThreadLocal<Cipher> AES_GCM = ThreadLocal.withInitial(Crypto::initAesGcmCipher);
    private static final ThreadLocal<Mac> HMAC_SHA256 = ThreadLocal.withInitial(Crypto::initHmacInstance);
    private static final ThreadLocal<SecretKeyFactory> PBKDF2_FACTORY = ThreadLocal.withInitial(Crypto::initPbkdf2Factory);

    private Crypto() {}

    public static byte[] randomBytes(int length) {
        byte[] out = new byte[length];
        if (length > 0) {
            RNG.nextBytes(out);
        }
        return out;
    }

    public static String sha256Hex(byte[] data) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(data);
            char[] out = new char[digest.length * 2];
            for (int i = 0; i < digest.length; i++) {
                out[i * 2] = HEX[(digest[i] >>> 4) & 0x0F];
                out[i * 2 + 1] = HEX[digest[i] & 0x0F];
            }
            return new String(out);
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("SHA-256 unavailable", exc);
        }
    }

    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.US_ASCII), b.getBytes(StandardCharsets.US_ASCII));
    }

    public static byte[] pbkdf2HmacSha256(byte[] password, byte[] salt, int iterations, int length) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be > 0");
        }
        if (length <= 0) {
            throw new IllegalArgumentException("length must be > 0");
        }
        byte[] fast = pbkdf2HmacSha256Native(password, salt, iterations, length);
        if (fast != null) {
            return fast;
        }
        return pbkdf2HmacSha256Slow(password, salt, iterations, length);
    }

    // JCE rejects empty passwords and cannot represent bytes that are not valid UTF-8.
    private static byte[] pbkdf2HmacSha256Native(byte[] password, byte[] salt, int iterations, int length) {
        if (password == null || password.length == 0) {
            return null;
        }
        String pwStr = new String(password, StandardCharsets.UTF_8);
        byte[] roundTrip = pwStr.getBytes(StandardCharsets.UTF_8);
        if (!Arrays.equals(roundTrip, password)) {
            Arrays.fill(roundTrip, (byte) 0);
            return null;
        }
        Arrays.fill(roundTrip, (byte) 0);
        char[] chars = pwStr.toCharArray();
        PBEKeySpec spec = new PBEKeySpec(chars, salt, iterations, length * 8);
        try {
            SecretKeyFactory factory = PBKDF2_FACTORY.get();
            if (factory == null) {
                return null;
            }
            return factory.generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException exc) {
            return null;
        } finally {
            spec.clearPassword();
            Arrays.fill(chars, '\0');
        }
    }

    private static byte[] pbkdf2HmacSha256Slow(byte[] password, byte[] salt, int iterations, int length) {
        int hashLen = 32;
        int blocks = (length + hashLen - 1) / hashLen;
        byte[] output = new byte[length];
        for (int block = 1; block <= blocks; block++) {
            byte[] t = pbkdf2Block(password, salt, iterations, block);
            int offset = (block - 1) * hashLen;
            int toCopy = Math.min(hashLen, length - offset);
            System.arraycopy(t, 0, output, offset, toCopy);
            Arrays.fill(t, (byte) 0);
        }
        return output;
    }

    private static byte[] pbkdf2Block(byte[] password, byte[] salt, int iterations, int blockIndex) {
        byte[] blockSalt = new byte[salt.length + 4];
        System.arraycopy(salt, 0, blockSalt, 0, salt.length);
        blockSalt[blockSalt.length - 4] = (byte) ((blockIndex >> 24) & 0xFF);
        blockSalt[blockSalt.length - 3] = (byte) ((blockIndex >> 16) & 0xFF);
        blockSalt[blockSalt.length - 2] = (byte) ((blockIndex >> 8) & 0xFF);
        blockSalt[blockSalt.length - 1] = (byte) (blockIndex & 0xFF);

        Mac mac = initHmac(password);
        byte[] u = new byte[32];
        byte[] t = new byte[32];
        try {
            mac.update(blockSalt);
            mac.doFinal(u, 0);
            System.arraycopy(u, 0, t, 0, u.length);
            for (int i = 1; i < iterations; i++) {
                mac.update(u);
                mac.doFinal(u, 0);
                for (int j = 0; j < t.length; j++) {
                    t[j] ^= u[j];
                }
            }
            return t;
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("PBKDF2 failed", exc);
        } finally {
            Arrays.fill(u, (byte) 0);
        }
    }

    static Mac initHmac(byte[] key) {
        try {
            Mac mac = HMAC_SHA256.get();
            // HmacSHA256 refuses an empty key spec; a single zero byte hashes to the same HMAC key.
            byte[] effective = key.length == 0 ? new byte[1] : key;
            mac.init(new SecretKeySpec(effective, "HmacSHA256"));
            return mac;
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("HMAC init failed", exc);
        }
    }

    public static byte[] aesGcmEncryptWithIv(byte[] key, byte[] iv, byte[] plaintext, byte[] aad) {
        try {
            Cipher cipher = AES_GCM.get();
            GCMParameterSpec spec = new GCMParameterSpec(Constants.TAG_LEN * 8, iv);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), spec);
            if (aad != null && aad.length > 0) {
                cipher.updateAAD(aad);
            }
            return cipher.doFinal(plaintext);
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("AES-GCM encrypt failed", exc);
        }
    }

    public static byte[] aesGcmDecryptWithIv(byte[] key, byte[] iv, byte[] ciphertext, byte[] aad) {
        if (ciphertext.length < Constants.TAG_LEN) {
            throw new IllegalArgumentException("AEAD payload too short");
        }
        try {
            Cipher cipher = AES_GCM.get();
            GCMParameterSpec spec = new GCMParameterSpec(Constants.TAG_LEN * 8, iv);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), spec);
            if (aad != null && aad.length > 0) {
                cipher.updateAAD(aad);
            }
            return cipher.doFinal(ciphertext);
        } catch (GeneralSecurityException exc) {
            throw new IllegalArgumentException("Bad password or corrupted payload", exc);
        }
    }

    private static Cipher initAesGcmCipher() {
        try {
            return Cipher.getInstance("AES/GCM/NoPadding");
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("AES-GCM unavailable", exc);
        }
    }

    private static Mac initHmacInstance() {
        try {
            return Mac.getInstance("HmacSHA256");
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("HMAC unavailable", exc);
        }
    }

    private static SecretKeyFactory initPbkdf2Factory() {
        try {
            return SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
        } catch (GeneralSecurityException exc) {
            return null;
        }
    }
}
