package com.fixcraft.veilforge;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

/**
 * Salted, deliberately slow password-to-key derivation: PBKDF2-HMAC-SHA256 or Argon2id.
 * An empty password is accepted here; rejecting weak passwords is the caller's job.
 */
public final class KeyDerivation {
    private KeyDerivation() {}

    public static byte[] deriveKey(String password, byte[] salt, KdfParams params) {
        if (salt == null || salt.length != Constants.SALT_LEN) {
            throw new IllegalArgumentException("salt must be " + Constants.SALT_LEN + " bytes");
        }
        byte[] pw = (password == null ? "" : password).getBytes(StandardCharsets.UTF_8);
        try {
            if (params.isArgon2()) {
                return argon2id(pw, salt, params);
            }
            return Crypto.pbkdf2HmacSha256(pw, salt, params.iterations(), Constants.KEY_LEN);
        } finally {
            Arrays.fill(pw, (byte) 0);
        }
    }

    private static byte[] argon2id(byte[] password, byte[] salt, KdfParams params) {
        Argon2Parameters argon = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
            .withVersion(Argon2Parameters.ARGON2_VERSION_13)
            .withIterations(params.iterations())
            .withMemoryAsKB(params.memoryKib())
            .withParallelism(params.parallelism())
            .withSalt(salt)
            .build();
        Argon2BytesGenerator generator = new Argon2BytesGenerator();
        generator.init(argon);
        byte[] out = new byte[Constants.KEY_LEN];
        generator.generateBytes(password, out);
        return out;
    }
}
