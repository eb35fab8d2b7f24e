package com.fixcraft.veilforge;

import java.util.Arrays;

/**
 * Salt, nonce and derived key for a single seal or open call. The key is wiped on {@link #close()}.
 */
public final class KeyMaterial implements AutoCloseable {
    private final byte[] salt;
    private final byte[] nonce;
    private final byte[] key;
    private boolean closed;

    KeyMaterial(byte[] salt, byte[] nonce, byte[] key) {
        this.salt = salt;
        this.nonce = nonce;
        this.key = key;
    }

    /** Fresh random salt and nonce, key derived from the password. */
    public static KeyMaterial generate(String password, KdfParams params) {
        byte[] salt = Crypto.randomBytes(Constants.SALT_LEN);
        byte[] nonce = Crypto.randomBytes(Constants.NONCE_LEN);
        return new KeyMaterial(salt, nonce, KeyDerivation.deriveKey(password, salt, params));
    }

    public static KeyMaterial recover(String password, byte[] salt, byte[] nonce, KdfParams params) {
        return new KeyMaterial(salt.clone(), nonce.clone(), KeyDerivation.deriveKey(password, salt, params));
    }

    public byte[] salt() {
        return salt.clone();
    }

    public byte[] nonce() {
        return nonce.clone();
    }

    byte[] key() {
        if (closed) {
            throw new IllegalStateException("key material already wiped");
        }
        return key;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        Arrays.fill(key, (byte) 0);
        closed = true;
    }
}
