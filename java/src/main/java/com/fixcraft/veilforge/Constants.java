package com.fixcraft.veilforge;

import java.nio.charset.StandardCharsets;

public final class Constants {
    private Constants() {}

    public static final byte[] CONTAINER_MAGIC = "VFSTEGO1".getBytes(StandardCharsets.US_ASCII);
    public static final String CONTAINER_VERSION = "1";
    public static final String CIPHER_NAME = "aes-256-gcm";

    public static final int SALT_LEN = 16;
    public static final int NONCE_LEN = 12;
    public static final int TAG_LEN = 16;
    public static final int KEY_LEN = 32;
    public static final int SEALED_OVERHEAD = SALT_LEN + NONCE_LEN + TAG_LEN;

    public static final byte[] PAYLOAD_AAD = "veilforge.payload.v1".getBytes(StandardCharsets.US_ASCII);

    public static final String KDF_PBKDF2 = "pbkdf2-sha256";
    public static final String KDF_ARGON2ID = "argon2id";
    public static final int PBKDF2_MIN_ITERS = 1000;
    // upper bounds also apply to parameters read back from metadata, which is not authenticated
    public static final int PBKDF2_MAX_ITERS = 2_000_000;
    public static final int ARGON2_DEFAULT_ITERS = 3;
    public static final int ARGON2_DEFAULT_MEMORY_KIB = 64 * 1024;
    public static final int ARGON2_DEFAULT_PARALLELISM = 1;
    public static final int ARGON2_MAX_ITERS = 16;
    public static final int ARGON2_MAX_MEMORY_KIB = 256 * 1024;
    public static final int ARGON2_MAX_PARALLELISM = 16;

    public static final String META_VERSION = "version";
    public static final String META_CIPHER = "cipher";
    public static final String META_ENCRYPTED = "encrypted";
    public static final String META_CONTENT_TYPE = "content_type";
    public static final String META_FILENAME = "original_filename";
    public static final String META_CHECKSUM = "checksum";
    public static final String META_REDUNDANCY = "redundancy";
    public static final String META_KDF = "kdf";
    public static final String META_KDF_ITERS = "kdf_iterations";
    public static final String META_KDF_MEMORY = "kdf_memory_kib";
    public static final String META_KDF_PARALLELISM = "kdf_parallelism";

    // Stored as original_filename for text messages; never a legal file name on common filesystems.
    public static final String TEXT_FILENAME_SENTINEL = "<text>";

    public static final int HEADER_MARKER = 0x56;
    public static final int HEADER_BYTES = 6;
    public static final int HEADER_COPIES = 7;
    public static final int HEADER_SLOTS = HEADER_BYTES * 8 * HEADER_COPIES;

    public static final int MAX_REDUNDANCY = 255;
    public static final int MAX_METADATA_LEN = 64 * 1024;
    public static final int MAX_CONTAINER_LEN = Integer.MAX_VALUE - 64;

    public static final int VIDEO_MASK_BITS = 3;
    public static final int AUDIO_SAMPLE_BITS = 16;

    public static final byte[] DOCUMENT_TRAILER_MAGIC = "VFDOC1".getBytes(StandardCharsets.US_ASCII);
}
