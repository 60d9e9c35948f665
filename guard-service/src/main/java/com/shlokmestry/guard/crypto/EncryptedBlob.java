package com.shlokmestry.guard.crypto;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Base64;

/**
 * At-rest form of an encrypted token.
 *
 * Format: [salt(32 bytes)][iv(16 bytes)][tag(16 bytes)][ciphertext], Base64 encoded.
 */
public record EncryptedBlob(
        byte[] salt,
        byte[] iv,
        byte[] tag,
        byte[] ciphertext
) {
    public static final int SALT_LENGTH = 32;
    public static final int IV_LENGTH = 16;
    public static final int TAG_LENGTH = 16;
    public static final int HEADER_LENGTH = SALT_LENGTH + IV_LENGTH + TAG_LENGTH;

    /** Plaintexts shorter than this are NUL-padded before sealing. */
    public static final int MIN_CIPHERTEXT_LENGTH = 16;

    /** Header plus one AES block; anything shorter is treated as plaintext. */
    public static final int MIN_PLAUSIBLE_LENGTH = HEADER_LENGTH + MIN_CIPHERTEXT_LENGTH;

    public String encode() {
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH + ciphertext.length);
        buffer.put(salt);
        buffer.put(iv);
        buffer.put(tag);
        buffer.put(ciphertext);
        return Base64.getEncoder().encodeToString(buffer.array());
    }

    /**
     * Splits a Base64 blob into its parts.
     *
     * @throws IllegalArgumentException if the value is not Base64 or has no room for ciphertext
     */
    public static EncryptedBlob decode(String encoded) {
        byte[] decoded = Base64.getDecoder().decode(encoded);
        if (decoded.length <= HEADER_LENGTH) {
            throw new IllegalArgumentException("Encrypted value is truncated");
        }
        return new EncryptedBlob(
                Arrays.copyOfRange(decoded, 0, SALT_LENGTH),
                Arrays.copyOfRange(decoded, SALT_LENGTH, SALT_LENGTH + IV_LENGTH),
                Arrays.copyOfRange(decoded, SALT_LENGTH + IV_LENGTH, HEADER_LENGTH),
                Arrays.copyOfRange(decoded, HEADER_LENGTH, decoded.length));
    }

    /**
     * Heuristic: the value decodes as Base64 and is long enough to hold a header and one
     * block of ciphertext. Not a cryptographic check.
     */
    public static boolean isPlausible(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        try {
            return Base64.getDecoder().decode(value).length >= MIN_PLAUSIBLE_LENGTH;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
