package com.shlokmestry.guard.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

import com.shlokmestry.guard.config.ConfigurationException;

/**
 * The 32-byte secret every token key is derived from. Parsed from 64 hex characters.
 */
public final class MasterKey {

    public static final int LENGTH_BYTES = 32;
    public static final int HEX_LENGTH = LENGTH_BYTES * 2;

    private static final String GENERATE_HINT = "Generate with: openssl rand -hex 32";

    private final byte[] bytes;

    private MasterKey(byte[] bytes) {
        this.bytes = bytes;
    }

    public static MasterKey fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new ConfigurationException(
                    "ENCRYPTION_KEY is required for token encryption. " + GENERATE_HINT);
        }
        if (hex.length() != HEX_LENGTH) {
            throw new ConfigurationException(
                    "ENCRYPTION_KEY must be exactly 32 bytes (64 hex characters). " + GENERATE_HINT);
        }
        try {
            return new MasterKey(HexFormat.of().parseHex(hex));
        } catch (IllegalArgumentException e) {
            // the parser message echoes the offending characters
            throw new ConfigurationException("ENCRYPTION_KEY must be hexadecimal. " + GENERATE_HINT);
        }
    }

    byte[] bytes() {
        return bytes.clone();
    }

    /**
     * First 8 bytes of SHA-256 over the key, hex encoded. Safe to log and compare.
     */
    public String fingerprint() {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(bytes);
            return HexFormat.of().formatHex(digest, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MasterKey other)) return false;
        return MessageDigest.isEqual(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "MasterKey[fingerprint=" + fingerprint() + "]";
    }
}
