package com.shlokmestry.guard.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.bouncycastle.crypto.generators.SCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.shlokmestry.guard.config.EncryptionProps;

/**
 * Authenticated encryption of OAuth tokens before they are persisted.
 *
 * Every call derives a fresh AES-256 key from the master key and a random salt with scrypt
 * (N=16384, r=8, p=1), then encrypts with AES-GCM under a random IV. The result is laid out
 * as described in {@link EncryptedBlob}.
 *
 * The active master key is read under a read lock; {@link #activate(String)} swaps it under
 * the write lock so no call ever sees a partially rotated key.
 */
@Component
public class TokenCipher {

    private static final Logger log = LoggerFactory.getLogger(TokenCipher.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH = 32;
    private static final int TAG_LENGTH_BITS = EncryptedBlob.TAG_LENGTH * 8;
    private static final int SCRYPT_N = 16384;
    private static final int SCRYPT_R = 8;
    private static final int SCRYPT_P = 1;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final ReadWriteLock keyLock = new ReentrantReadWriteLock();
    private String activeKeyHex;

    public TokenCipher(EncryptionProps props) {
        this.activeKeyHex = props == null ? null : props.key();
    }

    /**
     * Encrypts a token with the active master key. Empty input is returned unchanged.
     *
     * @throws com.shlokmestry.guard.config.ConfigurationException if the master key is missing or malformed
     * @throws CryptoException if the cipher itself fails
     */
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return plaintext;
        }
        keyLock.readLock().lock();
        try {
            return encrypt(plaintext, MasterKey.fromHex(activeKeyHex));
        } finally {
            keyLock.readLock().unlock();
        }
    }

    /**
     * Decrypts a blob produced by {@link #encrypt(String)}. Empty input is returned unchanged.
     *
     * @throws CryptoException on malformed input, truncation, or a tag mismatch
     */
    public String decrypt(String blob) {
        if (blob == null || blob.isEmpty()) {
            return blob;
        }
        keyLock.readLock().lock();
        try {
            return decrypt(blob, MasterKey.fromHex(activeKeyHex));
        } finally {
            keyLock.readLock().unlock();
        }
    }

    public boolean isLikelyEncrypted(String value) {
        return EncryptedBlob.isPlausible(value);
    }

    /**
     * Re-encrypts a blob from {@code oldKeyHex} to {@code newKeyHex}. The active key is
     * neither read nor changed.
     */
    public String rotate(String blob, String oldKeyHex, String newKeyHex) {
        if (blob == null || blob.isEmpty()) {
            return blob;
        }
        MasterKey oldKey = MasterKey.fromHex(oldKeyHex);
        MasterKey newKey = MasterKey.fromHex(newKeyHex);
        return encrypt(decrypt(blob, oldKey), newKey);
    }

    /**
     * Makes {@code newKeyHex} the active master key. The key is validated before the swap.
     */
    public void activate(String newKeyHex) {
        MasterKey key = MasterKey.fromHex(newKeyHex);
        keyLock.writeLock().lock();
        try {
            activeKeyHex = newKeyHex;
        } finally {
            keyLock.writeLock().unlock();
        }
        log.info("encryption key activated fingerprint={}", key.fingerprint());
    }

    public String activeKeyFingerprint() {
        keyLock.readLock().lock();
        try {
            return MasterKey.fromHex(activeKeyHex).fingerprint();
        } finally {
            keyLock.readLock().unlock();
        }
    }

    /**
     * 32 random bytes, hex encoded; suitable as {@code ENCRYPTION_KEY}.
     */
    public static String generateKey() {
        byte[] key = new byte[MasterKey.LENGTH_BYTES];
        RANDOM.nextBytes(key);
        return HexFormat.of().formatHex(key);
    }

    private String encrypt(String plaintext, MasterKey masterKey) {
        byte[] salt = randomBytes(EncryptedBlob.SALT_LENGTH);
        byte[] iv = randomBytes(EncryptedBlob.IV_LENGTH);
        byte[] key = deriveKey(masterKey, salt);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] sealed = cipher.doFinal(pad(plaintext.getBytes(StandardCharsets.UTF_8)));

            // JCE appends the tag; the stored layout keeps it in the header
            int split = sealed.length - EncryptedBlob.TAG_LENGTH;
            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, split);
            byte[] tag = Arrays.copyOfRange(sealed, split, sealed.length);
            return new EncryptedBlob(salt, iv, tag, ciphertext).encode();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to encrypt token", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    private String decrypt(String encoded, MasterKey masterKey) {
        EncryptedBlob blob;
        try {
            blob = EncryptedBlob.decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Failed to decrypt token", e);
        }

        byte[] key = deriveKey(masterKey, blob.salt());
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH_BITS, blob.iv()));
            byte[] sealed = ByteBuffer.allocate(blob.ciphertext().length + blob.tag().length)
                    .put(blob.ciphertext())
                    .put(blob.tag())
                    .array();
            byte[] plaintext = cipher.doFinal(sealed);
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(plaintext, 0, unpaddedLength(plaintext)))
                    .toString();
        } catch (GeneralSecurityException | CharacterCodingException e) {
            throw new CryptoException("Failed to decrypt token", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /**
     * GCM does not pad, so short tokens are NUL-padded to one block to keep every blob at
     * least {@link EncryptedBlob#MIN_PLAUSIBLE_LENGTH} bytes. Longer tokens are sealed as is.
     */
    private static byte[] pad(byte[] plaintext) {
        if (plaintext.length > 0 && plaintext[plaintext.length - 1] == 0) {
            throw new IllegalArgumentException("Token must not end with a NUL character");
        }
        if (plaintext.length >= EncryptedBlob.MIN_CIPHERTEXT_LENGTH) {
            return plaintext;
        }
        return Arrays.copyOf(plaintext, EncryptedBlob.MIN_CIPHERTEXT_LENGTH);
    }

    private static int unpaddedLength(byte[] plaintext) {
        int end = plaintext.length;
        if (end != EncryptedBlob.MIN_CIPHERTEXT_LENGTH) {
            return end;
        }
        while (end > 0 && plaintext[end - 1] == 0) {
            end--;
        }
        return end;
    }

    private static byte[] deriveKey(MasterKey masterKey, byte[] salt) {
        byte[] password = masterKey.bytes();
        try {
            return SCrypt.generate(password, salt, SCRYPT_N, SCRYPT_R, SCRYPT_P, KEY_LENGTH);
        } finally {
            Arrays.fill(password, (byte) 0);
        }
    }

    private static byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        RANDOM.nextBytes(bytes);
        return bytes;
    }
}
