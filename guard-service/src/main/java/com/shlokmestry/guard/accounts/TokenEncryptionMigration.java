package com.shlokmestry.guard.accounts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shlokmestry.guard.config.DeploymentMode;
import com.shlokmestry.guard.crypto.CryptoException;
import com.shlokmestry.guard.crypto.TokenCipher;

/**
 * One-off encryption of tokens written before the interceptor was in place. Works on the
 * raw store, never through {@link EncryptingAccountStore}.
 */
public class TokenEncryptionMigration {

    private static final Logger log = LoggerFactory.getLogger(TokenEncryptionMigration.class);

    private final AccountStore rawStore;
    private final TokenCipher cipher;
    private final DeploymentMode mode;
    private final boolean confirmed;

    public TokenEncryptionMigration(AccountStore rawStore, TokenCipher cipher, DeploymentMode mode, boolean confirmed) {
        this.rawStore = rawStore;
        this.cipher = cipher;
        this.mode = mode;
        this.confirmed = confirmed;
    }

    /**
     * Encrypts every plaintext token in place.
     *
     * @return number of accounts that were updated
     * @throws MigrationNotConfirmedException in production without explicit confirmation
     */
    public int encryptExisting() {
        if (mode.isProduction() && !confirmed) {
            throw new MigrationNotConfirmedException();
        }
        log.info("token migration started mode={}", mode);

        int updated = 0;
        for (OAuthAccount account : rawStore.findAll()) {
            AccountPatch patch = new AccountPatch(null, null, null, null, null, null);
            for (TokenField field : TokenField.values()) {
                String value = field.get(account);
                if (value != null && !value.isEmpty() && !cipher.isLikelyEncrypted(value)) {
                    patch = field.set(patch, cipher.encrypt(value));
                }
            }
            if (!patch.isEmpty()) {
                rawStore.update(account.id(), patch);
                updated++;
            }
        }

        log.info("token migration complete updatedAccounts={}", updated);
        return updated;
    }

    public EncryptionReport validate() {
        int total = 0;
        int encrypted = 0;
        int unencrypted = 0;
        int corrupted = 0;

        for (OAuthAccount account : rawStore.findAll()) {
            total++;
            boolean hasEncrypted = false;
            boolean hasPlaintext = false;
            boolean hasCorrupted = false;

            for (TokenField field : TokenField.values()) {
                String value = field.get(account);
                if (value == null || value.isEmpty()) {
                    continue;
                }
                if (!cipher.isLikelyEncrypted(value)) {
                    hasPlaintext = true;
                    continue;
                }
                try {
                    cipher.decrypt(value);
                    hasEncrypted = true;
                } catch (CryptoException e) {
                    log.debug("token validation failed field={} accountId={}", field.columnName(), account.id());
                    hasCorrupted = true;
                }
            }

            if (hasCorrupted) {
                corrupted++;
            } else if (hasPlaintext) {
                unencrypted++;
            } else if (hasEncrypted) {
                encrypted++;
            }
        }
        return new EncryptionReport(total, encrypted, unencrypted, corrupted);
    }
}
