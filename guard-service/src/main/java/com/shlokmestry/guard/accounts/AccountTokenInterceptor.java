package com.shlokmestry.guard.accounts;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.shlokmestry.guard.crypto.CryptoException;
import com.shlokmestry.guard.crypto.TokenCipher;
import com.shlokmestry.guard.observability.CredentialMetrics;

/**
 * Applies {@link TokenCipher} to the {@link TokenField}s of account writes and reads.
 *
 * Writes: every non-empty token field that does not already look encrypted is encrypted;
 * failures propagate. Reads: every field that looks encrypted is decrypted; a field that
 * fails to decrypt becomes null and is logged, the rest of the record is returned.
 */
@Component
public class AccountTokenInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AccountTokenInterceptor.class);

    private final TokenCipher cipher;
    private final CredentialMetrics metrics;

    public AccountTokenInterceptor(TokenCipher cipher, CredentialMetrics metrics) {
        this.cipher = cipher;
        this.metrics = metrics;
    }

    public OAuthAccount encrypt(OAuthAccount account) {
        if (account == null) {
            return null;
        }
        OAuthAccount result = account;
        for (TokenField field : TokenField.values()) {
            String value = field.get(result);
            if (needsEncryption(value)) {
                result = field.set(result, cipher.encrypt(value));
            }
        }
        return result;
    }

    public AccountPatch encrypt(AccountPatch patch) {
        if (patch == null) {
            return null;
        }
        AccountPatch result = patch;
        for (TokenField field : TokenField.values()) {
            String value = field.get(result);
            if (needsEncryption(value)) {
                result = field.set(result, cipher.encrypt(value));
            }
        }
        return result;
    }

    public List<OAuthAccount> encrypt(List<OAuthAccount> accounts) {
        return accounts.stream().map(this::encrypt).toList();
    }

    public OAuthAccount decrypt(OAuthAccount account) {
        if (account == null) {
            return null;
        }
        OAuthAccount result = account;
        for (TokenField field : TokenField.values()) {
            String value = field.get(result);
            if (!cipher.isLikelyEncrypted(value)) {
                continue;
            }
            try {
                result = field.set(result, cipher.decrypt(value));
            } catch (CryptoException e) {
                metrics.decryptFailure(field.columnName());
                log.error("token decrypt failed field={} accountId={}; field cleared", field.columnName(), account.id(), e);
                result = field.set(result, null);
            }
        }
        return result;
    }

    public List<OAuthAccount> decrypt(List<OAuthAccount> accounts) {
        return accounts.stream().map(this::decrypt).toList();
    }

    private boolean needsEncryption(String value) {
        return value != null && !value.isEmpty() && !cipher.isLikelyEncrypted(value);
    }
}
