package com.shlokmestry.guard.accounts;

/**
 * Per-account encryption state. An account counts as corrupted if any token fails to
 * decrypt, else unencrypted if any token is plaintext, else encrypted if it has a token.
 */
public record EncryptionReport(
        int totalAccounts,
        int encryptedAccounts,
        int unencryptedAccounts,
        int corruptedAccounts
) {
    public boolean isClean() {
        return unencryptedAccounts == 0 && corruptedAccounts == 0;
    }
}
