package com.shlokmestry.guard.tools;

import com.shlokmestry.guard.crypto.TokenCipher;

/**
 * Prints a new master key for {@code ENCRYPTION_KEY}.
 */
public final class EncryptionKeyTool {

    private EncryptionKeyTool() {
    }

    public static void main(String[] args) {
        System.out.println(TokenCipher.generateKey());
    }
}
