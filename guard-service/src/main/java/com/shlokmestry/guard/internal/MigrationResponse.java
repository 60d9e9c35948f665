package com.shlokmestry.guard.internal;

import com.shlokmestry.guard.accounts.EncryptionReport;

public record MigrationResponse(
        int updatedAccounts,
        EncryptionReport before,
        EncryptionReport after
) {}
