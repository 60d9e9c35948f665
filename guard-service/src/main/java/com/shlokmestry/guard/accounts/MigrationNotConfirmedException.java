package com.shlokmestry.guard.accounts;

public class MigrationNotConfirmedException extends RuntimeException {
    public MigrationNotConfirmedException() {
        super("Set app.encryption.migration.confirmed=true (CONFIRM_ENCRYPTION_MIGRATION) to migrate in production");
    }
}
