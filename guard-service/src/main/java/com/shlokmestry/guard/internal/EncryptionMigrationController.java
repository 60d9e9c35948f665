package com.shlokmestry.guard.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.guard.accounts.EncryptionReport;
import com.shlokmestry.guard.accounts.TokenEncryptionMigration;

@RestController
@RequestMapping("/internal/encryption")
public class EncryptionMigrationController {

    private static final Logger log = LoggerFactory.getLogger(EncryptionMigrationController.class);

    private final TokenEncryptionMigration migration;

    public EncryptionMigrationController(TokenEncryptionMigration migration) {
        this.migration = migration;
    }

    @GetMapping("/status")
    public EncryptionReport status() {
        return migration.validate();
    }

    @PostMapping("/migrate")
    public MigrationResponse migrate() {
        EncryptionReport before = migration.validate();
        // an account with a corrupted token may still hold plaintext ones
        int updated = migration.encryptExisting();
        EncryptionReport after = migration.validate();
        if (!after.isClean()) {
            log.warn("token migration left issues unencrypted={} corrupted={}",
                    after.unencryptedAccounts(), after.corruptedAccounts());
        }
        return new MigrationResponse(updated, before, after);
    }
}
