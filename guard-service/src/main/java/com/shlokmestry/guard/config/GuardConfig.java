package com.shlokmestry.guard.config;

import java.time.Clock;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import com.shlokmestry.guard.accounts.AccountStore;
import com.shlokmestry.guard.accounts.AccountTokenInterceptor;
import com.shlokmestry.guard.accounts.EncryptingAccountStore;
import com.shlokmestry.guard.accounts.InMemoryAccountStore;
import com.shlokmestry.guard.accounts.TokenEncryptionMigration;
import com.shlokmestry.guard.crypto.TokenCipher;
import com.shlokmestry.guard.ratelimit.storage.RateLimitStorage;
import com.shlokmestry.guard.ratelimit.storage.RateLimitStorageFactory;
import com.shlokmestry.guard.ratelimit.storage.StorageBackend;

@Configuration
public class GuardConfig {

    @Bean
    @ConditionalOnMissingBean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    StorageBackend storageBackend(RateLimitProps props, AppProps appProps) {
        return StorageBackend.resolve(props, appProps.deploymentMode());
    }

    @Bean
    RateLimitStorage rateLimitStorage(RateLimitStorageFactory factory, StorageBackend backend) {
        return factory.create(backend);
    }

    /**
     * Raw account persistence; holds ciphertext. Replace with a database-backed store by
     * declaring a bean of the same name.
     */
    @Bean
    @ConditionalOnMissingBean(name = "accountRecords")
    AccountStore accountRecords() {
        return new InMemoryAccountStore();
    }

    @Bean
    @Primary
    AccountStore accountStore(@Qualifier("accountRecords") AccountStore accountRecords,
                              AccountTokenInterceptor interceptor) {
        return new EncryptingAccountStore(accountRecords, interceptor);
    }

    @Bean
    TokenEncryptionMigration tokenEncryptionMigration(@Qualifier("accountRecords") AccountStore accountRecords,
                                                      TokenCipher cipher,
                                                      AppProps appProps,
                                                      EncryptionProps encryptionProps) {
        return new TokenEncryptionMigration(
                accountRecords,
                cipher,
                appProps.deploymentMode(),
                encryptionProps.migration().confirmed());
    }
}
