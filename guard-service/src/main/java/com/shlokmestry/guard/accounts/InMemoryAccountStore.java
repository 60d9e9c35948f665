package com.shlokmestry.guard.accounts;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local account store. Values are kept exactly as written, so wrapped by
 * {@link EncryptingAccountStore} it holds ciphertext only.
 */
public class InMemoryAccountStore implements AccountStore {

    private final ConcurrentHashMap<String, OAuthAccount> accounts = new ConcurrentHashMap<>();

    @Override
    public OAuthAccount create(OAuthAccount account) {
        OAuthAccount stored = account.id() == null ? account.withId(UUID.randomUUID().toString()) : account;
        OAuthAccount existing = accounts.putIfAbsent(stored.id(), stored);
        if (existing != null) {
            throw new IllegalArgumentException("Account already exists: " + stored.id());
        }
        return stored;
    }

    @Override
    public int createMany(List<OAuthAccount> batch) {
        int created = 0;
        for (OAuthAccount account : batch) {
            create(account);
            created++;
        }
        return created;
    }

    @Override
    public OAuthAccount update(String id, AccountPatch patch) {
        OAuthAccount updated = accounts.computeIfPresent(id, (k, current) -> patch.applyTo(current));
        if (updated == null) {
            throw new AccountNotFoundException(id);
        }
        return updated;
    }

    @Override
    public OAuthAccount upsert(String id, OAuthAccount create, AccountPatch update) {
        return accounts.compute(id, (k, current) -> current == null ? create.withId(id) : update.applyTo(current));
    }

    @Override
    public int updateMany(String userId, AccountPatch patch) {
        int updated = 0;
        for (OAuthAccount account : findByUserId(userId)) {
            if (accounts.computeIfPresent(account.id(), (k, current) -> patch.applyTo(current)) != null) {
                updated++;
            }
        }
        return updated;
    }

    @Override
    public Optional<OAuthAccount> findById(String id) {
        return Optional.ofNullable(accounts.get(id));
    }

    @Override
    public Optional<OAuthAccount> findByProvider(String provider, String providerAccountId) {
        return accounts.values().stream()
                .filter(a -> Objects.equals(a.provider(), provider))
                .filter(a -> Objects.equals(a.providerAccountId(), providerAccountId))
                .findFirst();
    }

    @Override
    public List<OAuthAccount> findByUserId(String userId) {
        return accounts.values().stream()
                .filter(a -> Objects.equals(a.userId(), userId))
                .sorted(Comparator.comparing(OAuthAccount::id))
                .toList();
    }

    @Override
    public List<OAuthAccount> findAll() {
        List<OAuthAccount> all = new ArrayList<>(accounts.values());
        all.sort(Comparator.comparing(OAuthAccount::id));
        return all;
    }
}
