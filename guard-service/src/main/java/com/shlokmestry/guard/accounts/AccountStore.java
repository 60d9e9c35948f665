package com.shlokmestry.guard.accounts;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of linked OAuth accounts. Write methods that return a record return it as
 * stored after the write.
 */
public interface AccountStore {
    OAuthAccount create(OAuthAccount account);

    /** @return number of accounts created */
    int createMany(List<OAuthAccount> accounts);

    /** @throws AccountNotFoundException if no account has this id */
    OAuthAccount update(String id, AccountPatch patch);

    OAuthAccount upsert(String id, OAuthAccount create, AccountPatch update);

    /** @return number of accounts of {@code userId} that were updated */
    int updateMany(String userId, AccountPatch patch);

    Optional<OAuthAccount> findById(String id);

    Optional<OAuthAccount> findByProvider(String provider, String providerAccountId);

    List<OAuthAccount> findByUserId(String userId);

    List<OAuthAccount> findAll();
}
