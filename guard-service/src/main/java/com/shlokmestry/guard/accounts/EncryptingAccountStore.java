package com.shlokmestry.guard.accounts;

import java.util.List;
import java.util.Optional;

/**
 * {@link AccountStore} that encrypts token fields on the way in and decrypts them on the
 * way out, so callers only ever handle plaintext.
 */
public class EncryptingAccountStore implements AccountStore {

    private final AccountStore delegate;
    private final AccountTokenInterceptor interceptor;

    public EncryptingAccountStore(AccountStore delegate, AccountTokenInterceptor interceptor) {
        this.delegate = delegate;
        this.interceptor = interceptor;
    }

    @Override
    public OAuthAccount create(OAuthAccount account) {
        return interceptor.decrypt(delegate.create(interceptor.encrypt(account)));
    }

    @Override
    public int createMany(List<OAuthAccount> accounts) {
        return delegate.createMany(interceptor.encrypt(accounts));
    }

    @Override
    public OAuthAccount update(String id, AccountPatch patch) {
        return interceptor.decrypt(delegate.update(id, interceptor.encrypt(patch)));
    }

    @Override
    public OAuthAccount upsert(String id, OAuthAccount create, AccountPatch update) {
        return interceptor.decrypt(delegate.upsert(id, interceptor.encrypt(create), interceptor.encrypt(update)));
    }

    @Override
    public int updateMany(String userId, AccountPatch patch) {
        return delegate.updateMany(userId, interceptor.encrypt(patch));
    }

    @Override
    public Optional<OAuthAccount> findById(String id) {
        return delegate.findById(id).map(interceptor::decrypt);
    }

    @Override
    public Optional<OAuthAccount> findByProvider(String provider, String providerAccountId) {
        return delegate.findByProvider(provider, providerAccountId).map(interceptor::decrypt);
    }

    @Override
    public List<OAuthAccount> findByUserId(String userId) {
        return interceptor.decrypt(delegate.findByUserId(userId));
    }

    @Override
    public List<OAuthAccount> findAll() {
        return interceptor.decrypt(delegate.findAll());
    }
}
