package com.shlokmestry.guard.accounts;

/**
 * Partial update of an {@link OAuthAccount}. A null component means the field is not
 * part of the write and keeps its stored value.
 */
public record AccountPatch(
        String accessToken,
        String refreshToken,
        String idToken,
        Long expiresAt,
        String tokenType,
        String scope
) {
    public static AccountPatch tokens(String accessToken, String refreshToken, String idToken) {
        return new AccountPatch(accessToken, refreshToken, idToken, null, null, null);
    }

    public AccountPatch withAccessToken(String accessToken) {
        return new AccountPatch(accessToken, refreshToken, idToken, expiresAt, tokenType, scope);
    }

    public AccountPatch withRefreshToken(String refreshToken) {
        return new AccountPatch(accessToken, refreshToken, idToken, expiresAt, tokenType, scope);
    }

    public AccountPatch withIdToken(String idToken) {
        return new AccountPatch(accessToken, refreshToken, idToken, expiresAt, tokenType, scope);
    }

    public boolean isEmpty() {
        return accessToken == null && refreshToken == null && idToken == null
                && expiresAt == null && tokenType == null && scope == null;
    }

    public OAuthAccount applyTo(OAuthAccount account) {
        return new OAuthAccount(
                account.id(),
                account.userId(),
                account.provider(),
                account.providerAccountId(),
                accessToken != null ? accessToken : account.accessToken(),
                refreshToken != null ? refreshToken : account.refreshToken(),
                idToken != null ? idToken : account.idToken(),
                expiresAt != null ? expiresAt : account.expiresAt(),
                tokenType != null ? tokenType : account.tokenType(),
                scope != null ? scope : account.scope());
    }

    @Override
    public String toString() {
        return "AccountPatch[expiresAt=" + expiresAt + ", tokenType=" + tokenType + ", scope=" + scope + "]";
    }
}
