package com.shlokmestry.guard.accounts;

/**
 * Stored OAuth credentials for one linked provider account. The three token fields are
 * the ones kept encrypted at rest, see {@link TokenField}.
 */
public record OAuthAccount(
        String id,
        String userId,
        String provider,
        String providerAccountId,
        String accessToken,
        String refreshToken,
        String idToken,
        Long expiresAt,
        String tokenType,
        String scope
) {
    public OAuthAccount withId(String id) {
        return new OAuthAccount(id, userId, provider, providerAccountId, accessToken, refreshToken, idToken,
                expiresAt, tokenType, scope);
    }

    public OAuthAccount withAccessToken(String accessToken) {
        return new OAuthAccount(id, userId, provider, providerAccountId, accessToken, refreshToken, idToken,
                expiresAt, tokenType, scope);
    }

    public OAuthAccount withRefreshToken(String refreshToken) {
        return new OAuthAccount(id, userId, provider, providerAccountId, accessToken, refreshToken, idToken,
                expiresAt, tokenType, scope);
    }

    public OAuthAccount withIdToken(String idToken) {
        return new OAuthAccount(id, userId, provider, providerAccountId, accessToken, refreshToken, idToken,
                expiresAt, tokenType, scope);
    }

    // tokens stay out of logs
    @Override
    public String toString() {
        return "OAuthAccount[id=" + id + ", userId=" + userId + ", provider=" + provider + "]";
    }
}
