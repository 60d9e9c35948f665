package com.shlokmestry.guard.accounts;

import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * The account fields holding OAuth secrets.
 */
public enum TokenField {
    ACCESS_TOKEN("access_token",
            OAuthAccount::accessToken, OAuthAccount::withAccessToken,
            AccountPatch::accessToken, AccountPatch::withAccessToken),
    REFRESH_TOKEN("refresh_token",
            OAuthAccount::refreshToken, OAuthAccount::withRefreshToken,
            AccountPatch::refreshToken, AccountPatch::withRefreshToken),
    ID_TOKEN("id_token",
            OAuthAccount::idToken, OAuthAccount::withIdToken,
            AccountPatch::idToken, AccountPatch::withIdToken);

    private final String columnName;
    private final Function<OAuthAccount, String> accountGetter;
    private final BiFunction<OAuthAccount, String, OAuthAccount> accountSetter;
    private final Function<AccountPatch, String> patchGetter;
    private final BiFunction<AccountPatch, String, AccountPatch> patchSetter;

    TokenField(String columnName,
               Function<OAuthAccount, String> accountGetter,
               BiFunction<OAuthAccount, String, OAuthAccount> accountSetter,
               Function<AccountPatch, String> patchGetter,
               BiFunction<AccountPatch, String, AccountPatch> patchSetter) {
        this.columnName = columnName;
        this.accountGetter = accountGetter;
        this.accountSetter = accountSetter;
        this.patchGetter = patchGetter;
        this.patchSetter = patchSetter;
    }

    public String columnName() {
        return columnName;
    }

    public String get(OAuthAccount account) {
        return accountGetter.apply(account);
    }

    public OAuthAccount set(OAuthAccount account, String value) {
        return accountSetter.apply(account, value);
    }

    public String get(AccountPatch patch) {
        return patchGetter.apply(patch);
    }

    public AccountPatch set(AccountPatch patch, String value) {
        return patchSetter.apply(patch, value);
    }
}
