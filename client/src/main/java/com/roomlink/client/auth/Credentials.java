package com.roomlink.client.auth;

import lombok.ToString;
import lombok.Value;
import lombok.With;

/**
 * What the client logs in with: a nick, plus an account and password for account logins.
 */
@Value
public class Credentials {
    @With
    String nick;

    /**
     * Account name, null for guest logins.
     */
    String account;

    @ToString.Exclude
    String password;

    public static Credentials guest(String nick) {
        return new Credentials(nick, null, null);
    }

    public static Credentials account(String nick, String account, String password) {
        if (account == null || account.isBlank()) {
            throw new IllegalArgumentException("account must not be blank");
        }
        if (password == null) {
            throw new IllegalArgumentException("password is required for account " + account);
        }
        return new Credentials(nick, account, password);
    }

    public boolean isGuest() {
        return account == null;
    }
}
