package com.roomlink.client.auth;

import com.roomlink.core.model.UserRole;
import com.roomlink.core.msg.Message;
import lombok.Value;

/**
 * Authenticated identity returned by a successful login.
 */
@Value
public class Identity {
    int handle;
    String nick;
    String account;
    UserRole role;

    static Identity fromLoginOk(Message message) {
        String account = message.text("username");
        return new Identity(
                message.intValue("handle", -1),
                message.text("nick"),
                account == null || account.isEmpty() ? null : account,
                UserRole.of(message.flag("mod"), message.flag("owner")));
    }

    public boolean isGuest() {
        return account == null;
    }
}
