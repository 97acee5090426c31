package com.roomlink.core.error;

import lombok.Getter;

/**
 * Login handshake failure. Never retried automatically: retrying only makes sense
 * with different credentials.
 */
@Getter
public class AuthException extends RoomLinkException {
    private final AuthFailureReason reason;

    public AuthException(AuthFailureReason reason, String message) {
        super(reason + ": " + message);
        this.reason = reason;
    }
}
