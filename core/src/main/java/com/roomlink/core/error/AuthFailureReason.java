package com.roomlink.core.error;

import java.util.Locale;

/**
 * Why a login handshake failed.
 */
public enum AuthFailureReason {
    INVALID_CREDENTIALS,
    NICK_TAKEN,
    RATE_LIMITED,
    TIMEOUT,
    PROTOCOL_ERROR;

    /**
     * Maps the {@code reason} field of a {@code login_failed} frame.
     *
     * @param wireReason reason as sent by the server, may be null
     * @return matching reason, {@link #PROTOCOL_ERROR} when unrecognised
     */
    public static AuthFailureReason fromWire(String wireReason) {
        if (wireReason == null) {
            return PROTOCOL_ERROR;
        }
        try {
            return valueOf(wireReason.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return PROTOCOL_ERROR;
        }
    }
}
