package com.roomlink.core.error;

/**
 * Malformed inbound frame. Logged and skipped, never fatal.
 */
public class DecodeException extends RoomLinkException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
