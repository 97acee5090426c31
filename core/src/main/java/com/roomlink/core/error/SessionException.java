package com.roomlink.core.error;

/**
 * Fatal session failure: reconnect budget exhausted, login rejected on reconnect,
 * or the server closed the session for good.
 */
public class SessionException extends RoomLinkException {

    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
