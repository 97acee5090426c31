package com.roomlink.core.error;

/**
 * Network-level failure while opening a connection (timeout, refused, gateway lookup failed).
 * Retryable.
 */
public class ConnectFailedException extends RoomLinkException {

    public ConnectFailedException(String message) {
        super(message);
    }

    public ConnectFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
