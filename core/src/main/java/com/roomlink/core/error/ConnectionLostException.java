package com.roomlink.core.error;

/**
 * Abnormal end of an open connection: no close handshake, I/O error or keepalive timeout.
 */
public class ConnectionLostException extends RoomLinkException {

    public ConnectionLostException(String message) {
        super(message);
    }

    public ConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
