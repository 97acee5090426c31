package com.roomlink.core.error;

/**
 * Raised when a frame is sent while the transport is not open.
 */
public class NotConnectedException extends RoomLinkException {

    public NotConnectedException(String message) {
        super(message);
    }
}
