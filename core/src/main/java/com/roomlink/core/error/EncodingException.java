package com.roomlink.core.error;

/**
 * Invalid outbound request. Thrown synchronously to the caller; nothing is sent.
 */
public class EncodingException extends RoomLinkException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
