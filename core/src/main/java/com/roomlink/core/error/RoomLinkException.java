package com.roomlink.core.error;

/**
 * Base type for every failure raised by the client library.
 * <p>
 * All subtypes are unchecked: reactive pipelines carry them as error signals,
 * synchronous client actions throw them directly.
 * </p>
 */
public class RoomLinkException extends RuntimeException {

    public RoomLinkException(String message) {
        super(message);
    }

    public RoomLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
