package com.roomlink.core.error;

/**
 * Client-side pre-check failure for an action the current identity is not allowed to perform.
 */
public class PermissionDeniedException extends RoomLinkException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
