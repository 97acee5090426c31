package com.roomlink.core.model;

/**
 * Permission level of a room user.
 */
public enum UserRole {
    DEFAULT,
    MODERATOR,
    OWNER;

    /**
     * @return true when the role may kick, ban and moderate broadcasts
     */
    public boolean canModerate() {
        return this != DEFAULT;
    }

    public static UserRole of(boolean mod, boolean owner) {
        if (owner) {
            return OWNER;
        }
        return mod ? MODERATOR : DEFAULT;
    }
}
