package com.roomlink.client.state;

import com.roomlink.core.model.BannedUser;
import com.roomlink.core.model.UserRecord;

/**
 * What one {@link RoomState#apply} call changed.
 *
 * @param changed whether the state was modified at all
 * @param before  record of the affected user before the change, null if it was not in the roster
 * @param after   record after the change, null if the user was removed
 * @param banned  ban-list entry added or removed, if any
 */
public record RoomUpdate(boolean changed, UserRecord before, UserRecord after, BannedUser banned) {

    private static final RoomUpdate NONE = new RoomUpdate(false, null, null, null);
    private static final RoomUpdate ROOM = new RoomUpdate(true, null, null, null);

    public static RoomUpdate none() {
        return NONE;
    }

    /**
     * Room-level change (flags, metadata, ban list or the whole roster).
     */
    public static RoomUpdate room() {
        return ROOM;
    }

    public static RoomUpdate user(UserRecord before, UserRecord after) {
        return new RoomUpdate(true, before, after, null);
    }

    public static RoomUpdate ban(BannedUser banned, UserRecord removed) {
        return new RoomUpdate(true, removed, null, banned);
    }
}
