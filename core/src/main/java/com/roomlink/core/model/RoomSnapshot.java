package com.roomlink.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable copy of the room state, safe to hand to callers and event handlers.
 */
@Value
@Builder
public class RoomSnapshot {
    String name;

    /**
     * Roster in join order: handle -> record.
     */
    Map<Integer, UserRecord> users;

    /**
     * Handle of the client's own record, null before {@code joined} was received.
     */
    Integer selfHandle;

    boolean greenRoom;
    boolean passwordProtected;
    boolean captchaEnabled;

    /**
     * Raw room information and settings as sent by the server.
     */
    Map<String, String> metadata;

    List<BannedUser> banList;

    public Optional<UserRecord> user(int handle) {
        return Optional.ofNullable(users.get(handle));
    }

    public Optional<UserRecord> self() {
        return selfHandle == null ? Optional.empty() : user(selfHandle);
    }

    public Optional<UserRecord> findByNick(String nick) {
        return users.values().stream().filter(u -> u.getNick().equals(nick)).findFirst();
    }

    public Set<String> nicks() {
        return users.values().stream().map(UserRecord::getNick).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Handles with an active broadcast.
     */
    public Set<Integer> broadcasters() {
        return users.values().stream()
                .filter(UserRecord::isBroadcasting)
                .map(UserRecord::getHandle)
                .collect(Collectors.toUnmodifiableSet());
    }
}
